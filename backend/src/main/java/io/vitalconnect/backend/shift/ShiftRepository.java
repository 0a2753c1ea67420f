package io.vitalconnect.backend.shift;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ShiftRepository extends JpaRepository<Shift, UUID> {

  List<Shift> findByHospitalIdAndDayOfWeekIn(UUID hospitalId, Collection<Integer> days);
}
