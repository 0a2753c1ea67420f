package io.vitalconnect.backend.occurrence;

import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OccurrenceRepository extends JpaRepository<Occurrence, UUID> {

  boolean existsBySourceEventId(String sourceEventId);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT o FROM Occurrence o WHERE o.id = :id")
  Optional<Occurrence> findByIdForUpdate(@Param("id") UUID id);
}
