package io.vitalconnect.backend.occurrence;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OccurrenceHistoryRepository extends JpaRepository<OccurrenceHistory, UUID> {

  List<OccurrenceHistory> findByOccurrenceIdOrderByCreatedAtAsc(UUID occurrenceId);
}
