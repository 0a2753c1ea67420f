package io.vitalconnect.backend.notification;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface NotificationRecordRepository extends JpaRepository<NotificationRecord, UUID> {

  List<NotificationRecord> findByOccurrenceIdOrderByCreatedAtAsc(UUID occurrenceId);
}
