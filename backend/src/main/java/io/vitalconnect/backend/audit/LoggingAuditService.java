package io.vitalconnect.backend.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Writes audit records as structured lines on the dedicated {@code AUDIT} logger. */
@Service
public class LoggingAuditService implements AuditService {

  private static final Logger audit = LoggerFactory.getLogger("AUDIT");
  private static final Logger log = LoggerFactory.getLogger(LoggingAuditService.class);

  @Override
  public void log(AuditEventRecord record) {
    try {
      audit.info(
          "event={} entityType={} entityId={} actorId={} actorType={} source={} ip={} details={}",
          record.eventType(),
          record.entityType(),
          record.entityId(),
          record.actorId(),
          record.actorType(),
          record.source(),
          record.ipAddress(),
          record.details());
    } catch (RuntimeException e) {
      log.warn("Failed to write audit event {}: {}", record.eventType(), e.getMessage());
    }
  }
}
