package io.vitalconnect.backend.audit;

/**
 * Write-only sink for audit events. Persistence and querying of the audit trail live outside this
 * service.
 */
public interface AuditService {

  /**
   * Records a single audit event. Implementations must not throw: an audit failure never aborts
   * the operation being audited.
   *
   * @param record the audit event data
   */
  void log(AuditEventRecord record);
}
