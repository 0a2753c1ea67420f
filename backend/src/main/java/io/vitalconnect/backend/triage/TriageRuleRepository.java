package io.vitalconnect.backend.triage;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TriageRuleRepository extends JpaRepository<TriageRule, UUID> {

  @Query(
      """
      SELECT r FROM TriageRule r
      WHERE r.active = true AND r.tenantId = :tenantId
      ORDER BY r.priority, r.name
      """)
  List<TriageRule> findActiveByTenantId(@Param("tenantId") UUID tenantId);

  @Query(
      """
      SELECT r FROM TriageRule r
      WHERE r.active = true AND r.tenantId IS NULL
      ORDER BY r.priority, r.name
      """)
  List<TriageRule> findActiveGlobal();
}
