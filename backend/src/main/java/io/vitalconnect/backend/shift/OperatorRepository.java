package io.vitalconnect.backend.shift;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OperatorRepository extends JpaRepository<Operator, UUID> {

  @Query(
      nativeQuery = true,
      value =
          """
          SELECT u.* FROM users u
            JOIN user_hospitals uh ON uh.user_id = u.id
          WHERE uh.hospital_id = :hospitalId
            AND u.ativo = true
            AND u.role = 'gestor'
          ORDER BY u.nome
          """)
  List<Operator> findActiveManagersByHospitalId(@Param("hospitalId") UUID hospitalId);
}
