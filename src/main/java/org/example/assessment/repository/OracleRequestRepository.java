package org.example.assessment.repository;

import org.example.assessment.entity.OracleRequestEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OracleRequestRepository extends JpaRepository<OracleRequestEntity, String> {

    List<OracleRequestEntity> findByUserId(String userId);
}
