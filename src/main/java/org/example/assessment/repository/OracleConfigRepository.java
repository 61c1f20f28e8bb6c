package org.example.assessment.repository;

import org.example.assessment.entity.OracleConfigEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OracleConfigRepository extends JpaRepository<OracleConfigEntity, String> {
}
