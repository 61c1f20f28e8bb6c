package org.example.assessment.repository;

import org.example.assessment.entity.AssessmentEntity;
import org.example.assessment.entity.AssessmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AssessmentRepository extends JpaRepository<AssessmentEntity, String> {

    long countByStatus(AssessmentStatus status);
}
