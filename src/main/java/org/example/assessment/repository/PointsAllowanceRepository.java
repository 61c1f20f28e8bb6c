package org.example.assessment.repository;

import org.example.assessment.entity.PointsAllowanceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PointsAllowanceRepository extends JpaRepository<PointsAllowanceEntity, String> {

    Optional<PointsAllowanceEntity> findByOwnerIdAndSpenderId(String ownerId, String spenderId);
}
