package org.example.assessment.repository;

import org.example.assessment.entity.AuditEventEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AuditEventRepository extends JpaRepository<AuditEventEntity, Long> {

    Optional<AuditEventEntity> findTopByOrderBySequenceDesc();

    List<AuditEventEntity> findAllByOrderBySequenceAsc();

    @Query("SELECT ae FROM AuditEventEntity ae ORDER BY ae.sequence DESC")
    List<AuditEventEntity> findRecent(Pageable pageable);
}
