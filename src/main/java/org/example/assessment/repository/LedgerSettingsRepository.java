package org.example.assessment.repository;

import org.example.assessment.entity.LedgerSettingsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LedgerSettingsRepository extends JpaRepository<LedgerSettingsEntity, String> {
}
