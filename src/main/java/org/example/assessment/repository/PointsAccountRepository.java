package org.example.assessment.repository;

import org.example.assessment.entity.PointsAccountEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.List;

@Repository
public interface PointsAccountRepository extends JpaRepository<PointsAccountEntity, String> {

    List<PointsAccountEntity> findAllByOrderByHolderIndexAsc();

    @Query("SELECT pa FROM PointsAccountEntity pa ORDER BY pa.balance DESC, pa.holderIndex ASC")
    List<PointsAccountEntity> findTopHolders(Pageable pageable);

    @Query("SELECT SUM(pa.balance) FROM PointsAccountEntity pa")
    BigInteger sumBalances();
}
