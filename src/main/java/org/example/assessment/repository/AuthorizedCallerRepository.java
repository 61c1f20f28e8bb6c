package org.example.assessment.repository;

import org.example.assessment.entity.AuthorizedCallerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuthorizedCallerRepository extends JpaRepository<AuthorizedCallerEntity, String> {

    List<AuthorizedCallerEntity> findAllByOrderByAuthorizedAtAsc();
}
