package org.example.assessment.repository;

import org.example.assessment.entity.QuestionSetEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface QuestionSetRepository extends JpaRepository<QuestionSetEntity, String> {

    List<QuestionSetEntity> findAllByOrderByCatalogIndexAsc();
}
