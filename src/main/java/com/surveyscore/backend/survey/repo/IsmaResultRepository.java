package com.surveyscore.backend.survey.repo;

import com.surveyscore.backend.survey.entity.IsmaResultEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface IsmaResultRepository extends JpaRepository<IsmaResultEntity, Long> {

    List<IsmaResultEntity> findByUserIdOrderByCreatedAtDescIdDesc(Long userId);

    long countByUserId(Long userId);
}
