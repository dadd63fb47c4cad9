package com.surveyscore.backend.survey.repo;

import com.surveyscore.backend.survey.entity.FatigueResultEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FatigueResultRepository extends JpaRepository<FatigueResultEntity, Long> {

    List<FatigueResultEntity> findByUserIdOrderByCreatedAtDescIdDesc(Long userId);

    long countByUserId(Long userId);
}
