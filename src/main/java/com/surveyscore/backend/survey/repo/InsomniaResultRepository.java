package com.surveyscore.backend.survey.repo;

import com.surveyscore.backend.survey.entity.InsomniaResultEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface InsomniaResultRepository extends JpaRepository<InsomniaResultEntity, Long> {

    List<InsomniaResultEntity> findByUserIdOrderByCreatedAtDescIdDesc(Long userId);

    long countByUserId(Long userId);
}
