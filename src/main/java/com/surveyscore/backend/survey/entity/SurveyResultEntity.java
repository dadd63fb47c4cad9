package com.surveyscore.backend.survey.entity;

import com.surveyscore.backend.survey.instrument.InstrumentKind;
import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;

/**
 * 三張結果表共用欄位。每筆結果建立後不再修改。
 * total_sum 必須等於各題欄位加總（見 {@link #recomputeTotal()}）。
 */
@Getter
@Setter
@MappedSuperclass
public abstract class SurveyResultEntity {

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "total_sum", nullable = false, updatable = false)
    private Integer totalSum;

    // 欄位名沿用舊表：存的是分類標籤原文
    @Column(name = "question_mn", nullable = false, updatable = false, length = 255)
    private String questionMn;

    @Column(name = "band_code", nullable = false, updatable = false, length = 32)
    private String bandCode;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public abstract Long getResultId();

    public abstract InstrumentKind instrumentKind();

    /** 各題欄位組回 canonical id → 回答（題目順序） */
    public abstract LinkedHashMap<String, Integer> responses();

    public int recomputeTotal() {
        int sum = 0;
        for (Integer v : responses().values()) {
            if (v != null) sum += v;
        }
        return sum;
    }
}
