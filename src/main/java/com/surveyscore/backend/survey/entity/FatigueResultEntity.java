package com.surveyscore.backend.survey.entity;

import com.surveyscore.backend.survey.instrument.InstrumentKind;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;

/** 慢性疲勞量表（17 題）結果 */
@Getter
@Setter
@Entity
@Table(
        name = "fatigue",
        indexes = {
                @Index(name = "ix_fatigue_user_created", columnList = "user_id, created_at")
        }
)
public class FatigueResultEntity extends SurveyResultEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "fatigue_id")
    private Long id;

    @Column(name = "sleep_disorder", updatable = false)
    private Integer sleepDisorder;

    @Column(name = "waking_fatigue", updatable = false)
    private Integer wakingFatigue;

    @Column(name = "focus_issue", updatable = false)
    private Integer focusIssue;

    @Column(name = "muscle_pain", updatable = false)
    private Integer musclePain;

    @Column(name = "body_pain", updatable = false)
    private Integer bodyPain;

    @Column(name = "head_pain", updatable = false)
    private Integer headPain;

    @Column(name = "neck_shoulder_stiffness", updatable = false)
    private Integer neckShoulderStiffness;

    @Column(name = "throat_pain", updatable = false)
    private Integer throatPain;

    @Column(name = "motion_dizziness", updatable = false)
    private Integer motionDizziness;

    @Column(name = "exercise_fatigue", updatable = false)
    private Integer exerciseFatigue;

    @Column(name = "eye_sensitivity", updatable = false)
    private Integer eyeSensitivity;

    @Column(name = "numb_sensation", updatable = false)
    private Integer numbSensation;

    @Column(name = "anxiety_issue", updatable = false)
    private Integer anxietyIssue;

    @Column(name = "restless_sleep", updatable = false)
    private Integer restlessSleep;

    @Column(name = "cold_sensitivity", updatable = false)
    private Integer coldSensitivity;

    @Column(name = "stomach_upset", updatable = false)
    private Integer stomachUpset;

    @Column(name = "allergic_reaction", updatable = false)
    private Integer allergicReaction;

    @Override
    public Long getResultId() {
        return id;
    }

    @Override
    public InstrumentKind instrumentKind() {
        return InstrumentKind.FATIGUE;
    }

    @Override
    public LinkedHashMap<String, Integer> responses() {
        LinkedHashMap<String, Integer> m = new LinkedHashMap<>();
        m.put("sleep_disorder", sleepDisorder);
        m.put("waking_fatigue", wakingFatigue);
        m.put("focus_issue", focusIssue);
        m.put("muscle_pain", musclePain);
        m.put("body_pain", bodyPain);
        m.put("head_pain", headPain);
        m.put("neck_shoulder_stiffness", neckShoulderStiffness);
        m.put("throat_pain", throatPain);
        m.put("motion_dizziness", motionDizziness);
        m.put("exercise_fatigue", exerciseFatigue);
        m.put("eye_sensitivity", eyeSensitivity);
        m.put("numb_sensation", numbSensation);
        m.put("anxiety_issue", anxietyIssue);
        m.put("restless_sleep", restlessSleep);
        m.put("cold_sensitivity", coldSensitivity);
        m.put("stomach_upset", stomachUpset);
        m.put("allergic_reaction", allergicReaction);
        return m;
    }
}
