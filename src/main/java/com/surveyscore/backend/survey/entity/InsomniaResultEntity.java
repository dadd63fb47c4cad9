package com.surveyscore.backend.survey.entity;

import com.surveyscore.backend.survey.instrument.InstrumentKind;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;

/** 失眠量表（7 題）結果 */
@Getter
@Setter
@Entity
@Table(
        name = "insomnia_web",
        indexes = {
                @Index(name = "ix_insomnia_web_user_created", columnList = "user_id, created_at")
        }
)
public class InsomniaResultEntity extends SurveyResultEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "insomnia_id")
    private Long id;

    @Column(name = "fall_asleep", updatable = false)
    private Integer fallAsleep;

    @Column(name = "stay_asleep", updatable = false)
    private Integer stayAsleep;

    @Column(name = "early_rising", updatable = false)
    private Integer earlyRising;

    @Column(name = "sleep_satisfaction", updatable = false)
    private Integer sleepSatisfaction;

    @Column(name = "daily_impact", updatable = false)
    private Integer dailyImpact;

    @Column(name = "life_quality", updatable = false)
    private Integer lifeQuality;

    @Column(name = "sleep_concern", updatable = false)
    private Integer sleepConcern;

    @Override
    public Long getResultId() {
        return id;
    }

    @Override
    public InstrumentKind instrumentKind() {
        return InstrumentKind.INSOMNIA;
    }

    @Override
    public LinkedHashMap<String, Integer> responses() {
        LinkedHashMap<String, Integer> m = new LinkedHashMap<>();
        m.put("fall_asleep", fallAsleep);
        m.put("stay_asleep", stayAsleep);
        m.put("early_rising", earlyRising);
        m.put("sleep_satisfaction", sleepSatisfaction);
        m.put("daily_impact", dailyImpact);
        m.put("life_quality", lifeQuality);
        m.put("sleep_concern", sleepConcern);
        return m;
    }
}
