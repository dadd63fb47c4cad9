package com.surveyscore.backend.survey.entity;

import com.surveyscore.backend.survey.instrument.InstrumentKind;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;

/** ISMA 壓力量表（24 題）結果 */
@Getter
@Setter
@Entity
@Table(
        name = "isma_web",
        indexes = {
                @Index(name = "ix_isma_web_user_created", columnList = "user_id, created_at")
        }
)
public class IsmaResultEntity extends SurveyResultEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "isma_id")
    private Long id;

    @Column(name = "sleep_enough", updatable = false)
    private Integer sleepEnough;

    @Column(name = "appetite_change", updatable = false)
    private Integer appetiteChange;

    @Column(name = "guilt_feeling", updatable = false)
    private Integer guiltFeeling;

    @Column(name = "overthinking", updatable = false)
    private Integer overthinking;

    @Column(name = "focus_memory", updatable = false)
    private Integer focusMemory;

    @Column(name = "no_hobby_time", updatable = false)
    private Integer noHobbyTime;

    @Column(name = "muscle_pain", updatable = false)
    private Integer musclePain;

    @Column(name = "addiction", updatable = false)
    private Integer addiction;

    @Column(name = "work_at_home", updatable = false)
    private Integer workAtHome;

    @Column(name = "enough_time", updatable = false)
    private Integer enoughTime;

    @Column(name = "ignore_problems", updatable = false)
    private Integer ignoreProblems;

    @Column(name = "perfectionist", updatable = false)
    private Integer perfectionist;

    @Column(name = "bad_time_estimate", updatable = false)
    private Integer badTimeEstimate;

    @Column(name = "overwhelmed", updatable = false)
    private Integer overwhelmed;

    @Column(name = "low_self_esteem", updatable = false)
    private Integer lowSelfEsteem;

    @Column(name = "impatient", updatable = false)
    private Integer impatient;

    @Column(name = "hurried", updatable = false)
    private Integer hurried;

    @Column(name = "road_rage", updatable = false)
    private Integer roadRage;

    @Column(name = "competitive", updatable = false)
    private Integer competitive;

    @Column(name = "critical", updatable = false)
    private Integer critical;

    @Column(name = "distracted", updatable = false)
    private Integer distracted;

    @Column(name = "low_libido", updatable = false)
    private Integer lowLibido;

    @Column(name = "teeth_grinding", updatable = false)
    private Integer teethGrinding;

    @Column(name = "performance_drop", updatable = false)
    private Integer performanceDrop;

    @Override
    public Long getResultId() {
        return id;
    }

    @Override
    public InstrumentKind instrumentKind() {
        return InstrumentKind.ISMA;
    }

    @Override
    public LinkedHashMap<String, Integer> responses() {
        LinkedHashMap<String, Integer> m = new LinkedHashMap<>();
        m.put("sleep_enough", sleepEnough);
        m.put("appetite_change", appetiteChange);
        m.put("guilt_feeling", guiltFeeling);
        m.put("overthinking", overthinking);
        m.put("focus_memory", focusMemory);
        m.put("no_hobby_time", noHobbyTime);
        m.put("muscle_pain", musclePain);
        m.put("addiction", addiction);
        m.put("work_at_home", workAtHome);
        m.put("enough_time", enoughTime);
        m.put("ignore_problems", ignoreProblems);
        m.put("perfectionist", perfectionist);
        m.put("bad_time_estimate", badTimeEstimate);
        m.put("overwhelmed", overwhelmed);
        m.put("low_self_esteem", lowSelfEsteem);
        m.put("impatient", impatient);
        m.put("hurried", hurried);
        m.put("road_rage", roadRage);
        m.put("competitive", competitive);
        m.put("critical", critical);
        m.put("distracted", distracted);
        m.put("low_libido", lowLibido);
        m.put("teeth_grinding", teethGrinding);
        m.put("performance_drop", performanceDrop);
        return m;
    }
}
