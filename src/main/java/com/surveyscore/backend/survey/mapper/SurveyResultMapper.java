package com.surveyscore.backend.survey.mapper;

import com.surveyscore.backend.survey.engine.ScoredSubmission;
import com.surveyscore.backend.survey.entity.FatigueResultEntity;
import com.surveyscore.backend.survey.entity.InsomniaResultEntity;
import com.surveyscore.backend.survey.entity.IsmaResultEntity;
import com.surveyscore.backend.survey.entity.SurveyResultEntity;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 評分結果 → 各問卷的結果表 entity。
 * 每個欄位逐一對應，不用反射或動態組裝；對不上的 key 早在 validator 就被擋下。
 */
@Component
public class SurveyResultMapper {

    public SurveyResultEntity toEntity(Long userId, ScoredSubmission scored) {
        SurveyResultEntity e = switch (scored.instrument().kind()) {
            case ISMA -> toIsma(scored.responses());
            case INSOMNIA -> toInsomnia(scored.responses());
            case FATIGUE -> toFatigue(scored.responses());
        };
        e.setUserId(userId);
        e.setTotalSum(scored.totalSum());
        e.setQuestionMn(scored.band().label());
        e.setBandCode(scored.band().code());
        return e;
    }

    IsmaResultEntity toIsma(Map<String, Integer> r) {
        IsmaResultEntity e = new IsmaResultEntity();
        e.setSleepEnough(answer(r, "sleep_enough"));
        e.setAppetiteChange(answer(r, "appetite_change"));
        e.setGuiltFeeling(answer(r, "guilt_feeling"));
        e.setOverthinking(answer(r, "overthinking"));
        e.setFocusMemory(answer(r, "focus_memory"));
        e.setNoHobbyTime(answer(r, "no_hobby_time"));
        e.setMusclePain(answer(r, "muscle_pain"));
        e.setAddiction(answer(r, "addiction"));
        e.setWorkAtHome(answer(r, "work_at_home"));
        e.setEnoughTime(answer(r, "enough_time"));
        e.setIgnoreProblems(answer(r, "ignore_problems"));
        e.setPerfectionist(answer(r, "perfectionist"));
        e.setBadTimeEstimate(answer(r, "bad_time_estimate"));
        e.setOverwhelmed(answer(r, "overwhelmed"));
        e.setLowSelfEsteem(answer(r, "low_self_esteem"));
        e.setImpatient(answer(r, "impatient"));
        e.setHurried(answer(r, "hurried"));
        e.setRoadRage(answer(r, "road_rage"));
        e.setCompetitive(answer(r, "competitive"));
        e.setCritical(answer(r, "critical"));
        e.setDistracted(answer(r, "distracted"));
        e.setLowLibido(answer(r, "low_libido"));
        e.setTeethGrinding(answer(r, "teeth_grinding"));
        e.setPerformanceDrop(answer(r, "performance_drop"));
        return e;
    }

    InsomniaResultEntity toInsomnia(Map<String, Integer> r) {
        InsomniaResultEntity e = new InsomniaResultEntity();
        e.setFallAsleep(answer(r, "fall_asleep"));
        e.setStayAsleep(answer(r, "stay_asleep"));
        e.setEarlyRising(answer(r, "early_rising"));
        e.setSleepSatisfaction(answer(r, "sleep_satisfaction"));
        e.setDailyImpact(answer(r, "daily_impact"));
        e.setLifeQuality(answer(r, "life_quality"));
        e.setSleepConcern(answer(r, "sleep_concern"));
        return e;
    }

    FatigueResultEntity toFatigue(Map<String, Integer> r) {
        FatigueResultEntity e = new FatigueResultEntity();
        e.setSleepDisorder(answer(r, "sleep_disorder"));
        e.setWakingFatigue(answer(r, "waking_fatigue"));
        e.setFocusIssue(answer(r, "focus_issue"));
        e.setMusclePain(answer(r, "muscle_pain"));
        e.setBodyPain(answer(r, "body_pain"));
        e.setHeadPain(answer(r, "head_pain"));
        e.setNeckShoulderStiffness(answer(r, "neck_shoulder_stiffness"));
        e.setThroatPain(answer(r, "throat_pain"));
        e.setMotionDizziness(answer(r, "motion_dizziness"));
        e.setExerciseFatigue(answer(r, "exercise_fatigue"));
        e.setEyeSensitivity(answer(r, "eye_sensitivity"));
        e.setNumbSensation(answer(r, "numb_sensation"));
        e.setAnxietyIssue(answer(r, "anxiety_issue"));
        e.setRestlessSleep(answer(r, "restless_sleep"));
        e.setColdSensitivity(answer(r, "cold_sensitivity"));
        e.setStomachUpset(answer(r, "stomach_upset"));
        e.setAllergicReaction(answer(r, "allergic_reaction"));
        return e;
    }

    private static Integer answer(Map<String, Integer> r, String questionId) {
        Integer v = r.get(questionId);
        if (v == null) throw new IllegalStateException("RESPONSE_MISSING_AFTER_VALIDATION: " + questionId);
        return v;
    }
}
