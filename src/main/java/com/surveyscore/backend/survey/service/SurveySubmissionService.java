package com.surveyscore.backend.survey.service;

import com.surveyscore.backend.survey.dto.SurveyDtos;
import com.surveyscore.backend.survey.engine.ScoredSubmission;
import com.surveyscore.backend.survey.engine.SubmissionValidationException;
import com.surveyscore.backend.survey.engine.SurveyScoringEngine;
import com.surveyscore.backend.survey.entity.FatigueResultEntity;
import com.surveyscore.backend.survey.entity.InsomniaResultEntity;
import com.surveyscore.backend.survey.entity.IsmaResultEntity;
import com.surveyscore.backend.survey.entity.SurveyResultEntity;
import com.surveyscore.backend.survey.instrument.Instrument;
import com.surveyscore.backend.survey.instrument.ScoreBand;
import com.surveyscore.backend.survey.mapper.SurveyResultMapper;
import com.surveyscore.backend.survey.repo.FatigueResultRepository;
import com.surveyscore.backend.survey.repo.InsomniaResultRepository;
import com.surveyscore.backend.survey.repo.IsmaResultRepository;
import com.surveyscore.backend.users.user.service.UserRegistrationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

@Slf4j
@Service
@RequiredArgsConstructor
public class SurveySubmissionService {

    private final SurveyScoringEngine engine;
    private final SurveyResultMapper mapper;
    private final UserRegistrationService users;
    private final IsmaResultRepository ismaRepo;
    private final InsomniaResultRepository insomniaRepo;
    private final FatigueResultRepository fatigueRepo;

    /**
     * 驗證 → 算分 → 分類 → 寫一筆結果。
     * 任何一步失敗都不會寫入（all-or-nothing）。
     */
    @Transactional
    public SurveyDtos.SubmitResponse submit(String instrumentName, Long userId, Map<String, Integer> responses) {
        ScoredSubmission scored;
        try {
            scored = engine.evaluate(instrumentName, responses);
        } catch (SubmissionValidationException e) {
            log.warn("[Survey] rejected instrument={} userId={} {}", instrumentName, userId, e.getMessage());
            throw e;
        }

        if (!users.exists(userId)) {
            throw new NoSuchElementException("USER_NOT_FOUND");
        }

        SurveyResultEntity saved = persist(mapper.toEntity(userId, scored));

        log.info("[Survey] stored instrument={} userId={} resultId={} totalSum={} band={}",
                scored.instrument().name(), userId, saved.getResultId(), scored.totalSum(), scored.band().code());

        return new SurveyDtos.SubmitResponse(
                saved.getResultId(),
                scored.instrument().name(),
                scored.totalSum(),
                scored.band().code(),
                scored.label()
        );
    }

    @Transactional(readOnly = true)
    public List<SurveyDtos.ResultItem> history(String instrumentName, Long userId) {
        Instrument instrument = engine.registry().get(instrumentName);
        List<? extends SurveyResultEntity> rows = switch (instrument.kind()) {
            case ISMA -> ismaRepo.findByUserIdOrderByCreatedAtDescIdDesc(userId);
            case INSOMNIA -> insomniaRepo.findByUserIdOrderByCreatedAtDescIdDesc(userId);
            case FATIGUE -> fatigueRepo.findByUserIdOrderByCreatedAtDescIdDesc(userId);
        };
        return rows.stream().map(r -> toItem(instrument, r)).toList();
    }

    public List<SurveyDtos.InstrumentDto> instruments() {
        return engine.registry().all().stream()
                .map(i -> new SurveyDtos.InstrumentDto(
                        i.name(),
                        i.questionIds(),
                        i.externalKeys(),
                        i.bands().stream().map(SurveySubmissionService::toBandDto).toList()))
                .toList();
    }

    private SurveyResultEntity persist(SurveyResultEntity e) {
        return switch (e.instrumentKind()) {
            case ISMA -> ismaRepo.save((IsmaResultEntity) e);
            case INSOMNIA -> insomniaRepo.save((InsomniaResultEntity) e);
            case FATIGUE -> fatigueRepo.save((FatigueResultEntity) e);
        };
    }

    private static SurveyDtos.ResultItem toItem(Instrument instrument, SurveyResultEntity r) {
        int stored = (r.getTotalSum() == null) ? 0 : r.getTotalSum();
        if (stored != r.recomputeTotal()) {
            // 舊資料可能被手動改過；照存的值回，但留 log 方便追
            log.warn("[Survey] total_sum mismatch instrument={} resultId={} stored={} recomputed={}",
                    instrument.name(), r.getResultId(), stored, r.recomputeTotal());
        }
        return new SurveyDtos.ResultItem(
                r.getResultId(),
                instrument.name(),
                stored,
                r.getBandCode(),
                r.getQuestionMn(),
                r.responses(),
                r.getCreatedAt()
        );
    }

    private static SurveyDtos.BandDto toBandDto(ScoreBand b) {
        return new SurveyDtos.BandDto(
                b.code(),
                b.label(),
                b.unboundedBelow() ? null : b.low(),
                b.unboundedAbove() ? null : b.high()
        );
    }
}
