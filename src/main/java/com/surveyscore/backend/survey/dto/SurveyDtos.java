package com.surveyscore.backend.survey.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class SurveyDtos {

    /** POST /survey/{instrument}，例如 {"responses": {"sleep_enough": 1, ...}, "user_id": 1} */
    public record SubmitRequest(
            @NotNull Map<String, Integer> responses,
            @JsonProperty("user_id") @JsonAlias("userId") @NotNull Long userId
    ) {}

    public record SubmitResponse(
            @JsonProperty("result_id") Long resultId,
            String instrument,
            @JsonProperty("total_sum") int totalSum,
            @JsonProperty("band_code") String bandCode,
            @JsonProperty("question_mn") String questionMn
    ) {}

    /** 歷史紀錄一筆 */
    public record ResultItem(
            @JsonProperty("result_id") Long resultId,
            String instrument,
            @JsonProperty("total_sum") int totalSum,
            @JsonProperty("band_code") String bandCode,
            @JsonProperty("question_mn") String questionMn,
            Map<String, Integer> responses,
            @JsonProperty("created_at") Instant createdAt
    ) {}

    public record InstrumentDto(
            String name,
            @JsonProperty("question_ids") List<String> questionIds,
            @JsonProperty("external_keys") List<String> externalKeys,
            List<BandDto> bands
    ) {}

    /** min / max 為 null 代表該側無界 */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record BandDto(
            String code,
            String label,
            Integer min,
            Integer max
    ) {}
}
