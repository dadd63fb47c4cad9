package com.surveyscore.backend.survey.controller;

import com.surveyscore.backend.survey.dto.SurveyDtos;
import com.surveyscore.backend.survey.service.SurveySubmissionService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * /survey/isma、/survey/insomnia、/survey/fatigue 共用同一條路由。
 */
@RestController
@RequestMapping("/survey")
public class SurveyController {

    private final SurveySubmissionService service;

    public SurveyController(SurveySubmissionService service) {
        this.service = service;
    }

    @GetMapping(value = "/instruments", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<SurveyDtos.InstrumentDto>> instruments() {
        return ResponseEntity.ok(service.instruments());
    }

    @PostMapping(value = "/{instrument}",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SurveyDtos.SubmitResponse> submit(
            @PathVariable("instrument") String instrument,
            @Valid @RequestBody SurveyDtos.SubmitRequest body
    ) {
        return ResponseEntity.ok(service.submit(instrument, body.userId(), body.responses()));
    }

    @GetMapping(value = "/{instrument}/results", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<SurveyDtos.ResultItem>> results(
            @PathVariable("instrument") String instrument,
            @RequestParam("user_id") Long userId
    ) {
        return ResponseEntity.ok(service.history(instrument, userId));
    }
}
