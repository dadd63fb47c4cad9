package com.surveyscore.backend.survey.config;

import com.surveyscore.backend.survey.engine.Classifier;
import com.surveyscore.backend.survey.engine.Scorer;
import com.surveyscore.backend.survey.engine.SubmissionValidator;
import com.surveyscore.backend.survey.engine.SurveyScoringEngine;
import com.surveyscore.backend.survey.instrument.InstrumentCatalog;
import com.surveyscore.backend.survey.instrument.InstrumentRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SurveyProperties.class)
public class SurveyConfig {

    @Bean
    public InstrumentRegistry instrumentRegistry() {
        return new InstrumentRegistry(InstrumentCatalog.defaults());
    }

    @Bean
    public SubmissionValidator submissionValidator(SurveyProperties props) {
        return new SubmissionValidator(props.isRejectNegativeResponses());
    }

    @Bean
    public SurveyScoringEngine surveyScoringEngine(InstrumentRegistry registry, SubmissionValidator validator) {
        return new SurveyScoringEngine(registry, validator, new Scorer(), new Classifier());
    }
}
