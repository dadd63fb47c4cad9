package com.surveyscore.backend.survey.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * app.survey.*
 */
@ConfigurationProperties(prefix = "app.survey")
public class SurveyProperties {

    /** 單題回答是否拒收負數（原本服務照單全收） */
    private boolean rejectNegativeResponses = true;

    public boolean isRejectNegativeResponses() { return rejectNegativeResponses; }
    public void setRejectNegativeResponses(boolean rejectNegativeResponses) { this.rejectNegativeResponses = rejectNegativeResponses; }
}
