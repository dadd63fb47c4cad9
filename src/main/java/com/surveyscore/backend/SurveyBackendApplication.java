package com.surveyscore.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SurveyBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(SurveyBackendApplication.class, args);
    }
}
