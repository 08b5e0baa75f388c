package com.gillianbc.finhealth.config;

import com.gillianbc.finhealth.feedback.FeedbackTemplateCatalog;
import com.gillianbc.finhealth.model.Glossary;
import com.gillianbc.finhealth.report.HtmlReportWriter;
import com.gillianbc.finhealth.service.HeaderGenerator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Loads the reference data once at startup. Every bean here is immutable and shared
 * by all analyses.
 */
@Configuration
@EnableConfigurationProperties(FinanceHealthProperties.class)
public class FinanceHealthConfiguration {

    @Bean
    public BenchmarkTable benchmarkTable(FinanceHealthProperties properties) {
        return ReferenceDataLoader.loadBenchmarkTable(properties.getBenchmarkResource());
    }

    @Bean
    public CityTierDirectory cityTierDirectory(FinanceHealthProperties properties) {
        return ReferenceDataLoader.loadCityTiers(properties.getCityTierResource());
    }

    @Bean
    public Glossary glossary(FinanceHealthProperties properties) {
        return new Glossary(ReferenceDataLoader.loadGlossary(properties.getGlossaryResource()));
    }

    @Bean
    public FeedbackTemplateCatalog feedbackTemplateCatalog() {
        return FeedbackTemplateCatalog.defaults();
    }

    @Bean
    public HeaderGenerator headerGenerator() {
        return new HeaderGenerator(new Random());
    }

    @Bean
    public HtmlReportWriter htmlReportWriter(FinanceHealthProperties properties) {
        return new HtmlReportWriter(properties);
    }
}
