package com.gillianbc.finhealth.report;

import com.gillianbc.finhealth.config.FinanceHealthProperties;
import com.gillianbc.finhealth.model.FinancialHealthReport;
import com.gillianbc.finhealth.model.ScoringTableRow;
import com.gillianbc.finhealth.model.UserProfile;
import com.gillianbc.finhealth.service.FinancialHealthAnalyzer;
import com.gillianbc.finhealth.service.UserProfileReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;

/**
 * Analyses the profile at {@code finance-health.report.profile-path} with the default weights,
 * logs the scoring table and writes the HTML report. Inactive when the property is unset.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "finance-health.report", name = "profile-path")
public class ProfileReportRunner implements ApplicationRunner {

    private final FinanceHealthProperties properties;
    private final UserProfileReader reader;
    private final FinancialHealthAnalyzer analyzer;
    private final HtmlReportWriter writer;

    public ProfileReportRunner(FinanceHealthProperties properties,
                               UserProfileReader reader,
                               FinancialHealthAnalyzer analyzer,
                               HtmlReportWriter writer) {
        this.properties = properties;
        this.reader = reader;
        this.analyzer = analyzer;
        this.writer = writer;
    }

    @Override
    public void run(ApplicationArguments args) {
        UserProfile profile = reader.read(Paths.get(properties.getReport().getProfilePath()));
        FinancialHealthReport report = analyzer.analyse(profile);
        for (ScoringTableRow row : report.getScoringTable().getRows()) {
            log.info("{} | weight {} | benchmark {} | value {} | {} | {} points", row.getMetric(), row.getWeightAssigned(),
                    row.getBenchmark(), row.getUserValue(), row.getVerdict(), row.getPointsAwarded().toPlainString());
        }
        writer.save(report);
    }
}
