package com.gillianbc.finhealth.report;

import com.gillianbc.finhealth.TestProfiles;
import com.gillianbc.finhealth.model.FinancialHealthReport;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class HtmlReportWriterTest {

    private final FinancialHealthReport report = TestProfiles.analyzer().analyse(TestProfiles.standard());

    @Test
    @DisplayName("The page carries the score, the table and the non-empty feedback sections")
    void render_containsSections() {
        String html = new HtmlReportWriter(Path.of("unused")).render(report);

        assertTrue(html.startsWith("<!DOCTYPE html>"));
        assertTrue(html.contains("<h2>Score: 91.43 / 100</h2>"));
        assertTrue(html.contains("<td class=\"metric-column\">Savings Income Ratio</td>"));
        assertTrue(html.contains("<tr class=\"total\"><td class=\"metric-column\">Total</td>"));
        assertTrue(html.contains("Commendable Areas"));
        assertTrue(html.contains("Areas to Review"));
        assertFalse(html.contains("Areas for Improvement"));
        assertTrue(html.contains("<h2>Glossary</h2>"));
    }

    @Test
    @DisplayName("A profile with weak areas gets an improvement section")
    void render_withLoans_containsImprovements() {
        FinancialHealthReport indebted = TestProfiles.analyzer().analyse(TestProfiles.withLoans());
        String html = new HtmlReportWriter(Path.of("unused")).render(indebted);

        assertTrue(html.contains("Areas for Improvement"));
        assertTrue(html.contains("You are saving only 7% of your income, far below a healthy level."));
    }

    @Test
    @DisplayName("Save writes a timestamped HTML file into the output directory")
    void save_writesFile(@TempDir Path dir) throws IOException {
        Path written = new HtmlReportWriter(dir.resolve("results")).save(report);
        log.info("Report written to {}", written);

        assertTrue(Files.exists(written));
        assertTrue(written.getFileName().toString().matches("finance-health-report-\\d{8}-\\d{6}\\.html"));
        assertTrue(Files.readString(written, StandardCharsets.UTF_8).contains("Financial Health Report"));
    }

    @Test
    @DisplayName("Markup characters in text are escaped")
    void escape_markup() {
        assertEquals("&lt;b&gt;Tom &amp; Jerry&lt;/b&gt;", HtmlReportWriter.escape("<b>Tom & Jerry</b>"));
        assertEquals("", HtmlReportWriter.escape(null));
    }
}
