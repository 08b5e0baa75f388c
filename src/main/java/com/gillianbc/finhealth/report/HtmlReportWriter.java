package com.gillianbc.finhealth.report;

import com.gillianbc.finhealth.config.FinanceHealthProperties;
import com.gillianbc.finhealth.exception.FinanceHealthException;
import com.gillianbc.finhealth.model.FeedbackPoint;
import com.gillianbc.finhealth.model.FinancialHealthReport;
import com.gillianbc.finhealth.model.ImprovementPoint;
import com.gillianbc.finhealth.model.PersonalFinanceMetrics;
import com.gillianbc.finhealth.model.ScoringTableRow;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes a {@link FinancialHealthReport} as a single self-contained HTML page.
 */
@Slf4j
public class HtmlReportWriter {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final DateTimeFormatter GENERATED_ON = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path outputDir;

    public HtmlReportWriter(FinanceHealthProperties properties) {
        this(Paths.get(properties.getReport().getOutputDir()));
    }

    public HtmlReportWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * @return the file written, named {@code finance-health-report-<timestamp>.html}
     */
    public Path save(FinancialHealthReport report) {
        String html = render(report);
        try {
            Files.createDirectories(outputDir);
            String filename = "finance-health-report-" + LocalDateTime.now().format(FILE_STAMP) + ".html";
            Path filePath = outputDir.resolve(filename);
            Files.write(filePath, html.getBytes(StandardCharsets.UTF_8));
            log.info("Finance health report saved to: {}", filePath.toAbsolutePath());
            return filePath;
        } catch (IOException e) {
            log.error("Failed to save HTML report to {}", outputDir, e);
            throw new FinanceHealthException("Failed to save HTML report", e);
        }
    }

    public String render(FinancialHealthReport report) {
        PersonalFinanceMetrics pfm = report.getMetrics();
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n")
            .append("<html lang=\"en\">\n")
            .append("<head>\n")
            .append("    <meta charset=\"UTF-8\">\n")
            .append("    <meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n")
            .append("    <title>Financial Health Report</title>\n")
            .append("    <style>\n")
            .append("        body { font-family: Arial, sans-serif; margin: 20px; background-color: #f5f5f5; }\n")
            .append("        .container { max-width: 1200px; margin: 0 auto; background-color: white; padding: 20px; border-radius: 8px; box-shadow: 0 2px 4px rgba(0,0,0,0.1); }\n")
            .append("        h1 { color: #2c3e50; text-align: center; margin-bottom: 30px; }\n")
            .append("        .summary { background-color: #ecf0f1; padding: 15px; border-radius: 5px; margin-bottom: 30px; }\n")
            .append("        table { width: 100%; border-collapse: collapse; margin-top: 10px; }\n")
            .append("        th, td { border: 1px solid #ddd; padding: 8px; text-align: right; }\n")
            .append("        th { background-color: #3498db; color: white; font-weight: bold; }\n")
            .append("        tr:nth-child(even) { background-color: #f2f2f2; }\n")
            .append("        .metric-column { text-align: left; font-weight: bold; }\n")
            .append("        .total { font-weight: bold; background-color: #dfe6e9 !important; }\n")
            .append("        .commendable h3 { color: #00b894; }\n")
            .append("        .review h3 { color: #e17055; }\n")
            .append("        .improvement h3 { color: #d63031; }\n")
            .append("    </style>\n")
            .append("</head>\n")
            .append("<body>\n")
            .append("    <div class=\"container\">\n")
            .append("        <h1>Financial Health Report</h1>\n")
            .append("        <div class=\"summary\">\n")
            .append("            <h2>Score: ").append(report.totalScore().toPlainString()).append(" / 100</h2>\n")
            .append("            <p><strong>City tier:</strong> ").append(pfm.getCityTier().key())
            .append(" &nbsp; <strong>Income bracket:</strong> ").append(pfm.getIncomeBracket()).append("</p>\n")
            .append("            <p><strong>Monthly income:</strong> ").append(rupees(pfm.getTotalMonthlyIncome()))
            .append(" &nbsp; <strong>Monthly expense:</strong> ").append(rupees(pfm.getTotalMonthlyExpense()))
            .append(" &nbsp; <strong>Monthly EMI:</strong> ").append(rupees(pfm.getTotalMonthlyEmi())).append("</p>\n")
            .append("            <p><strong>Total assets:</strong> ").append(rupees(pfm.getTotalAssets()))
            .append(" &nbsp; <strong>Total liabilities:</strong> ").append(rupees(pfm.getTotalLiabilities()))
            .append(" &nbsp; <strong>Target retirement corpus:</strong> ").append(rupees(pfm.getTargetRetirementCorpus())).append("</p>\n")
            .append("        </div>\n");

        appendScoringTable(html, report.getScoringTable().getRows());
        appendPoints(html, "commendable", "Commendable Areas", report.getFeedback().getCommendableAreas());
        appendPoints(html, "review", "Areas to Review", report.getFeedback().getReviewAreas());
        appendPoints(html, "improvement", "Areas for Improvement", report.getFeedback().getAreasForImprovement());
        appendGlossary(html, report.getGlossary());

        html.append("        <p><em>Generated on: ").append(LocalDateTime.now().format(GENERATED_ON)).append("</em></p>\n")
            .append("    </div>\n")
            .append("</body>\n")
            .append("</html>");
        return html.toString();
    }

    private static void appendScoringTable(StringBuilder html, List<ScoringTableRow> rows) {
        html.append("        <h2>Scoring Table</h2>\n")
            .append("        <table>\n")
            .append("            <tr><th class=\"metric-column\">Metric</th><th>Weight Assigned</th><th>Benchmark</th>")
            .append("<th>User Value</th><th>Verdict</th><th>Points Awarded</th></tr>\n");
        for (int i = 0; i < rows.size(); i++) {
            ScoringTableRow row = rows.get(i);
            html.append(i == rows.size() - 1 ? "            <tr class=\"total\">" : "            <tr>")
                .append("<td class=\"metric-column\">").append(escape(row.getMetric())).append("</td>")
                .append("<td>").append(escape(row.getWeightAssigned())).append("</td>")
                .append("<td>").append(escape(row.getBenchmark())).append("</td>")
                .append("<td>").append(escape(row.getUserValue())).append("</td>")
                .append("<td>").append(escape(row.getVerdict())).append("</td>")
                .append("<td>").append(row.getPointsAwarded().toPlainString()).append("</td></tr>\n");
        }
        html.append("        </table>\n");
    }

    private static void appendPoints(StringBuilder html, String cssClass, String title, List<? extends FeedbackPoint> points) {
        if (points.isEmpty()) {
            return;
        }
        html.append("        <div class=\"").append(cssClass).append("\">\n")
            .append("            <h2>").append(title).append("</h2>\n");
        for (FeedbackPoint point : points) {
            html.append("            <h3>").append(escape(point.getHeader())).append("</h3>\n")
                .append("            <p>").append(escape(point.getCurrentScenario())).append("</p>\n");
            if (point instanceof ImprovementPoint) {
                html.append("            <p><strong>Action:</strong> ")
                    .append(escape(((ImprovementPoint) point).getActionable())).append("</p>\n");
            }
        }
        html.append("        </div>\n");
    }

    private static void appendGlossary(StringBuilder html, Map<String, Object> glossary) {
        if (glossary == null || glossary.isEmpty()) {
            return;
        }
        html.append("        <h2>Glossary</h2>\n")
            .append("        <dl>\n");
        glossary.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> html.append("            <dt><strong>").append(escape(e.getKey())).append("</strong></dt><dd>")
                        .append(escape(String.valueOf(e.getValue()))).append("</dd>\n"));
        html.append("        </dl>\n");
    }

    private static String rupees(BigDecimal amount) {
        return "&#8377;" + String.format(Locale.ENGLISH, "%,.2f", amount);
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<':
                    sb.append("&lt;");
                    break;
                case '>':
                    sb.append("&gt;");
                    break;
                case '&':
                    sb.append("&amp;");
                    break;
                case '"':
                    sb.append("&quot;");
                    break;
                case '\'':
                    sb.append("&#39;");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
