package com.gillianbc.finhealth.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gillianbc.finhealth.TestProfiles;
import com.gillianbc.finhealth.config.FinanceHealthProperties;
import com.gillianbc.finhealth.service.UserProfileReader;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class ProfileReportRunnerTest {

    @Test
    @DisplayName("Running against a profile file writes one HTML report")
    void run_writesReport(@TempDir Path dir) throws IOException {
        Path profile = dir.resolve("profile.json");
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("profiles/sample-profile.json")) {
            assertNotNull(in, "sample profile missing from the test classpath");
            Files.copy(in, profile);
        }
        FinanceHealthProperties properties = TestProfiles.properties();
        properties.getReport().setProfilePath(profile.toString());
        Path output = dir.resolve("results");

        new ProfileReportRunner(properties, new UserProfileReader(new ObjectMapper()), TestProfiles.analyzer(),
                new HtmlReportWriter(output)).run(null);

        List<Path> written;
        try (Stream<Path> files = Files.list(output)) {
            written = files.collect(Collectors.toList());
        }
        log.info("Runner wrote {}", written);
        assertEquals(1, written.size());
        assertTrue(Files.readString(written.get(0), StandardCharsets.UTF_8).contains("Financial Health Report"));
    }
}
