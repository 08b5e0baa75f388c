package com.gillianbc.finhealth.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gillianbc.finhealth.TestProfiles;
import com.gillianbc.finhealth.exception.MissingProfileException;
import com.gillianbc.finhealth.model.Gender;
import com.gillianbc.finhealth.model.MaritalStatus;
import com.gillianbc.finhealth.model.RiskProfile;
import com.gillianbc.finhealth.model.UserProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static com.gillianbc.finhealth.TestProfiles.amount;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UserProfileReaderTest {

    private final UserProfileReader reader = new UserProfileReader(new ObjectMapper());

    private UserProfile sample() throws IOException {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("profiles/sample-profile.json")) {
            assertNotNull(in, "sample profile missing from the test classpath");
            return reader.read(in);
        }
    }

    @Test
    @DisplayName("Snake-case JSON maps onto the profile")
    void read_sampleProfile() throws IOException {
        UserProfile profile = sample();

        assertEquals(32, profile.getPersonalData().getAge());
        assertEquals(Gender.FEMALE, profile.getPersonalData().getGender());
        assertEquals(RiskProfile.MODERATE, profile.getPersonalData().getRiskProfile());
        assertEquals(MaritalStatus.MARRIED, profile.getPersonalData().getMaritalStatus());
        assertEquals(1, profile.getPersonalData().getNoOfDependents());
        assertEquals(amount("90000"), profile.getIncomeData().getSalariedIncome());
        assertEquals(amount("420000"), profile.getAssetData().getTotalEmergencyFund());
        assertTrue(profile.getLiabilityData().isDebtFree());
    }

    @Test
    @DisplayName("investment_returns is read as other income")
    void read_aliasForOtherIncome() throws IOException {
        assertEquals(amount("10000"), sample().getIncomeData().getOtherIncome());
    }

    @Test
    @DisplayName("The sample profile scores like the equivalent built profile")
    void read_sampleMatchesStandardProfile() throws IOException {
        assertEquals(TestProfiles.analyzer().analyse(TestProfiles.standard()).totalScore(),
                TestProfiles.analyzer().analyse(sample()).totalScore());
    }

    @Test
    @DisplayName("Negative amounts are rejected")
    void read_negativeAmount_throws() {
        String json = "{\"personal_data\":{\"age\":30,\"city\":\"Pune\"},\"income_data\":{\"salaried_income\":-1},"
                + "\"expense_data\":{},\"asset_data\":{},\"liability_data\":{},\"insurance_data\":{}}";
        assertThrows(IOException.class,
                () -> reader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    @DisplayName("A missing file is reported as a missing profile")
    void read_missingFile_throws(@TempDir Path dir) {
        assertThrows(MissingProfileException.class, () -> reader.read(dir.resolve("absent.json")));
    }
}
