package com.gillianbc.finhealth.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.gillianbc.finhealth.exception.FinanceHealthException;
import com.gillianbc.finhealth.exception.MissingProfileException;
import com.gillianbc.finhealth.model.UserProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a {@link UserProfile} from snake_case JSON such as
 * <pre>
 * { "personal_data": { "age": 32, "city": "Pune", ... }, "income_data": { "salaried_income": 120000 }, ... }
 * </pre>
 * Unknown fields are ignored; missing amounts count as zero.
 */
@Slf4j
@Service
public class UserProfileReader {

    private final ObjectMapper mapper;

    public UserProfileReader(ObjectMapper objectMapper) {
        this.mapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null").copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public UserProfile read(Path path) {
        if (!Files.isReadable(path)) {
            throw new MissingProfileException("Profile " + path + " does not exist or cannot be read.");
        }
        try (InputStream in = Files.newInputStream(path)) {
            UserProfile profile = read(in);
            log.info("Read profile from {}", path);
            return profile;
        } catch (IOException e) {
            throw new FinanceHealthException("Failed to read profile " + path, e);
        }
    }

    /**
     * @throws IOException when the JSON is malformed or fails profile validation
     */
    public UserProfile read(InputStream in) throws IOException {
        UserProfile profile = mapper.readValue(in, UserProfile.class);
        if (profile == null) {
            throw new MissingProfileException();
        }
        return profile;
    }
}
