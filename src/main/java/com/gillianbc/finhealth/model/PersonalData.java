package com.gillianbc.finhealth.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * Who the profile belongs to. Age and retirement age drive the retirement projection,
 * the net worth multiplier and the order feedback is presented in. The city may be missing,
 * in which case the profile is benchmarked as Tier 3.
 */
@Getter
@ToString
public class PersonalData {

    private final int age;
    private final Gender gender;
    private final String city;
    private final RiskProfile riskProfile;
    private final int expectedRetirementAge;
    private final MaritalStatus maritalStatus;
    private final int noOfDependents;

    @Builder
    @Jacksonized
    public PersonalData(int age,
                        Gender gender,
                        String city,
                        RiskProfile riskProfile,
                        int expectedRetirementAge,
                        MaritalStatus maritalStatus,
                        int noOfDependents) {
        if (age < 0) {
            throw new IllegalArgumentException("age must be >= 0");
        }
        if (noOfDependents < 0) {
            throw new IllegalArgumentException("noOfDependents must be >= 0");
        }
        this.age = age;
        this.gender = gender;
        this.city = city;
        this.riskProfile = riskProfile;
        this.expectedRetirementAge = expectedRetirementAge;
        this.maritalStatus = maritalStatus;
        this.noOfDependents = noOfDependents;
    }

    public int yearsToRetirement() {
        return expectedRetirementAge - age;
    }
}
