package com.gillianbc.finhealth.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.Objects;

/**
 * Immutable input to one analysis. Owned by the caller; the engine only reads it.
 */
@Getter
@ToString
public class UserProfile {

    private final PersonalData personalData;
    private final IncomeData incomeData;
    private final ExpenseData expenseData;
    private final AssetData assetData;
    private final LiabilityData liabilityData;
    private final InsuranceData insuranceData;

    @Builder
    @Jacksonized
    public UserProfile(PersonalData personalData,
                       IncomeData incomeData,
                       ExpenseData expenseData,
                       AssetData assetData,
                       LiabilityData liabilityData,
                       InsuranceData insuranceData) {
        this.personalData = Objects.requireNonNull(personalData, "personalData must not be null");
        this.incomeData = Objects.requireNonNull(incomeData, "incomeData must not be null");
        this.expenseData = Objects.requireNonNull(expenseData, "expenseData must not be null");
        this.assetData = Objects.requireNonNull(assetData, "assetData must not be null");
        this.liabilityData = Objects.requireNonNull(liabilityData, "liabilityData must not be null");
        this.insuranceData = Objects.requireNonNull(insuranceData, "insuranceData must not be null");
    }
}
