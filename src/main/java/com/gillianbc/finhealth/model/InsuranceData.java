package com.gillianbc.finhealth.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

import static com.gillianbc.finhealth.model.Amounts.nonNegativeOrZero;

@Getter
@ToString
public class InsuranceData {

    private final BigDecimal totalMedicalCover;
    private final BigDecimal totalTermCover;

    @Builder
    @Jacksonized
    public InsuranceData(BigDecimal totalMedicalCover, BigDecimal totalTermCover) {
        this.totalMedicalCover = nonNegativeOrZero(totalMedicalCover, "totalMedicalCover");
        this.totalTermCover = nonNegativeOrZero(totalTermCover, "totalTermCover");
    }
}
