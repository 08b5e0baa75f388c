package com.gillianbc.finhealth.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

import static com.gillianbc.finhealth.model.Amounts.nonNegativeOrZero;

/**
 * Monthly income by source, in INR.
 */
@Getter
@ToString
public class IncomeData {

    private final BigDecimal salariedIncome;
    private final BigDecimal businessIncome;
    private final BigDecimal freelanceIncome;
    private final BigDecimal rentalIncome;
    private final BigDecimal otherIncome;

    @Builder
    @Jacksonized
    public IncomeData(BigDecimal salariedIncome,
                      BigDecimal businessIncome,
                      BigDecimal freelanceIncome,
                      BigDecimal rentalIncome,
                      @JsonAlias("investment_returns") BigDecimal otherIncome) {
        this.salariedIncome = nonNegativeOrZero(salariedIncome, "salariedIncome");
        this.businessIncome = nonNegativeOrZero(businessIncome, "businessIncome");
        this.freelanceIncome = nonNegativeOrZero(freelanceIncome, "freelanceIncome");
        this.rentalIncome = nonNegativeOrZero(rentalIncome, "rentalIncome");
        this.otherIncome = nonNegativeOrZero(otherIncome, "otherIncome");
    }
}
