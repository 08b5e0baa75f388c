package com.gillianbc.finhealth.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

import static com.gillianbc.finhealth.model.Amounts.nonNegativeOrZero;

/**
 * Current holdings plus the monthly SIPs feeding them, in INR.
 */
@Getter
@ToString
public class AssetData {

    private final BigDecimal equitySip;
    private final BigDecimal debtSip;
    private final BigDecimal retirementSip;
    private final BigDecimal totalSavingsBalance;
    private final BigDecimal totalEmergencyFund;
    private final BigDecimal totalEquityInvestments;
    private final BigDecimal totalDebtInvestments;
    private final BigDecimal totalRetirementInvestments;
    private final BigDecimal totalRealEstateInvestments;

    @Builder
    @Jacksonized
    public AssetData(BigDecimal equitySip,
                     BigDecimal debtSip,
                     BigDecimal retirementSip,
                     BigDecimal totalSavingsBalance,
                     BigDecimal totalEmergencyFund,
                     BigDecimal totalEquityInvestments,
                     BigDecimal totalDebtInvestments,
                     BigDecimal totalRetirementInvestments,
                     BigDecimal totalRealEstateInvestments) {
        this.equitySip = nonNegativeOrZero(equitySip, "equitySip");
        this.debtSip = nonNegativeOrZero(debtSip, "debtSip");
        this.retirementSip = nonNegativeOrZero(retirementSip, "retirementSip");
        this.totalSavingsBalance = nonNegativeOrZero(totalSavingsBalance, "totalSavingsBalance");
        this.totalEmergencyFund = nonNegativeOrZero(totalEmergencyFund, "totalEmergencyFund");
        this.totalEquityInvestments = nonNegativeOrZero(totalEquityInvestments, "totalEquityInvestments");
        this.totalDebtInvestments = nonNegativeOrZero(totalDebtInvestments, "totalDebtInvestments");
        this.totalRetirementInvestments = nonNegativeOrZero(totalRetirementInvestments, "totalRetirementInvestments");
        this.totalRealEstateInvestments = nonNegativeOrZero(totalRealEstateInvestments, "totalRealEstateInvestments");
    }
}
