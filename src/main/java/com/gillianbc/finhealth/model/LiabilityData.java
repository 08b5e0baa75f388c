package com.gillianbc.finhealth.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

import static com.gillianbc.finhealth.model.Amounts.nonNegativeOrZero;

/**
 * Monthly EMIs and outstanding balances for the five loan types, in INR.
 */
@Getter
@ToString
public class LiabilityData {

    private final BigDecimal creditCardEmi;
    private final BigDecimal personalLoanEmi;
    private final BigDecimal carLoanEmi;
    private final BigDecimal studentLoanEmi;
    private final BigDecimal homeLoanEmi;
    private final BigDecimal outstandingCreditCardBalance;
    private final BigDecimal outstandingPersonalLoanBalance;
    private final BigDecimal outstandingCarLoanBalance;
    private final BigDecimal outstandingStudentLoanBalance;
    private final BigDecimal outstandingHomeLoanBalance;

    @Builder
    @Jacksonized
    public LiabilityData(BigDecimal creditCardEmi,
                         BigDecimal personalLoanEmi,
                         BigDecimal carLoanEmi,
                         BigDecimal studentLoanEmi,
                         BigDecimal homeLoanEmi,
                         BigDecimal outstandingCreditCardBalance,
                         BigDecimal outstandingPersonalLoanBalance,
                         BigDecimal outstandingCarLoanBalance,
                         BigDecimal outstandingStudentLoanBalance,
                         BigDecimal outstandingHomeLoanBalance) {
        this.creditCardEmi = nonNegativeOrZero(creditCardEmi, "creditCardEmi");
        this.personalLoanEmi = nonNegativeOrZero(personalLoanEmi, "personalLoanEmi");
        this.carLoanEmi = nonNegativeOrZero(carLoanEmi, "carLoanEmi");
        this.studentLoanEmi = nonNegativeOrZero(studentLoanEmi, "studentLoanEmi");
        this.homeLoanEmi = nonNegativeOrZero(homeLoanEmi, "homeLoanEmi");
        this.outstandingCreditCardBalance = nonNegativeOrZero(outstandingCreditCardBalance, "outstandingCreditCardBalance");
        this.outstandingPersonalLoanBalance = nonNegativeOrZero(outstandingPersonalLoanBalance, "outstandingPersonalLoanBalance");
        this.outstandingCarLoanBalance = nonNegativeOrZero(outstandingCarLoanBalance, "outstandingCarLoanBalance");
        this.outstandingStudentLoanBalance = nonNegativeOrZero(outstandingStudentLoanBalance, "outstandingStudentLoanBalance");
        this.outstandingHomeLoanBalance = nonNegativeOrZero(outstandingHomeLoanBalance, "outstandingHomeLoanBalance");
    }

    /**
     * @return true when every outstanding balance is zero
     */
    public boolean isDebtFree() {
        return outstandingCreditCardBalance.signum() == 0
                && outstandingPersonalLoanBalance.signum() == 0
                && outstandingCarLoanBalance.signum() == 0
                && outstandingStudentLoanBalance.signum() == 0
                && outstandingHomeLoanBalance.signum() == 0;
    }
}
