package com.gillianbc.finhealth.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

import static com.gillianbc.finhealth.model.Amounts.nonNegativeOrZero;

/**
 * Monthly outgoings excluding loan EMIs, in INR.
 */
@Getter
@ToString
public class ExpenseData {

    private final BigDecimal housingCost;
    private final BigDecimal utilitiesAndBills;
    private final BigDecimal groceriesAndEssentials;
    private final BigDecimal discretionaryExpense;
    private final BigDecimal medicalInsurancePremium;
    private final BigDecimal termInsurancePremium;

    @Builder
    @Jacksonized
    public ExpenseData(BigDecimal housingCost,
                       BigDecimal utilitiesAndBills,
                       BigDecimal groceriesAndEssentials,
                       BigDecimal discretionaryExpense,
                       BigDecimal medicalInsurancePremium,
                       BigDecimal termInsurancePremium) {
        this.housingCost = nonNegativeOrZero(housingCost, "housingCost");
        this.utilitiesAndBills = nonNegativeOrZero(utilitiesAndBills, "utilitiesAndBills");
        this.groceriesAndEssentials = nonNegativeOrZero(groceriesAndEssentials, "groceriesAndEssentials");
        this.discretionaryExpense = nonNegativeOrZero(discretionaryExpense, "discretionaryExpense");
        this.medicalInsurancePremium = nonNegativeOrZero(medicalInsurancePremium, "medicalInsurancePremium");
        this.termInsurancePremium = nonNegativeOrZero(termInsurancePremium, "termInsurancePremium");
    }
}
