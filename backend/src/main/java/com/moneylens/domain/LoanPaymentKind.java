package com.moneylens.domain;

/**
 * Interest payments are recorded but leave the outstanding balance unchanged; principal payments reduce it.
 */
public enum LoanPaymentKind {
    INTEREST,
    PRINCIPAL
}
