package com.kreasipositif.baiprocessor.domain;

import java.util.Objects;

/**
 * Identifies a transaction row that has already been written to the cash-application file.
 */
public record AppliedTransactionKey(String date, String creditAmount, String description, String bankReference) {

    public AppliedTransactionKey {
        date = Objects.requireNonNullElse(date, "");
        creditAmount = Objects.requireNonNullElse(creditAmount, "");
        description = Objects.requireNonNullElse(description, "");
        bankReference = Objects.requireNonNullElse(bankReference, "");
    }
}
