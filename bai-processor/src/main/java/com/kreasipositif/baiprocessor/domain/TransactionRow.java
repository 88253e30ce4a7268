package com.kreasipositif.baiprocessor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One exported transaction line: a {@code 16} record flattened with the context it inherited
 * from its account, group and file.
 *
 * <p>CSV column order:
 * <pre>
 *   Date, Bank ID, Account Number, Account Title, Entity, Tran Type, BAI Type Code, Currency,
 *   Credit Amount, Debit Amount, Bank Ref #, End to End ID, Customer Ref #, Description,
 *   Reason for Payment, Notes
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionRow {

    /** Bean property names, in CSV column order. */
    public static final String[] FIELDS = {
            "date", "bankId", "accountNumber", "accountTitle", "entity",
            "transactionType", "typeCode", "currency", "creditAmount", "debitAmount",
            "bankReference", "endToEndId", "customerReference", "description",
            "reasonForPayment", "notes"
    };

    public static final String[] HEADERS = {
            "Date", "Bank ID", "Account Number", "Account Title", "Entity",
            "Tran Type", "BAI Type Code", "Currency", "Credit Amount", "Debit Amount",
            "Bank Ref #", "End to End ID", "Customer Ref #", "Description",
            "Reason for Payment", "Notes"
    };

    /** Group as-of date rendered as M/D/YYYY (raw value when it does not parse). */
    private String date;

    /** Originator of the enclosing group. */
    private String bankId;

    private String accountNumber;
    private String accountTitle;
    private String entity;

    /** Human-readable label for {@link #typeCode}. */
    private String transactionType;

    private String typeCode;
    private String currency;

    /** Formatted amount when the type code is a credit, otherwise empty. */
    private String creditAmount;

    /** Formatted amount when the type code is a debit, otherwise empty. */
    private String debitAmount;

    private String bankReference;
    private String endToEndId;
    private String customerReference;

    /** Free text of the transaction, continuations included. */
    private String description;

    private String reasonForPayment;
    private String notes;

    /**
     * The credit amount as a number; zero when the column is empty or not numeric.
     */
    public BigDecimal parsedCreditAmount() {
        if (creditAmount == null) {
            return BigDecimal.ZERO;
        }
        String plain = creditAmount.replace(",", "").trim();
        if (plain.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(plain);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    public AppliedTransactionKey applicationKey() {
        return new AppliedTransactionKey(date, creditAmount, description, bankReference);
    }
}
