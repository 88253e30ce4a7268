package com.kreasipositif.baiprocessor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.stream.Stream;

/**
 * A transaction row with the outcome of invoice matching appended.
 *
 * <p>The four match columns are always present; all of them are empty when no invoice qualified.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CashApplicationRow {

    public static final String[] FIELDS = Stream.concat(
                    Arrays.stream(TransactionRow.FIELDS).map(f -> "transaction." + f),
                    Stream.of("matchedCustomer", "invoiceNumber", "confidence", "invoiceLink"))
            .toArray(String[]::new);

    public static final String[] HEADERS = Stream.concat(
                    Arrays.stream(TransactionRow.HEADERS),
                    Stream.of("Matched Customer", "Invoice #", "Confidence", "Invoice Link"))
            .toArray(String[]::new);

    private TransactionRow transaction;

    @Builder.Default
    private String matchedCustomer = "";

    @Builder.Default
    private String invoiceNumber = "";

    /** Winning score as a percentage, e.g. {@code 80%}. */
    @Builder.Default
    private String confidence = "";

    /** Spreadsheet {@code =HYPERLINK(...)} formula pointing at the invoice. */
    @Builder.Default
    private String invoiceLink = "";

    public static CashApplicationRow unmatched(TransactionRow transaction) {
        return CashApplicationRow.builder().transaction(transaction).build();
    }

    public boolean isMatched() {
        return !invoiceNumber.isEmpty();
    }
}
