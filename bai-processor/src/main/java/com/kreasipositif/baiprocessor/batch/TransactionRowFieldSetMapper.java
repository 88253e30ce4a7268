package com.kreasipositif.baiprocessor.batch;

import com.kreasipositif.baiprocessor.domain.TransactionRow;
import org.springframework.batch.item.file.mapping.FieldSetMapper;
import org.springframework.batch.item.file.transform.FieldSet;
import org.springframework.stereotype.Component;

/**
 * Maps a parsed transactions-CSV {@link FieldSet} back to a {@link TransactionRow}.
 *
 * <p>Column indices (0-based), matching the CSV header:
 * <pre>
 *   0  Date                 8  Credit Amount
 *   1  Bank ID              9  Debit Amount
 *   2  Account Number      10  Bank Ref #
 *   3  Account Title       11  End to End ID
 *   4  Entity              12  Customer Ref #
 *   5  Tran Type           13  Description
 *   6  BAI Type Code       14  Reason for Payment
 *   7  Currency            15  Notes
 * </pre>
 *
 * <p>Rows written by other tools may stop early; missing trailing columns read as empty.
 */
@Component
public class TransactionRowFieldSetMapper implements FieldSetMapper<TransactionRow> {

    @Override
    public TransactionRow mapFieldSet(FieldSet fieldSet) {
        return TransactionRow.builder()
                .date(read(fieldSet, 0))
                .bankId(read(fieldSet, 1))
                .accountNumber(read(fieldSet, 2))
                .accountTitle(read(fieldSet, 3))
                .entity(read(fieldSet, 4))
                .transactionType(read(fieldSet, 5))
                .typeCode(read(fieldSet, 6))
                .currency(read(fieldSet, 7))
                .creditAmount(read(fieldSet, 8))
                .debitAmount(read(fieldSet, 9))
                .bankReference(read(fieldSet, 10))
                .endToEndId(read(fieldSet, 11))
                .customerReference(read(fieldSet, 12))
                // free text keeps its spacing so the de-duplication key stays stable
                .description(readRaw(fieldSet, 13))
                .reasonForPayment(read(fieldSet, 14))
                .notes(read(fieldSet, 15))
                .build();
    }

    private static String read(FieldSet fieldSet, int index) {
        return index < fieldSet.getFieldCount() ? fieldSet.readString(index) : "";
    }

    private static String readRaw(FieldSet fieldSet, int index) {
        return index < fieldSet.getFieldCount() ? fieldSet.readRawString(index) : "";
    }
}
