package com.kreasipositif.baiprocessor.bai2;

import com.kreasipositif.baiprocessor.bai2.model.FileRecord;
import com.kreasipositif.baiprocessor.domain.BalanceRow;
import com.kreasipositif.baiprocessor.domain.TransactionRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class Bai2RowProjectorTest {

    private static final String FILE = String.join("\n",
            "01,BANKUS33,ACMEAR,240115,0600,1,80,,2/",
            "02,ACMEAR,021000021,1,240115,0600,USD,2/",
            "03,123456789,,010,1500000,,,015,1750000,2,0/",
            "16,169,150000,0,BR0001,CR0001,ACH PAYMENT ACME CORP/",
            "16,469,2500,0,BR0002,,PAYROLL/",
            "49,3402500,4/",
            "03,987654321,CAD,040,99,,/",
            "16,ABC,12.5,0,BR0003,,ODD/",
            "49,99,3/",
            "98,3402599,2,9/",
            "99,3402599,1,11/");

    private final Bai2Decoder decoder = new Bai2Decoder();
    private final Bai2RowProjector projector = new Bai2RowProjector("AR Account", "Acme Holdings");

    @Test
    @DisplayName("One balance row per quadruple, carrying header and trailer fields of every level")
    void balanceRows_fullyDenormalised() {
        List<BalanceRow> rows = projector.balanceRows(decoder.decode(FILE));

        assertThat(rows).extracting(BalanceRow::getBalanceTypeCode).containsExactly("010", "015", "040");

        BalanceRow first = rows.get(0);
        assertThat(first.getFileSenderId()).isEqualTo("BANKUS33");
        assertThat(first.getGroupOriginatorId()).isEqualTo("021000021");
        assertThat(first.getAsOfDate()).isEqualTo("240115");
        assertThat(first.getCurrencyCode()).isEqualTo("USD");
        assertThat(first.getCustomerAccount()).isEqualTo("123456789");
        assertThat(first.getBalanceAmount()).isEqualTo("1500000");
        assertThat(first.getAccountControlTotal()).isEqualTo("3402500");
        assertThat(first.getGroupControlTotal()).isEqualTo("3402599");
        assertThat(first.getFileControlTotal()).isEqualTo("3402599");

        BalanceRow second = rows.get(1);
        assertThat(second.getBalanceItemCount()).isEqualTo("2");
        assertThat(second.getBalanceFundsType()).isEqualTo("0");

        // account currency wins over the group's
        assertThat(rows.get(2).getCurrencyCode()).isEqualTo("CAD");
        assertThat(rows.get(2).getAccountControlTotal()).isEqualTo("99");
    }

    @Test
    @DisplayName("Credit transaction — formatted credit amount, empty debit, label and context columns")
    void transactionRows_credit() {
        TransactionRow row = projector.transactionRows(decoder.decode(FILE)).get(0);

        assertThat(row.getDate()).isEqualTo("1/15/2024");
        assertThat(row.getBankId()).isEqualTo("021000021");
        assertThat(row.getAccountNumber()).isEqualTo("123456789");
        assertThat(row.getAccountTitle()).isEqualTo("AR Account");
        assertThat(row.getEntity()).isEqualTo("Acme Holdings");
        assertThat(row.getTransactionType()).isEqualTo("ACH CREDIT");
        assertThat(row.getTypeCode()).isEqualTo("169");
        assertThat(row.getCurrency()).isEqualTo("USD");
        assertThat(row.getCreditAmount()).isEqualTo("1,500.00");
        assertThat(row.getDebitAmount()).isEmpty();
        assertThat(row.getBankReference()).isEqualTo("BR0001");
        assertThat(row.getCustomerReference()).isEqualTo("CR0001");
        assertThat(row.getDescription()).isEqualTo("ACH PAYMENT ACME CORP");
        assertThat(row.getEndToEndId()).isEmpty();
        assertThat(row.getReasonForPayment()).isEmpty();
        assertThat(row.getNotes()).isEmpty();
    }

    @Test
    @DisplayName("Debit and unclassifiable transactions fill only the debit column")
    void transactionRows_debits() {
        List<TransactionRow> rows = projector.transactionRows(decoder.decode(FILE));

        assertThat(rows).hasSize(3);
        assertThat(rows.get(1).getTransactionType()).isEqualTo("ACH DEBIT");
        assertThat(rows.get(1).getDebitAmount()).isEqualTo("25.00");
        assertThat(rows.get(1).getCreditAmount()).isEmpty();

        TransactionRow odd = rows.get(2);
        assertThat(odd.getTransactionType()).isEqualTo("Debit (ABC)");
        assertThat(odd.getDebitAmount()).isEqualTo("12.5");
        assertThat(odd.getCreditAmount()).isEmpty();
        assertThat(odd.getCurrency()).isEqualTo("CAD");
    }

    @Test
    @DisplayName("Orphaned records are not exported; an empty file yields no rows")
    void rows_skipOrphansAndEmptyFiles() {
        FileRecord orphans = decoder.decode(String.join("\n",
                "01,BANK,RCV,240115,0600/",
                "03,LOOSE,USD,010,100,,/",
                "16,169,100,0,R1,,LOOSE/"));

        assertThat(projector.balanceRows(orphans)).isEmpty();
        assertThat(projector.transactionRows(orphans)).isEmpty();
        assertThat(projector.transactionRows(decoder.decode("01,BANK,RCV,240115,0600/"))).isEmpty();
    }
}
