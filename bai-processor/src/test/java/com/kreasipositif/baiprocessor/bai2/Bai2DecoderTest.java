package com.kreasipositif.baiprocessor.bai2;

import com.kreasipositif.baiprocessor.bai2.model.AccountRecord;
import com.kreasipositif.baiprocessor.bai2.model.BalanceEntry;
import com.kreasipositif.baiprocessor.bai2.model.FileRecord;
import com.kreasipositif.baiprocessor.bai2.model.GroupRecord;
import com.kreasipositif.baiprocessor.bai2.model.TransactionContext;
import com.kreasipositif.baiprocessor.bai2.model.TransactionRecord;
import com.kreasipositif.baiprocessor.exception.BankFileException;
import com.kreasipositif.baiprocessor.exception.EmptyBankFileException;
import com.kreasipositif.baiprocessor.exception.MalformedBankFileException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Bai2DecoderTest {

    private static final String SINGLE_TRANSACTION_FILE = String.join("\n",
            "01,BANKUS33,ACMEAR,240115,0600,1,80,,2/",
            "02,ACMEAR,021000021,1,240115,0600,USD,2/",
            "03,123456789,,010,1500000,,,015,1750000,2,0/",
            "16,169,100000,0,BR0001,CR0001,ACH PAYMENT ACME CORP/",
            "49,3350000,3/",
            "98,3350000,1,5/",
            "99,3350000,1,7/");

    private final Bai2Decoder decoder = new Bai2Decoder();

    // ─────────────────────────────────────────────────────────────────────────
    // Hierarchy
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Header fields of every level are populated from their records")
    void decode_populatesHeaderFields() {
        FileRecord file = decoder.decode(SINGLE_TRANSACTION_FILE);

        assertThat(file.getSenderId()).isEqualTo("BANKUS33");
        assertThat(file.getReceiverId()).isEqualTo("ACMEAR");
        assertThat(file.getCreationDate()).isEqualTo("240115");
        assertThat(file.getCreationTime()).isEqualTo("0600");
        assertThat(file.getResendIndicator()).isEqualTo("1");
        assertThat(file.getRecordSize()).isEqualTo("80");
        assertThat(file.getBlockingFactor()).isEmpty();
        assertThat(file.getVersionNumber()).isEqualTo("2");

        GroupRecord group = file.getGroups().get(0);
        assertThat(group.getUltimateReceiverId()).isEqualTo("ACMEAR");
        assertThat(group.getOriginatorId()).isEqualTo("021000021");
        assertThat(group.getGroupStatus()).isEqualTo("1");
        assertThat(group.getAsOfDate()).isEqualTo("240115");
        assertThat(group.getCurrencyCode()).isEqualTo("USD");
        assertThat(group.getAsOfDateModifier()).isEqualTo("2");
    }

    @Test
    @DisplayName("Single-transaction file — transaction carries the context of its account, group and file")
    void decode_singleTransaction_copiesAncestorContext() {
        FileRecord file = decoder.decode(SINGLE_TRANSACTION_FILE);

        TransactionRecord transaction = file.getGroups().get(0).getAccounts().get(0).getTransactions().get(0);
        assertThat(transaction.getTypeCode()).isEqualTo("169");
        assertThat(transaction.getAmount()).isEqualTo("100000");
        assertThat(transaction.getFundsType()).isEqualTo("0");
        assertThat(transaction.getBankReference()).isEqualTo("BR0001");
        assertThat(transaction.getCustomerReference()).isEqualTo("CR0001");
        assertThat(transaction.getText()).isEqualTo("ACH PAYMENT ACME CORP");

        // account has no currency, so the group's applies
        assertThat(transaction.getContext()).isEqualTo(new TransactionContext(
                "123456789", "USD", "240115", "0600", "2", "021000021", "ACMEAR", "240115", "0600"));
    }

    @Test
    @DisplayName("Balance quadruples are read from position 3; a quadruple with no type code is dropped")
    void decode_accountHeader_readsBalanceQuadruples() {
        FileRecord file = decoder.decode(String.join("\n",
                "01,BANK,RCV,240115,0600/",
                "02,RCV,BANK,1,240115/",
                "03,555,EUR,010,100,1,0,,200,,,040,300/"));

        AccountRecord account = file.getGroups().get(0).getAccounts().get(0);
        assertThat(account.getCurrencyCode()).isEqualTo("EUR");
        assertThat(account.getBalances()).containsExactly(
                new BalanceEntry("010", "100", "1", "0"),
                new BalanceEntry("040", "300", "", ""));
    }

    @Test
    @DisplayName("Trailers populate control totals; a truncated file leaves them empty without failing")
    void decode_trailers() {
        FileRecord complete = decoder.decode(SINGLE_TRANSACTION_FILE);
        assertThat(complete.getControlTotal()).isEqualTo("3350000");
        // second trailer field: group count on 99, account count on 98
        assertThat(complete.getRecordCount()).isEqualTo("1");
        assertThat(complete.getGroups().get(0).getControlTotal()).isEqualTo("3350000");
        assertThat(complete.getGroups().get(0).getRecordCount()).isEqualTo("1");
        assertThat(complete.getGroups().get(0).getAccounts().get(0).getRecordCount()).isEqualTo("3");

        FileRecord truncated = decoder.decode(String.join("\n",
                "01,BANK,RCV,240115,0600/",
                "02,RCV,BANK,1,240115/",
                "03,555,USD/",
                "16,169,100,0,R1,,PAYMENT/"));
        assertThat(truncated.getControlTotal()).isEmpty();
        assertThat(truncated.getGroups().get(0).getControlTotal()).isEmpty();
        assertThat(truncated.getGroups().get(0).getAccounts().get(0).getControlTotal()).isEmpty();
        assertThat(truncated.getGroups().get(0).getAccounts().get(0).getTransactions()).hasSize(1);
    }

    @Test
    @DisplayName("Groups, accounts and transactions keep file order")
    void decode_preservesOrder() {
        FileRecord file = decoder.decode(String.join("\n",
                "01,BANK,RCV,240115,0600/",
                "02,RCV,BANK-A,1,240115/",
                "03,A1,USD/",
                "16,169,1,0,R1,,FIRST/",
                "16,469,2,0,R2,,SECOND/",
                "49,3,4/",
                "03,A2,USD/",
                "16,195,3,0,R3,,THIRD/",
                "49,3,3/",
                "98,6,2,9/",
                "02,RCV,BANK-B,1,240116/",
                "03,B1,CAD/",
                "49,0,2/",
                "98,0,1,4/",
                "99,6,2,15/"));

        assertThat(file.getGroups()).extracting(GroupRecord::getOriginatorId).containsExactly("BANK-A", "BANK-B");
        assertThat(file.getGroups().get(0).getAccounts())
                .extracting(AccountRecord::getCustomerAccount).containsExactly("A1", "A2");
        assertThat(file.getGroups().get(0).getAccounts().get(0).getTransactions())
                .extracting(TransactionRecord::getText).containsExactly("FIRST", "SECOND");
        assertThat(file.getGroups().get(1).getAccounts().get(0).getTransactions()).isEmpty();
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Free text and continuations
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Commas inside transaction text are kept")
    void decode_textWithCommas() {
        FileRecord file = decoder.decode(String.join("\n",
                "01,BANK,RCV,240115,0600/",
                "02,RCV,BANK,1,240115/",
                "03,555,USD/",
                "16,169,100,0,R1,,PAYMENT FOR INV 1001, 1002/"));

        assertThat(file.getGroups().get(0).getAccounts().get(0).getTransactions().get(0).getText())
                .isEqualTo("PAYMENT FOR INV 1001, 1002");
    }

    @Test
    @DisplayName("Continuation records extend the transaction text, however the text is split")
    void decode_continuationsAreChunkingIndependent() {
        String header = String.join("\n",
                "01,BANK,RCV,240115,0600/",
                "02,RCV,BANK,1,240115/",
                "03,555,USD/");

        FileRecord oneLine = decoder.decode(header + "\n16,169,100,0,R1,,WIRE FROM GLOBEX REF 2002/");
        FileRecord twoLines = decoder.decode(header + "\n16,169,100,0,R1,,WIRE FROM /\n88,GLOBEX REF 2002/");
        FileRecord threeLines = decoder.decode(header + "\n16,169,100,0,R1,,WIRE /\n88,FROM GLOBEX /\n88,REF 2002/");

        assertThat(oneLine).isEqualTo(twoLines).isEqualTo(threeLines);
    }

    @Test
    @DisplayName("Continuation of an account header adds balance quadruples")
    void decode_accountHeaderContinuation() {
        FileRecord file = decoder.decode(String.join("\r\n",
                "01,BANK,RCV,240115,0600/",
                "02,RCV,BANK,1,240115/",
                "03,555,USD,010,100,1,0,/",
                "88,015,200,2,0/"));

        assertThat(file.getGroups().get(0).getAccounts().get(0).getBalances())
                .extracting(BalanceEntry::typeCode).containsExactly("010", "015");
    }

    @Test
    @DisplayName("joinContinuations drops blank lines and folds 88 records into the previous line")
    void joinContinuations_foldsAndDropsBlankLines() {
        List<String> joined = Bai2Decoder.joinContinuations(List.of(
                "16,169,100,0,R1,,ABC/",
                "",
                "88,DEF/",
                "   ",
                "88,GHI/",
                "49,100,2/"));

        assertThat(joined).containsExactly("16,169,100,0,R1,,ABCDEFGHI/", "49,100,2/");
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Orphans and unknown records
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Account before any group and transaction before any account are kept as orphans")
    void decode_orphans() {
        FileRecord file = decoder.decode(String.join("\n",
                "01,BANK,RCV,240115,0600/",
                "16,169,100,0,R0,,NO ACCOUNT/",
                "03,LOOSE,USD/",
                "16,169,200,0,R1,,LOOSE ACCOUNT/"));

        assertThat(file.getGroups()).isEmpty();
        assertThat(file.getOrphanedAccounts()).extracting(AccountRecord::getCustomerAccount).containsExactly("LOOSE");
        assertThat(file.getOrphanedTransactions()).extracting(TransactionRecord::getBankReference).containsExactly("R0");

        // the orphaned account still collects its transaction, without context
        TransactionRecord underLooseAccount = file.getOrphanedAccounts().get(0).getTransactions().get(0);
        assertThat(underLooseAccount.getBankReference()).isEqualTo("R1");
        assertThat(underLooseAccount.getContext()).isEqualTo(TransactionContext.EMPTY);
    }

    @Test
    @DisplayName("A transaction after a group trailer has no open account")
    void decode_transactionAfterGroupTrailer_isOrphaned() {
        FileRecord file = decoder.decode(String.join("\n",
                "01,BANK,RCV,240115,0600/",
                "02,RCV,BANK,1,240115/",
                "03,555,USD/",
                "98,0,1,3/",
                "16,169,100,0,LATE,,AFTER TRAILER/"));

        assertThat(file.getGroups().get(0).getAccounts().get(0).getTransactions()).isEmpty();
        assertThat(file.getOrphanedTransactions()).extracting(TransactionRecord::getBankReference)
                .containsExactly("LATE");
    }

    @Test
    @DisplayName("Unknown record types are ignored")
    void decode_unknownRecordsIgnored() {
        FileRecord withNoise = decoder.decode(SINGLE_TRANSACTION_FILE.replace("49,", "77,SOMETHING/\n49,"));

        assertThat(withNoise).isEqualTo(decoder.decode(SINGLE_TRANSACTION_FILE));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Structural errors and idempotence
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Empty or blank content is rejected as an empty bank file")
    void decode_empty() {
        assertThatThrownBy(() -> decoder.decode("")).isInstanceOf(EmptyBankFileException.class);
        assertThatThrownBy(() -> decoder.decode(" \n\r\n ")).isInstanceOf(EmptyBankFileException.class);
        assertThatThrownBy(() -> decoder.decode(null)).isInstanceOf(BankFileException.class);
    }

    @Test
    @DisplayName("Content without a 01 header is rejected as malformed")
    void decode_noFileHeader() {
        assertThatThrownBy(() -> decoder.decode("02,RCV,BANK,1,240115/\n03,555,USD/"))
                .isInstanceOf(MalformedBankFileException.class)
                .isInstanceOf(BankFileException.class);
    }

    @Test
    @DisplayName("A header with nothing after it is a valid, empty file")
    void decode_headerOnly() {
        FileRecord file = decoder.decode("01,BANK,RCV,240115,0600/");

        assertThat(file.getSenderId()).isEqualTo("BANK");
        assertThat(file.getGroups()).isEmpty();
    }

    @Test
    @DisplayName("Decoding the same content twice yields equal trees")
    void decode_isIdempotent() {
        FileRecord first = decoder.decode(SINGLE_TRANSACTION_FILE);
        FileRecord second = decoder.decode(SINGLE_TRANSACTION_FILE);

        assertThat(first).isEqualTo(second).isNotSameAs(second);
    }
}
