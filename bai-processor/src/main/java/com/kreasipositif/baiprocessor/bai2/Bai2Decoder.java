package com.kreasipositif.baiprocessor.bai2;

import com.kreasipositif.baiprocessor.bai2.model.AccountRecord;
import com.kreasipositif.baiprocessor.bai2.model.BalanceEntry;
import com.kreasipositif.baiprocessor.bai2.model.FileRecord;
import com.kreasipositif.baiprocessor.bai2.model.GroupRecord;
import com.kreasipositif.baiprocessor.bai2.model.TransactionContext;
import com.kreasipositif.baiprocessor.bai2.model.TransactionRecord;
import com.kreasipositif.baiprocessor.exception.EmptyBankFileException;
import com.kreasipositif.baiprocessor.exception.MalformedBankFileException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the text of a BAI2 file into a {@link FileRecord} tree.
 *
 * <h3>Passes</h3>
 * <ol>
 *   <li>{@link #joinContinuations(List)} folds every {@code 88} record into the logical record
 *       before it.</li>
 *   <li>Each logical record is split into {@link RecordFields} and dispatched on its type code,
 *       with one "current" pointer per level of the hierarchy.</li>
 * </ol>
 *
 * <p>Decoding is best-effort: unknown record types are ignored, short records default their
 * missing fields to {@code ""}, and a missing trailer simply leaves its fields empty. Only an empty
 * input or one without a {@code 01} header is rejected.
 *
 * <p>Instances hold no state between calls and may be shared.
 */
@Slf4j
public class Bai2Decoder {

    private static final int BALANCE_FIELDS_START = 3;
    private static final int BALANCE_QUADRUPLE_SIZE = 4;
    private static final int TRANSACTION_TEXT_START = 6;

    /**
     * @param content the whole file, {@code \n} or {@code \r\n} separated
     * @throws EmptyBankFileException      when {@code content} is null or blank
     * @throws MalformedBankFileException  when no {@code 01} file header is present
     */
    public FileRecord decode(String content) {
        if (content == null || content.isBlank()) {
            throw new EmptyBankFileException("Bank file is empty — nothing to decode");
        }

        List<String> records = joinContinuations(content.lines().toList());
        boolean hasFileHeader = records.stream()
                .anyMatch(r -> RecordFields.parse(r).recordType() == Bai2RecordType.FILE_HEADER);
        if (!hasFileHeader) {
            throw new MalformedBankFileException(
                    "No BAI2 file header (01) found in " + records.size() + " record(s)");
        }

        DecoderState state = new DecoderState();
        for (String record : records) {
            state.accept(RecordFields.parse(record));
        }

        FileRecord file = state.file;
        log.debug("Decoded BAI2 file from sender '{}' — {} group(s), {} orphaned account(s), {} orphaned transaction(s)",
                file.getSenderId(), file.getGroups().size(),
                file.getOrphanedAccounts().size(), file.getOrphanedTransactions().size());
        return file;
    }

    /**
     * Drops blank lines and appends each {@code 88} continuation's payload to the preceding
     * logical record, after removing that record's trailing {@code /}.
     *
     * <p>A continuation with nothing before it is kept as a record of its own and later ignored.
     */
    public static List<String> joinContinuations(List<String> lines) {
        List<String> merged = new ArrayList<>();
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            String tag = line.split(RecordFields.FIELD_DELIMITER, 2)[0];
            if (Bai2RecordType.fromCode(tag) == Bai2RecordType.CONTINUATION && !merged.isEmpty()) {
                String payload = line.startsWith(tag + RecordFields.FIELD_DELIMITER)
                        ? line.substring(tag.length() + 1)
                        : line.substring(tag.length());
                int last = merged.size() - 1;
                merged.set(last, RecordFields.stripTrailing(merged.get(last), RecordFields.RECORD_TERMINATOR) + payload);
            } else {
                merged.add(line);
            }
        }
        return merged;
    }

    // ─── state machine ───────────────────────────────────────────────────────

    /**
     * The currently open group and account while walking the records.
     */
    private static final class DecoderState {

        private final FileRecord file = new FileRecord();
        private GroupRecord currentGroup;
        private AccountRecord currentAccount;

        void accept(RecordFields fields) {
            switch (fields.recordType()) {
                case FILE_HEADER -> fileHeader(fields);
                case GROUP_HEADER -> groupHeader(fields);
                case ACCOUNT_HEADER -> accountHeader(fields);
                case TRANSACTION_DETAIL -> transactionDetail(fields);
                case ACCOUNT_TRAILER -> accountTrailer(fields);
                case GROUP_TRAILER -> groupTrailer(fields);
                case FILE_TRAILER -> fileTrailer(fields);
                case CONTINUATION, UNKNOWN -> log.trace("Ignoring record '{}'", fields.get(0));
            }
        }

        private void fileHeader(RecordFields fields) {
            file.setSenderId(fields.get(1));
            file.setReceiverId(fields.get(2));
            file.setCreationDate(fields.get(3));
            file.setCreationTime(fields.get(4));
            file.setResendIndicator(fields.get(5));
            file.setRecordSize(fields.get(6));
            file.setBlockingFactor(fields.get(7));
            file.setVersionNumber(fields.get(8));
        }

        private void groupHeader(RecordFields fields) {
            GroupRecord group = new GroupRecord();
            group.setUltimateReceiverId(fields.get(1));
            group.setOriginatorId(fields.get(2));
            group.setGroupStatus(fields.get(3));
            group.setAsOfDate(fields.get(4));
            group.setAsOfTime(fields.get(5));
            group.setCurrencyCode(fields.get(6));
            group.setAsOfDateModifier(fields.get(7));
            file.getGroups().add(group);
            currentGroup = group;
        }

        private void accountHeader(RecordFields fields) {
            AccountRecord account = new AccountRecord();
            account.setCustomerAccount(fields.get(1));
            account.setCurrencyCode(fields.get(2));

            for (int i = BALANCE_FIELDS_START; i < fields.size(); i += BALANCE_QUADRUPLE_SIZE) {
                BalanceEntry balance = new BalanceEntry(
                        fields.get(i), fields.get(i + 1), fields.get(i + 2), fields.get(i + 3));
                if (!balance.typeCode().isEmpty()) {
                    account.getBalances().add(balance);
                }
            }

            if (currentGroup != null) {
                currentGroup.getAccounts().add(account);
            } else {
                log.warn("Account header for '{}' has no open group — kept as orphan", account.getCustomerAccount());
                file.getOrphanedAccounts().add(account);
            }
            currentAccount = account;
        }

        private void transactionDetail(RecordFields fields) {
            TransactionRecord transaction = TransactionRecord.builder()
                    .typeCode(fields.get(1))
                    .amount(fields.get(2))
                    .fundsType(fields.get(3))
                    .bankReference(fields.get(4))
                    .customerReference(fields.get(5))
                    .text(fields.joinFrom(TRANSACTION_TEXT_START))
                    .build();

            if (currentAccount != null && currentGroup != null) {
                transaction.setContext(TransactionContext.of(file, currentGroup, currentAccount));
            }

            if (currentAccount != null) {
                currentAccount.getTransactions().add(transaction);
            } else {
                log.warn("Transaction detail (type {}, bank ref '{}') has no open account — kept as orphan",
                        transaction.getTypeCode(), transaction.getBankReference());
                file.getOrphanedTransactions().add(transaction);
            }
        }

        private void accountTrailer(RecordFields fields) {
            if (currentAccount != null) {
                currentAccount.setControlTotal(fields.get(1));
                currentAccount.setRecordCount(fields.get(2));
            }
        }

        private void groupTrailer(RecordFields fields) {
            if (currentGroup != null) {
                currentGroup.setControlTotal(fields.get(1));
                currentGroup.setRecordCount(fields.get(2));
            }
            currentAccount = null;
        }

        private void fileTrailer(RecordFields fields) {
            file.setControlTotal(fields.get(1));
            file.setRecordCount(fields.get(2));
            currentGroup = null;
        }
    }
}
