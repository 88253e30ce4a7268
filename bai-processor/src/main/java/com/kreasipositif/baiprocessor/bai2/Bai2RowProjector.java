package com.kreasipositif.baiprocessor.bai2;

import com.kreasipositif.baiprocessor.bai2.model.AccountRecord;
import com.kreasipositif.baiprocessor.bai2.model.BalanceEntry;
import com.kreasipositif.baiprocessor.bai2.model.FileRecord;
import com.kreasipositif.baiprocessor.bai2.model.GroupRecord;
import com.kreasipositif.baiprocessor.bai2.model.TransactionContext;
import com.kreasipositif.baiprocessor.bai2.model.TransactionRecord;
import com.kreasipositif.baiprocessor.domain.BalanceRow;
import com.kreasipositif.baiprocessor.domain.TransactionRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a decoded {@link FileRecord} into export rows, group by group and account by account,
 * in file order.
 *
 * <p>Orphaned accounts and transactions are not exported.
 */
public class Bai2RowProjector {

    private final String accountTitle;
    private final String entityName;

    /**
     * @param accountTitle constant written to the "Account Title" column of every transaction row
     * @param entityName   constant written to the "Entity" column of every transaction row
     */
    public Bai2RowProjector(String accountTitle, String entityName) {
        this.accountTitle = accountTitle;
        this.entityName = entityName;
    }

    /**
     * One row per balance quadruple, carrying every file, group and account field.
     */
    public List<BalanceRow> balanceRows(FileRecord file) {
        List<BalanceRow> rows = new ArrayList<>();
        for (GroupRecord group : file.getGroups()) {
            for (AccountRecord account : group.getAccounts()) {
                String currency = account.getCurrencyCode().isEmpty()
                        ? group.getCurrencyCode()
                        : account.getCurrencyCode();
                for (BalanceEntry balance : account.getBalances()) {
                    rows.add(BalanceRow.builder()
                            .fileSenderId(file.getSenderId())
                            .fileReceiverId(file.getReceiverId())
                            .fileCreationDate(file.getCreationDate())
                            .fileCreationTime(file.getCreationTime())
                            .resendIndicator(file.getResendIndicator())
                            .groupOriginatorId(group.getOriginatorId())
                            .groupReceiverId(group.getUltimateReceiverId())
                            .groupStatus(group.getGroupStatus())
                            .asOfDate(group.getAsOfDate())
                            .asOfTime(group.getAsOfTime())
                            .asOfDateModifier(group.getAsOfDateModifier())
                            .currencyCode(currency)
                            .customerAccount(account.getCustomerAccount())
                            .balanceTypeCode(balance.typeCode())
                            .balanceAmount(balance.amount())
                            .balanceItemCount(balance.itemCount())
                            .balanceFundsType(balance.fundsType())
                            .accountControlTotal(account.getControlTotal())
                            .accountRecordCount(account.getRecordCount())
                            .groupControlTotal(group.getControlTotal())
                            .groupRecordCount(group.getRecordCount())
                            .fileControlTotal(file.getControlTotal())
                            .fileRecordCount(file.getRecordCount())
                            .build());
                }
            }
        }
        return rows;
    }

    /**
     * One row per transaction detail, using the context snapshot taken when it was decoded.
     */
    public List<TransactionRow> transactionRows(FileRecord file) {
        List<TransactionRow> rows = new ArrayList<>();
        for (GroupRecord group : file.getGroups()) {
            for (AccountRecord account : group.getAccounts()) {
                for (TransactionRecord transaction : account.getTransactions()) {
                    rows.add(toRow(transaction));
                }
            }
        }
        return rows;
    }

    TransactionRow toRow(TransactionRecord transaction) {
        TransactionContext context = transaction.getContext();
        boolean credit = Bai2TypeCodes.isCredit(transaction.getTypeCode());
        String amount = Bai2Formats.formatAmount(transaction.getAmount());

        return TransactionRow.builder()
                .date(Bai2Formats.formatDate(context.asOfDate()))
                .bankId(context.bankId())
                .accountNumber(context.accountId())
                .accountTitle(accountTitle)
                .entity(entityName)
                .transactionType(Bai2TypeCodes.label(transaction.getTypeCode()))
                .typeCode(transaction.getTypeCode())
                .currency(context.currencyCode())
                .creditAmount(credit ? amount : "")
                .debitAmount(credit ? "" : amount)
                .bankReference(transaction.getBankReference())
                .endToEndId("")
                .customerReference(transaction.getCustomerReference())
                .description(transaction.getText())
                .reasonForPayment("")
                .notes("")
                .build();
    }
}
