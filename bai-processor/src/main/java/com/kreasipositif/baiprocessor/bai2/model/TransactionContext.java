package com.kreasipositif.baiprocessor.bai2.model;

/**
 * Ancestor values copied onto a transaction when it is decoded, so row export never walks back
 * up the tree.
 *
 * @param currencyCode the account currency, or the group currency when the account has none
 * @param bankId       the group originator
 * @param customerId   the group ultimate receiver
 */
public record TransactionContext(
        String accountId,
        String currencyCode,
        String asOfDate,
        String asOfTime,
        String asOfDateModifier,
        String bankId,
        String customerId,
        String fileCreationDate,
        String fileCreationTime) {

    public static final TransactionContext EMPTY = new TransactionContext("", "", "", "", "", "", "", "", "");

    public static TransactionContext of(FileRecord file, GroupRecord group, AccountRecord account) {
        String currency = account.getCurrencyCode().isEmpty()
                ? group.getCurrencyCode()
                : account.getCurrencyCode();
        return new TransactionContext(
                account.getCustomerAccount(),
                currency,
                group.getAsOfDate(),
                group.getAsOfTime(),
                group.getAsOfDateModifier(),
                group.getOriginatorId(),
                group.getUltimateReceiverId(),
                file.getCreationDate(),
                file.getCreationTime());
    }
}
