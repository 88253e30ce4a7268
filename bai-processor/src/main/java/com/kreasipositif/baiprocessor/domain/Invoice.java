package com.kreasipositif.baiprocessor.domain;

import java.math.BigDecimal;

/**
 * An open accounts-receivable invoice, as returned by the invoice service.
 *
 * @param id              invoice service internal id
 * @param number          display number shown to users (e.g. {@code INV-1042})
 * @param customerName    customer display name used for fuzzy matching
 * @param amountRemaining unpaid balance, the target for incoming credits
 * @param referenceUrl    link to the invoice in the invoice system
 */
public record Invoice(
        String id,
        String number,
        String customerName,
        BigDecimal amountRemaining,
        String currency,
        String dueDate,
        String referenceUrl) {}
