package com.kreasipositif.baiprocessor.bai2.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code 03} account header with its balance summaries, the {@code 16} details that follow it
 * and the {@code 49} trailer.
 */
@Data
public class AccountRecord {

    private String customerAccount = "";
    private String currencyCode = "";

    private final List<BalanceEntry> balances = new ArrayList<>();
    private final List<TransactionRecord> transactions = new ArrayList<>();

    private String controlTotal = "";
    private String recordCount = "";
}
