package com.kreasipositif.baiprocessor.bai2.model;

/**
 * One type-code / amount / item-count / funds-type quadruple from an account header.
 */
public record BalanceEntry(String typeCode, String amount, String itemCount, String fundsType) {}
