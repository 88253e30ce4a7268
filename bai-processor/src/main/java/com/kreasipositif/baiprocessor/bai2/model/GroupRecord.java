package com.kreasipositif.baiprocessor.bai2.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code 02} group header, its accounts and the {@code 98} trailer.
 */
@Data
public class GroupRecord {

    private String ultimateReceiverId = "";
    private String originatorId = "";
    private String groupStatus = "";
    private String asOfDate = "";
    private String asOfTime = "";
    private String currencyCode = "";
    private String asOfDateModifier = "";

    private final List<AccountRecord> accounts = new ArrayList<>();

    private String controlTotal = "";
    private String recordCount = "";
}
