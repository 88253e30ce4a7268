package com.kreasipositif.baiprocessor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One exported balance line: an account-header balance quadruple together with every header and
 * trailer field of its account, group and file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceRow {

    public static final String[] FIELDS = {
            "fileSenderId", "fileReceiverId", "fileCreationDate", "fileCreationTime", "resendIndicator",
            "groupOriginatorId", "groupReceiverId", "groupStatus", "asOfDate", "asOfTime", "asOfDateModifier",
            "currencyCode", "customerAccount",
            "balanceTypeCode", "balanceAmount", "balanceItemCount", "balanceFundsType",
            "accountControlTotal", "accountRecordCount", "groupControlTotal", "groupRecordCount",
            "fileControlTotal", "fileRecordCount"
    };

    public static final String[] HEADERS = {
            "file_sender_id", "file_receiver_id", "file_creation_date", "file_creation_time", "resend_indicator",
            "group_originator_id", "group_receiver_id", "group_status", "as_of_date", "as_of_time", "as_of_date_modifier",
            "currency_code", "customer_account",
            "balance_type_code", "balance_amount", "balance_item_count", "balance_funds_type",
            "account_control_total", "account_record_count", "group_control_total", "group_record_count",
            "file_control_total", "file_record_count"
    };

    private String fileSenderId;
    private String fileReceiverId;
    private String fileCreationDate;
    private String fileCreationTime;
    private String resendIndicator;

    private String groupOriginatorId;
    private String groupReceiverId;
    private String groupStatus;
    private String asOfDate;
    private String asOfTime;
    private String asOfDateModifier;

    /** Account currency, falling back to the group currency. */
    private String currencyCode;
    private String customerAccount;

    private String balanceTypeCode;

    /** Raw minor-unit amount as reported. */
    private String balanceAmount;
    private String balanceItemCount;
    private String balanceFundsType;

    private String accountControlTotal;
    private String accountRecordCount;
    private String groupControlTotal;
    private String groupRecordCount;
    private String fileControlTotal;
    private String fileRecordCount;
}
