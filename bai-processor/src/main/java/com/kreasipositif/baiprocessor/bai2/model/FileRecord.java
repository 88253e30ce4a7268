package com.kreasipositif.baiprocessor.bai2.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a decoded BAI2 file: the {@code 01} header, its groups in file order and the
 * {@code 99} trailer.
 *
 * <p>Trailer fields stay empty when the file ends without a {@code 99} record.
 */
@Data
public class FileRecord {

    private String senderId = "";
    private String receiverId = "";
    private String creationDate = "";
    private String creationTime = "";
    private String resendIndicator = "";
    private String recordSize = "";
    private String blockingFactor = "";
    private String versionNumber = "";

    private final List<GroupRecord> groups = new ArrayList<>();

    // ── 99 trailer ──────────────────────────────────────────────────────────
    private String controlTotal = "";
    private String recordCount = "";

    // ── records that arrived without an open parent ─────────────────────────

    /** Account headers seen while no group was open. */
    private final List<AccountRecord> orphanedAccounts = new ArrayList<>();

    /** Transaction details seen while no account was open. */
    private final List<TransactionRecord> orphanedTransactions = new ArrayList<>();
}
