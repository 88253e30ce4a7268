package com.kreasipositif.baiprocessor.batch;

import com.kreasipositif.baiprocessor.domain.AppliedTransactionKey;
import com.kreasipositif.baiprocessor.domain.CashApplicationRow;
import com.kreasipositif.baiprocessor.domain.Invoice;
import com.kreasipositif.baiprocessor.domain.TransactionRow;
import com.kreasipositif.baiprocessor.matching.InvoiceMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ItemProcessor;

import java.util.List;
import java.util.Set;

/**
 * Applies each transaction row to the open invoices fetched for this step execution.
 *
 * <p>Rows already present in the cash-application file are filtered out (the processor returns
 * {@code null}), so re-running the job over the same transactions file appends nothing new.
 * Every other row is passed on, matched or not.
 *
 * <p>Created per step execution in {@link com.kreasipositif.baiprocessor.config.BatchConfig}.
 */
@Slf4j
public class CashApplicationItemProcessor implements ItemProcessor<TransactionRow, CashApplicationRow> {

    private final InvoiceMatcher matcher;
    private final List<Invoice> openInvoices;
    private final Set<AppliedTransactionKey> appliedKeys;

    public CashApplicationItemProcessor(InvoiceMatcher matcher,
                                        List<Invoice> openInvoices,
                                        Set<AppliedTransactionKey> appliedKeys) {
        this.matcher = matcher;
        this.openInvoices = openInvoices;
        this.appliedKeys = appliedKeys;
    }

    @Override
    public CashApplicationRow process(TransactionRow row) {
        if (appliedKeys.contains(row.applicationKey())) {
            log.debug("Skipping already-applied transaction (bank ref '{}', date {})",
                    row.getBankReference(), row.getDate());
            return null;
        }
        return matcher.match(row, openInvoices);
    }
}
