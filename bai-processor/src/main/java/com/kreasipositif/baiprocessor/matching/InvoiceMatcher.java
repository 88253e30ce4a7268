package com.kreasipositif.baiprocessor.matching;

import com.kreasipositif.baiprocessor.domain.CashApplicationRow;
import com.kreasipositif.baiprocessor.domain.Invoice;
import com.kreasipositif.baiprocessor.domain.TransactionRow;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Picks the open invoice an incoming credit most likely pays.
 *
 * <h3>Scoring (out of 100)</h3>
 * <ul>
 *   <li>Amount: 50 points when the credit equals the amount remaining to the cent, 30 points when
 *       it is within 1% of the larger of the two, otherwise 0.</li>
 *   <li>Name: up to 50 points, the token-set similarity of the transaction description and the
 *       invoice customer name scaled onto 0–50.</li>
 * </ul>
 *
 * <p>The highest total wins; an exact tie goes to the invoice whose amount remaining is closer to the
 * credit, and after that to the invoice seen first. The winner is applied only when it scores at
 * least {@value #MIN_SCORE}.
 *
 * <p>Debits and rows without a positive credit amount are never matched. The matcher keeps no
 * state between calls.
 */
@Slf4j
public class InvoiceMatcher {

    public static final int AMOUNT_EXACT_POINTS = 50;
    public static final int AMOUNT_CLOSE_POINTS = 30;
    public static final int NAME_MAX_POINTS = 50;
    public static final int MIN_SCORE = 60;

    private static final BigDecimal EXACT_TOLERANCE = new BigDecimal("0.01");
    private static final BigDecimal CLOSE_TOLERANCE = new BigDecimal("0.01");

    private final String linkLabel;

    /**
     * @param linkLabel text shown for the invoice hyperlink, e.g. {@code Open in NetSuite}
     */
    public InvoiceMatcher(String linkLabel) {
        this.linkLabel = linkLabel;
    }

    /**
     * Matches every row; the result has the same size and order as {@code transactions}.
     */
    public List<CashApplicationRow> match(List<TransactionRow> transactions, List<Invoice> invoices) {
        return transactions.stream()
                .map(transaction -> match(transaction, invoices))
                .toList();
    }

    public CashApplicationRow match(TransactionRow transaction, List<Invoice> invoices) {
        BigDecimal credit = transaction.parsedCreditAmount();
        if (credit.signum() <= 0) {
            return CashApplicationRow.unmatched(transaction);
        }

        Invoice best = null;
        int bestScore = 0;
        for (Invoice invoice : invoices) {
            int amountPoints = amountPoints(credit, invoice.amountRemaining());
            if (amountPoints == 0) {
                // a name alone cannot reach MIN_SCORE
                continue;
            }
            int total = amountPoints + namePoints(transaction.getDescription(), invoice.customerName());

            if (total > bestScore) {
                best = invoice;
                bestScore = total;
            } else if (total == bestScore && best != null
                    && distance(credit, invoice).compareTo(distance(credit, best)) < 0) {
                best = invoice;
            }
        }

        if (best == null || bestScore < MIN_SCORE) {
            log.debug("No invoice for credit {} (bank ref '{}') — best score {}",
                    credit, transaction.getBankReference(), bestScore);
            return CashApplicationRow.unmatched(transaction);
        }

        log.debug("Credit {} (bank ref '{}') applied to invoice {} with score {}",
                credit, transaction.getBankReference(), best.number(), bestScore);
        return CashApplicationRow.builder()
                .transaction(transaction)
                .matchedCustomer(best.customerName())
                .invoiceNumber(best.number())
                .confidence(Math.min(bestScore, 100) + "%")
                .invoiceLink("=HYPERLINK(\"" + best.referenceUrl() + "\",\"" + linkLabel + "\")")
                .build();
    }

    /**
     * Scores a single invoice for a credit of {@code amount} described by {@code description}.
     */
    public MatchScore score(BigDecimal amount, String description, Invoice invoice) {
        return new MatchScore(
                amountPoints(amount, invoice.amountRemaining()),
                namePoints(description, invoice.customerName()));
    }

    static int amountPoints(BigDecimal credit, BigDecimal remaining) {
        if (credit == null || remaining == null || credit.signum() <= 0 || remaining.signum() <= 0) {
            return 0;
        }
        BigDecimal difference = credit.subtract(remaining).abs();
        if (difference.compareTo(EXACT_TOLERANCE) < 0) {
            return AMOUNT_EXACT_POINTS;
        }
        BigDecimal relative = difference.divide(credit.max(remaining), MathContext.DECIMAL64);
        return relative.compareTo(CLOSE_TOLERANCE) <= 0 ? AMOUNT_CLOSE_POINTS : 0;
    }

    static int namePoints(String description, String customerName) {
        if (description == null || description.isEmpty() || customerName == null || customerName.isEmpty()) {
            return 0;
        }
        int similarity = NameSimilarity.tokenSetRatio(description, customerName);
        return (int) Math.round(similarity * NAME_MAX_POINTS / 100.0);
    }

    private static BigDecimal distance(BigDecimal credit, Invoice invoice) {
        return credit.subtract(invoice.amountRemaining()).abs();
    }
}
