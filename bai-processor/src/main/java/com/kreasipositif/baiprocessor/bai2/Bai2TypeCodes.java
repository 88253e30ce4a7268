package com.kreasipositif.baiprocessor.bai2;

import java.util.Map;

/**
 * Classification and display labels for BAI2 transaction type codes.
 *
 * <p>Codes 100–399 report money in; everything else, including codes that are not numeric,
 * is treated as money out.
 */
public final class Bai2TypeCodes {

    private static final int CREDIT_MIN = 100;
    private static final int CREDIT_MAX = 399;

    private static final Map<String, String> LABELS = Map.of(
            "169", "ACH CREDIT",
            "195", "WIRE TRANSFER CREDIT",
            "214", "FX Wire Transfer Credit",
            "174", "Miscellaneous ACH Credit",
            "301", "MOBILE DEPOSIT",
            "469", "ACH DEBIT",
            "495", "WIRE TRANSFER DEBIT",
            "575", "ZERO BAL TRF DEBIT",
            "496", "FX Wire Transfer Debit");

    private Bai2TypeCodes() {
    }

    public static boolean isCredit(String typeCode) {
        if (typeCode == null) {
            return false;
        }
        try {
            int code = Integer.parseInt(typeCode.trim());
            return code >= CREDIT_MIN && code <= CREDIT_MAX;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Known codes map to the bank's own wording; others read {@code Credit (code)} or {@code Debit (code)}.
     */
    public static String label(String typeCode) {
        String known = LABELS.get(typeCode);
        if (known != null) {
            return known;
        }
        return (isCredit(typeCode) ? "Credit" : "Debit") + " (" + typeCode + ")";
    }
}
