package com.kreasipositif.baiprocessor.bai2;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;

/**
 * Renders raw BAI2 amounts and dates for export. Values that do not parse are returned as they came.
 */
public final class Bai2Formats {

    /** Two-digit years 69–99 fall in the 1900s, 00–68 in the 2000s. */
    private static final DateTimeFormatter SHORT_DATE = new DateTimeFormatterBuilder()
            .appendValueReduced(ChronoField.YEAR, 2, 2, 1969)
            .appendValue(ChronoField.MONTH_OF_YEAR, 2)
            .appendValue(ChronoField.DAY_OF_MONTH, 2)
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter LONG_DATE = new DateTimeFormatterBuilder()
            .appendValue(ChronoField.YEAR, 4)
            .appendValue(ChronoField.MONTH_OF_YEAR, 2)
            .appendValue(ChronoField.DAY_OF_MONTH, 2)
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private Bai2Formats() {
    }

    /**
     * Minor units to a grouped, two-decimal string: {@code "150000"} becomes {@code "1,500.00"}.
     */
    public static String formatAmount(String minorUnits) {
        if (minorUnits == null) {
            return "";
        }
        try {
            BigDecimal major = new BigDecimal(new BigInteger(minorUnits.trim())).movePointLeft(2);
            return amountFormat().format(major);
        } catch (NumberFormatException e) {
            return minorUnits;
        }
    }

    /**
     * {@code YYMMDD} or {@code YYYYMMDD} to {@code M/D/YYYY} without leading zeros.
     */
    public static String formatDate(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.trim();
        DateTimeFormatter formatter = switch (value.length()) {
            case 6 -> SHORT_DATE;
            case 8 -> LONG_DATE;
            default -> null;
        };
        if (formatter == null) {
            return value;
        }
        try {
            LocalDate date = LocalDate.parse(value, formatter);
            return date.getMonthValue() + "/" + date.getDayOfMonth() + "/" + date.getYear();
        } catch (DateTimeParseException e) {
            return value;
        }
    }

    // DecimalFormat is not thread-safe
    private static DecimalFormat amountFormat() {
        return new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.US));
    }
}
