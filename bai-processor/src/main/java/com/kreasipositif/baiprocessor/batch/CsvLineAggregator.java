package com.kreasipositif.baiprocessor.batch;

import org.springframework.batch.item.file.transform.ExtractorLineAggregator;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Comma-delimited line aggregator that quotes a value when it contains the delimiter, a double
 * quote or a line break, doubling any embedded quotes.
 *
 * <p>Spring Batch's {@code DelimitedLineAggregator} writes values verbatim, which breaks BAI2 free
 * text such as {@code "INV 1001, 1002"} into extra columns.
 */
public class CsvLineAggregator<T> extends ExtractorLineAggregator<T> {

    static final String DELIMITER = ",";
    private static final String QUOTE = "\"";

    @Override
    protected String doAggregate(Object[] fields) {
        return Arrays.stream(fields)
                .map(CsvLineAggregator::escape)
                .collect(Collectors.joining(DELIMITER));
    }

    static String escape(Object field) {
        String value = field == null ? "" : field.toString();
        if (value.contains(DELIMITER) || value.contains(QUOTE) || value.contains("\n") || value.contains("\r")) {
            return QUOTE + value.replace(QUOTE, QUOTE + QUOTE) + QUOTE;
        }
        return value;
    }

    static String headerLine(String[] headers) {
        return Arrays.stream(headers)
                .map(CsvLineAggregator::escape)
                .collect(Collectors.joining(DELIMITER));
    }
}
