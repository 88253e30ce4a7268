package com.kreasipositif.baiprocessor.bai2;

import java.util.Arrays;
import java.util.List;

/**
 * The comma-separated fields of one logical BAI2 record.
 *
 * <p>Every position is optional: reading past the last field yields an empty string, so callers
 * never index the raw array directly.
 */
public final class RecordFields {

    static final String FIELD_DELIMITER = ",";
    static final String RECORD_TERMINATOR = "/";

    private final List<String> fields;

    private RecordFields(List<String> fields) {
        this.fields = fields;
    }

    /**
     * Splits a logical record after stripping its trailing {@code /} and any trailing {@code ,}.
     */
    public static RecordFields parse(String line) {
        String body = stripTrailing(stripTrailing(line, RECORD_TERMINATOR), FIELD_DELIMITER);
        return new RecordFields(Arrays.asList(body.split(FIELD_DELIMITER, -1)));
    }

    public Bai2RecordType recordType() {
        return Bai2RecordType.fromCode(get(0));
    }

    /** Field at {@code index}, or {@code ""} when the record is shorter. */
    public String get(int index) {
        return index < fields.size() ? fields.get(index) : "";
    }

    /** All fields from {@code index} onward re-joined with the delimiter; free text may contain commas. */
    public String joinFrom(int index) {
        if (index >= fields.size()) {
            return "";
        }
        return String.join(FIELD_DELIMITER, fields.subList(index, fields.size()));
    }

    public int size() {
        return fields.size();
    }

    static String stripTrailing(String value, String suffix) {
        String result = value;
        while (result.endsWith(suffix)) {
            result = result.substring(0, result.length() - suffix.length());
        }
        return result;
    }
}
