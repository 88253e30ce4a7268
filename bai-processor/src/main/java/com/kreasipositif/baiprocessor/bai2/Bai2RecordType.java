package com.kreasipositif.baiprocessor.bai2;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * BAI2 record type codes, as found in field 0 of every record.
 */
public enum Bai2RecordType {

    FILE_HEADER("01"),
    GROUP_HEADER("02"),
    ACCOUNT_HEADER("03"),
    TRANSACTION_DETAIL("16"),
    ACCOUNT_TRAILER("49"),
    CONTINUATION("88"),
    GROUP_TRAILER("98"),
    FILE_TRAILER("99"),
    UNKNOWN("");

    private static final Map<String, Bai2RecordType> BY_CODE = Arrays.stream(values())
            .filter(type -> type != UNKNOWN)
            .collect(Collectors.toMap(Bai2RecordType::getCode, Function.identity()));

    private final String code;

    Bai2RecordType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves a record tag; anything unrecognised maps to {@link #UNKNOWN} and is ignored by the decoder.
     */
    public static Bai2RecordType fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        return BY_CODE.getOrDefault(code.trim(), UNKNOWN);
    }
}
