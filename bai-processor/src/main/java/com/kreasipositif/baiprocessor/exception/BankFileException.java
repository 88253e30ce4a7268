package com.kreasipositif.baiprocessor.exception;

/**
 * Base type for bank files that cannot be decoded at all.
 *
 * <p>Individual malformed records never raise this; they are skipped or defaulted.
 */
public class BankFileException extends RuntimeException {

    public BankFileException(String message) {
        super(message);
    }
}
