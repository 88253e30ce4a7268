package com.kreasipositif.baiprocessor.exception;

/**
 * The bank file has content but no {@code 01} file header, so it is not BAI2.
 */
public class MalformedBankFileException extends BankFileException {

    public MalformedBankFileException(String message) {
        super(message);
    }
}
