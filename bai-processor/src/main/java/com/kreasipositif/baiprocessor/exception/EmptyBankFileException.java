package com.kreasipositif.baiprocessor.exception;

/**
 * The bank file has no content, so there is nothing to process.
 */
public class EmptyBankFileException extends BankFileException {

    public EmptyBankFileException(String message) {
        super(message);
    }
}
