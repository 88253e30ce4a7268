package com.kreasipositif.baiprocessor.exception;

/**
 * Open invoices could not be fetched from the invoice service, even after retries.
 */
public class InvoiceServiceException extends RuntimeException {

    public InvoiceServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
