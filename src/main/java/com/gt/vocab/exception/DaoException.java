package com.gt.vocab.exception;

// Base for failures raised by the review item and word stores
public class DaoException extends RuntimeException {

    public DaoException(String errMsg) {
        super(errMsg);
    }

    public DaoException(String errMsg, Throwable cause) {
        super(errMsg, cause);
    }
}
