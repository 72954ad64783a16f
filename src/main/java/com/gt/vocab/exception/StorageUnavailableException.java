package com.gt.vocab.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when the backing store cannot be reached or a statement times out
@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE)
public class StorageUnavailableException extends DaoException {

    public StorageUnavailableException(String operation, Throwable cause) {
        super("Storage unavailable during " + operation, cause);
    }
}
