package com.gt.vocab.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class WordNotFoundException extends RuntimeException {

    public WordNotFoundException(String wordId) {
        super("Word " + wordId + " not found in catalog");
    }
}
