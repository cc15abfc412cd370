package com.gt.asjp.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when two word lists have no concept in common, so no mean distance exists for the pair
@ResponseStatus(value = HttpStatus.UNPROCESSABLE_ENTITY)
public class NoComparableConceptsException extends RuntimeException {

    public NoComparableConceptsException(String msg) {
        super(msg);
    }

    public NoComparableConceptsException(String msg, Exception ex) {
        super(msg, ex);
    }
}
