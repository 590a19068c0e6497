package com.pricewatch.pipeline.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveJobRunException extends RuntimeException {
    public ActiveJobRunException(String message) {
        super(message);
    }
}
