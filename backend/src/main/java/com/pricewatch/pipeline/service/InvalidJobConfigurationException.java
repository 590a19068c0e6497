package com.pricewatch.pipeline.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidJobConfigurationException extends RuntimeException {
    public InvalidJobConfigurationException(String message) {
        super(message);
    }
}
