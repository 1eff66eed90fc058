package com.sitepulse.seo.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidSeedUrlException extends RuntimeException {
    public InvalidSeedUrlException(String message) {
        super(message);
    }
}
