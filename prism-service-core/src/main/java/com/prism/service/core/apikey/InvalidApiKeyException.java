package com.prism.service.core.apikey;

/** Missing, malformed, unknown or revoked API key. */
public class InvalidApiKeyException extends IllegalArgumentException {

    public InvalidApiKeyException(String message) {
        super(message);
    }
}
