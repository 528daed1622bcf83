package io.github.jakubt4.hawkeye.service.broadcast;

public class UnknownClientException extends RuntimeException {

    public UnknownClientException(final String clientId) {
        super("Unknown client: " + clientId);
    }
}
