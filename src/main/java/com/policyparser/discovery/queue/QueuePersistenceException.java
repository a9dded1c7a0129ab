package com.policyparser.discovery.queue;

public class QueuePersistenceException extends RuntimeException {
    private final String domain;

    public QueuePersistenceException(String domain, String message, Throwable cause) {
        super(message, cause);
        this.domain = domain;
    }

    public String domain() {
        return domain;
    }
}
