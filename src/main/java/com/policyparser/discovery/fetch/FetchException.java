package com.policyparser.discovery.fetch;

public class FetchException extends RuntimeException {

    public enum Kind {
        TIMEOUT, NETWORK_FAILURE, HTTP_STATUS
    }

    private final Kind kind;
    private final int statusCode;
    private final String url;

    public FetchException(Kind kind, String url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.url = url;
        this.statusCode = statusCode;
    }

    public static FetchException timeout(String url, String message) {
        return new FetchException(Kind.TIMEOUT, url, 0, message, null);
    }

    public static FetchException network(String url, Throwable cause) {
        return new FetchException(Kind.NETWORK_FAILURE, url, 0, "network failure fetching " + url + ": " + cause.getMessage(), cause);
    }

    public static FetchException httpStatus(String url, int code) {
        return new FetchException(Kind.HTTP_STATUS, url, code, "HTTP " + code + " for " + url, null);
    }

    public Kind kind() {
        return kind;
    }

    public int statusCode() {
        return statusCode;
    }

    public String url() {
        return url;
    }
}
