package com.policyparser.discovery.scoring;

public class DimensionMismatchException extends IllegalArgumentException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(String what, int expected, int actual) {
        super(what + ": expected " + expected + " but was " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
