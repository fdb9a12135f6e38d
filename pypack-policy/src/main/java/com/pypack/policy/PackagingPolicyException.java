package com.pypack.policy;

/**
 * Thrown when a textual packaging policy value cannot be parsed. The configuration that
 * supplied the value is rejected as a whole.
 */
public class PackagingPolicyException extends RuntimeException {

    private final String value;

    protected PackagingPolicyException(String message, String value) {
        super(message);
        this.value = value;
    }

    /** The rejected input (may be null). */
    public String getValue() {
        return value;
    }
}
