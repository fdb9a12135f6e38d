package com.pypack.policy;

/** Thrown by {@link PythonResourcesPolicy#parse(String)} for a value in none of the recognized forms. */
public final class InvalidPolicyValueException extends PackagingPolicyException {

    public InvalidPolicyValueException(String value) {
        super("invalid value for Python Resources Policy: " + value, value);
    }
}
