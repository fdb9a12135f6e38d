package com.pypack.policy;

/** Thrown by {@link ExtensionModuleFilter#parse(String)} for an unrecognized literal. */
public final class InvalidFilterValueException extends PackagingPolicyException {

    public InvalidFilterValueException(String value) {
        super(value + " is not a valid extension module filter", value);
    }
}
