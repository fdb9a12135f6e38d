package com.pypack.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which extension modules a packaging policy includes, beyond the minimally required ones
 * (which are always included). Configuration uses the lowercase literal, e.g. {@code no-gpl}.
 */
public enum ExtensionModuleFilter {
    /** Only minimally required extensions. */
    MINIMAL("minimal"),
    /** Every available extension. */
    ALL("all"),
    /** Extensions that link no external libraries. */
    NO_LIBRARIES("no-libraries"),
    /** Extensions whose linked libraries are known not to be copyleft-licensed. */
    NO_GPL("no-gpl");

    private final String value;

    ExtensionModuleFilter(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /**
     * @param value one of {@code minimal}, {@code all}, {@code no-libraries}, {@code no-gpl} (exact match)
     * @throws InvalidFilterValueException for any other value, including null
     */
    @JsonCreator
    public static ExtensionModuleFilter parse(String value) {
        for (ExtensionModuleFilter f : values()) {
            if (f.value.equals(value)) return f;
        }
        throw new InvalidFilterValueException(value);
    }
}
