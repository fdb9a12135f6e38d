package com.pypack.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.Optional;

/**
 * Where packaged Python resources may be loaded from at run time.
 * <p>
 * Textual form, used verbatim in configuration:
 * <ul>
 *   <li>{@code in-memory-only}</li>
 *   <li>{@code filesystem-relative-only:<prefix>}</li>
 *   <li>{@code prefer-in-memory-fallback-filesystem-relative:<prefix>}</li>
 * </ul>
 * The prefix is a path relative to the produced binary. It is not checked for filesystem
 * legality and may be empty or contain {@code :}.
 *
 * @param mode   placement mode
 * @param prefix install path prefix; null iff {@code mode} is {@link Mode#IN_MEMORY_ONLY}
 */
public record PythonResourcesPolicy(Mode mode, String prefix) {

    private static final String IN_MEMORY_ONLY = "in-memory-only";
    private static final String FILESYSTEM_RELATIVE_ONLY = "filesystem-relative-only:";
    private static final String PREFER_IN_MEMORY = "prefer-in-memory-fallback-filesystem-relative:";

    public enum Mode {
        /** Only load from memory; a resource that cannot be loaded from memory is an error. */
        IN_MEMORY_ONLY,
        /** Only load from a filesystem path relative to the binary. */
        FILESYSTEM_RELATIVE_ONLY,
        /** Load from memory when possible, otherwise from a path relative to the binary. */
        PREFER_IN_MEMORY_FALLBACK_FILESYSTEM_RELATIVE
    }

    public PythonResourcesPolicy {
        Objects.requireNonNull(mode, "mode");
        if (mode == Mode.IN_MEMORY_ONLY) {
            if (prefix != null) {
                throw new IllegalArgumentException("in-memory-only policy takes no prefix");
            }
        } else {
            Objects.requireNonNull(prefix, "prefix");
        }
    }

    public static PythonResourcesPolicy inMemoryOnly() {
        return new PythonResourcesPolicy(Mode.IN_MEMORY_ONLY, null);
    }

    public static PythonResourcesPolicy filesystemRelativeOnly(String prefix) {
        return new PythonResourcesPolicy(Mode.FILESYSTEM_RELATIVE_ONLY, prefix);
    }

    public static PythonResourcesPolicy preferInMemoryFallbackFilesystemRelative(String prefix) {
        return new PythonResourcesPolicy(Mode.PREFER_IN_MEMORY_FALLBACK_FILESYSTEM_RELATIVE, prefix);
    }

    /**
     * Parses the textual form.
     *
     * @throws InvalidPolicyValueException if {@code value} is null or matches none of the three forms
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PythonResourcesPolicy parse(String value) {
        if (value == null) {
            throw new InvalidPolicyValueException(null);
        }
        if (value.equals(IN_MEMORY_ONLY)) {
            return inMemoryOnly();
        } else if (value.startsWith(FILESYSTEM_RELATIVE_ONLY)) {
            return filesystemRelativeOnly(value.substring(FILESYSTEM_RELATIVE_ONLY.length()));
        } else if (value.startsWith(PREFER_IN_MEMORY)) {
            return preferInMemoryFallbackFilesystemRelative(value.substring(PREFER_IN_MEMORY.length()));
        }
        throw new InvalidPolicyValueException(value);
    }

    /** Textual form; {@code parse(p.format())} equals {@code p}. */
    @JsonValue
    public String format() {
        return switch (mode) {
            case IN_MEMORY_ONLY -> IN_MEMORY_ONLY;
            case FILESYSTEM_RELATIVE_ONLY -> FILESYSTEM_RELATIVE_ONLY + prefix;
            case PREFER_IN_MEMORY_FALLBACK_FILESYSTEM_RELATIVE -> PREFER_IN_MEMORY + prefix;
        };
    }

    /** Path prefix for filesystem-relative modes. */
    public Optional<String> getPrefix() {
        return Optional.ofNullable(prefix);
    }

    public boolean allowsInMemory() {
        return switch (mode) {
            case IN_MEMORY_ONLY, PREFER_IN_MEMORY_FALLBACK_FILESYSTEM_RELATIVE -> true;
            case FILESYSTEM_RELATIVE_ONLY -> false;
        };
    }

    public boolean allowsFilesystem() {
        return switch (mode) {
            case IN_MEMORY_ONLY -> false;
            case FILESYSTEM_RELATIVE_ONLY, PREFER_IN_MEMORY_FALLBACK_FILESYSTEM_RELATIVE -> true;
        };
    }

    @Override
    public String toString() {
        return format();
    }
}
