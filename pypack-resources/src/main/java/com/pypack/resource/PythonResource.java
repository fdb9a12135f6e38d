package com.pypack.resource;

/**
 * A resource discovered in a Python distribution that may be embedded in a built binary.
 * Implementations are immutable values; {@link #kind()} is the tag consumers dispatch on.
 */
public interface PythonResource {

    ResourceKind kind();

    /** Fully qualified name of the resource (module name, package-qualified resource name, path). */
    String fullName();

    /**
     * True if the resource only exists to support tests of the package that ships it.
     * Always false for kinds that carry no test flag.
     */
    default boolean isTest() {
        return false;
    }
}
