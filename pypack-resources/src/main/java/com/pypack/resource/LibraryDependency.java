package com.pypack.resource;

import java.util.Objects;

/**
 * A library an extension module links against.
 *
 * @param name        library name without platform prefix/suffix (e.g. {@code ssl})
 * @param isStatic    true if linked statically
 * @param isSystem    true if provided by the operating system
 * @param isFramework true if an Apple framework
 */
public record LibraryDependency(
        String name,
        boolean isStatic,
        boolean isSystem,
        boolean isFramework
) {
    public LibraryDependency {
        Objects.requireNonNull(name, "name");
    }

    public static LibraryDependency dynamic(String name) {
        return new LibraryDependency(name, false, false, false);
    }

    public static LibraryDependency staticLibrary(String name) {
        return new LibraryDependency(name, true, false, false);
    }

    public static LibraryDependency system(String name) {
        return new LibraryDependency(name, false, true, false);
    }
}
