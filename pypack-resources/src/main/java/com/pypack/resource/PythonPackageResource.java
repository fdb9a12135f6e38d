package com.pypack.resource;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Non-code file belonging to a Python package.
 *
 * @param leafPackage  package directly containing the file (e.g. {@code lib2to3})
 * @param relativeName path of the file relative to the package directory
 * @param path         location of the file on disk
 */
public record PythonPackageResource(
        String leafPackage,
        String relativeName,
        Path path,
        boolean isStdlib,
        boolean isTest
) implements PythonResource {

    public PythonPackageResource {
        Objects.requireNonNull(leafPackage, "leafPackage");
        Objects.requireNonNull(relativeName, "relativeName");
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.RESOURCE;
    }

    @Override
    public String fullName() {
        return leafPackage + "." + relativeName;
    }
}
