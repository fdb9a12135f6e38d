package com.pypack.resource;

import java.nio.file.Path;
import java.util.Objects;

/** A Python egg archive. Eggs are never embedded; they are reported so callers can warn. */
public record PythonEggFile(
        Path path,
        boolean isStdlib,
        boolean isTest
) implements PythonResource {

    public PythonEggFile {
        Objects.requireNonNull(path, "path");
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.EGG_FILE;
    }

    @Override
    public String fullName() {
        return path.toString();
    }
}
