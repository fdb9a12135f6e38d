package com.pypack.resource;

import java.nio.file.Path;
import java.util.Objects;

/** A {@code .pth} file. */
public record PythonPathExtension(
        String location,
        Path path,
        boolean isStdlib
) implements PythonResource {

    public PythonPathExtension {
        Objects.requireNonNull(location, "location");
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.PATH_EXTENSION;
    }

    @Override
    public String fullName() {
        return location;
    }
}
