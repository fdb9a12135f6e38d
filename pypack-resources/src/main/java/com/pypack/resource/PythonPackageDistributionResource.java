package com.pypack.resource;

import java.nio.file.Path;
import java.util.Objects;

/** File from a package's {@code .dist-info} or {@code .egg-info} metadata directory. */
public record PythonPackageDistributionResource(
        String packageName,
        String version,
        String name,
        Path path
) implements PythonResource {

    public PythonPackageDistributionResource {
        Objects.requireNonNull(packageName, "packageName");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.DISTRIBUTION_RESOURCE;
    }

    @Override
    public String fullName() {
        return packageName + ":" + name;
    }
}
