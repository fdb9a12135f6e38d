package com.pypack.resource;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Compiled bytecode of a Python module as found in a distribution.
 *
 * @param bytecodePath location of the {@code .pyc} file
 */
public record PythonModuleBytecode(
        String name,
        Path bytecodePath,
        BytecodeOptimizationLevel optimizeLevel,
        boolean isPackage,
        String cacheTag,
        boolean isStdlib,
        boolean isTest
) implements PythonResource {

    public PythonModuleBytecode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(bytecodePath, "bytecodePath");
        optimizeLevel = optimizeLevel != null ? optimizeLevel : BytecodeOptimizationLevel.ZERO;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.MODULE_BYTECODE;
    }

    @Override
    public String fullName() {
        return name;
    }
}
