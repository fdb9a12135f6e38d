package com.pypack.resource;

import java.util.Objects;

/** Python module source to be compiled to bytecode when the binary is assembled. */
public record PythonModuleBytecodeRequest(
        String name,
        String source,
        BytecodeOptimizationLevel optimizeLevel,
        boolean isPackage,
        String cacheTag,
        boolean isStdlib,
        boolean isTest
) implements PythonResource {

    public PythonModuleBytecodeRequest {
        Objects.requireNonNull(name, "name");
        source = source != null ? source : "";
        optimizeLevel = optimizeLevel != null ? optimizeLevel : BytecodeOptimizationLevel.ZERO;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.MODULE_BYTECODE_REQUEST;
    }

    @Override
    public String fullName() {
        return name;
    }
}
