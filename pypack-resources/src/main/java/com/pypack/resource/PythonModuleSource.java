package com.pypack.resource;

import java.util.Objects;

/**
 * Source code of a Python module.
 *
 * @param name     fully qualified module name (e.g. {@code json.decoder})
 * @param source   module source text
 * @param isPackage true if the module is a package ({@code __init__.py})
 * @param cacheTag interpreter cache tag (e.g. {@code cpython-39})
 * @param isStdlib true if the module belongs to the standard library
 * @param isTest   true if the module is only used by tests
 */
public record PythonModuleSource(
        String name,
        String source,
        boolean isPackage,
        String cacheTag,
        boolean isStdlib,
        boolean isTest
) implements PythonResource {

    public PythonModuleSource {
        Objects.requireNonNull(name, "name");
        source = source != null ? source : "";
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.MODULE_SOURCE;
    }

    @Override
    public String fullName() {
        return name;
    }

    /** Request to compile this source at the given optimization level. */
    public PythonModuleBytecodeRequest toBytecodeRequest(BytecodeOptimizationLevel optimizeLevel) {
        return new PythonModuleBytecodeRequest(name, source, optimizeLevel, isPackage, cacheTag, isStdlib, isTest);
    }
}
