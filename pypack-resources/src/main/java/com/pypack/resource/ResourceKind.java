package com.pypack.resource;

/**
 * Kind tag of a {@link PythonResource}. Consumers switch over this exhaustively; adding a kind
 * breaks every switch expression that does not handle it.
 */
public enum ResourceKind {
    /** Python module source code. */
    MODULE_SOURCE,
    /** Request to compile module source to bytecode at packaging time. */
    MODULE_BYTECODE_REQUEST,
    /** Already compiled module bytecode. */
    MODULE_BYTECODE,
    /** Non-code file belonging to a Python package. */
    RESOURCE,
    /** Package distribution metadata file (e.g. {@code METADATA} in a {@code .dist-info} directory). */
    DISTRIBUTION_RESOURCE,
    /** Extension module backed by a shared library. */
    EXTENSION_MODULE_DYNAMIC_LIBRARY,
    /** Extension module whose object files are linked into the binary. */
    EXTENSION_MODULE_STATICALLY_LINKED,
    /** {@code .pth} file extending {@code sys.path}. */
    PATH_EXTENSION,
    /** Python egg archive. */
    EGG_FILE
}
