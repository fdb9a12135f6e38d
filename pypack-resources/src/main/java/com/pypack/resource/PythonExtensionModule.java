package com.pypack.resource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A compiled Python extension module, in one concrete variant.
 * <p>
 * A distribution may ship several variants of the same logical extension (e.g. {@code _ssl} linked
 * against a system OpenSSL and a variant with OpenSSL linked statically). Variants of one
 * extension are grouped in {@link ExtensionModuleVariants}.
 * <p>
 * Licensing metadata distinguishes "unknown" from "known empty": {@link #getLicenses()} and
 * {@link #getLicensePublicDomain()} are empty when the distribution says nothing.
 */
public final class PythonExtensionModule implements PythonResource {

    private final String name;
    private final String initFn;
    private final String extensionFileSuffix;
    private final Path sharedLibrary;
    private final List<Path> objectFiles;
    private final boolean isPackage;
    private final List<LibraryDependency> linkLibraries;
    private final boolean isStdlib;
    private final boolean builtinDefault;
    private final boolean required;
    private final String variant;
    private final List<String> licenses;
    private final Boolean licensePublicDomain;

    private PythonExtensionModule(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name");
        this.initFn = b.initFn;
        this.extensionFileSuffix = b.extensionFileSuffix != null ? b.extensionFileSuffix : "";
        this.sharedLibrary = b.sharedLibrary;
        this.objectFiles = List.copyOf(b.objectFiles);
        this.isPackage = b.isPackage;
        this.linkLibraries = List.copyOf(b.linkLibraries);
        this.isStdlib = b.isStdlib;
        this.builtinDefault = b.builtinDefault;
        this.required = b.required;
        this.variant = b.variant;
        this.licenses = b.licenses != null ? List.copyOf(b.licenses) : null;
        this.licensePublicDomain = b.licensePublicDomain;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Builder pre-populated with this module's values. */
    public Builder toBuilder() {
        Builder b = new Builder(name)
                .initFn(initFn)
                .extensionFileSuffix(extensionFileSuffix)
                .sharedLibrary(sharedLibrary)
                .isPackage(isPackage)
                .isStdlib(isStdlib)
                .builtinDefault(builtinDefault)
                .required(required)
                .variant(variant)
                .licensePublicDomain(licensePublicDomain);
        b.objectFiles.addAll(objectFiles);
        b.linkLibraries.addAll(linkLibraries);
        if (licenses != null) b.licenses(licenses);
        return b;
    }

    @Override
    public ResourceKind kind() {
        return sharedLibrary != null
                ? ResourceKind.EXTENSION_MODULE_DYNAMIC_LIBRARY
                : ResourceKind.EXTENSION_MODULE_STATICALLY_LINKED;
    }

    @Override
    public String fullName() {
        return name;
    }

    public String getName() {
        return name;
    }

    /** Name of the module init function (e.g. {@code PyInit__ssl}); empty if unknown. */
    public Optional<String> getInitFn() {
        return Optional.ofNullable(initFn);
    }

    public String getExtensionFileSuffix() {
        return extensionFileSuffix;
    }

    public Optional<Path> getSharedLibrary() {
        return Optional.ofNullable(sharedLibrary);
    }

    public List<Path> getObjectFiles() {
        return objectFiles;
    }

    public boolean isPackage() {
        return isPackage;
    }

    public List<LibraryDependency> getLinkLibraries() {
        return linkLibraries;
    }

    public boolean isStdlib() {
        return isStdlib;
    }

    /** True if the interpreter compiles this extension in as a builtin by default. */
    public boolean isBuiltinDefault() {
        return builtinDefault;
    }

    /** True if the interpreter cannot initialize without this extension. */
    public boolean isRequired() {
        return required;
    }

    /** Variant name (e.g. {@code default}, {@code static}); empty when the extension has a single variant. */
    public Optional<String> getVariant() {
        return Optional.ofNullable(variant);
    }

    /** SPDX license identifiers of linked libraries; empty if not declared. */
    public Optional<List<String>> getLicenses() {
        return Optional.ofNullable(licenses);
    }

    /** Whether linked library code is in the public domain; empty if not declared. */
    public Optional<Boolean> getLicensePublicDomain() {
        return Optional.ofNullable(licensePublicDomain);
    }

    /** A stdlib extension that is built in by default or required is needed by every interpreter. */
    public boolean isMinimallyRequired() {
        return isStdlib && (builtinDefault || required);
    }

    public boolean requiresLibraries() {
        return !linkLibraries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PythonExtensionModule that = (PythonExtensionModule) o;
        return isPackage == that.isPackage
                && isStdlib == that.isStdlib
                && builtinDefault == that.builtinDefault
                && required == that.required
                && name.equals(that.name)
                && Objects.equals(initFn, that.initFn)
                && extensionFileSuffix.equals(that.extensionFileSuffix)
                && Objects.equals(sharedLibrary, that.sharedLibrary)
                && objectFiles.equals(that.objectFiles)
                && linkLibraries.equals(that.linkLibraries)
                && Objects.equals(variant, that.variant)
                && Objects.equals(licenses, that.licenses)
                && Objects.equals(licensePublicDomain, that.licensePublicDomain);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, initFn, extensionFileSuffix, sharedLibrary, objectFiles, isPackage,
                linkLibraries, isStdlib, builtinDefault, required, variant, licenses, licensePublicDomain);
    }

    @Override
    public String toString() {
        return variant != null ? name + "[" + variant + "]" : name;
    }

    public static final class Builder {
        private final String name;
        private String initFn;
        private String extensionFileSuffix;
        private Path sharedLibrary;
        private final List<Path> objectFiles = new ArrayList<>();
        private boolean isPackage;
        private final List<LibraryDependency> linkLibraries = new ArrayList<>();
        private boolean isStdlib;
        private boolean builtinDefault;
        private boolean required;
        private String variant;
        private List<String> licenses;
        private Boolean licensePublicDomain;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder initFn(String initFn) { this.initFn = initFn; return this; }
        public Builder extensionFileSuffix(String suffix) { this.extensionFileSuffix = suffix; return this; }
        public Builder sharedLibrary(Path sharedLibrary) { this.sharedLibrary = sharedLibrary; return this; }
        public Builder objectFile(Path objectFile) { this.objectFiles.add(Objects.requireNonNull(objectFile, "objectFile")); return this; }
        public Builder isPackage(boolean isPackage) { this.isPackage = isPackage; return this; }
        public Builder linkLibrary(LibraryDependency library) { this.linkLibraries.add(Objects.requireNonNull(library, "library")); return this; }
        public Builder isStdlib(boolean isStdlib) { this.isStdlib = isStdlib; return this; }
        public Builder builtinDefault(boolean builtinDefault) { this.builtinDefault = builtinDefault; return this; }
        public Builder required(boolean required) { this.required = required; return this; }
        public Builder variant(String variant) { this.variant = variant; return this; }
        public Builder licenses(List<String> licenses) { this.licenses = licenses != null ? new ArrayList<>(licenses) : null; return this; }
        public Builder licensePublicDomain(Boolean licensePublicDomain) { this.licensePublicDomain = licensePublicDomain; return this; }

        public PythonExtensionModule build() {
            return new PythonExtensionModule(this);
        }
    }
}
