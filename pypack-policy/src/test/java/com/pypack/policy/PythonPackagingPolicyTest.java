package com.pypack.policy;

import com.pypack.licensing.LicenseAllowList;
import com.pypack.licensing.NonCopyleftLicenses;
import com.pypack.resource.BytecodeOptimizationLevel;
import com.pypack.resource.LibraryDependency;
import com.pypack.resource.PythonEggFile;
import com.pypack.resource.PythonExtensionModule;
import com.pypack.resource.PythonModuleBytecode;
import com.pypack.resource.PythonModuleBytecodeRequest;
import com.pypack.resource.PythonModuleSource;
import com.pypack.resource.PythonPackageDistributionResource;
import com.pypack.resource.PythonPackageResource;
import com.pypack.resource.PythonPathExtension;
import com.pypack.resource.PythonResource;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PythonPackagingPolicyTest {

    private static final boolean[] BOOLS = {false, true};

    @Test
    void defaults() {
        PythonPackagingPolicy policy = new PythonPackagingPolicy();

        assertEquals(ExtensionModuleFilter.ALL, policy.getExtensionModuleFilter());
        assertEquals(PythonResourcesPolicy.inMemoryOnly(), policy.getResourcesPolicy());
        assertTrue(policy.isIncludeDistributionSources());
        assertFalse(policy.isIncludeDistributionResources());
        assertFalse(policy.isIncludeTest());
        assertTrue(policy.getPreferredExtensionModuleVariants().isEmpty());
        assertTrue(policy.getBrokenExtensions().isEmpty());
        assertSame(NonCopyleftLicenses.getInstance(), policy.getLicenseAllowList());
    }

    @Test
    void setters_replaceFields() {
        PythonPackagingPolicy policy = new PythonPackagingPolicy();
        policy.setExtensionModuleFilter(ExtensionModuleFilter.NO_GPL);
        policy.setResourcesPolicy(PythonResourcesPolicy.filesystemRelativeOnly("lib"));
        policy.setIncludeDistributionSources(false);
        policy.setIncludeDistributionResources(true);
        policy.setIncludeTest(true);
        policy.setPreferredExtensionModuleVariant("_ssl", "default");
        policy.setPreferredExtensionModuleVariant("_ssl", "static");

        assertEquals(ExtensionModuleFilter.NO_GPL, policy.getExtensionModuleFilter());
        assertEquals(PythonResourcesPolicy.filesystemRelativeOnly("lib"), policy.getResourcesPolicy());
        assertFalse(policy.isIncludeDistributionSources());
        assertTrue(policy.isIncludeDistributionResources());
        assertTrue(policy.isIncludeTest());
        assertEquals(Map.of("_ssl", "static"), policy.getPreferredExtensionModuleVariants());
    }

    @Test
    void setters_rejectNull() {
        PythonPackagingPolicy policy = new PythonPackagingPolicy();
        assertThrows(NullPointerException.class, () -> policy.setExtensionModuleFilter(null));
        assertThrows(NullPointerException.class, () -> policy.setResourcesPolicy(null));
        assertThrows(NullPointerException.class, () -> policy.setLicenseAllowList(null));
        assertThrows(NullPointerException.class, () -> policy.registerBrokenExtension(null, "_crypt"));
    }

    @Test
    void registerBrokenExtension_appendsPerTarget() {
        PythonPackagingPolicy policy = new PythonPackagingPolicy();
        policy.registerBrokenExtension("x86_64-unknown-linux-musl", "_crypt");
        policy.registerBrokenExtension("x86_64-unknown-linux-musl", "nis");
        policy.registerBrokenExtension("x86_64-unknown-linux-musl", "_crypt");
        policy.registerBrokenExtension("x86_64-apple-darwin", "_tkinter");

        assertEquals(List.of("_crypt", "nis", "_crypt"), policy.getBrokenExtensions("x86_64-unknown-linux-musl"));
        assertEquals(List.of("_tkinter"), policy.getBrokenExtensions("x86_64-apple-darwin"));
        assertEquals(List.of(), policy.getBrokenExtensions("x86_64-pc-windows-msvc"));
        assertTrue(policy.isBrokenExtension("x86_64-unknown-linux-musl", "nis"));
        assertFalse(policy.isBrokenExtension("x86_64-apple-darwin", "nis"));
        assertThrows(UnsupportedOperationException.class,
                () -> policy.getBrokenExtensions("x86_64-apple-darwin").add("_curses"));
    }

    @Test
    void copy_isIndependent() {
        PythonPackagingPolicy policy = new PythonPackagingPolicy();
        policy.registerBrokenExtension("aarch64-apple-darwin", "_tkinter");
        policy.setPreferredExtensionModuleVariant("_ssl", "static");

        PythonPackagingPolicy copy = policy.copy();
        policy.registerBrokenExtension("aarch64-apple-darwin", "_curses");
        policy.setPreferredExtensionModuleVariant("_sqlite3", "static");
        policy.setExtensionModuleFilter(ExtensionModuleFilter.MINIMAL);

        assertEquals(List.of("_tkinter"), copy.getBrokenExtensions("aarch64-apple-darwin"));
        assertEquals(Map.of("_ssl", "static"), copy.getPreferredExtensionModuleVariants());
        assertEquals(ExtensionModuleFilter.ALL, copy.getExtensionModuleFilter());
    }

    @Test
    void filterPythonResource_moduleSource() {
        for (boolean sources : BOOLS) {
            for (boolean resources : BOOLS) {
                for (boolean tests : BOOLS) {
                    for (boolean isTest : BOOLS) {
                        PythonPackagingPolicy policy = policy(sources, resources, tests);
                        PythonResource r = new PythonModuleSource("foo", "", false, "cpython-39", true, isTest);
                        assertEquals(sources && (tests || !isTest), policy.filterPythonResource(r),
                                describe(sources, resources, tests, isTest));
                    }
                }
            }
        }
    }

    @Test
    void filterPythonResource_bytecodeRequest() {
        for (boolean sources : BOOLS) {
            for (boolean resources : BOOLS) {
                for (boolean tests : BOOLS) {
                    for (boolean isTest : BOOLS) {
                        PythonPackagingPolicy policy = policy(sources, resources, tests);
                        PythonResource r = new PythonModuleBytecodeRequest(
                                "foo", "", BytecodeOptimizationLevel.ZERO, false, "cpython-39", true, isTest);
                        assertEquals(tests || !isTest, policy.filterPythonResource(r),
                                describe(sources, resources, tests, isTest));
                    }
                }
            }
        }
    }

    @Test
    void filterPythonResource_packageResource() {
        for (boolean sources : BOOLS) {
            for (boolean resources : BOOLS) {
                for (boolean tests : BOOLS) {
                    for (boolean isTest : BOOLS) {
                        PythonPackagingPolicy policy = policy(sources, resources, tests);
                        PythonResource r = new PythonPackageResource("lib2to3", "Grammar.txt", null, true, isTest);
                        assertEquals(resources && (tests || !isTest), policy.filterPythonResource(r),
                                describe(sources, resources, tests, isTest));
                    }
                }
            }
        }
    }

    @Test
    void filterPythonResource_neverAcceptsOtherKinds() {
        List<PythonResource> never = List.of(
                new PythonModuleBytecode("foo", Path.of("foo.pyc"), BytecodeOptimizationLevel.ZERO, false, "cpython-39", true, false),
                new PythonPackageDistributionResource("requests", "2.25.1", "METADATA", null),
                PythonExtensionModule.builder("_ssl").sharedLibrary(Path.of("_ssl.so")).build(),
                PythonExtensionModule.builder("_ssl").objectFile(Path.of("_ssl.o")).build(),
                new PythonPathExtension("site-packages/foo.pth", null, false),
                new PythonEggFile(Path.of("foo.egg"), false, false));

        for (boolean sources : BOOLS) {
            for (boolean resources : BOOLS) {
                for (boolean tests : BOOLS) {
                    PythonPackagingPolicy policy = policy(sources, resources, tests);
                    for (PythonResource r : never) {
                        assertFalse(policy.filterPythonResource(r), r.kind() + " " + describe(sources, resources, tests, false));
                    }
                }
            }
        }
    }

    @Test
    void filterPythonResource_examplesFromDefaults() {
        PythonPackagingPolicy policy = new PythonPackagingPolicy();
        assertTrue(policy.filterPythonResource(new PythonModuleSource("json", "", true, "cpython-39", true, false)));
        assertFalse(policy.filterPythonResource(new PythonModuleSource("test.test_json", "", false, "cpython-39", true, true)));

        policy.setIncludeDistributionSources(false);
        assertFalse(policy.filterPythonResource(new PythonModuleSource("json", "", true, "cpython-39", true, false)));
    }

    @Test
    void isLicenseAdmitted_usesConfiguredAllowList() {
        PythonPackagingPolicy policy = new PythonPackagingPolicy();
        PythonExtensionModule em = PythonExtensionModule.builder("_vendor")
                .linkLibrary(LibraryDependency.staticLibrary("vendor"))
                .licenses(List.of("LicenseRef-Vendor"))
                .build();

        assertFalse(policy.isLicenseAdmitted(em));
        policy.setLicenseAllowList(LicenseAllowList.of("LicenseRef-Vendor"));
        assertTrue(policy.isLicenseAdmitted(em));
    }

    private static PythonPackagingPolicy policy(boolean sources, boolean resources, boolean tests) {
        PythonPackagingPolicy policy = new PythonPackagingPolicy();
        policy.setIncludeDistributionSources(sources);
        policy.setIncludeDistributionResources(resources);
        policy.setIncludeTest(tests);
        return policy;
    }

    private static String describe(boolean sources, boolean resources, boolean tests, boolean isTest) {
        return "sources=" + sources + " resources=" + resources + " tests=" + tests + " isTest=" + isTest;
    }
}
