package com.pypack.resource;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PythonResourceTest {

    @Test
    void moduleSource_toBytecodeRequestKeepsFlags() {
        PythonModuleSource source = new PythonModuleSource("test.test_json", "import json\n", false, "cpython-39", true, true);
        PythonModuleBytecodeRequest request = source.toBytecodeRequest(BytecodeOptimizationLevel.TWO);

        assertEquals(ResourceKind.MODULE_BYTECODE_REQUEST, request.kind());
        assertEquals("test.test_json", request.fullName());
        assertEquals(BytecodeOptimizationLevel.TWO, request.optimizeLevel());
        assertTrue(request.isTest());
        assertTrue(request.isStdlib());
    }

    @Test
    void fullName_perKind() {
        assertEquals("lib2to3.Grammar.txt",
                new PythonPackageResource("lib2to3", "Grammar.txt", Path.of("Grammar.txt"), true, false).fullName());
        assertEquals("requests:METADATA",
                new PythonPackageDistributionResource("requests", "2.25.1", "METADATA", Path.of("METADATA")).fullName());
        assertEquals("site-packages/foo.pth",
                new PythonPathExtension("site-packages/foo.pth", Path.of("foo.pth"), false).fullName());
    }

    @Test
    void isTest_falseForKindsWithoutTestFlag() {
        assertFalse(new PythonPackageDistributionResource("requests", "2.25.1", "RECORD", null).isTest());
        assertFalse(new PythonPathExtension("easy-install.pth", null, false).isTest());
        assertTrue(new PythonEggFile(Path.of("foo.egg"), false, true).isTest());
    }

    @Test
    void bytecodeOptimizationLevel_fromLevel() {
        assertEquals(BytecodeOptimizationLevel.ONE, BytecodeOptimizationLevel.fromLevel(1));
        assertEquals(".opt-2", BytecodeOptimizationLevel.fromLevel(2).getFileNameTag());
        assertEquals("", BytecodeOptimizationLevel.ZERO.getFileNameTag());
        assertThrows(IllegalArgumentException.class, () -> BytecodeOptimizationLevel.fromLevel(3));
    }
}
