package com.pypack.resource;

/** Python bytecode optimization level ({@code -O} flag count). */
public enum BytecodeOptimizationLevel {
    ZERO(0, ""),
    ONE(1, ".opt-1"),
    TWO(2, ".opt-2");

    private final int level;
    private final String fileNameTag;

    BytecodeOptimizationLevel(int level, String fileNameTag) {
        this.level = level;
        this.fileNameTag = fileNameTag;
    }

    public int getLevel() {
        return level;
    }

    /** Tag inserted into {@code __pycache__} file names (e.g. {@code foo.cpython-39.opt-1.pyc}). */
    public String getFileNameTag() {
        return fileNameTag;
    }

    public static BytecodeOptimizationLevel fromLevel(int level) {
        for (BytecodeOptimizationLevel l : values()) {
            if (l.level == level) return l;
        }
        throw new IllegalArgumentException("Unsupported bytecode optimization level: " + level);
    }
}
