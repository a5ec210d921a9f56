package com.autolang.ctrans.error;

/**
 * 编译错误分类。每种错误由持有对应不变量的 pass 抛出。
 */
public enum ErrorKind {
    ASSEMBLY_CONFLICT,
    MISSING_MODULE,
    UNRESOLVED_GENERIC,
    CYCLIC_INSTANTIATION,
    RECURSIVE_LAYOUT,
    DUPLICATE_DISCRIMINANT,
    INVALID_PATTERN,
    NON_EXHAUSTIVE_MATCH,
    SPEC_MISMATCH,
    OWNERSHIP_VIOLATION,
    SYMBOL_COLLISION,
    DEPENDENCY_FAILED
}
