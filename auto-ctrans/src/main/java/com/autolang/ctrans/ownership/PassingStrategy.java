package com.autolang.ctrans.ownership;

/**
 * 参数传递策略
 */
public enum PassingStrategy {
    COPY,           // 按值
    REF_IMMUTABLE,  // const T*
    REF_MUTABLE,    // T*
    POINTER         // 显式指针
}
