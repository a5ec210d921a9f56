package com.autolang.tree.decl;

/**
 * 方法种类：静态方法没有接收者。
 */
public enum MethodKind {
    STATIC,
    INSTANCE
}
