package com.autolang.tree.decl;

/**
 * 字段可见性
 */
public enum Visibility {
    PUBLIC,
    PRIVATE
}
