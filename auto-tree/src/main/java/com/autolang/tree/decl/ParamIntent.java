package com.autolang.tree.decl;

/**
 * 参数声明时的所有权意图。
 */
public enum ParamIntent {
    READ,       // 只读借用
    MUTATE,     // 原地修改
    MOVE,       // 所有权转移
    ADDRESS     // 取地址（仅限底层代码块）
}
