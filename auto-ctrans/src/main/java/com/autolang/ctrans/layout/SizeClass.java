package com.autolang.ctrans.layout;

/**
 * 尺寸分类，决定只读参数按值还是按引用传递。
 */
public enum SizeClass {
    SMALL,  // 不超过小聚合上限，按值复制
    LARGE,  // 超过上限或尺寸未知
    HEAP    // 持有堆上数据
}
