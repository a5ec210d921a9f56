package com.autolang.tree.module;

/**
 * 目标场景。决定装配时选择哪个场景片段（文件后缀）。
 */
public enum Scenario {
    STATIC_C("c"),
    INTERPRETED("vm");

    private final String suffix;

    Scenario(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }

    /**
     * 按后缀或枚举名查找（不区分大小写），找不到时抛出 IllegalArgumentException。
     */
    public static Scenario fromName(String name) {
        for (Scenario s : values()) {
            if (s.suffix.equalsIgnoreCase(name) || s.name().equalsIgnoreCase(name)) return s;
        }
        throw new IllegalArgumentException("Unknown scenario: " + name);
    }
}
