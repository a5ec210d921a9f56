package com.autolang.ctrans.layout;

import com.autolang.tree.decl.FieldDecl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个变体的布局：判别值、枚举常量名和负载存储方式。
 */
public final class VariantLayout {

    public enum Storage {
        NONE,    // 无负载，不占联合体空间
        SINGLE,  // 单字段，直接以变体名存放
        STRUCT   // 多字段，匿名 struct
    }

    private final String name;
    private final String constantName;
    private final int discriminant;
    private final List<FieldDecl> fields;

    public VariantLayout(String name, String constantName, int discriminant, List<FieldDecl> fields) {
        this.name = name;
        this.constantName = constantName;
        this.discriminant = discriminant;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public String getName() {
        return name;
    }

    public String getConstantName() {
        return constantName;
    }

    public int getDiscriminant() {
        return discriminant;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    public Storage getStorage() {
        if (fields.isEmpty()) return Storage.NONE;
        return fields.size() == 1 ? Storage.SINGLE : Storage.STRUCT;
    }

    /**
     * 第 index 个负载字段相对于值本身的访问路径，如 {@code as.Int} 或 {@code as.Pair.left}。
     */
    public String accessPath(int index) {
        if (getStorage() == Storage.SINGLE) return TagLayout.UNION_NAME + "." + name;
        return TagLayout.UNION_NAME + "." + name + "." + fields.get(index).getName();
    }
}
