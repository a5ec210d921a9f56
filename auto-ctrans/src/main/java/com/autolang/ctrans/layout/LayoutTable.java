package com.autolang.ctrans.layout;

import com.autolang.tree.stmt.MatchStmt;
import com.autolang.tree.type.ArrayType;
import com.autolang.tree.type.NamedType;
import com.autolang.tree.type.TypeRef;

import java.util.*;

/**
 * 布局表：类型尺寸、和类型布局、match 分派方案。由 {@link AdtLayoutCompiler} 填写。
 * 可导入已完成的依赖模块的布局表，本模块查不到的类型和标签布局依次到导入表中查找。
 */
public class LayoutTable {
    private final Map<String, TypeLayout> typeLayouts = new LinkedHashMap<>();
    private final Map<String, TagLayout> tagLayouts = new LinkedHashMap<>();
    private final Map<MatchStmt, DispatchPlan> plans = new IdentityHashMap<>();
    private final List<LayoutTable> imports = new ArrayList<>();

    /**
     * 导入依赖模块的布局（只读引用，不复制）。
     */
    public void importFrom(LayoutTable dependency) {
        if (dependency != this && !imports.contains(dependency)) imports.add(dependency);
    }

    public TypeLayout getTypeLayout(String typeName) {
        TypeLayout layout = typeLayouts.get(typeName);
        if (layout != null) return layout;
        for (LayoutTable dep : imports) {
            layout = dep.getTypeLayout(typeName);
            if (layout != null) return layout;
        }
        return null;
    }

    void putTypeLayout(String typeName, TypeLayout layout) {
        typeLayouts.put(typeName, layout);
    }

    /**
     * 查询任意具体类型的尺寸分类。标量和指针为 SMALL，定长数组为 LARGE，
     * 未登记的命名类型（未导入的外部模块或不透明类型）按 LARGE 处理。
     */
    public SizeClass sizeClassOf(TypeRef type) {
        if (type instanceof ArrayType) return SizeClass.LARGE;
        if (type instanceof NamedType) {
            TypeLayout layout = getTypeLayout(((NamedType) type).getName());
            return layout != null ? layout.getSizeClass() : SizeClass.LARGE;
        }
        return SizeClass.SMALL;
    }

    public TagLayout getTagLayout(String tagName) {
        TagLayout layout = tagLayouts.get(tagName);
        if (layout != null) return layout;
        for (LayoutTable dep : imports) {
            layout = dep.getTagLayout(tagName);
            if (layout != null) return layout;
        }
        return null;
    }

    void putTagLayout(TagLayout layout) {
        tagLayouts.put(layout.getTagName(), layout);
    }

    /**
     * 本模块自己的标签布局（不含导入）。
     */
    public Collection<TagLayout> getTagLayouts() {
        return Collections.unmodifiableCollection(tagLayouts.values());
    }

    public DispatchPlan getPlan(MatchStmt match) {
        return plans.get(match);
    }

    void putPlan(MatchStmt match, DispatchPlan plan) {
        plans.put(match, plan);
    }

    /**
     * 降级阶段重建 MatchStmt 时把方案转给新节点。
     */
    public void transferPlan(MatchStmt from, MatchStmt to) {
        if (from == to) return;
        DispatchPlan plan = plans.get(from);
        if (plan != null) plans.put(to, plan);
    }

    public int planCount() {
        return plans.size();
    }
}
