package com.autolang.tree.decl;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.type.NamedType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 记录类型声明，拥有自己的字段和方法。
 * <p>
 * opaque 表示接口片段中的占位声明（只有名字），由场景片段补全；
 * heap 表示该聚合持有堆上数据；specs 是该类型实现的规格（可带泛型实参）。
 */
public class TypeDecl extends Declaration {

    private final List<String> typeParams;
    private final List<FieldDecl> fields;
    private final List<MethodDecl> methods;
    private final boolean opaque;
    private final boolean heap;
    private final List<NamedType> specs;

    public TypeDecl(SourceLocation location, String name, List<String> typeParams,
                    List<FieldDecl> fields, List<MethodDecl> methods,
                    boolean opaque, boolean heap) {
        this(location, name, typeParams, fields, methods, opaque, heap, null);
    }

    public TypeDecl(SourceLocation location, String name, List<String> typeParams,
                    List<FieldDecl> fields, List<MethodDecl> methods,
                    boolean opaque, boolean heap, List<NamedType> specs) {
        super(location, name);
        this.typeParams = typeParams != null
                ? Collections.unmodifiableList(new ArrayList<>(typeParams))
                : Collections.<String>emptyList();
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.methods = Collections.unmodifiableList(new ArrayList<>(methods));
        this.opaque = opaque;
        this.heap = heap;
        this.specs = specs != null
                ? Collections.unmodifiableList(new ArrayList<>(specs))
                : Collections.<NamedType>emptyList();
    }

    public List<String> getTypeParams() {
        return typeParams;
    }

    public boolean isGeneric() {
        return !typeParams.isEmpty();
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    public FieldDecl findField(String fieldName) {
        for (FieldDecl f : fields) {
            if (f.getName().equals(fieldName)) return f;
        }
        return null;
    }

    public List<MethodDecl> getMethods() {
        return methods;
    }

    public MethodDecl findMethod(String methodName) {
        for (MethodDecl m : methods) {
            if (m.getName().equals(methodName)) return m;
        }
        return null;
    }

    public boolean isOpaque() {
        return opaque;
    }

    public boolean isHeap() {
        return heap;
    }

    public List<NamedType> getSpecs() {
        return specs;
    }

    public boolean isTag() {
        return false;
    }

    /**
     * 以新名字、新成员复制本声明，保留 specs。TagDecl 覆写以保留变体。
     */
    public TypeDecl rebuild(String newName, List<String> newTypeParams,
                            List<FieldDecl> newFields, List<MethodDecl> newMethods) {
        return new TypeDecl(location, newName, newTypeParams, newFields, newMethods, opaque, heap, specs);
    }

    public TypeDecl withSpecs(List<NamedType> newSpecs) {
        return new TypeDecl(location, name, typeParams, fields, methods, opaque, heap, newSpecs);
    }
}
