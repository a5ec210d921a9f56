package com.autolang.tree.decl;

import com.autolang.tree.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 类型扩展块（ext）：为同模块中声明的类型追加字段和方法。
 * 场景片段借此补全接口片段中的类型，例如 C 场景为 File 增加私有的 _fp 字段。
 */
public class ExtDecl extends Declaration {

    private final List<FieldDecl> fields;
    private final List<MethodDecl> methods;

    public ExtDecl(SourceLocation location, String target, List<FieldDecl> fields, List<MethodDecl> methods) {
        super(location, target);
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.methods = Collections.unmodifiableList(new ArrayList<>(methods));
    }

    public String getTarget() {
        return name;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    public List<MethodDecl> getMethods() {
        return methods;
    }
}
