package com.autolang.tree.decl;

import com.autolang.tree.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 和类型的一个变体。explicitValue 非空表示源码显式指定了判别值。
 */
public class VariantDecl extends Declaration {

    private final List<FieldDecl> fields;
    private final Integer explicitValue;

    public VariantDecl(SourceLocation location, String name, List<FieldDecl> fields, Integer explicitValue) {
        super(location, name);
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.explicitValue = explicitValue;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    public boolean hasPayload() {
        return !fields.isEmpty();
    }

    public Integer getExplicitValue() {
        return explicitValue;
    }

    public VariantDecl withFields(List<FieldDecl> newFields) {
        return new VariantDecl(location, name, newFields, explicitValue);
    }
}
