package com.autolang.tree.expr;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.type.TypeRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 记录构造 Point(x: 1, y: 2)，字段按书写顺序保存。
 */
public class StructInit extends Expression {
    private final Map<String, Expression> fields;

    public StructInit(SourceLocation location, TypeRef type, Map<String, Expression> fields) {
        super(location, type);
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Map<String, Expression> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitStructInit(this, context);
    }
}
