package com.autolang.tree.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 用户声明的类型引用（record 或 tag），可带泛型实参。
 */
public final class NamedType extends TypeRef {

    private final String name;
    private final List<TypeRef> typeArgs;

    public NamedType(String name, List<TypeRef> typeArgs) {
        this.name = name;
        this.typeArgs = typeArgs != null && !typeArgs.isEmpty()
                ? Collections.unmodifiableList(new ArrayList<>(typeArgs))
                : Collections.<TypeRef>emptyList();
    }

    public NamedType(String name) {
        this(name, null);
    }

    public String getName() {
        return name;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    public boolean hasTypeArgs() {
        return !typeArgs.isEmpty();
    }

    @Override
    public boolean containsTypeParam() {
        for (TypeRef arg : typeArgs) {
            if (arg.containsTypeParam()) return true;
        }
        return false;
    }

    @Override
    public int nestingDepth() {
        int max = 0;
        for (TypeRef arg : typeArgs) {
            max = Math.max(max, arg.nestingDepth());
        }
        return typeArgs.isEmpty() ? 0 : max + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NamedType)) return false;
        NamedType that = (NamedType) o;
        return name.equals(that.name) && typeArgs.equals(that.typeArgs);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + typeArgs.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        if (!typeArgs.isEmpty()) {
            sb.append('<');
            for (int i = 0; i < typeArgs.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(typeArgs.get(i));
            }
            sb.append('>');
        }
        return sb.toString();
    }
}
