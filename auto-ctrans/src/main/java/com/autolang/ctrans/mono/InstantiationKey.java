package com.autolang.ctrans.mono;

import com.autolang.tree.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 泛型实例化键：(种类, 泛型名, 具体类型实参元组)。
 */
public final class InstantiationKey {

    public enum Kind {
        TYPE,
        FUNCTION,
        SPEC
    }

    private final Kind kind;
    private final String genericName;
    private final List<TypeRef> typeArgs;

    public InstantiationKey(Kind kind, String genericName, List<TypeRef> typeArgs) {
        this.kind = kind;
        this.genericName = genericName;
        this.typeArgs = Collections.unmodifiableList(new ArrayList<>(typeArgs));
    }

    public Kind getKind() {
        return kind;
    }

    public String getGenericName() {
        return genericName;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InstantiationKey)) return false;
        InstantiationKey that = (InstantiationKey) o;
        return kind == that.kind && genericName.equals(that.genericName) && typeArgs.equals(that.typeArgs);
    }

    @Override
    public int hashCode() {
        return (kind.hashCode() * 31 + genericName.hashCode()) * 31 + typeArgs.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(genericName).append('<');
        for (int i = 0; i < typeArgs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(typeArgs.get(i));
        }
        return sb.append('>').toString();
    }
}
