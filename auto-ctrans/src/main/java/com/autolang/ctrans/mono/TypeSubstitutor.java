package com.autolang.ctrans.mono;

import com.autolang.tree.type.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 结构替换：把泛型参数换成绑定的类型，不做实例名编码。未绑定的参数保持原样。
 */
public final class TypeSubstitutor {

    private TypeSubstitutor() {
    }

    public static TypeRef substitute(TypeRef type, Map<String, TypeRef> bindings) {
        if (type == null || bindings.isEmpty() || !type.containsTypeParam()) return type;
        if (type instanceof TypeParamType) {
            TypeRef bound = bindings.get(((TypeParamType) type).getName());
            return bound != null ? bound : type;
        }
        if (type instanceof PointerType) {
            return new PointerType(substitute(((PointerType) type).getPointee(), bindings));
        }
        if (type instanceof ArrayType) {
            ArrayType array = (ArrayType) type;
            return new ArrayType(substitute(array.getElementType(), bindings), array.getLength());
        }
        if (type instanceof NamedType) {
            NamedType named = (NamedType) type;
            List<TypeRef> args = new ArrayList<>(named.getTypeArgs().size());
            for (TypeRef arg : named.getTypeArgs()) {
                args.add(substitute(arg, bindings));
            }
            return new NamedType(named.getName(), args);
        }
        return type;
    }
}
