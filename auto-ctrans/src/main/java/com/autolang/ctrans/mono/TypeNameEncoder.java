package com.autolang.ctrans.mono;

import com.autolang.tree.type.*;

import java.util.List;

/**
 * 实例名编码。编码只依赖键本身，不同模块对同一实例得到同一名字。
 * <pre>
 *   (List, int)         → List_int
 *   (Map, str, List_int) → Map_str_List_int
 *   *T → ptr_T，[n]T → arrn_T
 * </pre>
 */
public final class TypeNameEncoder {

    private TypeNameEncoder() {
    }

    public static String instanceName(String genericName, List<TypeRef> typeArgs) {
        StringBuilder sb = new StringBuilder(genericName);
        for (TypeRef arg : typeArgs) {
            sb.append('_').append(encode(arg));
        }
        return sb.toString();
    }

    public static String encode(TypeRef type) {
        if (type instanceof PrimitiveType) {
            return ((PrimitiveType) type).getKind().getSourceName();
        }
        if (type instanceof NamedType) {
            NamedType named = (NamedType) type;
            return named.hasTypeArgs() ? instanceName(named.getName(), named.getTypeArgs()) : named.getName();
        }
        if (type instanceof PointerType) {
            return "ptr_" + encode(((PointerType) type).getPointee());
        }
        if (type instanceof ArrayType) {
            ArrayType array = (ArrayType) type;
            return "arr" + array.getLength() + "_" + encode(array.getElementType());
        }
        throw new IllegalArgumentException("Cannot encode non-concrete type " + type);
    }
}
