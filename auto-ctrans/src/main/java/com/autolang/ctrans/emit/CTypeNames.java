package com.autolang.ctrans.emit;

import com.autolang.tree.type.*;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 类型到 C 文本的映射，同时记录用到的标准头文件。
 */
public class CTypeNames {
    public static final String STDBOOL = "stdbool.h";
    public static final String STDINT = "stdint.h";
    public static final String STDDEF = "stddef.h";

    private final Set<String> usedHeaders = new LinkedHashSet<>();

    /**
     * 抽象类型名（用于复合字面量、强制转换）。
     */
    public String typeName(TypeRef type) {
        if (type instanceof PrimitiveType) {
            return primitive(((PrimitiveType) type).getKind());
        }
        if (type instanceof NamedType) {
            return "struct " + ((NamedType) type).getName();
        }
        if (type instanceof PointerType) {
            return typeName(((PointerType) type).getPointee()) + "*";
        }
        if (type instanceof ArrayType) {
            ArrayType array = (ArrayType) type;
            return typeName(array.getElementType()) + "[" + array.getLength() + "]";
        }
        throw new IllegalArgumentException("No C type for " + type);
    }

    /**
     * 带名字的声明，例如 {@code struct Node *next}、{@code int grid[4]}。
     */
    public String declare(TypeRef type, String name) {
        if (type instanceof PointerType) {
            return declare(((PointerType) type).getPointee(), "*" + name);
        }
        if (type instanceof ArrayType) {
            ArrayType array = (ArrayType) type;
            String declarator = name.startsWith("*") ? "(" + name + ")" : name;
            return declare(array.getElementType(), declarator + "[" + array.getLength() + "]");
        }
        if (type instanceof PrimitiveType) {
            PrimitiveType.Kind kind = ((PrimitiveType) type).getKind();
            if (kind == PrimitiveType.Kind.STR) return "const char *" + name;
            if (kind == PrimitiveType.Kind.CSTR) return "char *" + name;
        }
        return typeName(type) + " " + name;
    }

    public String enumName(String tagName) {
        return "enum " + tagName + "Kind";
    }

    private String primitive(PrimitiveType.Kind kind) {
        switch (kind) {
            case INT:    return "int";
            case UINT:   return "unsigned int";
            case LONG:
                usedHeaders.add(STDINT);
                return "int64_t";
            case FLOAT:  return "float";
            case DOUBLE: return "double";
            case BOOL:
                usedHeaders.add(STDBOOL);
                return "bool";
            case CHAR:   return "char";
            case BYTE:
                usedHeaders.add(STDINT);
                return "uint8_t";
            case STR:    return "const char*";
            case CSTR:   return "char*";
            default:     return "void";
        }
    }

    public void use(String header) {
        usedHeaders.add(header);
    }

    public boolean uses(String header) {
        return usedHeaders.contains(header);
    }
}
