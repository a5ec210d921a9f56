package com.autolang.tree.type;

/**
 * 内置标量类型。
 */
public final class PrimitiveType extends TypeRef {

    public enum Kind {
        INT("int"),
        UINT("uint"),
        LONG("long"),
        FLOAT("float"),
        DOUBLE("double"),
        BOOL("bool"),
        CHAR("char"),
        BYTE("byte"),
        STR("str"),
        CSTR("cstr"),
        VOID("void");

        private final String sourceName;

        Kind(String sourceName) {
            this.sourceName = sourceName;
        }

        public String getSourceName() {
            return sourceName;
        }
    }

    public static final PrimitiveType INT = new PrimitiveType(Kind.INT);
    public static final PrimitiveType UINT = new PrimitiveType(Kind.UINT);
    public static final PrimitiveType LONG = new PrimitiveType(Kind.LONG);
    public static final PrimitiveType FLOAT = new PrimitiveType(Kind.FLOAT);
    public static final PrimitiveType DOUBLE = new PrimitiveType(Kind.DOUBLE);
    public static final PrimitiveType BOOL = new PrimitiveType(Kind.BOOL);
    public static final PrimitiveType CHAR = new PrimitiveType(Kind.CHAR);
    public static final PrimitiveType BYTE = new PrimitiveType(Kind.BYTE);
    public static final PrimitiveType STR = new PrimitiveType(Kind.STR);
    public static final PrimitiveType CSTR = new PrimitiveType(Kind.CSTR);
    public static final PrimitiveType VOID = new PrimitiveType(Kind.VOID);

    private final Kind kind;

    private PrimitiveType(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 按源码名查找内置类型，不存在时返回 null。
     */
    public static PrimitiveType byName(String name) {
        for (Kind k : Kind.values()) {
            if (k.sourceName.equals(name)) return of(k);
        }
        return null;
    }

    public static PrimitiveType of(Kind kind) {
        switch (kind) {
            case INT:    return INT;
            case UINT:   return UINT;
            case LONG:   return LONG;
            case FLOAT:  return FLOAT;
            case DOUBLE: return DOUBLE;
            case BOOL:   return BOOL;
            case CHAR:   return CHAR;
            case BYTE:   return BYTE;
            case STR:    return STR;
            case CSTR:   return CSTR;
            default:     return VOID;
        }
    }

    @Override
    public boolean containsTypeParam() {
        return false;
    }

    @Override
    public int nestingDepth() {
        return 0;
    }

    @Override
    public String toString() {
        return kind.sourceName;
    }
}
