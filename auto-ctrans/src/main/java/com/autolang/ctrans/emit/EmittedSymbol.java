package com.autolang.ctrans.emit;

/**
 * 输出到 C 的一个符号。declaration 在生成声明文本后回填。
 */
public final class EmittedSymbol {

    public enum Kind {
        TYPE(true),
        KIND_ENUM(true),
        ENUM_CONSTANT(false),
        FUNCTION(false),
        TYPEDEF(false),
        VARIABLE(false);

        private final boolean tagNamespace;

        Kind(boolean tagNamespace) {
            this.tagNamespace = tagNamespace;
        }

        /**
         * C 的 struct/enum 标签与普通标识符分属不同命名空间。
         */
        public boolean isTagNamespace() {
            return tagNamespace;
        }
    }

    private final String name;
    private final Kind kind;
    private final String origin;
    private String declaration;

    public EmittedSymbol(String name, Kind kind, String origin) {
        this.name = name;
        this.kind = kind;
        this.origin = origin;
    }

    public String getName() { return name; }
    public Kind getKind() { return kind; }
    public String getOrigin() { return origin; }
    public String getDeclaration() { return declaration; }

    void setDeclaration(String declaration) {
        this.declaration = declaration;
    }

    @Override
    public String toString() {
        return kind + " " + name + " (" + origin + ")";
    }
}
