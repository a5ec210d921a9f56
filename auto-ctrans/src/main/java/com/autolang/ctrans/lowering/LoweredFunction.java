package com.autolang.ctrans.lowering;

import com.autolang.ctrans.ownership.SignatureBindings;
import com.autolang.tree.SourceLocation;
import com.autolang.tree.stmt.Block;
import com.autolang.tree.type.TypeRef;

/**
 * 降级后的自由函数：方法已展开为 {@code 类型名_方法名}，实例方法的接收者成为 self 参数。
 */
public class LoweredFunction {
    private final String cName;
    private final String origin;
    private final SourceLocation location;
    private final SignatureBindings bindings;
    private final TypeRef returnType;
    private final Block body;
    private final boolean main;
    private final String header;

    public LoweredFunction(String cName, String origin, SourceLocation location, SignatureBindings bindings,
                           TypeRef returnType, Block body, boolean main, String header) {
        this.cName = cName;
        this.origin = origin;
        this.location = location;
        this.bindings = bindings;
        this.returnType = returnType;
        this.body = body;
        this.main = main;
        this.header = header;
    }

    public String getCName() { return cName; }
    public String getOrigin() { return origin; }
    public SourceLocation getLocation() { return location; }
    public SignatureBindings getBindings() { return bindings; }
    public TypeRef getReturnType() { return returnType; }
    public Block getBody() { return body; }
    public boolean isMain() { return main; }

    /** 提供外部函数的系统头文件，可能为 null */
    public String getHeader() { return header; }

    public boolean isExternal() {
        return body == null;
    }
}
