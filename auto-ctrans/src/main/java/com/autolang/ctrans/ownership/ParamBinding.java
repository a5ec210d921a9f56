package com.autolang.ctrans.ownership;

import com.autolang.tree.decl.ParamIntent;
import com.autolang.tree.type.PointerType;
import com.autolang.tree.type.TypeRef;

/**
 * 参数、接收者或返回槽及其传递策略。分类后不再改变。
 */
public final class ParamBinding {

    public enum Role {
        PARAM,
        RECEIVER,
        RETURN
    }

    private final Role role;
    private final String name;
    private final TypeRef type;
    private final ParamIntent intent;
    private final PassingStrategy strategy;

    public ParamBinding(Role role, String name, TypeRef type, ParamIntent intent, PassingStrategy strategy) {
        this.role = role;
        this.name = name;
        this.type = type;
        this.intent = intent;
        this.strategy = strategy;
    }

    public Role getRole() { return role; }
    public String getName() { return name; }
    public TypeRef getType() { return type; }
    public ParamIntent getIntent() { return intent; }
    public PassingStrategy getStrategy() { return strategy; }

    /**
     * 是否由编译器插入了一层间接：引用传递，或对非指针类型取地址。
     * 这类绑定在值上下文中需要解引用，实参处需要取地址。
     */
    public boolean isIndirect() {
        switch (strategy) {
            case REF_IMMUTABLE:
            case REF_MUTABLE:
                return true;
            case POINTER:
                return !(type instanceof PointerType);
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return role.name().toLowerCase() + " " + name + ": " + type + " -> " + strategy;
    }
}
