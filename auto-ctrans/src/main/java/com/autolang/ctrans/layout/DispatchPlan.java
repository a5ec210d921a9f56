package com.autolang.ctrans.layout;

import com.autolang.tree.expr.Literal;
import com.autolang.tree.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * match 语句的分派方案。分支以下标引用 MatchStmt 的 arm，
 * 因此降级阶段重建 MatchStmt 后方案仍然有效。
 */
public final class DispatchPlan {

    public enum Form {
        SWITCH,
        IF_CHAIN   // 分支内有指向外层循环的 break/continue
    }

    /**
     * 负载解构：把变体存储中的字段复制到局部变量。
     */
    public static final class Binding {
        private final String name;
        private final TypeRef type;
        private final String accessPath;

        public Binding(String name, TypeRef type, String accessPath) {
            this.name = name;
            this.type = type;
            this.accessPath = accessPath;
        }

        public String getName() { return name; }
        public TypeRef getType() { return type; }
        public String getAccessPath() { return accessPath; }
    }

    public static final class Case {
        private final int armIndex;
        private final VariantLayout variant;
        private final Literal literal;
        private final List<Binding> bindings;
        private final String wholeBinding;

        private Case(int armIndex, VariantLayout variant, Literal literal,
                     List<Binding> bindings, String wholeBinding) {
            this.armIndex = armIndex;
            this.variant = variant;
            this.literal = literal;
            this.bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
            this.wholeBinding = wholeBinding;
        }

        public static Case variant(int armIndex, VariantLayout variant, List<Binding> bindings) {
            return new Case(armIndex, variant, null, bindings, null);
        }

        public static Case literal(int armIndex, Literal literal) {
            return new Case(armIndex, null, literal, Collections.<Binding>emptyList(), null);
        }

        public static Case catchAll(int armIndex, String wholeBinding) {
            return new Case(armIndex, null, null, Collections.<Binding>emptyList(), wholeBinding);
        }

        public int getArmIndex() { return armIndex; }
        public VariantLayout getVariant() { return variant; }
        public Literal getLiteral() { return literal; }
        public List<Binding> getBindings() { return bindings; }

        /** 通配分支绑定整个值的变量名，可能为 null */
        public String getWholeBinding() { return wholeBinding; }

        public boolean isCatchAll() {
            return variant == null && literal == null;
        }
    }

    private final Form form;
    private final TagLayout tag;
    private final List<Case> cases;

    public DispatchPlan(Form form, TagLayout tag, List<Case> cases) {
        this.form = form;
        this.tag = tag;
        this.cases = Collections.unmodifiableList(new ArrayList<>(cases));
    }

    public Form getForm() {
        return form;
    }

    /** 标量 match 时为 null */
    public TagLayout getTag() {
        return tag;
    }

    public boolean isTagDispatch() {
        return tag != null;
    }

    public List<Case> getCases() {
        return cases;
    }
}
