package com.autolang.ctrans.layout;

import com.autolang.ctrans.CompilationContext;
import com.autolang.ctrans.error.ErrorKind;
import com.autolang.ctrans.mono.ResolvedModule;
import com.autolang.ctrans.pass.TransPass;
import com.autolang.tree.TreeScanner;
import com.autolang.tree.decl.*;
import com.autolang.tree.expr.Literal;
import com.autolang.tree.pattern.LiteralPattern;
import com.autolang.tree.pattern.Pattern;
import com.autolang.tree.pattern.VariantPattern;
import com.autolang.tree.pattern.WildcardPattern;
import com.autolang.tree.stmt.*;
import com.autolang.tree.type.NamedType;
import com.autolang.tree.type.PrimitiveType;
import com.autolang.tree.type.TypeRef;

import java.util.*;
import java.util.logging.Logger;

/**
 * ADT 布局编译：计算所有类型的尺寸分类，为每个和类型分配判别值，
 * 并为每条 match 语句生成分派方案、检查穷尽性。
 */
public class AdtLayoutCompiler implements TransPass<ResolvedModule, ResolvedModule> {
    private static final Logger LOG = Logger.getLogger(AdtLayoutCompiler.class.getName());

    @Override
    public String getName() {
        return "adt-layout";
    }

    @Override
    public ResolvedModule run(ResolvedModule module, CompilationContext ctx) {
        LayoutTable table = ctx.getLayouts();
        TypeSizer sizer = new TypeSizer(module.getTypes(), ctx);
        for (TypeDecl type : module.getTypes()) {
            if (type.isOpaque()) continue;
            TypeLayout layout = sizer.layoutOf(type.getName());
            table.putTypeLayout(type.getName(), layout);
            LOG.fine(type.getName() + ": " + layout);
        }
        for (TypeDecl type : module.getTypes()) {
            if (type instanceof TagDecl) {
                table.putTagLayout(compileTag((TagDecl) type, ctx));
            }
        }
        MatchPlanner planner = new MatchPlanner(table, ctx);
        for (TypeDecl type : module.getTypes()) {
            for (MethodDecl method : type.getMethods()) {
                planner.scan(method.getBody(), null);
            }
        }
        for (FunctionDecl fn : module.getFunctions()) {
            planner.scan(fn.getBody(), null);
        }
        return module;
    }

    /**
     * 分配判别值：按声明顺序从 0 开始，显式值优先，自动值从已分配的最大值之后继续。
     */
    public static TagLayout compileTag(TagDecl tag, CompilationContext ctx) {
        List<VariantLayout> variants = new ArrayList<>();
        Map<Integer, String> used = new HashMap<>();
        int next = 0;
        for (VariantDecl variant : tag.getVariants()) {
            int value = variant.getExplicitValue() != null ? variant.getExplicitValue() : next;
            String previous = used.put(value, variant.getName());
            if (previous != null) {
                throw ctx.error(ErrorKind.DUPLICATE_DISCRIMINANT, tag.getName() + "." + variant.getName(),
                        variant.getLocation(), "Discriminant " + value + " already used by variant " + previous);
            }
            next = Math.max(next, value + 1);
            variants.add(new VariantLayout(variant.getName(), constantName(tag.getName(), variant.getName()),
                    value, variant.getFields()));
        }
        return new TagLayout(tag.getName(), variants);
    }

    public static String constantName(String tagName, String variantName) {
        return tagName.toUpperCase(Locale.ROOT) + "_" + variantName.toUpperCase(Locale.ROOT);
    }

    /**
     * 遍历函数体，为每条 match 生成分派方案。
     */
    private static final class MatchPlanner extends TreeScanner<Void> {
        private final LayoutTable table;
        private final CompilationContext ctx;

        MatchPlanner(LayoutTable table, CompilationContext ctx) {
            this.table = table;
            this.ctx = ctx;
        }

        @Override
        public Void visitMatch(MatchStmt node, Void context) {
            table.putPlan(node, plan(node));
            return super.visitMatch(node, context);
        }

        private DispatchPlan plan(MatchStmt match) {
            TypeRef targetType = match.getTarget().getType();
            TagLayout tag = targetType instanceof NamedType
                    ? table.getTagLayout(((NamedType) targetType).getName()) : null;
            DispatchPlan.Form form = DispatchPlan.Form.SWITCH;
            for (MatchArm arm : match.getArms()) {
                if (LoopExitFinder.exitsEnclosingLoop(arm.getBody())) {
                    form = DispatchPlan.Form.IF_CHAIN;
                    break;
                }
            }
            List<DispatchPlan.Case> cases = tag != null ? tagCases(match, tag) : scalarCases(match, targetType);
            return new DispatchPlan(form, tag, cases);
        }

        private List<DispatchPlan.Case> tagCases(MatchStmt match, TagLayout tag) {
            List<DispatchPlan.Case> cases = new ArrayList<>();
            Set<String> covered = new LinkedHashSet<>();
            boolean catchAll = false;
            List<MatchArm> arms = match.getArms();
            for (int i = 0; i < arms.size(); i++) {
                Pattern pattern = arms.get(i).getPattern();
                checkReachable(catchAll, pattern);
                if (pattern instanceof WildcardPattern) {
                    catchAll = true;
                    cases.add(DispatchPlan.Case.catchAll(i, ((WildcardPattern) pattern).getBinding()));
                    continue;
                }
                if (!(pattern instanceof VariantPattern)) {
                    throw invalid(pattern, "Literal pattern on tag " + tag.getTagName());
                }
                VariantPattern vp = (VariantPattern) pattern;
                VariantLayout variant = tag.findVariant(vp.getVariant());
                if (variant == null) {
                    throw invalid(pattern, "Tag " + tag.getTagName() + " has no variant '" + vp.getVariant() + "'");
                }
                if (!covered.add(variant.getName())) {
                    throw invalid(pattern, "Variant '" + variant.getName() + "' is matched twice");
                }
                if (vp.getBindings().size() > variant.getFields().size()) {
                    throw invalid(pattern, "Variant '" + variant.getName() + "' has "
                            + variant.getFields().size() + " payload fields, pattern binds " + vp.getBindings().size());
                }
                List<DispatchPlan.Binding> bindings = new ArrayList<>();
                for (int f = 0; f < vp.getBindings().size(); f++) {
                    String name = vp.getBindings().get(f);
                    if (VariantPattern.SKIP.equals(name)) continue;
                    bindings.add(new DispatchPlan.Binding(name, variant.getFields().get(f).getType(),
                            variant.accessPath(f)));
                }
                cases.add(DispatchPlan.Case.variant(i, variant, bindings));
            }
            if (!catchAll && covered.size() < tag.getVariants().size()) {
                List<String> missing = new ArrayList<>();
                for (VariantLayout v : tag.getVariants()) {
                    if (!covered.contains(v.getName())) missing.add(v.getName());
                }
                throw ctx.error(ErrorKind.NON_EXHAUSTIVE_MATCH, tag.getTagName(), match.getLocation(),
                        "Match does not cover variants " + missing + " and has no catch-all arm");
            }
            return cases;
        }

        /**
         * 标量 match：字面量 case 加可选的 default，不要求穷尽。
         */
        private List<DispatchPlan.Case> scalarCases(MatchStmt match, TypeRef targetType) {
            List<DispatchPlan.Case> cases = new ArrayList<>();
            Set<Long> seen = new HashSet<>();
            boolean catchAll = false;
            List<MatchArm> arms = match.getArms();
            for (int i = 0; i < arms.size(); i++) {
                Pattern pattern = arms.get(i).getPattern();
                checkReachable(catchAll, pattern);
                if (pattern instanceof WildcardPattern) {
                    catchAll = true;
                    cases.add(DispatchPlan.Case.catchAll(i, ((WildcardPattern) pattern).getBinding()));
                    continue;
                }
                if (pattern instanceof VariantPattern) {
                    throw invalid(pattern, "Variant pattern on non-tag target of type " + targetType);
                }
                Literal literal = ((LiteralPattern) pattern).getValue();
                if (!isIntegral(targetType) || !isIntegralLiteral(literal)) {
                    throw invalid(pattern, "Literal patterns need an integral, char or bool target, got " + targetType);
                }
                if (!seen.add(literalValue(literal, pattern))) {
                    throw invalid(pattern, "Literal " + literal.getText() + " is matched twice");
                }
                cases.add(DispatchPlan.Case.literal(i, literal));
            }
            return cases;
        }

        private void checkReachable(boolean afterCatchAll, Pattern pattern) {
            if (afterCatchAll) {
                throw invalid(pattern, "Arm after a catch-all arm is unreachable");
            }
        }

        private static boolean isIntegral(TypeRef type) {
            if (!(type instanceof PrimitiveType)) return false;
            switch (((PrimitiveType) type).getKind()) {
                case INT: case UINT: case LONG: case BOOL: case CHAR: case BYTE:
                    return true;
                default:
                    return false;
            }
        }

        private static boolean isIntegralLiteral(Literal literal) {
            switch (literal.getKind()) {
                case INT: case BOOL: case CHAR:
                    return true;
                default:
                    return false;
            }
        }

        /**
         * 字面量的整数值，用于检测重复 case（{@code 1} 与 {@code 0x1}、{@code 'a'} 与 {@code 97} 相同）。
         * 整数按 C 的写法解析：0x 十六进制、0b 二进制、0 开头八进制，忽略 u/l 后缀和下划线。
         */
        private Long literalValue(Literal literal, Pattern pattern) {
            String text = literal.getText();
            switch (literal.getKind()) {
                case BOOL:
                    return Boolean.parseBoolean(text) ? 1L : 0L;
                case CHAR:
                    return (long) charValue(text, pattern);
                default:
                    break;
            }
            String digits = text.replace("_", "");
            boolean negative = digits.startsWith("-");
            if (negative || digits.startsWith("+")) digits = digits.substring(1);
            int end = digits.length();
            while (end > 0 && "uUlL".indexOf(digits.charAt(end - 1)) >= 0) end--;
            digits = digits.substring(0, end);
            int radix = 10;
            if (digits.startsWith("0x") || digits.startsWith("0X")) {
                radix = 16;
                digits = digits.substring(2);
            } else if (digits.startsWith("0b") || digits.startsWith("0B")) {
                radix = 2;
                digits = digits.substring(2);
            } else if (digits.length() > 1 && digits.charAt(0) == '0') {
                radix = 8;
                digits = digits.substring(1);
            }
            try {
                long value = Long.parseLong(digits, radix);
                return negative ? -value : value;
            } catch (NumberFormatException e) {
                throw ctx.error(ErrorKind.INVALID_PATTERN, null, pattern.getLocation(),
                        "Malformed integer literal '" + text + "' in pattern");
            }
        }

        private char charValue(String text, Pattern pattern) {
            if (text.length() == 1) return text.charAt(0);
            if (text.length() == 2 && text.charAt(0) == '\\') {
                switch (text.charAt(1)) {
                    case 'n': return '\n';
                    case 't': return '\t';
                    case 'r': return '\r';
                    case '0': return '\0';
                    default: return text.charAt(1);
                }
            }
            throw ctx.error(ErrorKind.INVALID_PATTERN, null, pattern.getLocation(),
                    "Malformed character literal '" + text + "' in pattern");
        }

        private RuntimeException invalid(Pattern pattern, String message) {
            return ctx.error(ErrorKind.INVALID_PATTERN, null, pattern.getLocation(), message);
        }
    }

    /**
     * 查找指向 match 外层循环的 break/continue（嵌套循环内部的不算）。
     */
    static final class LoopExitFinder extends TreeScanner<Void> {
        private int loopDepth;
        private boolean found;

        static boolean exitsEnclosingLoop(Block body) {
            LoopExitFinder finder = new LoopExitFinder();
            finder.scan(body, null);
            return finder.found;
        }

        @Override
        public Void visitBreak(BreakStmt node, Void context) {
            if (loopDepth == 0) found = true;
            return null;
        }

        @Override
        public Void visitContinue(ContinueStmt node, Void context) {
            if (loopDepth == 0) found = true;
            return null;
        }

        @Override
        public Void visitWhile(WhileStmt node, Void context) {
            loopDepth++;
            super.visitWhile(node, context);
            loopDepth--;
            return null;
        }

        @Override
        public Void visitLoop(LoopStmt node, Void context) {
            loopDepth++;
            super.visitLoop(node, context);
            loopDepth--;
            return null;
        }

        @Override
        public Void visitForRange(ForRangeStmt node, Void context) {
            loopDepth++;
            super.visitForRange(node, context);
            loopDepth--;
            return null;
        }
    }
}
