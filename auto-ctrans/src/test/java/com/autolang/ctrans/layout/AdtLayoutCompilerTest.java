package com.autolang.ctrans.layout;

import com.autolang.ctrans.CompilationContext;
import com.autolang.ctrans.TestTrees;
import com.autolang.ctrans.error.CompileException;
import com.autolang.ctrans.error.ErrorKind;
import com.autolang.ctrans.mono.Monomorphizer;
import com.autolang.ctrans.mono.ResolvedModule;
import com.autolang.tree.module.ModuleUnit;
import com.autolang.tree.stmt.LoopStmt;
import com.autolang.tree.stmt.MatchStmt;
import com.autolang.tree.stmt.Statement;
import com.autolang.tree.type.NamedType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AdtLayoutCompiler 单元测试
 */
class AdtLayoutCompilerTest {

    private static final String OP = "{'kind':'tag','name':'Op','variants':["
            + "{'name':'Add','fields':[{'name':'a','type':'int'},{'name':'b','type':'int'}]},"
            + "{'name':'Neg','fields':[{'name':'v','type':'int'}]},"
            + "{'name':'Nop'}]}";
    private static final String OP_PARAM = "{'name':'o','type':'Op'}";
    private static final String TARGET = "{'expr':'ident','name':'o','type':'Op'}";

    private CompilationContext ctx;
    private ResolvedModule module;

    private CompilationContext compile(ModuleUnit unit) {
        ctx = TestTrees.context(unit.getName());
        module = new AdtLayoutCompiler().run(new Monomorphizer().run(unit, ctx), ctx);
        return ctx;
    }

    private CompileException failure(ModuleUnit unit, ErrorKind kind) {
        CompileException e = assertThrows(CompileException.class, () -> compile(unit));
        assertEquals(kind, e.getKind(), e.getMessage());
        return e;
    }

    private Statement firstStatement() {
        return module.findFunction("f").getBody().getStatements().get(0);
    }

    private static String match(String target, String... arms) {
        return "{'stmt':'match','line':7,'target':" + target + ",'arms':[" + String.join(",", arms) + "]}";
    }

    private static String arm(String pattern, String body) {
        return "{'pattern':" + pattern + ",'body':[" + body + "]}";
    }

    private static String variant(String name, String... bindings) {
        StringBuilder sb = new StringBuilder();
        for (String b : bindings) {
            if (sb.length() > 0) sb.append(',');
            sb.append('\'').append(b).append('\'');
        }
        return "{'pattern':'variant','name':'" + name + "','bindings':[" + sb + "]}";
    }

    private static final String WILDCARD = "{'pattern':'wildcard'}";

    private static String literal(String kind, String value) {
        return "{'pattern':'literal','value':{'expr':'lit','kind':'" + kind + "','value':'" + value + "'}}";
    }

    // ================================================================
    // 判别值
    // ================================================================

    @Nested
    @DisplayName("判别值")
    class DiscriminantTests {

        @Test
        @DisplayName("按声明顺序从 0 分配")
        void testSequential() {
            compile(TestTrees.unit("{'module':'m','decls':[" + OP + "]}"));
            TagLayout tag = ctx.getLayouts().getTagLayout("Op");
            assertEquals(0, tag.findVariant("Add").getDiscriminant());
            assertEquals(1, tag.findVariant("Neg").getDiscriminant());
            assertEquals(2, tag.findVariant("Nop").getDiscriminant());
            assertEquals("OP_ADD", tag.findVariant("Add").getConstantName());
            assertEquals("OpKind", tag.getKindEnumName());
        }

        @Test
        @DisplayName("显式值之后自动值继续递增")
        void testExplicit() {
            compile(TestTrees.unit("{'module':'m','decls':[{'kind':'tag','name':'E','variants':["
                    + "{'name':'A'},{'name':'B','value':10},{'name':'C'}]}]}"));
            TagLayout tag = ctx.getLayouts().getTagLayout("E");
            assertEquals(0, tag.findVariant("A").getDiscriminant());
            assertEquals(10, tag.findVariant("B").getDiscriminant());
            assertEquals(11, tag.findVariant("C").getDiscriminant());
            assertFalse(tag.hasUnion());
        }

        @Test
        @DisplayName("重复的判别值")
        void testDuplicate() {
            CompileException e = failure(TestTrees.unit("{'module':'m','decls':[{'kind':'tag','name':'E','variants':["
                    + "{'name':'A'},{'name':'B','value':0}]}]}"), ErrorKind.DUPLICATE_DISCRIMINANT);
            assertEquals("E.B", e.getError().getSymbol());
        }

        @Test
        @DisplayName("多次编译得到相同的判别值")
        void testStable() {
            ModuleUnit unit = TestTrees.unit("{'module':'m','decls':[" + OP + "]}");
            compile(unit);
            TagLayout first = ctx.getLayouts().getTagLayout("Op");
            compile(unit);
            TagLayout second = ctx.getLayouts().getTagLayout("Op");
            for (VariantLayout v : first.getVariants()) {
                assertEquals(v.getDiscriminant(), second.findVariant(v.getName()).getDiscriminant());
            }
        }

        @Test
        @DisplayName("负载存储方式与访问路径")
        void testStorage() {
            compile(TestTrees.unit("{'module':'m','decls':[" + OP + "]}"));
            TagLayout tag = ctx.getLayouts().getTagLayout("Op");
            assertEquals(VariantLayout.Storage.STRUCT, tag.findVariant("Add").getStorage());
            assertEquals(VariantLayout.Storage.SINGLE, tag.findVariant("Neg").getStorage());
            assertEquals(VariantLayout.Storage.NONE, tag.findVariant("Nop").getStorage());
            assertEquals("as.Add.b", tag.findVariant("Add").accessPath(1));
            assertEquals("as.Neg", tag.findVariant("Neg").accessPath(0));
            assertTrue(tag.hasUnion());
        }
    }

    // ================================================================
    // 尺寸分类
    // ================================================================

    @Nested
    @DisplayName("尺寸分类")
    class SizeTests {

        private TypeLayout layoutOf(String typeDecl, String name) {
            compile(TestTrees.unit("{'module':'m','decls':[" + typeDecl + "]}"));
            return ctx.getLayouts().getTypeLayout(name);
        }

        @Test
        @DisplayName("16 字节以内为 SMALL")
        void testSmall() {
            TypeLayout layout = layoutOf("{'kind':'type','name':'P','fields':[{'name':'a','type':'long'},"
                    + "{'name':'b','type':'long'}]}", "P");
            assertEquals(16, layout.getSize());
            assertEquals(SizeClass.SMALL, layout.getSizeClass());
        }

        @Test
        @DisplayName("超过 16 字节为 LARGE")
        void testLarge() {
            TypeLayout layout = layoutOf("{'kind':'type','name':'P','fields':[{'name':'a','type':'long'},"
                    + "{'name':'b','type':'long'},{'name':'c','type':'char'}]}", "P");
            assertEquals(24, layout.getSize());
            assertEquals(SizeClass.LARGE, layout.getSizeClass());
        }

        @Test
        @DisplayName("字段按自然对齐排布")
        void testAlignment() {
            TypeLayout layout = layoutOf("{'kind':'type','name':'P','fields':[{'name':'c','type':'char'},"
                    + "{'name':'i','type':'int'},{'name':'b','type':'bool'}]}", "P");
            assertEquals(12, layout.getSize());
            assertEquals(4, layout.getAlignment());
        }

        @Test
        @DisplayName("和类型尺寸为判别字段加最大负载")
        void testTagSize() {
            TypeLayout layout = layoutOf(OP, "Op");
            assertEquals(12, layout.getSize());
            assertEquals(SizeClass.SMALL, layout.getSizeClass());
        }

        @Test
        @DisplayName("堆类型及包含堆类型的聚合为 HEAP")
        void testHeap() {
            compile(TestTrees.unit("{'module':'m','decls':[{'kind':'type','name':'Buf','heap':true,"
                    + "'fields':[{'name':'data','type':'*byte'}]},"
                    + "{'kind':'type','name':'Holder','fields':[{'name':'b','type':'Buf'}]}]}"));
            assertEquals(SizeClass.HEAP, ctx.getLayouts().getTypeLayout("Buf").getSizeClass());
            assertEquals(SizeClass.HEAP, ctx.getLayouts().getTypeLayout("Holder").getSizeClass());
        }

        @Test
        @DisplayName("尺寸未知的类型按 LARGE 处理")
        void testUnknown() {
            compile(TestTrees.unit("{'module':'m','decls':[{'kind':'type','name':'Handle','opaque':true},"
                    + "{'kind':'type','name':'Wrapper','fields':[{'name':'h','type':'Handle'}]}]}"));
            LayoutTable layouts = ctx.getLayouts();
            assertNull(layouts.getTypeLayout("Handle"));
            assertEquals(SizeClass.LARGE, layouts.sizeClassOf(new NamedType("Handle")));
            assertFalse(layouts.getTypeLayout("Wrapper").isKnown());
            assertEquals(SizeClass.LARGE, layouts.getTypeLayout("Wrapper").getSizeClass());
        }

        @Test
        @DisplayName("小聚合上限可配置")
        void testLimitOption() {
            ModuleUnit unit = TestTrees.unit("{'module':'m','decls':[{'kind':'type','name':'P',"
                    + "'fields':[{'name':'a','type':'long'},{'name':'b','type':'long'}]}]}");
            ctx = TestTrees.context("m");
            ctx.getOptions().setSmallAggregateLimit(8);
            new AdtLayoutCompiler().run(new Monomorphizer().run(unit, ctx), ctx);
            assertEquals(SizeClass.LARGE, ctx.getLayouts().getTypeLayout("P").getSizeClass());
        }

        @Test
        @DisplayName("按值包含自身")
        void testRecursive() {
            CompileException e = failure(TestTrees.unit("{'module':'m','decls':["
                    + "{'kind':'type','name':'A','fields':[{'name':'b','type':'B'}]},"
                    + "{'kind':'type','name':'B','fields':[{'name':'a','type':'A'}]}]}"), ErrorKind.RECURSIVE_LAYOUT);
            assertTrue(e.getMessage().contains("A -> B -> A"), e.getMessage());
        }

        @Test
        @DisplayName("经由指针的自引用不算递归")
        void testPointerRecursion() {
            TypeLayout layout = layoutOf("{'kind':'type','name':'Node','fields':[{'name':'v','type':'int'},"
                    + "{'name':'next','type':'*Node'}]}", "Node");
            assertEquals(16, layout.getSize());
        }
    }

    // ================================================================
    // match 分派
    // ================================================================

    @Nested
    @DisplayName("match 分派")
    class MatchTests {

        @Test
        @DisplayName("覆盖全部变体的 match 用 switch 分派")
        void testExhaustive() {
            compile(TestTrees.function(OP_PARAM, match(TARGET,
                    arm(variant("Add", "a", "b"), ""),
                    arm(variant("Neg", "v"), ""),
                    arm(variant("Nop"), "")), OP));
            DispatchPlan plan = ctx.getLayouts().getPlan((MatchStmt) firstStatement());
            assertNotNull(plan);
            assertEquals(DispatchPlan.Form.SWITCH, plan.getForm());
            assertTrue(plan.isTagDispatch());
            assertEquals(3, plan.getCases().size());
            List<DispatchPlan.Binding> add = plan.getCases().get(0).getBindings();
            assertEquals("as.Add.a", add.get(0).getAccessPath());
            assertEquals("as.Add.b", add.get(1).getAccessPath());
            assertEquals("as.Neg", plan.getCases().get(1).getBindings().get(0).getAccessPath());
        }

        @Test
        @DisplayName("下划线跳过负载字段")
        void testSkipBinding() {
            compile(TestTrees.function(OP_PARAM, match(TARGET,
                    arm(variant("Add", "_", "b"), ""),
                    arm(WILDCARD, "")), OP));
            DispatchPlan plan = ctx.getLayouts().getPlan((MatchStmt) firstStatement());
            List<DispatchPlan.Binding> bindings = plan.getCases().get(0).getBindings();
            assertEquals(1, bindings.size());
            assertEquals("b", bindings.get(0).getName());
            assertTrue(plan.getCases().get(1).isCatchAll());
        }

        @Test
        @DisplayName("缺少变体且无通配分支")
        void testNonExhaustive() {
            CompileException e = failure(TestTrees.function(OP_PARAM, match(TARGET,
                    arm(variant("Add", "a", "b"), ""),
                    arm(variant("Neg", "v"), "")), OP), ErrorKind.NON_EXHAUSTIVE_MATCH);
            assertTrue(e.getMessage().contains("Nop"));
            assertEquals(7, e.getError().getLocation().getLine());
        }

        @Test
        @DisplayName("通配分支之后的分支不可达")
        void testUnreachable() {
            failure(TestTrees.function(OP_PARAM, match(TARGET,
                    arm(WILDCARD, ""),
                    arm(variant("Nop"), "")), OP), ErrorKind.INVALID_PATTERN);
        }

        @Test
        @DisplayName("不存在的变体")
        void testUnknownVariant() {
            failure(TestTrees.function(OP_PARAM, match(TARGET,
                    arm(variant("Mul", "a"), ""),
                    arm(WILDCARD, "")), OP), ErrorKind.INVALID_PATTERN);
        }

        @Test
        @DisplayName("同一变体匹配两次")
        void testDuplicateArm() {
            failure(TestTrees.function(OP_PARAM, match(TARGET,
                    arm(variant("Nop"), ""),
                    arm(variant("Nop"), ""),
                    arm(WILDCARD, "")), OP), ErrorKind.INVALID_PATTERN);
        }

        @Test
        @DisplayName("绑定个数超过负载字段")
        void testTooManyBindings() {
            failure(TestTrees.function(OP_PARAM, match(TARGET,
                    arm(variant("Neg", "x", "y"), ""),
                    arm(WILDCARD, "")), OP), ErrorKind.INVALID_PATTERN);
        }

        @Test
        @DisplayName("标量 match 不要求穷尽")
        void testScalar() {
            compile(TestTrees.function("{'name':'n','type':'int'}", match("{'expr':'ident','name':'n','type':'int'}",
                    arm(literal("int", "1"), ""),
                    arm(literal("int", "2"), "")), ""));
            DispatchPlan plan = ctx.getLayouts().getPlan((MatchStmt) firstStatement());
            assertFalse(plan.isTagDispatch());
            assertEquals(2, plan.getCases().size());
        }

        @Test
        @DisplayName("不同写法的相同整数值视为重复分支")
        void testDuplicateLiteralValue() {
            failure(TestTrees.function("{'name':'n','type':'int'}", match("{'expr':'ident','name':'n','type':'int'}",
                    arm(literal("int", "1"), ""),
                    arm(literal("int", "0x1"), "")), ""), ErrorKind.INVALID_PATTERN);
            failure(TestTrees.function("{'name':'c','type':'char'}", match("{'expr':'ident','name':'c','type':'char'}",
                    arm(literal("char", "a"), ""),
                    arm(literal("int", "97"), "")), ""), ErrorKind.INVALID_PATTERN);
        }

        @Test
        @DisplayName("八进制与二进制字面量按 C 规则求值")
        void testLiteralRadix() {
            compile(TestTrees.function("{'name':'n','type':'int'}", match("{'expr':'ident','name':'n','type':'int'}",
                    arm(literal("int", "010"), ""),
                    arm(literal("int", "10"), ""),
                    arm(literal("int", "0b11"), ""),
                    arm(literal("int", "7u"), "")), ""));
            assertEquals(4, ctx.getLayouts().getPlan((MatchStmt) firstStatement()).getCases().size());
        }

        @Test
        @DisplayName("浮点目标不能用字面量模式")
        void testFloatLiteral() {
            failure(TestTrees.function("{'name':'d','type':'double'}", match("{'expr':'ident','name':'d','type':'double'}",
                    arm(literal("float", "1.0"), ""),
                    arm(WILDCARD, "")), ""), ErrorKind.INVALID_PATTERN);
        }

        @Test
        @DisplayName("分支中跳出外层循环时改用 if 链")
        void testIfChain() {
            compile(TestTrees.function(OP_PARAM, "{'stmt':'loop','body':[" + match(TARGET,
                    arm(variant("Nop"), "{'stmt':'break'}"),
                    arm(WILDCARD, "{'stmt':'continue'}")) + "]}", OP));
            MatchStmt match = (MatchStmt) ((LoopStmt) firstStatement()).getBody().getStatements().get(0);
            assertEquals(DispatchPlan.Form.IF_CHAIN, ctx.getLayouts().getPlan(match).getForm());
        }

        @Test
        @DisplayName("嵌套循环内的 break 不影响分派方式")
        void testNestedLoopBreak() {
            compile(TestTrees.function(OP_PARAM, match(TARGET,
                    arm(variant("Nop"), "{'stmt':'loop','body':[{'stmt':'break'}]}"),
                    arm(WILDCARD, "")), OP));
            assertEquals(DispatchPlan.Form.SWITCH, ctx.getLayouts().getPlan((MatchStmt) firstStatement()).getForm());
        }
    }
}
