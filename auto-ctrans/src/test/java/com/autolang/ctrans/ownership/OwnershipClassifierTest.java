package com.autolang.ctrans.ownership;

import com.autolang.ctrans.CompilationContext;
import com.autolang.ctrans.TestTrees;
import com.autolang.ctrans.assemble.DirectoryFragmentSource;
import com.autolang.ctrans.assemble.FragmentAssembler;
import com.autolang.ctrans.error.CompileException;
import com.autolang.ctrans.error.ErrorKind;
import com.autolang.ctrans.layout.AdtLayoutCompiler;
import com.autolang.ctrans.mono.Monomorphizer;
import com.autolang.ctrans.mono.ResolvedModule;
import com.autolang.tree.module.ModuleUnit;
import com.autolang.tree.module.Scenario;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OwnershipClassifier 单元测试
 */
class OwnershipClassifierTest {

    private static final String SMALL = "{'kind':'type','name':'P','fields':[{'name':'x','type':'int'},{'name':'y','type':'int'}],"
            + "'methods':[{'name':'shift','mut':true,'params':[{'name':'d','type':'int'}],'body':[]},"
            + "{'name':'sum','returns':'int','body':[{'stmt':'return','value':{'expr':'selfField','field':'x','type':'int'}}]},"
            + "{'name':'origin','static':true,'returns':'P','body':[{'stmt':'return','value':"
            + "{'expr':'struct','type':'P','fields':{}}}]}]}";
    private static final String BIG = "{'kind':'type','name':'Big','fields':[{'name':'a','type':'long'},"
            + "{'name':'b','type':'long'},{'name':'c','type':'long'}]}";
    private static final String HEAP = "{'kind':'type','name':'Buf','heap':true,'fields':[{'name':'n','type':'int'}]}";

    private CompilationContext ctx;

    private ResolvedModule classify(ModuleUnit unit) {
        ctx = TestTrees.context(unit.getName());
        ResolvedModule resolved = new Monomorphizer().run(unit, ctx);
        resolved = new AdtLayoutCompiler().run(resolved, ctx);
        return new OwnershipClassifier().run(resolved, ctx);
    }

    private CompileException violation(ModuleUnit unit) {
        CompileException e = assertThrows(CompileException.class, () -> classify(unit));
        assertEquals(ErrorKind.OWNERSHIP_VIOLATION, e.getKind(), e.getMessage());
        return e;
    }

    private PassingStrategy strategyOf(String type, String intent) {
        String param = "{'name':'p','type':'" + type + "'" + (intent != null ? ",'intent':'" + intent + "'" : "") + "}";
        classify(TestTrees.function(param, "", SMALL + "," + BIG + "," + HEAP));
        return ctx.getBindings().forFunction("f").getParam(0).getStrategy();
    }

    private static String ident(String name, String type) {
        return "{'expr':'ident','name':'" + name + "','type':'" + type + "'}";
    }

    private static String let(String name, String type, boolean mutable, String init) {
        return "{'stmt':'let','name':'" + name + "','type':'" + type + "','mut':" + mutable + ",'init':" + init + "}";
    }

    private static String assign(String target, String value) {
        return "{'stmt':'expr','value':{'expr':'assign','target':" + target + ",'value':" + value + "}}";
    }

    private static final String ONE = "{'expr':'lit','kind':'int','value':'1'}";
    private static final String NEW_P = "{'expr':'struct','type':'P','fields':{'x':" + ONE + ",'y':" + ONE + "}}";

    private static String shift(String receiver) {
        return "{'stmt':'expr','value':{'expr':'method','owner':'P','method':'shift','receiver':" + receiver
                + ",'args':[" + ONE + "]}}";
    }

    // ================================================================
    // 决策表
    // ================================================================

    @Nested
    @DisplayName("决策表")
    class DecisionTableTests {

        @Test
        @DisplayName("小标量与小聚合只读时按值")
        void testSmallRead() {
            assertEquals(PassingStrategy.COPY, strategyOf("int", null));
            assertEquals(PassingStrategy.COPY, strategyOf("P", "read"));
        }

        @Test
        @DisplayName("大聚合与堆类型只读时按常量引用")
        void testLargeRead() {
            assertEquals(PassingStrategy.REF_IMMUTABLE, strategyOf("Big", null));
            assertEquals(PassingStrategy.REF_IMMUTABLE, strategyOf("Buf", null));
            assertEquals(PassingStrategy.REF_IMMUTABLE, strategyOf("[4]int", null));
        }

        @Test
        @DisplayName("MUTATE 按可变引用")
        void testMutate() {
            assertEquals(PassingStrategy.REF_MUTABLE, strategyOf("P", "mutate"));
            assertEquals(PassingStrategy.REF_MUTABLE, strategyOf("int", "mutate"));
        }

        @Test
        @DisplayName("MOVE 一律按值")
        void testMove() {
            assertEquals(PassingStrategy.COPY, strategyOf("Big", "move"));
            assertEquals(PassingStrategy.COPY, strategyOf("P", "move"));
        }

        @Test
        @DisplayName("指针类型保持指针")
        void testPointer() {
            assertEquals(PassingStrategy.POINTER, strategyOf("*int", null));
            assertEquals(PassingStrategy.POINTER, strategyOf("*Big", "mutate"));
        }

        @Test
        @DisplayName("底层函数的 ADDRESS 参数")
        void testAddress() {
            classify(TestTrees.unit("{'module':'m','decls':[{'kind':'fn','name':'raw','lowLevel':true,"
                    + "'params':[{'name':'n','type':'int','intent':'address'}],'body':[]}]}"));
            ParamBinding binding = ctx.getBindings().forFunction("raw").getParam(0);
            assertEquals(PassingStrategy.POINTER, binding.getStrategy());
            assertTrue(binding.isIndirect());
        }

        @Test
        @DisplayName("返回槽按值，指针除外")
        void testReturnSlot() {
            classify(TestTrees.unit("{'module':'m','decls':[" + BIG + ","
                    + "{'kind':'fn','name':'make','returns':'Big'},"
                    + "{'kind':'fn','name':'ref','returns':'*Big'}]}"));
            assertEquals(PassingStrategy.COPY, ctx.getBindings().forFunction("make").getReturnSlot().getStrategy());
            assertEquals(PassingStrategy.POINTER, ctx.getBindings().forFunction("ref").getReturnSlot().getStrategy());
        }

        @Test
        @DisplayName("接收者按方法是否修改分类")
        void testReceiver() {
            classify(TestTrees.unit("{'module':'m','decls':[" + SMALL + "]}"));
            BindingTable bindings = ctx.getBindings();
            assertEquals(PassingStrategy.REF_MUTABLE, bindings.forMethod("P", "shift").getReceiver().getStrategy());
            assertEquals(PassingStrategy.REF_IMMUTABLE, bindings.forMethod("P", "sum").getReceiver().getStrategy());
            assertNull(bindings.forMethod("P", "origin").getReceiver());
        }

        @Test
        @DisplayName("每个函数和方法都附加了绑定")
        void testTotal() throws IOException {
            ModuleUnit unit = new FragmentAssembler(new DirectoryFragmentSource(TestTrees.resourceDir("fragments")))
                    .assemble("geometry", Scenario.STATIC_C);
            classify(unit);
            BindingTable bindings = ctx.getBindings();
            assertEquals(5, bindings.getAll().size());
            assertNotNull(bindings.forMethod("Point", "norm1"));
            assertNotNull(bindings.forMethod("Point", "shift"));
            assertEquals(PassingStrategy.REF_IMMUTABLE, bindings.forFunction("area").getParam(0).getStrategy());
            assertEquals(PassingStrategy.COPY, bindings.forFunction("printf").getParam(1).getStrategy());
            assertEquals(0, bindings.forFunction("main").getParams().size());
        }
    }

    // ================================================================
    // 违规检查
    // ================================================================

    @Nested
    @DisplayName("违规检查")
    class ViolationTests {

        @Test
        @DisplayName("对不可变绑定调用修改接收者的方法")
        void testMutatingCallOnImmutable() {
            CompileException e = violation(TestTrees.function("",
                    let("p", "P", false, NEW_P) + "," + shift(ident("p", "P")), SMALL));
            assertEquals("p", e.getError().getSymbol());
        }

        @Test
        @DisplayName("可变绑定可以调用修改接收者的方法")
        void testMutatingCallOnMutable() {
            assertDoesNotThrow(() -> classify(TestTrees.function("",
                    let("p", "P", true, NEW_P) + "," + shift(ident("p", "P")), SMALL)));
        }

        @Test
        @DisplayName("对只读参数赋值")
        void testAssignReadParam() {
            violation(TestTrees.function("{'name':'n','type':'int'}", assign(ident("n", "int"), ONE), ""));
        }

        @Test
        @DisplayName("MUTATE 参数可以赋值")
        void testAssignMutateParam() {
            assertDoesNotThrow(() -> classify(TestTrees.function("{'name':'n','type':'int','intent':'mutate'}",
                    assign(ident("n", "int"), ONE), "")));
        }

        @Test
        @DisplayName("不可变绑定的字段同样不可赋值")
        void testAssignField() {
            violation(TestTrees.function("", let("p", "P", false, NEW_P) + ","
                    + assign("{'expr':'field','type':'int','field':'x','target':" + ident("p", "P") + "}", ONE), SMALL));
        }

        @Test
        @DisplayName("经由指针的写入不受绑定可变性限制")
        void testAssignThroughPointer() {
            assertDoesNotThrow(() -> classify(TestTrees.function("{'name':'q','type':'*P'}",
                    assign("{'expr':'field','type':'int','field':'x','target':" + ident("q", "*P") + "}", ONE), SMALL)));
        }

        @Test
        @DisplayName("经由指针调用修改接收者的方法")
        void testMutatingCallThroughPointer() {
            assertDoesNotThrow(() -> classify(TestTrees.function("{'name':'q','type':'*P'}",
                    shift(ident("q", "*P")), SMALL)));
        }

        @Test
        @DisplayName("指针绑定本身仍不可重新赋值")
        void testReassignPointerBinding() {
            CompileException e = violation(TestTrees.function("{'name':'q','type':'*P'}",
                    assign(ident("q", "*P"), "{'expr':'lit','kind':'null','value':'null','type':'*P'}"), SMALL));
            assertEquals("q", e.getError().getSymbol());
        }

        @Test
        @DisplayName("把不可变绑定传给 MUTATE 参数")
        void testPassToMutate() {
            violation(TestTrees.function("", let("p", "P", false, NEW_P) + ","
                            + "{'stmt':'expr','value':{'expr':'call','callee':'bump','args':[" + ident("p", "P") + "]}}",
                    SMALL + ",{'kind':'fn','name':'bump','params':[{'name':'t','type':'P','intent':'mutate'}],'body':[]}"));
        }

        @Test
        @DisplayName("非 mut 方法中修改 self 字段")
        void testSelfFieldInReadMethod() {
            violation(TestTrees.unit("{'module':'m','decls':[{'kind':'type','name':'C',"
                    + "'fields':[{'name':'n','type':'int'}],'methods':[{'name':'reset','body':["
                    + assign("{'expr':'selfField','field':'n','type':'int'}", ONE) + "]}]}]}"));
        }

        @Test
        @DisplayName("match 绑定不可赋值")
        void testPatternBinding() {
            violation(TestTrees.function("{'name':'k','type':'int'}", "{'stmt':'match','target':" + ident("k", "int")
                    + ",'arms':[{'pattern':{'pattern':'wildcard','binding':'v'},'body':["
                    + assign(ident("v", "int"), ONE) + "]}]}", ""));
        }

        @Test
        @DisplayName("底层代码块之外取地址")
        void testAddressOutsideLowLevel() {
            violation(TestTrees.function("", let("n", "int", true, ONE) + ","
                    + let("q", "*int", false, "{'expr':'addr','operand':" + ident("n", "int") + "}"), ""));
        }

        @Test
        @DisplayName("底层代码块内可以取地址")
        void testAddressInsideLowLevel() {
            assertDoesNotThrow(() -> classify(TestTrees.function("", let("n", "int", true, ONE) + ","
                    + "{'stmt':'lowlevel','body':[" + let("q", "*int", false,
                    "{'expr':'addr','operand':" + ident("n", "int") + "}") + "]}", "")));
        }

        @Test
        @DisplayName("非底层函数声明 ADDRESS 参数")
        void testAddressParam() {
            CompileException e = violation(TestTrees.function("{'name':'n','type':'int','intent':'address'}", "", ""));
            assertEquals("f(n)", e.getError().getSymbol());
        }
    }
}
