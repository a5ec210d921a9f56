package com.autolang.ctrans.lowering;

import com.autolang.ctrans.CompilationContext;
import com.autolang.ctrans.TestTrees;
import com.autolang.ctrans.TransOptions;
import com.autolang.ctrans.assemble.DirectoryFragmentSource;
import com.autolang.ctrans.assemble.FragmentAssembler;
import com.autolang.ctrans.emit.EmittedSymbol;
import com.autolang.ctrans.error.CompileException;
import com.autolang.ctrans.error.ErrorKind;
import com.autolang.ctrans.ownership.PassingStrategy;
import com.autolang.ctrans.pass.TransPipeline;
import com.autolang.tree.expr.*;
import com.autolang.tree.module.ModuleUnit;
import com.autolang.tree.module.Scenario;
import com.autolang.tree.stmt.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MethodLowering 与 BodyLowering 单元测试
 */
class MethodLoweringTest {

    private static final String BIG = "{'kind':'type','name':'Big','fields':[{'name':'a','type':'long'},"
            + "{'name':'b','type':'long'},{'name':'c','type':'long'}],"
            + "'methods':[{'name':'total','returns':'long','body':[{'stmt':'return','value':"
            + "{'expr':'selfField','field':'a','type':'long'}}]}]}";
    private static final String MAKE = "{'kind':'fn','name':'make','returns':'Big'}";
    private static final String USE = "{'kind':'fn','name':'use','returns':'bool','params':[{'name':'b','type':'Big'}]}";
    private static final String MAKE_CALL = "{'expr':'call','callee':'make','type':'Big'}";

    private CompilationContext ctx;

    private LoweredModule lower(ModuleUnit unit) {
        TransPipeline pipeline = new TransPipeline(new TransOptions());
        ctx = pipeline.newContext(unit.getName());
        return pipeline.executeToLowered(unit, ctx);
    }

    private static LoweredFunction function(LoweredModule module, String name) {
        for (LoweredFunction fn : module.getFunctions()) {
            if (fn.getCName().equals(name)) return fn;
        }
        throw new AssertionError("No function " + name);
    }

    private static List<Statement> bodyOf(LoweredModule module, String name) {
        return function(module, name).getBody().getStatements();
    }

    private static String useCall(String arg) {
        return "{'expr':'call','callee':'use','type':'bool','args':[" + arg + "]}";
    }

    // ================================================================
    // 方法变成自由函数
    // ================================================================

    @Nested
    @DisplayName("方法降级")
    class MethodTests {

        @Test
        @DisplayName("名字为类型名加方法名")
        void testMangle() {
            assertEquals("List_int_push", MethodLowering.mangle("List_int", "push"));
        }

        @Test
        @DisplayName("geometry 模块的函数列表")
        void testGeometry() throws IOException {
            ModuleUnit unit = new FragmentAssembler(new DirectoryFragmentSource(TestTrees.resourceDir("fragments")))
                    .assemble("geometry", Scenario.STATIC_C);
            LoweredModule module = lower(unit);

            assertEquals(5, module.getFunctions().size());
            assertEquals("Point_norm1", module.getFunctions().get(0).getCName());

            LoweredFunction shift = function(module, "Point_shift");
            assertEquals("self", shift.getBindings().getReceiver().getName());
            assertEquals(PassingStrategy.REF_MUTABLE, shift.getBindings().getReceiver().getStrategy());
            assertEquals("method Point.shift", shift.getOrigin());

            LoweredFunction printf = function(module, "printf");
            assertTrue(printf.isExternal());
            assertEquals("stdio.h", printf.getHeader());
            assertTrue(function(module, "main").isMain());

            assertNotNull(ctx.getSymbols().lookup("Point_shift", EmittedSymbol.Kind.FUNCTION));
        }

        @Test
        @DisplayName("字段简写改写为 self 字段访问")
        void testSelfField() {
            LoweredModule module = lower(TestTrees.unit("{'module':'m','decls':[" + BIG + "]}"));
            ReturnStmt ret = (ReturnStmt) bodyOf(module, "Big_total").get(0);
            FieldAccess access = (FieldAccess) ret.getValue();
            assertEquals("a", access.getField());
            assertTrue(access.getTarget() instanceof SelfExpr);
        }

        @Test
        @DisplayName("方法名与自由函数重名")
        void testCollision() {
            CompileException e = assertThrows(CompileException.class, () -> lower(TestTrees.unit(
                    "{'module':'m','decls':[" + BIG + ",{'kind':'fn','name':'Big_total','returns':'long'}]}")));
            assertEquals(ErrorKind.SYMBOL_COLLISION, e.getKind());
            assertTrue(e.getMessage().contains("method Big.total"), e.getMessage());
        }
    }

    // ================================================================
    // 临时值提升
    // ================================================================

    @Nested
    @DisplayName("临时值提升")
    class HoistTests {

        @Test
        @DisplayName("按引用传递的临时值提升为局部变量")
        void testHoistArgument() {
            LoweredModule module = lower(TestTrees.function("",
                    "{'stmt':'expr','value':" + useCall(MAKE_CALL) + "}", BIG + "," + MAKE + "," + USE));
            List<Statement> body = bodyOf(module, "f");
            assertEquals(2, body.size());

            LetStmt temp = (LetStmt) body.get(0);
            assertEquals("_tmp0", temp.getName());
            assertTrue(temp.isMutable());
            assertTrue(temp.getInitializer() instanceof CallExpr);

            CallExpr call = (CallExpr) ((ExprStmt) body.get(1)).getExpression();
            assertEquals("_tmp0", ((Identifier) call.getArgs().get(0)).getName());
        }

        @Test
        @DisplayName("按值传递的实参不提升")
        void testNoHoistForCopy() {
            LoweredModule module = lower(TestTrees.function("",
                    "{'stmt':'expr','value':{'expr':'call','callee':'g','args':["
                            + "{'expr':'call','callee':'h','type':'int'}]}}",
                    "{'kind':'fn','name':'g','params':[{'name':'n','type':'int'}]},{'kind':'fn','name':'h','returns':'int'}"));
            assertEquals(1, bodyOf(module, "f").size());
        }

        @Test
        @DisplayName("非位置接收者提升")
        void testHoistReceiver() {
            LoweredModule module = lower(TestTrees.function("",
                    "{'stmt':'return','value':{'expr':'method','owner':'Big','method':'total','type':'long',"
                            + "'receiver':" + MAKE_CALL + "}}", BIG + "," + MAKE));
            List<Statement> body = bodyOf(module, "f");
            assertEquals(2, body.size());
            MethodCallExpr call = (MethodCallExpr) ((ReturnStmt) body.get(1)).getValue();
            assertEquals("_tmp0", ((Identifier) call.getReceiver()).getName());
        }

        @Test
        @DisplayName("需要提升的 while 条件改写为 loop")
        void testWhileRewrite() {
            LoweredModule module = lower(TestTrees.function("",
                    "{'stmt':'while','cond':" + useCall(MAKE_CALL) + ",'body':[{'stmt':'continue'}]}",
                    BIG + "," + MAKE + "," + USE));
            List<Statement> body = bodyOf(module, "f");
            assertEquals(1, body.size());
            LoopStmt loop = (LoopStmt) body.get(0);
            List<Statement> inner = loop.getBody().getStatements();
            assertEquals(3, inner.size());
            assertTrue(inner.get(0) instanceof LetStmt);
            IfStmt exit = (IfStmt) inner.get(1);
            assertEquals(UnaryExpr.Operator.NOT, ((UnaryExpr) exit.getCondition()).getOperator());
            assertTrue(exit.getThenBranch().getStatements().get(0) instanceof BreakStmt);
            assertTrue(inner.get(2) instanceof ContinueStmt);
        }

        @Test
        @DisplayName("不需要提升的 while 保持不变")
        void testPlainWhile() {
            LoweredModule module = lower(TestTrees.function("{'name':'k','type':'bool'}",
                    "{'stmt':'while','cond':{'expr':'ident','name':'k','type':'bool'},'body':[{'stmt':'break'}]}", ""));
            assertTrue(bodyOf(module, "f").get(0) instanceof WhileStmt);
        }

        @Test
        @DisplayName("for 上界只求值一次")
        void testForBound() {
            LoweredModule module = lower(TestTrees.function("",
                    "{'stmt':'for','var':'i','from':{'expr':'lit','kind':'int','value':'0'},"
                            + "'to':{'expr':'call','callee':'count','type':'int'},'body':[]}",
                    "{'kind':'fn','name':'count','returns':'int'}"));
            List<Statement> body = bodyOf(module, "f");
            assertEquals(2, body.size());
            ForRangeStmt loop = (ForRangeStmt) body.get(1);
            assertEquals("_tmp0", ((Identifier) loop.getTo()).getName());
        }

        @Test
        @DisplayName("非位置 match 目标提升后分派方案随之转移")
        void testMatchTarget() {
            String tag = "{'kind':'tag','name':'Flag','variants':[{'name':'On'},{'name':'Off'}]}";
            LoweredModule module = lower(TestTrees.function("",
                    "{'stmt':'match','target':{'expr':'call','callee':'flag','type':'Flag'},'arms':["
                            + "{'pattern':{'pattern':'variant','name':'On'},'body':[]},"
                            + "{'pattern':{'pattern':'wildcard'},'body':[]}]}",
                    tag + ",{'kind':'fn','name':'flag','returns':'Flag'}"));
            List<Statement> body = bodyOf(module, "f");
            MatchStmt match = (MatchStmt) body.get(1);
            assertTrue(match.getTarget() instanceof Identifier);
            assertNotNull(ctx.getLayouts().getPlan(match));
        }

        @Test
        @DisplayName("&& 右侧的提升只在左侧成立时执行")
        void testShortCircuitAnd() {
            String cond = "{'expr':'binary','op':'&&','left':{'expr':'ident','name':'flag','type':'bool'},'right':"
                    + useCall(MAKE_CALL) + "}";
            LoweredModule module = lower(TestTrees.function("{'name':'flag','type':'bool'}",
                    "{'stmt':'if','cond':" + cond + ",'then':[{'stmt':'return'}]}", BIG + "," + MAKE + "," + USE));
            List<Statement> body = bodyOf(module, "f");
            assertEquals(3, body.size());

            LetStmt result = (LetStmt) body.get(0);
            assertEquals("_tmp1", result.getName());
            assertEquals("flag", ((Identifier) result.getInitializer()).getName());

            IfStmt guard = (IfStmt) body.get(1);
            assertEquals("_tmp1", ((Identifier) guard.getCondition()).getName());
            assertNull(guard.getElseBranch());
            List<Statement> branch = guard.getThenBranch().getStatements();
            assertEquals(2, branch.size());
            LetStmt made = (LetStmt) branch.get(0);
            assertEquals("_tmp0", made.getName());
            assertEquals("make", ((CallExpr) made.getInitializer()).getCallee());
            AssignExpr store = (AssignExpr) ((ExprStmt) branch.get(1)).getExpression();
            assertEquals("_tmp1", ((Identifier) store.getTarget()).getName());
            CallExpr use = (CallExpr) store.getValue();
            assertEquals("_tmp0", ((Identifier) use.getArgs().get(0)).getName());

            IfStmt original = (IfStmt) body.get(2);
            assertEquals("_tmp1", ((Identifier) original.getCondition()).getName());
        }

        @Test
        @DisplayName("|| 右侧的提升只在左侧不成立时执行")
        void testShortCircuitOr() {
            String cond = "{'expr':'binary','op':'||','left':{'expr':'ident','name':'flag','type':'bool'},'right':"
                    + useCall(MAKE_CALL) + "}";
            LoweredModule module = lower(TestTrees.function("{'name':'flag','type':'bool'}",
                    "{'stmt':'if','cond':" + cond + ",'then':[]}", BIG + "," + MAKE + "," + USE));
            IfStmt guard = (IfStmt) bodyOf(module, "f").get(1);
            UnaryExpr not = (UnaryExpr) guard.getCondition();
            assertEquals(UnaryExpr.Operator.NOT, not.getOperator());
            assertEquals("_tmp1", ((Identifier) not.getOperand()).getName());
        }

        @Test
        @DisplayName("while 条件中的短路提升进入 loop 内")
        void testShortCircuitInWhile() {
            String cond = "{'expr':'binary','op':'&&','left':{'expr':'ident','name':'flag','type':'bool'},'right':"
                    + useCall(MAKE_CALL) + "}";
            LoweredModule module = lower(TestTrees.function("{'name':'flag','type':'bool'}",
                    "{'stmt':'while','cond':" + cond + ",'body':[]}", BIG + "," + MAKE + "," + USE));
            List<Statement> body = bodyOf(module, "f");
            assertEquals(1, body.size());
            List<Statement> inner = ((LoopStmt) body.get(0)).getBody().getStatements();
            assertEquals(3, inner.size());
            assertTrue(inner.get(0) instanceof LetStmt);
            assertTrue(((IfStmt) inner.get(1)).getThenBranch().getStatements().get(0) instanceof LetStmt);
            IfStmt exit = (IfStmt) inner.get(2);
            assertTrue(exit.getThenBranch().getStatements().get(0) instanceof BreakStmt);
        }

        @Test
        @DisplayName("右侧无需提升的 && 保持原样")
        void testPlainAnd() {
            String cond = "{'expr':'binary','op':'&&','left':{'expr':'ident','name':'flag','type':'bool'},"
                    + "'right':{'expr':'ident','name':'flag','type':'bool'}}";
            LoweredModule module = lower(TestTrees.function("{'name':'flag','type':'bool'}",
                    "{'stmt':'if','cond':" + cond + ",'then':[]}", ""));
            List<Statement> body = bodyOf(module, "f");
            assertEquals(1, body.size());
            assertTrue(((IfStmt) body.get(0)).getCondition() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("临时变量编号在每个函数内独立")
        void testTempPerFunction() {
            String stmt = "{'stmt':'expr','value':" + useCall(MAKE_CALL) + "}";
            LoweredModule module = lower(TestTrees.unit("{'module':'m','decls':[" + BIG + "," + MAKE + "," + USE + ","
                    + "{'kind':'fn','name':'a','body':[" + stmt + "," + stmt + "]},"
                    + "{'kind':'fn','name':'b','body':[" + stmt + "]}]}"));
            List<Statement> a = bodyOf(module, "a");
            assertEquals("_tmp0", ((LetStmt) a.get(0)).getName());
            assertEquals("_tmp1", ((LetStmt) a.get(2)).getName());
            assertEquals("_tmp0", ((LetStmt) bodyOf(module, "b").get(0)).getName());
        }
    }
}
