package com.autolang.ctrans.batch;

import com.autolang.ctrans.AutoCTranspiler;
import com.autolang.ctrans.TestTrees;
import com.autolang.ctrans.TransOptions;
import com.autolang.ctrans.assemble.InMemoryFragmentSource;
import com.autolang.ctrans.error.CompileError;
import com.autolang.ctrans.error.ErrorKind;
import com.autolang.tree.module.Scenario;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ModuleBatch 单元测试
 */
class ModuleBatchTest {

    private InMemoryFragmentSource source;

    @BeforeEach
    void setUp() {
        source = new InMemoryFragmentSource();
    }

    private void module(String name, String uses, String decls) {
        source.add(TestTrees.fragment("{'module':'" + name + "','uses':[" + uses + "],'decls':[" + decls + "]}"));
    }

    private BatchResult run(int threads, String... modules) {
        AutoCTranspiler transpiler = new AutoCTranspiler(source, new TransOptions());
        return new ModuleBatch(transpiler, threads).run(Arrays.asList(modules), Scenario.STATIC_C);
    }

    private static final String OK_FN = "{'kind':'fn','name':'ok','body':[]}";
    private static final String BROKEN_FN = "{'kind':'fn','name':'bad','body':[{'stmt':'let','name':'x','type':'Ghost<int>'}]}";

    @Test
    @DisplayName("依赖顺序编译全部模块")
    void testAllSucceed() {
        module("base", "", "{'kind':'type','name':'Id','fields':[{'name':'v','type':'int'}]}");
        module("app", "'base'", OK_FN);
        module("tool", "'base','app'", OK_FN);
        BatchResult result = run(4, "tool", "app", "base");

        assertTrue(result.isSuccess(), result.toString());
        assertEquals(Arrays.asList("app", "base", "tool"), new ArrayList<>(result.getOutputs().keySet()));
        assertTrue(result.getOutputs().get("tool").getHeader().contains("#include \"base.h\"\n#include \"app.h\""));
    }

    @Test
    @DisplayName("失败只影响依赖它的模块")
    void testFailurePropagation() {
        module("broken", "", BROKEN_FN);
        module("user", "'broken'", OK_FN);
        module("sibling", "", OK_FN);
        BatchResult result = run(2, "broken", "user", "sibling");

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.UNRESOLVED_GENERIC, result.getError("broken").getKind());
        CompileError dep = result.getError("user");
        assertEquals(ErrorKind.DEPENDENCY_FAILED, dep.getKind());
        assertEquals("broken", dep.getSymbol());
        assertTrue(result.getOutputs().containsKey("sibling"));
        assertNull(result.getError("sibling"));
    }

    @Test
    @DisplayName("模块互相依赖")
    void testCycle() {
        module("a", "'b'", OK_FN);
        module("b", "'a'", OK_FN);
        BatchResult result = run(2, "a", "b");

        assertEquals(ErrorKind.DEPENDENCY_FAILED, result.getError("a").getKind());
        assertEquals(ErrorKind.DEPENDENCY_FAILED, result.getError("b").getKind());
        assertTrue(result.getOutputs().isEmpty());
        assertTrue(result.getError("b").getMessage().contains("Cyclic"), result.getError("b").getMessage());
    }

    @Test
    @DisplayName("批外依赖视为已编译")
    void testExternalDependency() {
        module("app", "'prebuilt'", OK_FN);
        BatchResult result = run(1, "app");
        assertTrue(result.isSuccess(), result.toString());
    }

    @Test
    @DisplayName("找不到片段的模块")
    void testMissingModule() {
        module("app", "", OK_FN);
        BatchResult result = run(1, "app", "ghost");
        assertEquals(ErrorKind.MISSING_MODULE, result.getError("ghost").getKind());
        assertTrue(result.getOutputs().containsKey("app"));
    }

    private static final String BOX = "{'kind':'type','name':'Box','typeParams':['T'],'fields':[{'name':'value','type':'T'}]}";
    private static final String BIG = "{'kind':'type','name':'Big','fields':[{'name':'a','type':'long'},"
            + "{'name':'b','type':'long'},{'name':'c','type':'long'}]}";
    private static final String TAKE = "{'kind':'fn','name':'take','params':[{'name':'b','type':'Big'}],'body':[]}";
    private static final String ID = "{'kind':'fn','name':'id','typeParams':['T'],'params':[{'name':'x','type':'T'}],"
            + "'returns':'T','body':[{'stmt':'return','value':{'expr':'ident','name':'x','type':'T'}}]}";

    private static String letFn(String name, String type) {
        return "{'kind':'fn','name':'" + name + "','body':[{'stmt':'let','name':'v','type':'" + type + "'}]}";
    }

    @Test
    @DisplayName("依赖方用到的泛型实例由声明模块生成")
    void testCrossModuleInstance() {
        module("a", "", BOX + "," + BIG + "," + TAKE);
        module("b", "'a'", "{'kind':'fn','name':'run','body':["
                + "{'stmt':'let','name':'bx','type':'Box<int>'},"
                + "{'stmt':'let','name':'x','type':'Big'},"
                + "{'stmt':'expr','value':{'expr':'call','callee':'take','args':[{'expr':'ident','name':'x','type':'Big'}]}}]}");
        BatchResult result = run(2, "a", "b");

        assertTrue(result.isSuccess(), result.toString());
        String aHeader = result.getOutputs().get("a").getHeader();
        assertTrue(aHeader.contains("struct Box_int {"), aHeader);
        assertTrue(aHeader.contains("void take(const struct Big *b);"), aHeader);
        String bHeader = result.getOutputs().get("b").getHeader();
        assertFalse(bHeader.contains("struct Box_int {"), bHeader);
        String bSource = result.getOutputs().get("b").getSource();
        assertTrue(bSource.contains("struct Box_int bx;"), bSource);
        assertTrue(bSource.contains("take(&x);"), bSource);
    }

    @Test
    @DisplayName("多个依赖方请求同一实例只生成一次")
    void testSharedRequest() {
        module("a", "", BOX);
        module("b", "'a'", letFn("f", "Box<int>"));
        module("c", "'a'", letFn("g", "Box<int>") + "," + letFn("h", "Box<bool>"));
        BatchResult result = run(3, "a", "b", "c");

        assertTrue(result.isSuccess(), result.toString());
        String aHeader = result.getOutputs().get("a").getHeader();
        assertEquals(aHeader.indexOf("struct Box_int {"), aHeader.lastIndexOf("struct Box_int {"), aHeader);
        assertTrue(aHeader.contains("struct Box_bool {"), aHeader);
    }

    @Test
    @DisplayName("经过中间模块的请求传到声明模块")
    void testTransitiveRequest() {
        module("a", "", BOX);
        module("b", "'a'", letFn("f", "Box<Box<long>>"));
        module("c", "'b'", OK_FN);
        BatchResult result = run(2, "a", "b", "c");

        assertTrue(result.isSuccess(), result.toString());
        String aHeader = result.getOutputs().get("a").getHeader();
        assertTrue(aHeader.indexOf("struct Box_long {") < aHeader.indexOf("struct Box_Box_long {"), aHeader);
    }

    @Test
    @DisplayName("依赖方调用泛型函数")
    void testCrossModuleFunction() {
        module("a", "", ID);
        module("b", "'a'", "{'kind':'fn','name':'f','returns':'int','body':[{'stmt':'return','value':"
                + "{'expr':'call','callee':'id','typeArgs':['int'],'type':'int',"
                + "'args':[{'expr':'lit','kind':'int','value':'1'}]}}]}");
        BatchResult result = run(2, "a", "b");

        assertTrue(result.isSuccess(), result.toString());
        assertTrue(result.getOutputs().get("a").getHeader().contains("int id_int(int x);"),
                result.getOutputs().get("a").getHeader());
        assertTrue(result.getOutputs().get("b").getSource().contains("return id_int(1);"),
                result.getOutputs().get("b").getSource());
    }

    @Test
    @DisplayName("实参是依赖方自己的类型")
    void testRequestWithLocalType() {
        module("a", "", BOX);
        module("b", "'a'", "{'kind':'type','name':'Mine','fields':[{'name':'v','type':'int'}]}," + letFn("f", "Box<Mine>"));
        BatchResult result = run(2, "a", "b");

        CompileError error = result.getError("b");
        assertEquals(ErrorKind.UNRESOLVED_GENERIC, error.getKind());
        assertTrue(error.getMessage().contains("Mine"), error.getMessage());
        assertTrue(result.getOutputs().containsKey("a"));
    }

    @Test
    @DisplayName("批内依赖都没有声明该泛型")
    void testUnknownGenericInBatch() {
        module("a", "", OK_FN);
        module("b", "'a'", letFn("f", "Ghost<int>"));
        BatchResult result = run(2, "a", "b");

        assertEquals(ErrorKind.UNRESOLVED_GENERIC, result.getError("b").getKind());
        assertNull(result.getError("a"));
    }

    @Test
    @DisplayName("类型实参个数与声明模块的模板不符")
    void testRequestArity() {
        module("a", "", BOX);
        module("b", "'a'", letFn("f", "Box<int, int>"));
        BatchResult result = run(1, "a", "b");

        assertEquals(ErrorKind.UNRESOLVED_GENERIC, result.getError("b").getKind());
    }

    @Test
    @DisplayName("导入的绑定参与依赖方的可变性检查")
    void testImportedIntentChecked() {
        module("a", "", BIG + ",{'kind':'fn','name':'bump','params':[{'name':'b','type':'Big','intent':'mutate'}],'body':[]}");
        module("b", "'a'", "{'kind':'fn','name':'f','body':[{'stmt':'let','name':'x','type':'Big'},"
                + "{'stmt':'expr','value':{'expr':'call','callee':'bump','args':[{'expr':'ident','name':'x','type':'Big'}]}}]}");
        BatchResult result = run(2, "a", "b");

        assertEquals(ErrorKind.OWNERSHIP_VIOLATION, result.getError("b").getKind());
    }

    @Test
    @DisplayName("空批次")
    void testEmpty() {
        BatchResult result = new ModuleBatch(new AutoCTranspiler(source, new TransOptions()), 1)
                .run(Collections.<String>emptyList(), Scenario.STATIC_C);
        assertTrue(result.isSuccess());
        assertTrue(result.getOutputs().isEmpty());
    }

    @Test
    @DisplayName("线程数必须为正")
    void testThreads() {
        AutoCTranspiler transpiler = new AutoCTranspiler(source, new TransOptions());
        assertThrows(IllegalArgumentException.class, () -> new ModuleBatch(transpiler, 0));
    }
}
