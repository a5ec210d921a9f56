package com.autolang.ctrans.assemble;

import com.autolang.ctrans.error.CompileException;
import com.autolang.ctrans.error.ErrorKind;
import com.autolang.tree.decl.TypeDecl;
import com.autolang.tree.module.ModuleUnit;
import com.autolang.tree.module.Scenario;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;

import static com.autolang.ctrans.TestTrees.fragment;
import static org.junit.jupiter.api.Assertions.*;

/**
 * FragmentAssembler 单元测试
 */
class FragmentAssemblerTest {

    private static final String SHARED = "{'module':'geo','uses':['base'],'decls':["
            + "{'kind':'type','name':'Point','opaque':true,'methods':[{'name':'len','returns':'int'}]},"
            + "{'kind':'fn','name':'origin','returns':'Point'}]}";

    private static final String STATIC_C = "{'module':'geo','scenario':'c','uses':['base','io'],'decls':["
            + "{'kind':'type','name':'Point','fields':[{'name':'x','type':'int'}],"
            + "'methods':[{'name':'len','returns':'int','body':[{'stmt':'return','value':{'expr':'lit','kind':'int','value':'0'}}]}]},"
            + "{'kind':'fn','name':'origin','returns':'Point','body':[]}]}";

    private ModuleUnit assemble(Scenario scenario, String... fragments) throws IOException {
        InMemoryFragmentSource source = new InMemoryFragmentSource();
        for (String json : fragments) source.add(fragment(json));
        return new FragmentAssembler(source).assemble("geo", scenario);
    }

    private CompileException conflict(String... fragments) {
        CompileException e = assertThrows(CompileException.class, () -> assemble(Scenario.STATIC_C, fragments));
        assertEquals(ErrorKind.ASSEMBLY_CONFLICT, e.getKind());
        return e;
    }

    // ================================================================
    // 合并
    // ================================================================

    @Nested
    @DisplayName("合并")
    class MergeTests {

        @Test
        @DisplayName("场景片段补全共享片段中的占位声明")
        void testCompletion() throws IOException {
            ModuleUnit unit = assemble(Scenario.STATIC_C, SHARED, STATIC_C);
            TypeDecl point = unit.findType("Point");
            assertFalse(point.isOpaque());
            assertEquals(1, point.getFields().size());
            assertFalse(point.findMethod("len").isExternal());
            assertFalse(unit.findFunction("origin").isExternal());
            assertEquals(Scenario.STATIC_C, unit.getScenario());
        }

        @Test
        @DisplayName("占位声明实现的规格并入完整声明")
        void testSpecsMerged() throws IOException {
            ModuleUnit unit = assemble(Scenario.STATIC_C,
                    "{'module':'geo','decls':[{'kind':'spec','name':'Show','methods':[]},"
                            + "{'kind':'type','name':'Point','opaque':true,'specs':['Show']},"
                            + "{'kind':'alias','name':'Coord','target':'int'}]}",
                    "{'module':'geo','scenario':'c','decls':[{'kind':'type','name':'Point','fields':[]}]}");
            assertEquals("Show", unit.findType("Point").getSpecs().get(0).getName());
            assertEquals(1, unit.getSpecs().size());
            assertEquals("Coord", unit.getAliases().get(0).getName());
        }

        @Test
        @DisplayName("uses 去重并保持首次出现的顺序")
        void testUses() throws IOException {
            ModuleUnit unit = assemble(Scenario.STATIC_C, SHARED, STATIC_C);
            assertEquals(Arrays.asList("base", "io"), unit.getUses());
        }

        @Test
        @DisplayName("没有场景片段时只用共享片段")
        void testSharedOnly() throws IOException {
            ModuleUnit unit = assemble(Scenario.INTERPRETED, SHARED, STATIC_C);
            assertTrue(unit.findType("Point").isOpaque());
            assertTrue(unit.findFunction("origin").isExternal());
        }

        @Test
        @DisplayName("没有任何片段时报告 MISSING_MODULE")
        void testMissingModule() {
            CompileException e = assertThrows(CompileException.class,
                    () -> new FragmentAssembler(new InMemoryFragmentSource()).assemble("nope", Scenario.STATIC_C));
            assertEquals(ErrorKind.MISSING_MODULE, e.getKind());
            assertEquals("nope", e.getError().getModule());
        }

        @Test
        @DisplayName("场景片段的声明排在前面")
        void testDeclarationOrder() throws IOException {
            ModuleUnit unit = assemble(Scenario.STATIC_C,
                    "{'module':'geo','decls':[{'kind':'fn','name':'a','body':[]}]}",
                    "{'module':'geo','scenario':'c','decls':[{'kind':'fn','name':'b','body':[]}]}");
            assertEquals("b", unit.getFunctions().get(0).getName());
            assertEquals("a", unit.getFunctions().get(1).getName());
        }
    }

    // ================================================================
    // 冲突
    // ================================================================

    @Nested
    @DisplayName("冲突")
    class ConflictTests {

        @Test
        @DisplayName("两个完整的同名类型")
        void testDuplicateType() {
            conflict("{'module':'geo','decls':[{'kind':'type','name':'P','fields':[]}]}",
                    "{'module':'geo','scenario':'c','decls':[{'kind':'type','name':'P','fields':[]}]}");
        }

        @Test
        @DisplayName("两个带函数体的同名函数")
        void testDuplicateFunction() {
            CompileException e = conflict("{'module':'geo','decls':[{'kind':'fn','name':'f','body':[]}]}",
                    "{'module':'geo','scenario':'c','decls':[{'kind':'fn','name':'f','body':[]}]}");
            assertEquals("f", e.getError().getSymbol());
        }

        @Test
        @DisplayName("两个都没有函数体的同名函数")
        void testDoubleStub() {
            conflict("{'module':'geo','decls':[{'kind':'fn','name':'f'}]}",
                    "{'module':'geo','scenario':'c','decls':[{'kind':'fn','name':'f'}]}");
        }

        @Test
        @DisplayName("占位与实现的参数个数不同")
        void testSignatureMismatch() {
            conflict("{'module':'geo','decls':[{'kind':'fn','name':'f','params':[{'name':'a','type':'int'}]}]}",
                    "{'module':'geo','scenario':'c','decls':[{'kind':'fn','name':'f','body':[]}]}");
        }

        @Test
        @DisplayName("泛型参数个数不同")
        void testTypeParamMismatch() {
            conflict("{'module':'geo','decls':[{'kind':'type','name':'Box','typeParams':['T'],'opaque':true}]}",
                    "{'module':'geo','scenario':'c','decls':[{'kind':'type','name':'Box','fields':[]}]}");
        }

        @Test
        @DisplayName("类型、别名与规格共用一个命名空间")
        void testTypeNamespace() {
            CompileException e = conflict("{'module':'geo','decls':[{'kind':'alias','name':'Point','target':'int'}]}",
                    "{'module':'geo','scenario':'c','decls':[{'kind':'type','name':'Point','fields':[]}]}");
            assertEquals("Point", e.getError().getSymbol());
            conflict("{'module':'geo','decls':[{'kind':'spec','name':'Show','methods':[]},"
                    + "{'kind':'alias','name':'Show','target':'int'}]}");
        }
    }

    // ================================================================
    // ext 块
    // ================================================================

    @Nested
    @DisplayName("ext 块")
    class ExtTests {

        @Test
        @DisplayName("ext 给类型追加字段和方法")
        void testExtend() throws IOException {
            ModuleUnit unit = assemble(Scenario.STATIC_C,
                    "{'module':'geo','decls':[{'kind':'type','name':'P','fields':[{'name':'x','type':'int'}]}]}",
                    "{'module':'geo','scenario':'c','decls':[{'kind':'ext','target':'P',"
                            + "'fields':[{'name':'y','type':'int'}],'methods':[{'name':'sum','returns':'int','body':[]}]}]}");
            TypeDecl p = unit.findType("P");
            assertEquals(2, p.getFields().size());
            assertEquals("y", p.getFields().get(1).getName());
            assertNotNull(p.findMethod("sum"));
        }

        @Test
        @DisplayName("ext 给占位类型加字段后成为完整类型")
        void testExtendOpaque() throws IOException {
            ModuleUnit unit = assemble(Scenario.STATIC_C,
                    "{'module':'geo','decls':[{'kind':'type','name':'P','opaque':true}]}",
                    "{'module':'geo','scenario':'c','decls':[{'kind':'ext','target':'P','fields':[{'name':'x','type':'int'}]}]}");
            assertFalse(unit.findType("P").isOpaque());
        }

        @Test
        @DisplayName("ext 目标不存在")
        void testUnknownTarget() {
            conflict("{'module':'geo','decls':[{'kind':'ext','target':'Ghost'}]}");
        }

        @Test
        @DisplayName("ext 重复声明字段")
        void testDuplicateField() {
            conflict("{'module':'geo','decls':[{'kind':'type','name':'P','fields':[{'name':'x','type':'int'}]},"
                    + "{'kind':'ext','target':'P','fields':[{'name':'x','type':'int'}]}]}");
        }

        @Test
        @DisplayName("ext 不能给和类型加字段")
        void testTagFields() {
            conflict("{'module':'geo','decls':[{'kind':'tag','name':'T','variants':[{'name':'A'}]},"
                    + "{'kind':'ext','target':'T','fields':[{'name':'x','type':'int'}]}]}");
        }
    }
}
