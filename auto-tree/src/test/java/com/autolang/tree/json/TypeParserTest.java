package com.autolang.tree.json;

import com.autolang.tree.type.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TypeParser 单元测试
 */
class TypeParserTest {

    @Test
    @DisplayName("内置类型解析为 PrimitiveType")
    void testPrimitives() {
        assertSame(PrimitiveType.INT, TypeParser.parse("int"));
        assertSame(PrimitiveType.STR, TypeParser.parse(" str "));
        assertSame(PrimitiveType.VOID, TypeParser.parse("void"));
    }

    @Test
    @DisplayName("指针与定长数组")
    void testPointerAndArray() {
        assertEquals(new PointerType(new PointerType(PrimitiveType.CHAR)), TypeParser.parse("**char"));
        assertEquals(new ArrayType(PrimitiveType.INT, 4), TypeParser.parse("[4]int"));
        assertEquals(new PointerType(new ArrayType(new NamedType("Node"), 2)), TypeParser.parse("*[2]Node"));
    }

    @Test
    @DisplayName("嵌套泛型实参")
    void testGenericArgs() {
        TypeRef type = TypeParser.parse("Map<str, List<int>>");
        NamedType map = (NamedType) type;
        assertEquals("Map", map.getName());
        assertEquals(PrimitiveType.STR, map.getTypeArgs().get(0));
        assertEquals(new NamedType("List", Collections.<TypeRef>singletonList(PrimitiveType.INT)),
                map.getTypeArgs().get(1));
        assertEquals(2, type.nestingDepth());
    }

    @Test
    @DisplayName("作用域内的名字解析为类型参数")
    void testTypeParams() {
        TypeRef type = TypeParser.parse("List<T>", Arrays.asList("T"));
        assertTrue(type.containsTypeParam());
        assertEquals(new NamedType("T"), TypeParser.parse("T"));
    }

    @Test
    @DisplayName("语法错误")
    void testErrors() {
        assertThrows(IllegalArgumentException.class, () -> TypeParser.parse(""));
        assertThrows(IllegalArgumentException.class, () -> TypeParser.parse("List<int"));
        assertThrows(IllegalArgumentException.class, () -> TypeParser.parse("[]int"));
        assertThrows(IllegalArgumentException.class, () -> TypeParser.parse("int>"));
    }
}
