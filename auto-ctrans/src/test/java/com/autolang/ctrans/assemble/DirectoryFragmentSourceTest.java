package com.autolang.ctrans.assemble;

import com.autolang.ctrans.TestTrees;
import com.autolang.tree.module.Fragment;
import com.autolang.tree.module.Scenario;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DirectoryFragmentSource 单元测试
 */
class DirectoryFragmentSourceTest {

    @Test
    @DisplayName("文件名由模块名和场景后缀组成")
    void testFileName() {
        assertEquals("geometry.at.json", DirectoryFragmentSource.fileName("geometry", null));
        assertEquals("geometry.c.at.json", DirectoryFragmentSource.fileName("geometry", Scenario.STATIC_C));
        assertEquals("geometry.vm.at.json", DirectoryFragmentSource.fileName("geometry", Scenario.INTERPRETED));
    }

    @Test
    @DisplayName("按场景加载片段，不存在时返回 null")
    void testLoad() throws IOException {
        DirectoryFragmentSource source = new DirectoryFragmentSource(TestTrees.resourceDir("fragments"));
        Fragment shared = source.load("geometry", null);
        assertNotNull(shared);
        assertTrue(shared.isShared());
        Fragment c = source.load("geometry", Scenario.STATIC_C);
        assertEquals(Scenario.STATIC_C, c.getScenario());
        assertNull(source.load("geometry", Scenario.INTERPRETED));
    }

    @Test
    @DisplayName("列出目录中的模块")
    void testListModules() throws IOException {
        DirectoryFragmentSource source = new DirectoryFragmentSource(TestTrees.resourceDir("fragments"));
        assertEquals(new TreeSet<>(Arrays.asList("collections", "geometry")), source.listModules());
    }

    @Test
    @DisplayName("片段声明的模块名与文件名不符")
    void testModuleMismatch(@TempDir Path dir) throws IOException {
        Files.write(dir.resolve("a.at.json"), "{\"module\": \"b\"}".getBytes(StandardCharsets.UTF_8));
        Files.write(dir.resolve("notes.txt"), "x".getBytes(StandardCharsets.UTF_8));
        DirectoryFragmentSource source = new DirectoryFragmentSource(dir);
        assertThrows(IOException.class, () -> source.load("a", null));
        Set<String> modules = source.listModules();
        assertEquals(new TreeSet<>(Arrays.asList("a")), modules);
    }
}
