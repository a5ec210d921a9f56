package com.autolang.ctrans.assemble;

import com.autolang.tree.json.TreeJsonReader;
import com.autolang.tree.module.Fragment;
import com.autolang.tree.module.Scenario;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * 从目录读取 JSON 片段：{@code <module>.at.json} 为共享片段，
 * {@code <module>.<suffix>.at.json} 为场景片段（suffix 见 {@link Scenario#getSuffix()}）。
 */
public class DirectoryFragmentSource implements FragmentSource {
    private static final Logger LOG = Logger.getLogger(DirectoryFragmentSource.class.getName());

    public static final String EXTENSION = ".at.json";

    private final Path directory;
    private final TreeJsonReader reader;

    public DirectoryFragmentSource(Path directory) {
        this(directory, new TreeJsonReader());
    }

    public DirectoryFragmentSource(Path directory, TreeJsonReader reader) {
        this.directory = directory;
        this.reader = reader;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public Fragment load(String moduleName, Scenario scenario) throws IOException {
        Path file = directory.resolve(fileName(moduleName, scenario));
        if (!Files.isRegularFile(file)) {
            LOG.fine("片段不存在: " + file);
            return null;
        }
        LOG.fine("加载片段: " + file);
        Fragment fragment = reader.read(file);
        if (!moduleName.equals(fragment.getModuleName())) {
            throw new IOException("Fragment " + file + " declares module '"
                    + fragment.getModuleName() + "', expected '" + moduleName + "'");
        }
        return fragment;
    }

    /**
     * 目录中出现的全部模块名（按名字排序），共享片段与场景片段都计入。
     */
    public Set<String> listModules() throws IOException {
        Set<String> modules = new TreeSet<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.forEach(file -> {
                String name = moduleOf(file.getFileName().toString());
                if (name != null) modules.add(name);
            });
        }
        return modules;
    }

    static String moduleOf(String fileName) {
        if (!fileName.endsWith(EXTENSION)) return null;
        String stem = fileName.substring(0, fileName.length() - EXTENSION.length());
        for (Scenario s : Scenario.values()) {
            String suffix = "." + s.getSuffix();
            if (stem.endsWith(suffix)) return stem.substring(0, stem.length() - suffix.length());
        }
        return stem.isEmpty() ? null : stem;
    }

    public static String fileName(String moduleName, Scenario scenario) {
        return scenario != null
                ? moduleName + "." + scenario.getSuffix() + EXTENSION
                : moduleName + EXTENSION;
    }
}
