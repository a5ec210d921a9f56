package com.autolang.ctrans;

import com.autolang.ctrans.assemble.FragmentAssembler;
import com.autolang.ctrans.assemble.FragmentSource;
import com.autolang.ctrans.emit.CModuleOutput;
import com.autolang.ctrans.pass.TransPipeline;
import com.autolang.tree.module.ModuleUnit;
import com.autolang.tree.module.Scenario;

import java.io.IOException;
import java.nio.file.Path;

/**
 * C 后端入口：装配片段并执行完整管线。
 *
 * <pre>
 * AutoCTranspiler trans = new AutoCTranspiler(new DirectoryFragmentSource(dir), new TransOptions());
 * CModuleOutput out = trans.transpile("geometry", Scenario.STATIC_C);
 * </pre>
 */
public class AutoCTranspiler {
    private final FragmentAssembler assembler;
    private final TransPipeline pipeline;

    public AutoCTranspiler(FragmentSource source, TransOptions options) {
        this.assembler = new FragmentAssembler(source);
        this.pipeline = new TransPipeline(options);
    }

    public TransOptions getOptions() {
        return pipeline.getOptions();
    }

    public TransPipeline getPipeline() {
        return pipeline;
    }

    public ModuleUnit assemble(String moduleName, Scenario scenario) throws IOException {
        return assembler.assemble(moduleName, scenario);
    }

    public CModuleOutput transpile(String moduleName, Scenario scenario) throws IOException {
        return transpile(assemble(moduleName, scenario));
    }

    public CModuleOutput transpile(ModuleUnit unit) {
        return pipeline.execute(unit);
    }

    /**
     * 编译并写出 {@code <module>.h} / {@code <module>.c}，返回头文件路径。
     */
    public Path transpileAndSave(String moduleName, Scenario scenario, Path outputDir) throws IOException {
        return transpile(moduleName, scenario).writeTo(outputDir);
    }

    /**
     * 检查模式：执行全部 pass 但不写文件。失败时抛出 {@link com.autolang.ctrans.error.CompileException}。
     */
    public void check(String moduleName, Scenario scenario) throws IOException {
        transpile(moduleName, scenario);
    }
}
