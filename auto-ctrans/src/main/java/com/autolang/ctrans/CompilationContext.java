package com.autolang.ctrans;

import com.autolang.ctrans.emit.SymbolTable;
import com.autolang.ctrans.error.CompileException;
import com.autolang.ctrans.error.ErrorKind;
import com.autolang.ctrans.layout.LayoutTable;
import com.autolang.ctrans.mono.InstantiationRequests;
import com.autolang.ctrans.mono.InstantiationTable;
import com.autolang.ctrans.ownership.BindingTable;
import com.autolang.tree.SourceLocation;

/**
 * 单次模块编译的上下文。
 * 各张表随运行单调增长，只由所属 pass 写入，运行结束后丢弃。
 */
public class CompilationContext {
    private final String moduleName;
    private final TransOptions options;
    private final InstantiationTable instantiations;
    private final LayoutTable layouts;
    private final BindingTable bindings;
    private final SymbolTable symbols;
    private final InstantiationRequests requests;

    public CompilationContext(String moduleName, TransOptions options) {
        this(moduleName, options, null);
    }

    /**
     * @param requests 批次共享的跨模块实例化请求表，单模块编译时为 null
     */
    public CompilationContext(String moduleName, TransOptions options, InstantiationRequests requests) {
        this.moduleName = moduleName;
        this.requests = requests;
        this.options = options != null ? options : new TransOptions();
        this.instantiations = new InstantiationTable(moduleName);
        this.layouts = new LayoutTable();
        this.bindings = new BindingTable();
        this.symbols = new SymbolTable(moduleName);
    }

    public String getModuleName() {
        return moduleName;
    }

    public TransOptions getOptions() {
        return options;
    }

    public InstantiationTable getInstantiations() {
        return instantiations;
    }

    public LayoutTable getLayouts() {
        return layouts;
    }

    public BindingTable getBindings() {
        return bindings;
    }

    public SymbolTable getSymbols() {
        return symbols;
    }

    public InstantiationRequests getRequests() {
        return requests;
    }

    /**
     * 导入已完成的依赖模块的布局与绑定，使跨模块的按值字段和调用与依赖的原型一致。
     */
    public void importFrom(CompilationContext dependency) {
        layouts.importFrom(dependency.getLayouts());
        bindings.importFrom(dependency.getBindings());
    }

    /**
     * 构造本模块的编译错误（由调用方抛出）。
     */
    public CompileException error(ErrorKind kind, String symbol, SourceLocation location, String message) {
        return new CompileException(kind, moduleName, symbol, location, message);
    }
}
