package com.autolang.ctrans.emit;

import com.autolang.ctrans.CompilationContext;
import com.autolang.ctrans.TransOptions;
import com.autolang.ctrans.layout.TagLayout;
import com.autolang.ctrans.layout.VariantLayout;
import com.autolang.ctrans.lowering.LoweredFunction;
import com.autolang.ctrans.lowering.LoweredModule;
import com.autolang.ctrans.lowering.MethodLowering;
import com.autolang.ctrans.ownership.ParamBinding;
import com.autolang.ctrans.ownership.PassingStrategy;
import com.autolang.ctrans.ownership.SignatureBindings;
import com.autolang.ctrans.pass.TransPass;
import com.autolang.tree.decl.*;
import com.autolang.tree.type.NamedType;
import com.autolang.tree.type.TypeRef;

import java.util.*;

/**
 * 输出阶段：生成 {@code <module>.h} 与 {@code <module>.c}。
 * <p>
 * 头文件依次为：保护宏、标准头、外部系统头（排序）、依赖模块头、struct 前向声明、
 * 类型定义（按值依赖拓扑序）、类型别名、规格 vtable 类型、函数原型、无系统头的外部函数原型、
 * vtable 实例的 extern 声明。vtable 实例定义在源文件末尾。
 * 输出只依赖输入顺序，相同输入得到逐字节相同的文本。
 */
public class CEmitter implements TransPass<LoweredModule, CModuleOutput> {

    @Override
    public String getName() {
        return "emit";
    }

    @Override
    public CModuleOutput run(LoweredModule module, CompilationContext ctx) {
        String indent = ctx.getOptions().getIndentString();
        CTypeNames types = new CTypeNames();
        registerTypes(module, ctx);

        // 先生成定义，收集函数体里用到的标准头
        CodeWriter source = new CodeWriter(indent);
        source.line("#include \"" + module.getName() + ".h\"");
        CStatementWriter statements = new CStatementWriter(ctx, types, source);
        for (LoweredFunction fn : module.getFunctions()) {
            if (fn.isExternal()) continue;
            source.blankLine();
            String signature = signature(fn, types);
            ctx.getSymbols().attachDeclaration(fn.getCName(), EmittedSymbol.Kind.FUNCTION, signature);
            source.line(signature + " {");
            source.indent();
            statements.writeBody(fn);
            source.dedent();
            source.line("}");
        }
        List<String> vtableExterns = writeVtableInstances(module, ctx, types, source);

        CodeWriter body = new CodeWriter(indent);
        writeTypes(module, ctx, types, body);
        writeAliases(module, ctx, types, body);
        writeVtableTypes(module, ctx, types, body);
        writePrototypes(module, types, body);
        if (!vtableExterns.isEmpty()) {
            body.blankLine();
            for (String line : vtableExterns) body.line(line);
        }

        CodeWriter header = new CodeWriter(indent);
        String guard = guardName(module.getName());
        boolean traditional = ctx.getOptions().getHeaderStyle() == TransOptions.HeaderStyle.INCLUDE_GUARD;
        if (traditional) {
            header.line("#ifndef " + guard);
            header.line("#define " + guard);
        } else {
            header.line("#pragma once");
        }
        writeIncludes(module, types, header);
        if (!body.isEmpty()) {
            header.blankLine();
            header.append(body.getOutput());
        }
        if (traditional) {
            header.blankLine();
            header.line("#endif /* " + guard + " */");
        }
        return new CModuleOutput(module.getName(), header.getOutput(), source.getOutput());
    }

    static String guardName(String moduleName) {
        StringBuilder sb = new StringBuilder();
        for (char c : moduleName.toCharArray()) {
            sb.append(Character.isLetterOrDigit(c) ? Character.toUpperCase(c) : '_');
        }
        return sb.append("_H").toString();
    }

    private void registerTypes(LoweredModule module, CompilationContext ctx) {
        SymbolTable symbols = ctx.getSymbols();
        for (TypeDecl type : module.getTypes()) {
            symbols.register(type.getName(), EmittedSymbol.Kind.TYPE, "type " + type.getName(), type.getLocation());
            if (!type.isTag()) continue;
            TagLayout tag = requireTagLayout(type.getName(), ctx);
            symbols.register(tag.getKindEnumName(), EmittedSymbol.Kind.KIND_ENUM,
                    "tag " + type.getName(), type.getLocation());
            for (VariantLayout v : tag.getVariants()) {
                symbols.register(v.getConstantName(), EmittedSymbol.Kind.ENUM_CONSTANT,
                        "variant " + type.getName() + "." + v.getName(), type.getLocation());
            }
        }
    }

    static String vtableType(String specName) {
        return specName + "_vtable";
    }

    static String vtableInstance(String typeName, String specName) {
        return typeName + "_" + specName + "_vtable";
    }

    private static TagLayout requireTagLayout(String name, CompilationContext ctx) {
        TagLayout tag = ctx.getLayouts().getTagLayout(name);
        if (tag == null) {
            throw new IllegalStateException("No layout for tag " + name);
        }
        return tag;
    }

    // ==================== 头文件 ====================

    private void writeIncludes(LoweredModule module, CTypeNames types, CodeWriter out) {
        List<String> lines = new ArrayList<>();
        for (String std : new String[]{CTypeNames.STDBOOL, CTypeNames.STDINT, CTypeNames.STDDEF}) {
            if (types.uses(std)) lines.add("#include <" + std + ">");
        }
        TreeSet<String> system = new TreeSet<>();
        for (LoweredFunction fn : module.getFunctions()) {
            if (fn.isExternal() && fn.getHeader() != null) system.add(fn.getHeader());
        }
        for (String h : system) {
            if (!lines.contains("#include <" + h + ">")) lines.add("#include <" + h + ">");
        }
        for (String dep : module.getUses()) {
            lines.add("#include \"" + dep + ".h\"");
        }
        if (lines.isEmpty()) return;
        out.blankLine();
        for (String line : lines) out.line(line);
    }

    private void writeTypes(LoweredModule module, CompilationContext ctx, CTypeNames types, CodeWriter out) {
        if (module.getTypes().isEmpty()) return;
        for (TypeDecl type : module.getTypes()) {
            out.line("struct " + type.getName() + ";");
        }
        for (TypeDecl type : DeclarationOrderer.order(module.getTypes())) {
            if (type.isOpaque()) continue;
            out.blankLine();
            String text = type.isTag()
                    ? tagDefinition((TagDecl) type, requireTagLayout(type.getName(), ctx), types, ctx)
                    : structDefinition(type, types, ctx);
            out.append(text);
            ctx.getSymbols().attachDeclaration(type.getName(), EmittedSymbol.Kind.TYPE, text);
        }
    }

    private void writeAliases(LoweredModule module, CompilationContext ctx, CTypeNames types, CodeWriter out) {
        if (module.getAliases().isEmpty()) return;
        out.blankLine();
        for (TypeAliasDecl alias : module.getAliases()) {
            String text = "typedef " + types.declare(alias.getTarget(), alias.getName()) + ";";
            ctx.getSymbols().register(alias.getName(), EmittedSymbol.Kind.TYPEDEF,
                    "alias " + alias.getName(), alias.getLocation());
            ctx.getSymbols().attachDeclaration(alias.getName(), EmittedSymbol.Kind.TYPEDEF, text);
            out.line(text);
        }
    }

    // ==================== 规格 vtable ====================

    /**
     * {@code typedef struct Spec_vtable { R (*m)(void *self, ...); } Spec_vtable;}
     */
    private void writeVtableTypes(LoweredModule module, CompilationContext ctx, CTypeNames types, CodeWriter out) {
        for (SpecDecl spec : module.getSpecs()) {
            String name = vtableType(spec.getName());
            ctx.getSymbols().register(name, EmittedSymbol.Kind.TYPEDEF, "spec " + spec.getName(), spec.getLocation());
            CodeWriter w = new CodeWriter(ctx.getOptions().getIndentString());
            w.line("typedef struct " + name + " {");
            w.indent();
            if (spec.getMethods().isEmpty()) {
                w.line("char _unused;");
            }
            for (MethodDecl m : spec.getMethods()) {
                w.line(slot(spec, m, "*" + m.getName(), ctx, types) + ";");
            }
            w.dedent();
            w.line("} " + name + ";");
            ctx.getSymbols().attachDeclaration(name, EmittedSymbol.Kind.TYPEDEF, w.getOutput());
            out.blankLine();
            out.append(w.getOutput());
        }
    }

    /**
     * 每个类型实现的每个规格一个 vtable 实例，槽位指向类型的方法；返回头文件中的 extern 声明。
     */
    private List<String> writeVtableInstances(LoweredModule module, CompilationContext ctx, CTypeNames types,
                                              CodeWriter out) {
        List<String> externs = new ArrayList<>();
        for (TypeDecl type : module.getTypes()) {
            for (NamedType ref : type.getSpecs()) {
                SpecDecl spec = requireSpec(module, ref.getName());
                String instance = vtableInstance(type.getName(), spec.getName());
                String declaration = vtableType(spec.getName()) + " " + instance;
                ctx.getSymbols().register(instance, EmittedSymbol.Kind.VARIABLE,
                        "vtable of " + type.getName() + " for " + spec.getName(), type.getLocation());
                ctx.getSymbols().attachDeclaration(instance, EmittedSymbol.Kind.VARIABLE, declaration);
                externs.add("extern " + declaration + ";");
                out.blankLine();
                out.line(declaration + " = {");
                out.indent();
                for (MethodDecl m : spec.getMethods()) {
                    // 实现方法的 self 是具体类型指针，按槽位类型转换
                    out.line("." + m.getName() + " = (" + slot(spec, m, "*", ctx, types) + ")"
                            + MethodLowering.mangle(type.getName(), m.getName()) + ",");
                }
                out.dedent();
                out.line("};");
            }
        }
        return externs;
    }

    private String slot(SpecDecl spec, MethodDecl method, String declarator, CompilationContext ctx, CTypeNames types) {
        SignatureBindings bindings = ctx.getBindings().forMethod(spec.getName(), method.getName());
        if (bindings == null) {
            throw new IllegalStateException("No bindings for " + spec.getName() + "." + method.getName());
        }
        List<String> params = new ArrayList<>();
        params.add(parameter(bindings.getReceiver(), "self", types));
        for (ParamBinding p : bindings.getParams()) {
            params.add(parameter(p, p.getName(), types));
        }
        return types.declare(method.getReturnType(), "(" + declarator + ")(" + String.join(", ", params) + ")");
    }

    private static SpecDecl requireSpec(LoweredModule module, String name) {
        for (SpecDecl spec : module.getSpecs()) {
            if (spec.getName().equals(name)) return spec;
        }
        throw new IllegalStateException("No spec " + name);
    }

    private String structDefinition(TypeDecl type, CTypeNames types, CompilationContext ctx) {
        CodeWriter w = new CodeWriter(ctx.getOptions().getIndentString());
        w.line("struct " + type.getName() + " {");
        w.indent();
        if (type.getFields().isEmpty()) {
            // C 不允许空结构体
            w.line("char _unused;");
        }
        for (FieldDecl f : type.getFields()) {
            w.line(types.declare(f.getType(), f.getName()) + ";");
        }
        w.dedent();
        w.line("};");
        return w.getOutput();
    }

    private String tagDefinition(TagDecl decl, TagLayout tag, CTypeNames types, CompilationContext ctx) {
        CodeWriter w = new CodeWriter(ctx.getOptions().getIndentString());
        w.line("enum " + tag.getKindEnumName() + " {");
        w.indent();
        List<VariantLayout> variants = tag.getVariants();
        for (int i = 0; i < variants.size(); i++) {
            VariantLayout v = variants.get(i);
            w.line(v.getConstantName() + " = " + v.getDiscriminant() + (i < variants.size() - 1 ? "," : ""));
        }
        w.dedent();
        w.line("};");
        String enumText = w.getOutput();
        ctx.getSymbols().attachDeclaration(tag.getKindEnumName(), EmittedSymbol.Kind.KIND_ENUM, enumText);

        w.blankLine();
        w.line("struct " + decl.getName() + " {");
        w.indent();
        w.line(types.enumName(decl.getName()) + " " + TagLayout.TAG_FIELD + ";");
        if (tag.hasUnion()) {
            w.line("union {");
            w.indent();
            for (VariantLayout v : variants) {
                switch (v.getStorage()) {
                    case SINGLE:
                        w.line(types.declare(v.getFields().get(0).getType(), v.getName()) + ";");
                        break;
                    case STRUCT:
                        w.line("struct {");
                        w.indent();
                        for (FieldDecl f : v.getFields()) {
                            w.line(types.declare(f.getType(), f.getName()) + ";");
                        }
                        w.dedent();
                        w.line("} " + v.getName() + ";");
                        break;
                    default:
                        break;
                }
            }
            w.dedent();
            w.line("} " + TagLayout.UNION_NAME + ";");
        }
        w.dedent();
        w.line("};");
        return w.getOutput();
    }

    private void writePrototypes(LoweredModule module, CTypeNames types, CodeWriter out) {
        List<String> defined = new ArrayList<>();
        List<String> external = new ArrayList<>();
        for (LoweredFunction fn : module.getFunctions()) {
            if (fn.isMain()) continue;
            if (!fn.isExternal()) {
                defined.add(signature(fn, types) + ";");
            } else if (fn.getHeader() == null) {
                external.add(signature(fn, types) + ";");
            }
        }
        for (List<String> group : Arrays.asList(defined, external)) {
            if (group.isEmpty()) continue;
            out.blankLine();
            for (String line : group) out.line(line);
        }
    }

    // ==================== 签名 ====================

    String signature(LoweredFunction fn, CTypeNames types) {
        if (fn.isMain()) return "int main(void)";
        List<String> params = new ArrayList<>();
        ParamBinding receiver = fn.getBindings().getReceiver();
        if (receiver != null) params.add(parameter(receiver, "self", types));
        for (ParamBinding p : fn.getBindings().getParams()) {
            params.add(parameter(p, p.getName(), types));
        }
        String list = params.isEmpty() ? "void" : String.join(", ", params);
        return types.declare(fn.getReturnType(), fn.getCName() + "(" + list + ")");
    }

    private static String parameter(ParamBinding binding, String name, CTypeNames types) {
        TypeRef type = binding.getType();
        if (!binding.isIndirect()) {
            return types.declare(type, name);
        }
        String declared = types.declare(type, "*" + name);
        return binding.getStrategy() == PassingStrategy.REF_IMMUTABLE ? "const " + declared : declared;
    }
}
