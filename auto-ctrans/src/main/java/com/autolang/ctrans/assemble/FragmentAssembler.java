package com.autolang.ctrans.assemble;

import com.autolang.ctrans.error.CompileException;
import com.autolang.ctrans.error.ErrorKind;
import com.autolang.tree.SourceLocation;
import com.autolang.tree.decl.*;
import com.autolang.tree.module.Fragment;
import com.autolang.tree.module.ModuleUnit;
import com.autolang.tree.module.Scenario;
import com.autolang.tree.type.NamedType;

import java.io.IOException;
import java.util.*;
import java.util.logging.Logger;

/**
 * 片段装配器：把共享接口片段与场景片段合并为一个 {@link ModuleUnit}。
 * <p>
 * 场景片段先读，共享片段后读，声明顺序取首次出现的位置。
 * 只有名字的占位声明（opaque 类型、无函数体的方法和函数）由另一侧的完整声明补全；
 * 两个完整声明同名即冲突。ext 块在所有片段读完后并入目标类型。
 * 类型、别名与规格共用一个命名空间。
 */
public class FragmentAssembler {
    private static final Logger LOG = Logger.getLogger(FragmentAssembler.class.getName());

    private final FragmentSource source;

    public FragmentAssembler(FragmentSource source) {
        this.source = source;
    }

    public ModuleUnit assemble(String moduleName, Scenario scenario) throws IOException {
        List<Fragment> fragments = new ArrayList<>(2);
        Fragment specific = source.load(moduleName, scenario);
        if (specific != null) fragments.add(specific);
        Fragment shared = source.load(moduleName, null);
        if (shared != null) fragments.add(shared);
        if (fragments.isEmpty()) {
            throw new CompileException(ErrorKind.MISSING_MODULE, moduleName, null, null,
                    "No fragment found for module '" + moduleName + "' (scenario " + scenario + ")");
        }
        return merge(moduleName, scenario, fragments);
    }

    /**
     * 按给定顺序合并片段。
     */
    public ModuleUnit merge(String moduleName, Scenario scenario, List<Fragment> fragments) {
        Merger merger = new Merger(moduleName);
        for (Fragment fragment : fragments) {
            LOG.fine("合并片段 " + fragment);
            merger.uses.addAll(fragment.getUses());
            for (Declaration decl : fragment.getDeclarations()) {
                merger.add(decl);
            }
        }
        merger.applyExtensions();
        return new ModuleUnit(moduleName, scenario, new ArrayList<>(merger.uses),
                new ArrayList<>(merger.types.values()), new ArrayList<>(merger.functions.values()),
                new ArrayList<>(merger.aliases.values()), new ArrayList<>(merger.specs.values()));
    }

    private static final class Merger {
        private final String moduleName;
        private final LinkedHashSet<String> uses = new LinkedHashSet<>();
        private final LinkedHashMap<String, TypeDecl> types = new LinkedHashMap<>();
        private final LinkedHashMap<String, FunctionDecl> functions = new LinkedHashMap<>();
        private final LinkedHashMap<String, TypeAliasDecl> aliases = new LinkedHashMap<>();
        private final LinkedHashMap<String, SpecDecl> specs = new LinkedHashMap<>();
        private final List<ExtDecl> extensions = new ArrayList<>();

        Merger(String moduleName) {
            this.moduleName = moduleName;
        }

        void add(Declaration decl) {
            if (decl instanceof TypeDecl) {
                TypeDecl type = (TypeDecl) decl;
                requireTypeNameFree(type.getName(), type.getLocation(), types);
                TypeDecl existing = types.get(type.getName());
                types.put(type.getName(), existing == null ? type : mergeTypes(existing, type));
            } else if (decl instanceof FunctionDecl) {
                FunctionDecl fn = (FunctionDecl) decl;
                FunctionDecl existing = functions.get(fn.getName());
                functions.put(fn.getName(), existing == null ? fn : mergeFunctions(existing, fn));
            } else if (decl instanceof ExtDecl) {
                extensions.add((ExtDecl) decl);
            } else if (decl instanceof TypeAliasDecl) {
                requireTypeNameFree(decl.getName(), decl.getLocation(), null);
                aliases.put(decl.getName(), (TypeAliasDecl) decl);
            } else if (decl instanceof SpecDecl) {
                requireTypeNameFree(decl.getName(), decl.getLocation(), null);
                specs.put(decl.getName(), (SpecDecl) decl);
            } else {
                throw conflict(decl.getName(), decl.getLocation(),
                        "Unsupported top-level declaration " + decl.getClass().getSimpleName());
            }
        }

        /**
         * 名字未被类型、别名或规格占用；same 是允许同名合并的那张表。
         */
        private void requireTypeNameFree(String name, SourceLocation loc, Map<String, ?> same) {
            for (Map<String, ?> table : Arrays.<Map<String, ?>>asList(types, aliases, specs)) {
                if (table == same) continue;
                Object existing = table.get(name);
                if (existing != null) {
                    throw conflict(name, loc, "Name already declared (first at "
                            + ((Declaration) existing).getLocation() + ")");
                }
            }
        }

        void applyExtensions() {
            for (ExtDecl ext : extensions) {
                TypeDecl target = types.get(ext.getTarget());
                if (target == null) {
                    throw conflict(ext.getTarget(), ext.getLocation(),
                            "ext block targets unknown type '" + ext.getTarget() + "'");
                }
                if (!ext.getFields().isEmpty() && target.isTag()) {
                    throw conflict(ext.getTarget(), ext.getLocation(), "ext block cannot add fields to a tag");
                }
                List<FieldDecl> fields = new ArrayList<>(target.getFields());
                for (FieldDecl field : ext.getFields()) {
                    if (target.findField(field.getName()) != null || containsField(fields, field.getName())) {
                        throw conflict(target.getName() + "." + field.getName(), field.getLocation(),
                                "Field already declared");
                    }
                    fields.add(field);
                }
                List<MethodDecl> methods = mergeMethods(target.getName(), target.getMethods(), ext.getMethods());
                TypeDecl extended;
                if (target.isOpaque() && !ext.getFields().isEmpty()) {
                    // 场景片段给出字段后，占位类型成为完整类型
                    extended = new TypeDecl(target.getLocation(), target.getName(), target.getTypeParams(),
                            fields, methods, false, target.isHeap(), target.getSpecs());
                } else {
                    extended = target.rebuild(target.getName(), target.getTypeParams(), fields, methods);
                }
                types.put(target.getName(), extended);
            }
        }

        private TypeDecl mergeTypes(TypeDecl first, TypeDecl second) {
            String name = first.getName();
            if (!first.isOpaque() && !second.isOpaque()) {
                throw conflict(name, second.getLocation(),
                        "Type declared twice (first at " + first.getLocation() + ")");
            }
            if (first.getTypeParams().size() != second.getTypeParams().size()) {
                throw conflict(name, second.getLocation(), "Generic parameter count differs between declarations");
            }
            TypeDecl full = first.isOpaque() ? second : first;
            List<MethodDecl> methods = mergeMethods(name, first.getMethods(), second.getMethods());
            TypeDecl merged = full.rebuild(name, full.getTypeParams(), full.getFields(), methods);
            LinkedHashSet<NamedType> specRefs = new LinkedHashSet<>(first.getSpecs());
            specRefs.addAll(second.getSpecs());
            return specRefs.size() == full.getSpecs().size() ? merged : merged.withSpecs(new ArrayList<>(specRefs));
        }

        private List<MethodDecl> mergeMethods(String owner, List<MethodDecl> first, List<MethodDecl> second) {
            LinkedHashMap<String, MethodDecl> merged = new LinkedHashMap<>();
            for (MethodDecl m : first) {
                addMethod(owner, merged, m);
            }
            for (MethodDecl m : second) {
                addMethod(owner, merged, m);
            }
            return new ArrayList<>(merged.values());
        }

        private void addMethod(String owner, Map<String, MethodDecl> merged, MethodDecl method) {
            MethodDecl existing = merged.get(method.getName());
            if (existing == null) {
                merged.put(method.getName(), method);
                return;
            }
            String symbol = owner + "." + method.getName();
            checkCompletion(symbol, existing.isExternal(), method.isExternal(), method.getLocation());
            if (existing.getParams().size() != method.getParams().size()
                    || existing.getKind() != method.getKind()) {
                throw conflict(symbol, method.getLocation(), "Signature differs from the stub declaration");
            }
            merged.put(method.getName(), existing.isExternal() ? method : existing);
        }

        private FunctionDecl mergeFunctions(FunctionDecl existing, FunctionDecl fn) {
            checkCompletion(fn.getName(), existing.isExternal(), fn.isExternal(), fn.getLocation());
            if (existing.getParams().size() != fn.getParams().size()
                    || existing.getTypeParams().size() != fn.getTypeParams().size()) {
                throw conflict(fn.getName(), fn.getLocation(), "Signature differs from the stub declaration");
            }
            return existing.isExternal() ? fn : existing;
        }

        /**
         * 只允许一侧是占位声明。
         */
        private void checkCompletion(String symbol, boolean existingStub, boolean incomingStub, SourceLocation loc) {
            if (existingStub && incomingStub) {
                throw conflict(symbol, loc, "Declared twice without a body");
            }
            if (!existingStub && !incomingStub) {
                throw conflict(symbol, loc, "Defined twice");
            }
        }

        private static boolean containsField(List<FieldDecl> fields, String name) {
            for (FieldDecl f : fields) {
                if (f.getName().equals(name)) return true;
            }
            return false;
        }

        private CompileException conflict(String symbol, SourceLocation loc, String message) {
            return new CompileException(ErrorKind.ASSEMBLY_CONFLICT, moduleName, symbol, loc, message);
        }
    }
}
