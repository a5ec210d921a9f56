package com.autolang.ctrans.emit;

import com.autolang.tree.decl.FieldDecl;
import com.autolang.tree.decl.TagDecl;
import com.autolang.tree.decl.TypeDecl;
import com.autolang.tree.decl.VariantDecl;
import com.autolang.tree.type.ArrayType;
import com.autolang.tree.type.NamedType;
import com.autolang.tree.type.TypeRef;

import java.util.*;

/**
 * 类型定义的输出顺序：按值依赖的拓扑序（首次引用深度优先，平局按声明顺序）。
 * 经由指针的依赖只需要前向声明，不参与排序。
 */
public final class DeclarationOrderer {

    private DeclarationOrderer() {
    }

    public static List<TypeDecl> order(List<TypeDecl> types) {
        Map<String, TypeDecl> byName = new LinkedHashMap<>();
        for (TypeDecl t : types) byName.put(t.getName(), t);
        List<TypeDecl> result = new ArrayList<>(types.size());
        Set<String> visited = new HashSet<>();
        for (TypeDecl t : types) {
            visit(t, byName, visited, result);
        }
        return result;
    }

    private static void visit(TypeDecl type, Map<String, TypeDecl> byName, Set<String> visited, List<TypeDecl> out) {
        if (!visited.add(type.getName())) return;
        for (String dep : valueDependencies(type)) {
            TypeDecl decl = byName.get(dep);
            if (decl != null) visit(decl, byName, visited, out);
        }
        out.add(type);
    }

    static List<String> valueDependencies(TypeDecl type) {
        List<String> deps = new ArrayList<>();
        if (type instanceof TagDecl) {
            for (VariantDecl v : ((TagDecl) type).getVariants()) {
                for (FieldDecl f : v.getFields()) collect(f.getType(), deps);
            }
        } else {
            for (FieldDecl f : type.getFields()) collect(f.getType(), deps);
        }
        return deps;
    }

    private static void collect(TypeRef type, List<String> deps) {
        if (type instanceof NamedType) {
            deps.add(((NamedType) type).getName());
        } else if (type instanceof ArrayType) {
            collect(((ArrayType) type).getElementType(), deps);
        }
    }
}
