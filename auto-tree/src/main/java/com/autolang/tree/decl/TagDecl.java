package com.autolang.tree.decl;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.type.NamedType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 和类型（tagged union）声明：有序变体列表，没有普通字段。
 */
public class TagDecl extends TypeDecl {

    private final List<VariantDecl> variants;

    public TagDecl(SourceLocation location, String name, List<String> typeParams,
                   List<VariantDecl> variants, List<MethodDecl> methods) {
        this(location, name, typeParams, variants, methods, null);
    }

    public TagDecl(SourceLocation location, String name, List<String> typeParams,
                   List<VariantDecl> variants, List<MethodDecl> methods, List<NamedType> specs) {
        super(location, name, typeParams, Collections.<FieldDecl>emptyList(), methods, false, false, specs);
        this.variants = Collections.unmodifiableList(new ArrayList<>(variants));
    }

    public List<VariantDecl> getVariants() {
        return variants;
    }

    public VariantDecl findVariant(String variantName) {
        for (VariantDecl v : variants) {
            if (v.getName().equals(variantName)) return v;
        }
        return null;
    }

    @Override
    public boolean isTag() {
        return true;
    }

    @Override
    public TypeDecl rebuild(String newName, List<String> newTypeParams,
                            List<FieldDecl> newFields, List<MethodDecl> newMethods) {
        return new TagDecl(location, newName, newTypeParams, variants, newMethods, getSpecs());
    }

    public TagDecl rebuild(String newName, List<VariantDecl> newVariants, List<MethodDecl> newMethods) {
        return new TagDecl(location, newName, Collections.<String>emptyList(), newVariants, newMethods, getSpecs());
    }

    @Override
    public TypeDecl withSpecs(List<NamedType> newSpecs) {
        return new TagDecl(location, name, getTypeParams(), variants, getMethods(), newSpecs);
    }
}
