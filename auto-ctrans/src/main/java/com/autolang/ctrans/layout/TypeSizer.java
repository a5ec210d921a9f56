package com.autolang.ctrans.layout;

import com.autolang.ctrans.CompilationContext;
import com.autolang.ctrans.TransOptions;
import com.autolang.ctrans.error.ErrorKind;
import com.autolang.tree.decl.FieldDecl;
import com.autolang.tree.decl.TagDecl;
import com.autolang.tree.decl.TypeDecl;
import com.autolang.tree.decl.VariantDecl;
import com.autolang.tree.type.*;

import java.util.*;

/**
 * 按 C 的自然对齐计算类型尺寸，并检测按值自包含的递归布局。
 * 指针字段一律视为 pointerSize 字节的不透明引用。
 */
public class TypeSizer {
    private static final int TAG_SIZE = 4;

    private final Map<String, TypeDecl> decls;
    private final TransOptions options;
    private final CompilationContext ctx;
    private final Map<String, TypeLayout> computed = new HashMap<>();
    private final LinkedHashSet<String> inProgress = new LinkedHashSet<>();

    public TypeSizer(Collection<TypeDecl> types, CompilationContext ctx) {
        this.decls = new HashMap<>();
        for (TypeDecl t : types) decls.put(t.getName(), t);
        this.options = ctx.getOptions();
        this.ctx = ctx;
    }

    public TypeLayout layoutOf(TypeRef type) {
        if (type instanceof PrimitiveType) {
            int size = primitiveSize(((PrimitiveType) type).getKind());
            return new TypeLayout(size, Math.max(size, 1), SizeClass.SMALL);
        }
        if (type instanceof PointerType) {
            return new TypeLayout(options.getPointerSize(), options.getPointerSize(), SizeClass.SMALL);
        }
        if (type instanceof ArrayType) {
            ArrayType array = (ArrayType) type;
            TypeLayout element = layoutOf(array.getElementType());
            int size = element.isKnown() ? element.getSize() * array.getLength() : -1;
            return new TypeLayout(size, element.getAlignment(), SizeClass.LARGE);
        }
        if (type instanceof NamedType) {
            return layoutOf(((NamedType) type).getName());
        }
        throw new IllegalArgumentException("Cannot size non-concrete type " + type);
    }

    public TypeLayout layoutOf(String typeName) {
        TypeLayout cached = computed.get(typeName);
        if (cached != null) return cached;
        TypeDecl decl = decls.get(typeName);
        if (decl == null) {
            TypeLayout imported = ctx.getLayouts().getTypeLayout(typeName);
            if (imported != null) return imported;
        }
        if (decl == null || decl.isOpaque()) {
            return new TypeLayout(-1, options.getPointerSize(), SizeClass.LARGE);
        }
        if (!inProgress.add(typeName)) {
            List<String> chain = new ArrayList<>(inProgress);
            chain = chain.subList(chain.indexOf(typeName), chain.size());
            throw ctx.error(ErrorKind.RECURSIVE_LAYOUT, typeName, decl.getLocation(),
                    "Type contains itself by value (" + String.join(" -> ", chain) + " -> " + typeName
                            + "); use a pointer field");
        }
        try {
            TypeLayout layout = decl instanceof TagDecl ? tagLayout((TagDecl) decl) : recordLayout(decl);
            computed.put(typeName, layout);
            return layout;
        } finally {
            inProgress.remove(typeName);
        }
    }

    private TypeLayout recordLayout(TypeDecl decl) {
        Aggregate agg = new Aggregate();
        for (FieldDecl field : decl.getFields()) {
            agg.add(layoutOf(field.getType()));
        }
        return agg.finish(decl.isHeap());
    }

    private TypeLayout tagLayout(TagDecl tag) {
        int unionSize = 0;
        int unionAlign = 1;
        boolean unknown = false;
        boolean heap = false;
        for (VariantDecl variant : tag.getVariants()) {
            Aggregate payload = new Aggregate();
            for (FieldDecl field : variant.getFields()) {
                payload.add(layoutOf(field.getType()));
            }
            TypeLayout p = payload.finish(false);
            unknown |= !p.isKnown();
            heap |= payload.heap;
            unionSize = Math.max(unionSize, Math.max(p.getSize(), 0));
            unionAlign = Math.max(unionAlign, p.getAlignment());
        }
        Aggregate agg = new Aggregate();
        agg.add(new TypeLayout(TAG_SIZE, TAG_SIZE, SizeClass.SMALL));
        if (unionSize > 0 || unknown) {
            agg.add(new TypeLayout(unknown ? -1 : align(unionSize, unionAlign), unionAlign,
                    heap ? SizeClass.HEAP : SizeClass.SMALL));
        }
        return agg.finish(false);
    }

    private int primitiveSize(PrimitiveType.Kind kind) {
        switch (kind) {
            case BOOL:
            case CHAR:
            case BYTE:
                return 1;
            case INT:
            case UINT:
            case FLOAT:
                return 4;
            case LONG:
            case DOUBLE:
                return 8;
            case STR:
            case CSTR:
                return options.getPointerSize();
            default:
                return 0;
        }
    }

    static int align(int offset, int alignment) {
        return alignment <= 1 ? offset : (offset + alignment - 1) / alignment * alignment;
    }

    /**
     * 按顺序排布字段的累加器。
     */
    private final class Aggregate {
        int offset;
        int alignment = 1;
        boolean unknown;
        boolean heap;

        void add(TypeLayout field) {
            if (!field.isKnown()) unknown = true;
            if (field.getSizeClass() == SizeClass.HEAP) heap = true;
            alignment = Math.max(alignment, field.getAlignment());
            offset = align(offset, field.getAlignment()) + Math.max(field.getSize(), 0);
        }

        TypeLayout finish(boolean declaredHeap) {
            int size = unknown ? -1 : align(offset, alignment);
            SizeClass sizeClass;
            if (declaredHeap || heap) {
                sizeClass = SizeClass.HEAP;
            } else if (unknown || size > options.getSmallAggregateLimit()) {
                sizeClass = SizeClass.LARGE;
            } else {
                sizeClass = SizeClass.SMALL;
            }
            return new TypeLayout(size, alignment, sizeClass);
        }
    }
}
