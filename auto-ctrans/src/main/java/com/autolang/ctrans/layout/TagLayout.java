package com.autolang.ctrans.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 和类型的 C 布局：{@code enum <Tag>Kind} 加 {@code struct <Tag> { tag; union as; }}。
 */
public final class TagLayout {
    public static final String TAG_FIELD = "tag";
    public static final String UNION_NAME = "as";

    private final String tagName;
    private final List<VariantLayout> variants;

    public TagLayout(String tagName, List<VariantLayout> variants) {
        this.tagName = tagName;
        this.variants = Collections.unmodifiableList(new ArrayList<>(variants));
    }

    public String getTagName() {
        return tagName;
    }

    public String getKindEnumName() {
        return tagName + "Kind";
    }

    public List<VariantLayout> getVariants() {
        return variants;
    }

    public VariantLayout findVariant(String name) {
        for (VariantLayout v : variants) {
            if (v.getName().equals(name)) return v;
        }
        return null;
    }

    /**
     * 所有变体都没有负载时省略联合体。
     */
    public boolean hasUnion() {
        for (VariantLayout v : variants) {
            if (v.getStorage() != VariantLayout.Storage.NONE) return true;
        }
        return false;
    }
}
