package com.autolang.ctrans.emit;

import com.autolang.ctrans.error.CompileException;
import com.autolang.ctrans.error.ErrorKind;
import com.autolang.tree.SourceLocation;

import java.util.*;

/**
 * 输出符号表。同一命名空间内名字唯一，重名即 SYMBOL_COLLISION。
 */
public class SymbolTable {
    private final String moduleName;
    private final Map<String, EmittedSymbol> tags = new LinkedHashMap<>();
    private final Map<String, EmittedSymbol> ordinary = new LinkedHashMap<>();

    public SymbolTable(String moduleName) {
        this.moduleName = moduleName;
    }

    public EmittedSymbol register(String name, EmittedSymbol.Kind kind, String origin, SourceLocation location) {
        Map<String, EmittedSymbol> namespace = kind.isTagNamespace() ? tags : ordinary;
        EmittedSymbol existing = namespace.get(name);
        if (existing != null) {
            throw new CompileException(ErrorKind.SYMBOL_COLLISION, moduleName, name, location,
                    "'" + name + "' from " + origin + " collides with " + existing.getOrigin());
        }
        EmittedSymbol symbol = new EmittedSymbol(name, kind, origin);
        namespace.put(name, symbol);
        return symbol;
    }

    public EmittedSymbol lookup(String name, EmittedSymbol.Kind kind) {
        return (kind.isTagNamespace() ? tags : ordinary).get(name);
    }

    public void attachDeclaration(String name, EmittedSymbol.Kind kind, String declaration) {
        EmittedSymbol symbol = lookup(name, kind);
        if (symbol == null) {
            throw new IllegalStateException("Unknown symbol " + name);
        }
        symbol.setDeclaration(declaration);
    }

    /**
     * 全部符号，标签命名空间在前，各自按登记顺序。
     */
    public List<EmittedSymbol> getAll() {
        List<EmittedSymbol> all = new ArrayList<>(tags.values());
        all.addAll(ordinary.values());
        return Collections.unmodifiableList(all);
    }

    public int size() {
        return tags.size() + ordinary.size();
    }
}
