package com.autolang.tree.json;

import com.autolang.tree.type.*;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * 文本类型语法解析器。
 * <pre>
 *   type  := '*' type | '[' INT ']' type | IDENT ( '<' type (',' type)* '>' )?
 * </pre>
 * 处于作用域内的泛型参数名解析为 {@link TypeParamType}，内置类型名解析为 {@link PrimitiveType}。
 */
public class TypeParser {
    private final String text;
    private final Collection<String> typeParams;
    private int pos;

    private TypeParser(String text, Collection<String> typeParams) {
        this.text = text;
        this.typeParams = typeParams;
    }

    public static TypeRef parse(String text) {
        return parse(text, Collections.<String>emptyList());
    }

    public static TypeRef parse(String text, Collection<String> typeParams) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Empty type");
        }
        TypeParser parser = new TypeParser(text, typeParams);
        TypeRef type = parser.parseType();
        parser.skipSpaces();
        if (parser.pos != text.length()) {
            throw parser.error("Unexpected '" + text.charAt(parser.pos) + "'");
        }
        return type;
    }

    private TypeRef parseType() {
        skipSpaces();
        if (peek() == '*') {
            pos++;
            return new PointerType(parseType());
        }
        if (peek() == '[') {
            pos++;
            skipSpaces();
            int start = pos;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
            if (start == pos) throw error("Array length expected");
            int length = Integer.parseInt(text.substring(start, pos));
            skipSpaces();
            expect(']');
            return new ArrayType(parseType(), length);
        }
        String name = parseIdent();
        skipSpaces();
        if (peek() == '<') {
            pos++;
            List<TypeRef> args = new ArrayList<>();
            args.add(parseType());
            skipSpaces();
            while (peek() == ',') {
                pos++;
                args.add(parseType());
                skipSpaces();
            }
            expect('>');
            return new NamedType(name, args);
        }
        if (typeParams.contains(name)) return new TypeParamType(name);
        PrimitiveType primitive = PrimitiveType.byName(name);
        if (primitive != null) return primitive;
        return new NamedType(name);
    }

    private String parseIdent() {
        skipSpaces();
        int start = pos;
        while (pos < text.length()
                && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_' || text.charAt(pos) == '.')) {
            pos++;
        }
        if (start == pos) throw error("Type name expected");
        return text.substring(start, pos);
    }

    private void expect(char c) {
        if (peek() != c) throw error("'" + c + "' expected");
        pos++;
    }

    private char peek() {
        return pos < text.length() ? text.charAt(pos) : '\0';
    }

    private void skipSpaces() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " in type '" + text + "' at " + pos);
    }
}
