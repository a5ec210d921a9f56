package com.autolang.tree.json;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.decl.*;
import com.autolang.tree.expr.*;
import com.autolang.tree.module.Fragment;
import com.autolang.tree.module.Scenario;
import com.autolang.tree.pattern.LiteralPattern;
import com.autolang.tree.pattern.Pattern;
import com.autolang.tree.pattern.VariantPattern;
import com.autolang.tree.pattern.WildcardPattern;
import com.autolang.tree.stmt.*;
import com.autolang.tree.type.*;
import com.google.gson.*;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * 程序树片段的 JSON 读取器（Gson）。
 *
 * <p>片段顶层：</p>
 * <pre>
 * { "module": "geom", "scenario": "c", "uses": ["base"], "decls": [ ... ] }
 * </pre>
 * scenario 缺省表示共享接口片段。
 *
 * <p>声明（kind 区分）：</p>
 * <ul>
 *   <li>{@code type}: name, typeParams, fields[{name,type,visibility}], methods, opaque, heap, specs</li>
 *   <li>{@code tag}: name, typeParams, variants[{name,fields,value}], methods, specs</li>
 *   <li>{@code fn}: name, typeParams, params[{name,type,intent}], returns, body, lowLevel, header</li>
 *   <li>{@code ext}: target, fields, methods</li>
 *   <li>{@code alias}: name, target</li>
 *   <li>{@code spec}: name, typeParams, methods（只有签名）</li>
 * </ul>
 * 方法：name, static, mut, params, returns, body。body 缺省表示外部提供。
 *
 * <p>语句以 {@code stmt} 区分：let / expr / return / if / while / loop / for / break / continue /
 * match / lowlevel。表达式以 {@code expr} 区分：lit / ident / self / selfField / field / binary /
 * unary / assign / call / method / variant / struct / addr / index，并以 {@code type} 给出解析后的类型。
 * 任意节点可带 line / col。</p>
 */
public class TreeJsonReader {

    public Fragment read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.getFileName().toString());
        }
    }

    public Fragment read(String json, String fileName) {
        return read(new StringReader(json), fileName);
    }

    public Fragment read(Reader reader, String fileName) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new TreeFormatException("Malformed JSON: " + e.getMessage(), fileName, 0, e);
        }
        if (root == null || !root.isJsonObject()) {
            throw new TreeFormatException("Fragment must be a JSON object", fileName);
        }
        return new Session(fileName).readFragment(root.getAsJsonObject());
    }

    /**
     * 单次读取的状态：文件名、当前泛型参数作用域、当前 self 类型。
     */
    private static final class Session {
        private final String fileName;
        private Set<String> typeParams = Collections.emptySet();
        private TypeRef selfType;

        Session(String fileName) {
            this.fileName = fileName;
        }

        Fragment readFragment(JsonObject obj) {
            String module = requireString(obj, "module");
            Scenario scenario = null;
            if (obj.has("scenario") && !obj.get("scenario").isJsonNull()) {
                try {
                    scenario = Scenario.fromName(obj.get("scenario").getAsString());
                } catch (IllegalArgumentException e) {
                    throw error(e.getMessage(), obj, e);
                }
            }
            List<Declaration> decls = new ArrayList<>();
            for (JsonElement e : array(obj, "decls")) {
                decls.add(readDecl(e.getAsJsonObject()));
            }
            return new Fragment(module, scenario, fileName, strings(obj, "uses"), decls);
        }

        // ==================== 声明 ====================

        private Declaration readDecl(JsonObject obj) {
            String kind = requireString(obj, "kind");
            switch (kind) {
                case "type": return readType(obj);
                case "tag":  return readTag(obj);
                case "fn":   return readFunction(obj);
                case "ext":  return readExt(obj);
                case "alias": return new TypeAliasDecl(loc(obj), requireString(obj, "name"), requireType(obj, "target"));
                case "spec": return readSpec(obj);
                default:
                    throw error("Unknown declaration kind: " + kind, obj, null);
            }
        }

        private TypeDecl readType(JsonObject obj) {
            String name = requireString(obj, "name");
            List<String> params = strings(obj, "typeParams");
            enterType(name, params);
            try {
                List<FieldDecl> fields = readFields(obj);
                List<MethodDecl> methods = readMethods(obj);
                return new TypeDecl(loc(obj), name, params, fields, methods,
                        bool(obj, "opaque"), bool(obj, "heap"), readSpecRefs(obj));
            } finally {
                leaveType();
            }
        }

        private TagDecl readTag(JsonObject obj) {
            String name = requireString(obj, "name");
            List<String> params = strings(obj, "typeParams");
            enterType(name, params);
            try {
                List<VariantDecl> variants = new ArrayList<>();
                for (JsonElement e : array(obj, "variants")) {
                    JsonObject v = e.getAsJsonObject();
                    Integer value = v.has("value") ? v.get("value").getAsInt() : null;
                    variants.add(new VariantDecl(loc(v), requireString(v, "name"), readFields(v), value));
                }
                return new TagDecl(loc(obj), name, params, variants, readMethods(obj), readSpecRefs(obj));
            } finally {
                leaveType();
            }
        }

        private SpecDecl readSpec(JsonObject obj) {
            String name = requireString(obj, "name");
            List<String> params = strings(obj, "typeParams");
            enterType(name, params);
            try {
                List<MethodDecl> methods = readMethods(obj);
                for (JsonElement e : array(obj, "methods")) {
                    JsonObject m = e.getAsJsonObject();
                    if (bool(m, "static") || m.has("body")) {
                        throw error("Spec method must be an instance method without body", m, null);
                    }
                }
                return new SpecDecl(loc(obj), name, params, methods);
            } finally {
                leaveType();
            }
        }

        /**
         * 类型实现的规格，类型参数作用域内解析（{@code Storage<T>}）。
         */
        private List<NamedType> readSpecRefs(JsonObject obj) {
            List<NamedType> specs = new ArrayList<>();
            for (String text : strings(obj, "specs")) {
                TypeRef ref = parseType(text, obj);
                if (!(ref instanceof NamedType)) {
                    throw error("Spec reference must name a spec: " + text, obj, null);
                }
                specs.add((NamedType) ref);
            }
            return specs;
        }

        private ExtDecl readExt(JsonObject obj) {
            String target = requireString(obj, "target");
            enterType(target, Collections.<String>emptyList());
            try {
                return new ExtDecl(loc(obj), target, readFields(obj), readMethods(obj));
            } finally {
                leaveType();
            }
        }

        private FunctionDecl readFunction(JsonObject obj) {
            String name = requireString(obj, "name");
            List<String> params = strings(obj, "typeParams");
            Set<String> saved = typeParams;
            typeParams = new LinkedHashSet<>(params);
            try {
                return new FunctionDecl(loc(obj), name, params, readParams(obj), returnType(obj),
                        obj.has("body") ? readBlock(obj.get("body"), obj) : null,
                        bool(obj, "lowLevel"), optString(obj, "header"));
            } finally {
                typeParams = saved;
            }
        }

        private List<FieldDecl> readFields(JsonObject obj) {
            List<FieldDecl> fields = new ArrayList<>();
            for (JsonElement e : array(obj, "fields")) {
                JsonObject f = e.getAsJsonObject();
                Visibility visibility = "private".equals(optString(f, "visibility"))
                        ? Visibility.PRIVATE : Visibility.PUBLIC;
                fields.add(new FieldDecl(loc(f), requireString(f, "name"), requireType(f, "type"), visibility));
            }
            return fields;
        }

        private List<MethodDecl> readMethods(JsonObject obj) {
            List<MethodDecl> methods = new ArrayList<>();
            for (JsonElement e : array(obj, "methods")) {
                JsonObject m = e.getAsJsonObject();
                MethodKind kind = bool(m, "static") ? MethodKind.STATIC : MethodKind.INSTANCE;
                methods.add(new MethodDecl(loc(m), requireString(m, "name"), kind, bool(m, "mut"),
                        readParams(m), returnType(m),
                        m.has("body") ? readBlock(m.get("body"), m) : null));
            }
            return methods;
        }

        private List<ParamDecl> readParams(JsonObject obj) {
            List<ParamDecl> params = new ArrayList<>();
            for (JsonElement e : array(obj, "params")) {
                JsonObject p = e.getAsJsonObject();
                ParamIntent intent = ParamIntent.READ;
                String text = optString(p, "intent");
                if (text != null) {
                    try {
                        intent = ParamIntent.valueOf(text.toUpperCase(Locale.ROOT));
                    } catch (IllegalArgumentException ex) {
                        throw error("Unknown parameter intent: " + text, p, ex);
                    }
                }
                params.add(new ParamDecl(loc(p), requireString(p, "name"), requireType(p, "type"), intent));
            }
            return params;
        }

        private TypeRef returnType(JsonObject obj) {
            return obj.has("returns") ? requireType(obj, "returns") : PrimitiveType.VOID;
        }

        private void enterType(String name, List<String> params) {
            typeParams = new LinkedHashSet<>(params);
            List<TypeRef> args = new ArrayList<>();
            for (String p : params) args.add(new TypeParamType(p));
            selfType = new NamedType(name, args);
        }

        private void leaveType() {
            typeParams = Collections.emptySet();
            selfType = null;
        }

        // ==================== 语句 ====================

        private Block readBlock(JsonElement element, JsonObject owner) {
            if (element == null || element.isJsonNull()) return null;
            if (!element.isJsonArray()) {
                throw error("Block must be an array of statements", owner, null);
            }
            List<Statement> stmts = new ArrayList<>();
            for (JsonElement e : element.getAsJsonArray()) {
                stmts.add(readStmt(e.getAsJsonObject()));
            }
            return new Block(loc(owner), stmts);
        }

        private Statement readStmt(JsonObject obj) {
            String kind = requireString(obj, "stmt");
            SourceLocation loc = loc(obj);
            switch (kind) {
                case "let":
                    return new LetStmt(loc, requireString(obj, "name"),
                            obj.has("type") ? requireType(obj, "type") : null,
                            bool(obj, "mut"), optExpr(obj, "init"));
                case "expr":
                    return new ExprStmt(loc, requireExpr(obj, "value"));
                case "return":
                    return new ReturnStmt(loc, optExpr(obj, "value"));
                case "if": {
                    Statement elseBranch = null;
                    JsonElement els = obj.get("else");
                    if (els != null && els.isJsonArray()) {
                        elseBranch = readBlock(els, obj);
                    } else if (els != null && els.isJsonObject()) {
                        elseBranch = readStmt(els.getAsJsonObject());
                    }
                    return new IfStmt(loc, requireExpr(obj, "cond"), requireBlock(obj, "then"), elseBranch);
                }
                case "while":
                    return new WhileStmt(loc, requireExpr(obj, "cond"), requireBlock(obj, "body"));
                case "loop":
                    return new LoopStmt(loc, requireBlock(obj, "body"));
                case "for":
                    return new ForRangeStmt(loc, requireString(obj, "var"), requireExpr(obj, "from"),
                            requireExpr(obj, "to"), bool(obj, "inclusive"), requireBlock(obj, "body"));
                case "break":
                    return new BreakStmt(loc);
                case "continue":
                    return new ContinueStmt(loc);
                case "match": {
                    List<MatchArm> arms = new ArrayList<>();
                    for (JsonElement e : array(obj, "arms")) {
                        JsonObject arm = e.getAsJsonObject();
                        arms.add(new MatchArm(loc(arm), readPattern(requireObject(arm, "pattern")),
                                requireBlock(arm, "body")));
                    }
                    return new MatchStmt(loc, requireExpr(obj, "target"), arms);
                }
                case "lowlevel":
                    return new LowLevelBlock(loc, requireBlock(obj, "body"));
                default:
                    throw error("Unknown statement kind: " + kind, obj, null);
            }
        }

        private Pattern readPattern(JsonObject obj) {
            String kind = requireString(obj, "pattern");
            switch (kind) {
                case "variant":
                    return new VariantPattern(loc(obj), requireString(obj, "name"), strings(obj, "bindings"));
                case "literal": {
                    Expression value = requireExpr(obj, "value");
                    if (!(value instanceof Literal)) {
                        throw error("Literal pattern needs a literal value", obj, null);
                    }
                    return new LiteralPattern(loc(obj), (Literal) value);
                }
                case "wildcard":
                    return new WildcardPattern(loc(obj), optString(obj, "binding"));
                default:
                    throw error("Unknown pattern kind: " + kind, obj, null);
            }
        }

        // ==================== 表达式 ====================

        private Expression readExpr(JsonObject obj) {
            String kind = requireString(obj, "expr");
            SourceLocation loc = loc(obj);
            switch (kind) {
                case "lit":
                    return readLiteral(obj, loc);
                case "ident":
                    return new Identifier(loc, requireType(obj, "type"), requireString(obj, "name"));
                case "self": {
                    TypeRef type = obj.has("type") ? requireType(obj, "type") : selfType;
                    if (type == null) throw error("'self' outside of a type", obj, null);
                    return new SelfExpr(loc, type);
                }
                case "selfField":
                    return new SelfFieldExpr(loc, requireType(obj, "type"), requireString(obj, "field"));
                case "field":
                    return new FieldAccess(loc, requireType(obj, "type"), requireExpr(obj, "target"),
                            requireString(obj, "field"));
                case "binary": {
                    BinaryExpr.Operator op = operator(obj, BinaryExpr.Operator.class);
                    Expression left = requireExpr(obj, "left");
                    Expression right = requireExpr(obj, "right");
                    TypeRef type = obj.has("type") ? requireType(obj, "type") : binaryType(op, left);
                    return new BinaryExpr(loc, type, op, left, right);
                }
                case "unary": {
                    UnaryExpr.Operator op = operator(obj, UnaryExpr.Operator.class);
                    Expression operand = requireExpr(obj, "operand");
                    TypeRef type;
                    if (obj.has("type")) {
                        type = requireType(obj, "type");
                    } else if (op == UnaryExpr.Operator.NOT) {
                        type = PrimitiveType.BOOL;
                    } else if (op == UnaryExpr.Operator.DEREF && operand.getType() instanceof PointerType) {
                        type = ((PointerType) operand.getType()).getPointee();
                    } else {
                        type = operand.getType();
                    }
                    return new UnaryExpr(loc, type, op, operand);
                }
                case "assign": {
                    AssignExpr.Operator op = obj.has("op")
                            ? operator(obj, AssignExpr.Operator.class) : AssignExpr.Operator.ASSIGN;
                    return new AssignExpr(loc, PrimitiveType.VOID, op,
                            requireExpr(obj, "target"), requireExpr(obj, "value"));
                }
                case "call": {
                    List<TypeRef> typeArgs = new ArrayList<>();
                    for (String t : strings(obj, "typeArgs")) typeArgs.add(parseType(t, obj));
                    return new CallExpr(loc, optType(obj), requireString(obj, "callee"), typeArgs, exprs(obj, "args"));
                }
                case "method": {
                    TypeRef owner = requireType(obj, "owner");
                    if (!(owner instanceof NamedType)) {
                        throw error("Method owner must be a named type: " + owner, obj, null);
                    }
                    return new MethodCallExpr(loc, optType(obj), (NamedType) owner, requireString(obj, "method"),
                            optExpr(obj, "receiver"), exprs(obj, "args"));
                }
                case "variant":
                    return new VariantInit(loc, requireType(obj, "type"), requireString(obj, "variant"),
                            exprs(obj, "args"));
                case "struct": {
                    Map<String, Expression> fields = new LinkedHashMap<>();
                    JsonObject values = obj.has("fields") ? requireObject(obj, "fields") : new JsonObject();
                    for (Map.Entry<String, JsonElement> e : values.entrySet()) {
                        fields.put(e.getKey(), readExpr(e.getValue().getAsJsonObject()));
                    }
                    return new StructInit(loc, requireType(obj, "type"), fields);
                }
                case "addr": {
                    Expression operand = requireExpr(obj, "operand");
                    TypeRef type = obj.has("type") ? requireType(obj, "type") : new PointerType(operand.getType());
                    return new AddressOf(loc, type, operand);
                }
                case "index":
                    return new IndexExpr(loc, requireType(obj, "type"), requireExpr(obj, "target"),
                            requireExpr(obj, "index"));
                default:
                    throw error("Unknown expression kind: " + kind, obj, null);
            }
        }

        private Literal readLiteral(JsonObject obj, SourceLocation loc) {
            String kindText = requireString(obj, "kind");
            Literal.LiteralKind kind;
            try {
                kind = Literal.LiteralKind.valueOf(kindText.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw error("Unknown literal kind: " + kindText, obj, e);
            }
            String text = kind == Literal.LiteralKind.NULL ? "null" : requireString(obj, "value");
            TypeRef type;
            if (obj.has("type")) {
                type = requireType(obj, "type");
            } else {
                switch (kind) {
                    case INT:   type = PrimitiveType.INT; break;
                    case FLOAT: type = PrimitiveType.DOUBLE; break;
                    case BOOL:  type = PrimitiveType.BOOL; break;
                    case CHAR:  type = PrimitiveType.CHAR; break;
                    case STR:   type = PrimitiveType.STR; break;
                    default:    type = new PointerType(PrimitiveType.VOID); break;
                }
            }
            return new Literal(loc, type, kind, text);
        }

        private static TypeRef binaryType(BinaryExpr.Operator op, Expression left) {
            switch (op) {
                case EQ: case NE: case LT: case LE: case GT: case GE: case AND: case OR:
                    return PrimitiveType.BOOL;
                default:
                    return left.getType();
            }
        }

        private <E extends Enum<E>> E operator(JsonObject obj, Class<E> type) {
            String symbol = requireString(obj, "op");
            try {
                if (type == BinaryExpr.Operator.class) return type.cast(BinaryExpr.Operator.fromSymbol(symbol));
                if (type == UnaryExpr.Operator.class) return type.cast(UnaryExpr.Operator.fromSymbol(symbol));
                return type.cast(AssignExpr.Operator.fromSymbol(symbol));
            } catch (IllegalArgumentException e) {
                throw error(e.getMessage(), obj, e);
            }
        }

        // ==================== 辅助方法 ====================

        private Expression requireExpr(JsonObject obj, String key) {
            return readExpr(requireObject(obj, key));
        }

        private Expression optExpr(JsonObject obj, String key) {
            JsonElement e = obj.get(key);
            if (e == null || e.isJsonNull()) return null;
            if (!e.isJsonObject()) throw error("'" + key + "' must be an expression object", obj, null);
            return readExpr(e.getAsJsonObject());
        }

        private List<Expression> exprs(JsonObject obj, String key) {
            List<Expression> result = new ArrayList<>();
            for (JsonElement e : array(obj, key)) {
                result.add(readExpr(e.getAsJsonObject()));
            }
            return result;
        }

        private Block requireBlock(JsonObject obj, String key) {
            if (!obj.has(key)) throw error("Missing '" + key + "'", obj, null);
            return readBlock(obj.get(key), obj);
        }

        private JsonObject requireObject(JsonObject obj, String key) {
            JsonElement e = obj.get(key);
            if (e == null || !e.isJsonObject()) throw error("Missing object '" + key + "'", obj, null);
            return e.getAsJsonObject();
        }

        private TypeRef requireType(JsonObject obj, String key) {
            return parseType(requireString(obj, key), obj);
        }

        /** 调用表达式的 type 缺省为 void */
        private TypeRef optType(JsonObject obj) {
            return obj.has("type") ? requireType(obj, "type") : PrimitiveType.VOID;
        }

        private TypeRef parseType(String text, JsonObject obj) {
            try {
                return TypeParser.parse(text, typeParams);
            } catch (IllegalArgumentException e) {
                throw error(e.getMessage(), obj, e);
            }
        }

        private String requireString(JsonObject obj, String key) {
            JsonElement e = obj.get(key);
            if (e == null || e.isJsonNull() || !e.isJsonPrimitive()) {
                throw error("Missing '" + key + "'", obj, null);
            }
            return e.getAsString();
        }

        private static String optString(JsonObject obj, String key) {
            JsonElement e = obj.get(key);
            return e == null || e.isJsonNull() ? null : e.getAsString();
        }

        private static boolean bool(JsonObject obj, String key) {
            JsonElement e = obj.get(key);
            return e != null && !e.isJsonNull() && e.getAsBoolean();
        }

        private static JsonArray array(JsonObject obj, String key) {
            JsonElement e = obj.get(key);
            return e != null && e.isJsonArray() ? e.getAsJsonArray() : new JsonArray();
        }

        private static List<String> strings(JsonObject obj, String key) {
            List<String> result = new ArrayList<>();
            for (JsonElement e : array(obj, key)) {
                result.add(e.getAsString());
            }
            return result;
        }

        private SourceLocation loc(JsonObject obj) {
            if (!obj.has("line")) return new SourceLocation(fileName, 0, 0);
            int col = obj.has("col") ? obj.get("col").getAsInt() : 0;
            return new SourceLocation(fileName, obj.get("line").getAsInt(), col);
        }

        private TreeFormatException error(String message, JsonObject obj, Throwable cause) {
            int line = obj != null && obj.has("line") ? obj.get("line").getAsInt() : 0;
            return new TreeFormatException(message, fileName, line, cause);
        }
    }
}
