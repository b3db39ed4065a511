package com.keellang.cli.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.ast.decl.FunDecl;
import com.keellang.compiler.ast.decl.Parameter;
import com.keellang.compiler.ast.decl.TypedProgram;
import com.keellang.compiler.ast.expr.AssignExpr;
import com.keellang.compiler.ast.expr.BinaryExpr;
import com.keellang.compiler.ast.expr.CallExpr;
import com.keellang.compiler.ast.expr.ConditionalExpr;
import com.keellang.compiler.ast.expr.DerefExpr;
import com.keellang.compiler.ast.expr.Expression;
import com.keellang.compiler.ast.expr.FieldAccess;
import com.keellang.compiler.ast.expr.IndexExpr;
import com.keellang.compiler.ast.expr.Literal;
import com.keellang.compiler.ast.expr.LocalRef;
import com.keellang.compiler.ast.expr.MethodCallExpr;
import com.keellang.compiler.ast.expr.MoveExpr;
import com.keellang.compiler.ast.expr.StringInterpolation;
import com.keellang.compiler.ast.expr.StructLiteral;
import com.keellang.compiler.ast.expr.UnaryExpr;
import com.keellang.compiler.ast.stmt.Block;
import com.keellang.compiler.ast.stmt.BreakStmt;
import com.keellang.compiler.ast.stmt.ContinueStmt;
import com.keellang.compiler.ast.stmt.ExpressionStmt;
import com.keellang.compiler.ast.stmt.ForStmt;
import com.keellang.compiler.ast.stmt.IfStmt;
import com.keellang.compiler.ast.stmt.LetStmt;
import com.keellang.compiler.ast.stmt.ReturnStmt;
import com.keellang.compiler.ast.stmt.Statement;
import com.keellang.compiler.ast.stmt.WhileStmt;
import com.keellang.compiler.symbols.FnSignature;
import com.keellang.compiler.symbols.Intrinsic;
import com.keellang.compiler.symbols.SymbolTable;
import com.keellang.compiler.types.FieldId;
import com.keellang.compiler.types.FnId;
import com.keellang.compiler.types.LocalId;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.SymbolId;
import com.keellang.compiler.types.TypeDesc;
import com.keellang.compiler.types.TypeId;
import com.keellang.compiler.types.TypeKind;
import com.keellang.compiler.types.TypeTable;

import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 读取类型检查器输出的 JSON 格式。
 * <p>
 * 顶层结构：
 * <pre>
 * {
 *   "source": "demo.keel",
 *   "types": [ { "kind": "struct", "name": "Vec2", "fields": [ {"id": 0, "name": "x", "type": 2} ] }, ... ],
 *   "functions": [ { "id": 0, "name": "translate", "params": [9, 2], "returns": 0, "intrinsic": "NONE" }, ... ],
 *   "bodies": [ { "fn": 0, "params": [ {"local": 0, "name": "self", "type": 9} ], "body": { "stmt": "block", ... } } ]
 * }
 * </pre>
 * 基本类型预先驻留在 0..6（unit, bool, i32, i64, f32, f64, string），
 * "types" 中的条目按顺序驻留，编号从 7 开始；条目可带 "id" 字段用于核对。
 * <p>
 * 表达式节点的 "type" / "regime" 缺失时保持为 null，由核心报告为编译器缺陷。
 */
public class TypedProgramReader {

    private final Gson gson = new GsonBuilder().create();

    public TypedProgram read(Reader reader) {
        JsonObject root = gson.fromJson(reader, JsonObject.class);
        if (root == null) throw new JsonParseException("empty input");
        return read(root);
    }

    public TypedProgram read(JsonObject root) {
        String source = root.has("source") ? root.get("source").getAsString() : "<input>";
        TypeTable types = readTypes(array(root, "types"));
        SymbolTable symbols = readSymbols(array(root, "functions"));

        List<FunDecl> bodies = new ArrayList<>();
        for (JsonElement e : array(root, "bodies")) {
            bodies.add(readBody(e.getAsJsonObject(), source, symbols));
        }
        return new TypedProgram(source, types, symbols, bodies);
    }

    // ========== 驻留表 ==========

    private TypeTable readTypes(JsonArray entries) {
        TypeTable.Builder builder = TypeTable.builder();
        for (JsonElement e : entries) {
            JsonObject t = e.getAsJsonObject();
            String kind = string(t, "kind");
            TypeId id;
            switch (kind) {
                case "struct": {
                    List<TypeDesc.StructField> fields = new ArrayList<>();
                    for (JsonElement f : array(t, "fields")) {
                        JsonObject field = f.getAsJsonObject();
                        fields.add(new TypeDesc.StructField(FieldId.of(integer(field, "id")),
                                string(field, "name"), TypeId.of(integer(field, "type"))));
                    }
                    id = builder.struct(string(t, "name"), fields);
                    break;
                }
                case "gc_ref":
                    id = builder.gcRef(TypeId.of(integer(t, "pointee")));
                    break;
                case "manual_ref":
                    id = builder.manualRef(TypeId.of(integer(t, "pointee")));
                    break;
                case "borrow":
                    id = builder.borrow(TypeId.of(integer(t, "pointee")));
                    break;
                case "array":
                    id = builder.array(TypeId.of(integer(t, "element")), integer(t, "length"));
                    break;
                default:
                    throw new JsonParseException("unknown type kind: " + kind);
            }
            if (t.has("id") && t.get("id").getAsInt() != id.getIndex()) {
                throw new JsonParseException("type entry declares id " + t.get("id").getAsInt()
                        + " but was interned as " + id.getIndex());
            }
        }
        return builder.build();
    }

    private SymbolTable readSymbols(JsonArray entries) {
        SymbolTable.Builder builder = SymbolTable.builder();
        for (JsonElement e : entries) {
            JsonObject f = e.getAsJsonObject();
            int id = integer(f, "id");
            List<TypeId> params = new ArrayList<>();
            for (JsonElement p : array(f, "params")) {
                params.add(TypeId.of(p.getAsInt()));
            }
            Intrinsic intrinsic = f.has("intrinsic")
                    ? Intrinsic.valueOf(string(f, "intrinsic").toUpperCase(Locale.ROOT))
                    : Intrinsic.NONE;
            builder.add(new FnSignature(FnId.of(id), SymbolId.of(id), string(f, "name"), params,
                    TypeId.of(integer(f, "returns")), intrinsic));
        }
        return builder.build();
    }

    // ========== 函数体 ==========

    private FunDecl readBody(JsonObject body, String source, SymbolTable symbols) {
        FnId id = FnId.of(integer(body, "fn"));
        FnSignature sig = symbols.function(id);
        if (sig == null) throw new JsonParseException("body for undeclared function " + id);
        List<Parameter> params = new ArrayList<>();
        for (JsonElement e : array(body, "params")) {
            JsonObject p = e.getAsJsonObject();
            params.add(new Parameter(location(p, source), LocalId.of(integer(p, "local")),
                    string(p, "name"), TypeId.of(integer(p, "type"))));
        }
        Statement stmt = readStmt(body.getAsJsonObject("body"), source);
        if (!(stmt instanceof Block)) throw new JsonParseException(sig.getName() + ": body must be a block");
        return new FunDecl(location(body, source), id, sig.getName(), params, sig.getReturnType(), (Block) stmt);
    }

    private Statement readStmt(JsonObject s, String source) {
        if (s == null) return null;
        SourceLocation loc = location(s, source);
        String kind = string(s, "stmt");
        switch (kind) {
            case "block": {
                List<Statement> stmts = new ArrayList<>();
                for (JsonElement e : array(s, "stmts")) {
                    stmts.add(readStmt(e.getAsJsonObject(), source));
                }
                return new Block(loc, stmts);
            }
            case "expr":
                return new ExpressionStmt(loc, readExpr(s.getAsJsonObject("expr"), source));
            case "let":
                return new LetStmt(loc, LocalId.of(integer(s, "local")), string(s, "name"),
                        TypeId.of(integer(s, "type")), readExpr(object(s, "init"), source));
            case "if":
                return new IfStmt(loc, readExpr(s.getAsJsonObject("cond"), source),
                        readStmt(s.getAsJsonObject("then"), source), readStmt(object(s, "else"), source));
            case "while":
                return new WhileStmt(loc, optString(s, "label"), readExpr(s.getAsJsonObject("cond"), source),
                        readStmt(s.getAsJsonObject("body"), source));
            case "for":
                return new ForStmt(loc, optString(s, "label"), readStmt(object(s, "init"), source),
                        readExpr(object(s, "cond"), source), readExpr(object(s, "update"), source),
                        readStmt(s.getAsJsonObject("body"), source));
            case "break":
                return new BreakStmt(loc, optString(s, "label"));
            case "continue":
                return new ContinueStmt(loc, optString(s, "label"));
            case "return":
                return new ReturnStmt(loc, readExpr(object(s, "value"), source));
            default:
                throw new JsonParseException("unknown statement kind: " + kind);
        }
    }

    private Expression readExpr(JsonObject e, String source) {
        if (e == null) return null;
        SourceLocation loc = location(e, source);
        TypeId type = e.has("type") ? TypeId.of(e.get("type").getAsInt()) : null;
        Regime regime = e.has("regime") ? Regime.valueOf(string(e, "regime").toUpperCase(Locale.ROOT)) : null;
        String kind = string(e, "expr");
        switch (kind) {
            case "lit":
                return readLiteral(e, loc, type, regime);
            case "local":
                return new LocalRef(loc, type, regime, LocalId.of(integer(e, "local")), optString(e, "name"));
            case "field":
                return new FieldAccess(loc, type, regime, readExpr(e.getAsJsonObject("target"), source),
                        FieldId.of(integer(e, "field")), integer(e, "index"));
            case "deref":
                return new DerefExpr(loc, type, regime, readExpr(e.getAsJsonObject("operand"), source));
            case "move":
                return new MoveExpr(loc, type, regime, readExpr(e.getAsJsonObject("operand"), source));
            case "index":
                return new IndexExpr(loc, type, regime, readExpr(e.getAsJsonObject("target"), source),
                        readExpr(e.getAsJsonObject("index"), source));
            case "unary":
                return new UnaryExpr(loc, type, regime, UnaryExpr.UnaryOp.valueOf(string(e, "op")),
                        readExpr(e.getAsJsonObject("operand"), source));
            case "binary":
                return new BinaryExpr(loc, type, regime, readExpr(e.getAsJsonObject("left"), source),
                        BinaryExpr.BinaryOp.valueOf(string(e, "op")), readExpr(e.getAsJsonObject("right"), source));
            case "call":
                return new CallExpr(loc, type, regime, FnId.of(integer(e, "fn")), readExprs(array(e, "args"), source));
            case "method":
                return new MethodCallExpr(loc, type, regime, readExpr(e.getAsJsonObject("receiver"), source),
                        FnId.of(integer(e, "fn")), optString(e, "name"), readExprs(array(e, "args"), source));
            case "struct":
                return new StructLiteral(loc, type, regime, readExprs(array(e, "fields"), source));
            case "assign":
                return new AssignExpr(loc, type, regime, readExpr(e.getAsJsonObject("target"), source),
                        e.has("op") ? AssignExpr.AssignOp.valueOf(string(e, "op")) : AssignExpr.AssignOp.ASSIGN,
                        readExpr(e.getAsJsonObject("value"), source));
            case "cond":
                return new ConditionalExpr(loc, type, regime, readExpr(e.getAsJsonObject("cond"), source),
                        readExpr(e.getAsJsonObject("then"), source), readExpr(e.getAsJsonObject("else"), source));
            case "interp": {
                List<StringInterpolation.StringPart> parts = new ArrayList<>();
                for (JsonElement p : array(e, "parts")) {
                    JsonObject part = p.getAsJsonObject();
                    SourceLocation partLoc = location(part, source);
                    if (part.has("text")) {
                        parts.add(new StringInterpolation.LiteralPart(partLoc, string(part, "text")));
                    } else {
                        parts.add(new StringInterpolation.ExprPart(partLoc,
                                readExpr(part.getAsJsonObject("expr"), source)));
                    }
                }
                return new StringInterpolation(loc, type, regime, parts);
            }
            default:
                throw new JsonParseException("unknown expression kind: " + kind);
        }
    }

    private Literal readLiteral(JsonObject e, SourceLocation loc, TypeId type, Regime regime) {
        Literal.LiteralKind kind = Literal.LiteralKind.valueOf(string(e, "kind").toUpperCase(Locale.ROOT));
        JsonElement v = e.get("value");
        Object value;
        switch (kind) {
            case BOOL:   value = v.getAsBoolean(); break;
            case I32:    value = v.getAsInt(); break;
            case I64:    value = v.getAsLong(); break;
            case F32:    value = v.getAsFloat(); break;
            case F64:    value = v.getAsDouble(); break;
            case STRING: value = v.getAsString(); break;
            default:     value = null; break;
        }
        return new Literal(loc, type, regime, value, kind);
    }

    private List<Expression> readExprs(JsonArray array, String source) {
        List<Expression> result = new ArrayList<>(array.size());
        for (JsonElement e : array) {
            result.add(readExpr(e.getAsJsonObject(), source));
        }
        return result;
    }

    // ========== 字段访问 ==========

    private static SourceLocation location(JsonObject node, String source) {
        if (!node.has("at")) return SourceLocation.UNKNOWN;
        JsonArray at = node.getAsJsonArray("at");
        return SourceLocation.of(source, at.get(0).getAsInt(), at.size() > 1 ? at.get(1).getAsInt() : 0);
    }

    private static JsonArray array(JsonObject node, String key) {
        return node.has(key) ? node.getAsJsonArray(key) : new JsonArray();
    }

    private static JsonObject object(JsonObject node, String key) {
        return node.has(key) && node.get(key).isJsonObject() ? node.getAsJsonObject(key) : null;
    }

    private static String string(JsonObject node, String key) {
        if (!node.has(key)) throw new JsonParseException("missing \"" + key + "\" in " + node);
        return node.get(key).getAsString();
    }

    private static String optString(JsonObject node, String key) {
        return node.has(key) && !node.get(key).isJsonNull() ? node.get(key).getAsString() : null;
    }

    private static int integer(JsonObject node, String key) {
        if (!node.has(key)) throw new JsonParseException("missing \"" + key + "\" in " + node);
        return node.get(key).getAsInt();
    }
}
