package com.keellang.cli.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.keellang.compiler.types.TypeId;
import com.keellang.compiler.types.TypeTable;
import com.keellang.ir.CompilationResult;
import com.keellang.ir.diag.Diagnostic;
import com.keellang.ir.mir.BasicBlock;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.MirLocal;
import com.keellang.ir.mir.MirSignature;
import com.keellang.ir.mir.MirStatement;
import com.keellang.ir.mir.MirTerminator;

/**
 * 把编译结果写成 JSON，供后端消费。
 * 每个函数输出签名、带制式的局部变量表、按编号排列的块与入口块编号（恒为 0）。
 * 语句以 MIR 文本形式输出；终止指令带有种类与目标块编号。
 */
public class MirJsonWriter {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    public String write(CompilationResult result) {
        return gson.toJson(toJson(result));
    }

    public JsonObject toJson(CompilationResult result) {
        TypeTable types = result.getModule().getTypes();
        JsonObject root = new JsonObject();
        root.addProperty("source", result.getModule().getSourceName());

        JsonArray functions = new JsonArray();
        for (MirFunction fn : result.getModule().getFunctions()) {
            functions.add(function(fn, types));
        }
        root.add("functions", functions);

        JsonArray diagnostics = new JsonArray();
        for (Diagnostic d : result.getDiagnostics()) {
            diagnostics.add(diagnostic(d));
        }
        root.add("diagnostics", diagnostics);
        return root;
    }

    private JsonObject function(MirFunction fn, TypeTable types) {
        JsonObject obj = new JsonObject();
        obj.addProperty("id", fn.getId().getIndex());
        obj.addProperty("name", fn.getName());

        MirSignature sig = fn.getSignature();
        JsonObject signature = new JsonObject();
        JsonArray params = new JsonArray();
        for (int i = 0; i < sig.getParamCount(); i++) {
            params.add(typed(sig.getParamTypes().get(i), sig.getParamRegimes().get(i).name(), types));
        }
        signature.add("params", params);
        signature.add("returns", typed(sig.getReturnType(), sig.getReturnRegime().name(), types));
        obj.add("signature", signature);

        JsonArray locals = new JsonArray();
        for (MirLocal local : fn.getLocals()) {
            JsonObject l = typed(local.getType(), local.getRegime().name(), types);
            l.addProperty("index", local.getIndex());
            l.addProperty("kind", local.getKind().name());
            if (local.getName() != null) l.addProperty("name", local.getName());
            locals.add(l);
        }
        obj.add("locals", locals);

        obj.addProperty("entry", 0);
        JsonArray blocks = new JsonArray();
        for (BasicBlock block : fn.getBlocks()) {
            JsonObject b = new JsonObject();
            b.addProperty("id", block.getId());
            JsonArray stmts = new JsonArray();
            for (MirStatement stmt : block.getStatements()) {
                stmts.add(stmt.toString());
            }
            b.add("statements", stmts);
            MirTerminator term = block.getTerminator();
            if (term != null) {
                b.add("terminator", terminator(term));
            } else {
                b.add("terminator", JsonNull.INSTANCE);
            }
            JsonArray successors = new JsonArray();
            if (term != null) {
                for (int succ : term.getSuccessors()) successors.add(succ);
            }
            b.add("successors", successors);
            blocks.add(b);
        }
        obj.add("blocks", blocks);
        return obj;
    }

    /**
     * 终止指令：kind 与跳转目标块编号，text 为 MIR 文本形式。
     */
    private static JsonObject terminator(MirTerminator term) {
        JsonObject obj = new JsonObject();
        if (term instanceof MirTerminator.Goto) {
            obj.addProperty("kind", "goto");
            obj.addProperty("target", ((MirTerminator.Goto) term).getTargetBlockId());
        } else if (term instanceof MirTerminator.Branch) {
            MirTerminator.Branch br = (MirTerminator.Branch) term;
            obj.addProperty("kind", "branch");
            obj.addProperty("condition", br.getCondition().toString());
            obj.addProperty("then", br.getThenBlock());
            obj.addProperty("else", br.getElseBlock());
        } else if (term instanceof MirTerminator.Switch) {
            MirTerminator.Switch sw = (MirTerminator.Switch) term;
            obj.addProperty("kind", "switch");
            obj.addProperty("key", sw.getKey().toString());
            JsonArray cases = new JsonArray();
            for (int i = 0; i < sw.getValues().size(); i++) {
                JsonObject c = new JsonObject();
                c.addProperty("value", sw.getValues().get(i));
                c.addProperty("target", sw.getTargets().get(i));
                cases.add(c);
            }
            obj.add("cases", cases);
            obj.addProperty("otherwise", sw.getDefaultBlock());
        } else if (term instanceof MirTerminator.Return) {
            obj.addProperty("kind", "return");
        } else if (term instanceof MirTerminator.Trap) {
            obj.addProperty("kind", "trap");
            obj.addProperty("reason", ((MirTerminator.Trap) term).getReason());
        } else {
            throw new IllegalStateException("unknown terminator " + term.getClass().getSimpleName());
        }
        obj.addProperty("text", term.toString());
        return obj;
    }

    private static JsonObject typed(TypeId type, String regime, TypeTable types) {
        JsonObject obj = new JsonObject();
        obj.addProperty("type", type.getIndex());
        obj.addProperty("display", types.display(type));
        obj.addProperty("regime", regime);
        return obj;
    }

    private static JsonObject diagnostic(Diagnostic d) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", d.getKind().name());
        obj.addProperty("stage", d.getStage().getDisplayName());
        obj.addProperty("function", d.getFunction());
        obj.addProperty("block", d.getBlock());
        obj.addProperty("instruction", d.getInstruction());
        obj.addProperty("message", d.getMessage());
        obj.addProperty("location", d.getLocation().toString());
        return obj;
    }
}
