package com.keellang.compiler.ast.decl;

import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.LocalId;
import com.keellang.compiler.types.TypeId;

/**
 * 函数参数
 */
public class Parameter {
    private final SourceLocation location;
    private final LocalId local;
    private final String name;
    private final TypeId type;

    public Parameter(SourceLocation location, LocalId local, String name, TypeId type) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.local = local;
        this.name = name;
        this.type = type;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public LocalId getLocal() {
        return local;
    }

    public String getName() {
        return name;
    }

    public TypeId getType() {
        return type;
    }
}
