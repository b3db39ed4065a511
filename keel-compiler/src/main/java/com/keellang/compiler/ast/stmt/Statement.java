package com.keellang.compiler.ast.stmt;

import com.keellang.compiler.ast.AstNode;
import com.keellang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
