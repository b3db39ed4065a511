package com.keellang.ir.mir;

/**
 * 局部变量种类。局部变量表顺序固定为：返回槽、参数、其余。
 */
public enum LocalKind {
    RETURN,
    ARG,
    USER,
    TEMP
}
