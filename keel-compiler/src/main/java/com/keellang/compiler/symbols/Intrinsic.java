package com.keellang.compiler.symbols;

/**
 * 由上游声明、被本核心特殊识别的内建函数。
 */
public enum Intrinsic {
    NONE,
    /** 手动释放（free），只接受 MANUAL_HANDLE 操作数 */
    RELEASE,
    /** 字符串拼接 (string, string) → string */
    STRING_CONCAT,
    /** 任意值 → string */
    TO_STRING
}
