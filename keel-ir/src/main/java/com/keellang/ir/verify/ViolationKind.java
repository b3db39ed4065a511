package com.keellang.ir.verify;

/**
 * 校验器可报告的不变量类别。
 */
public enum ViolationKind {
    /** 块缺少终止指令 */
    MISSING_TERMINATOR,
    /** 跳转目标不存在，或块 ID 与位置不一致 */
    INVALID_TARGET,
    /** 入口块被函数内的跳转指向 */
    ENTRY_HAS_PREDECESSOR,
    /** 引用了局部变量表之外的局部变量 */
    UNDECLARED_LOCAL,
    TYPE_MISMATCH,
    /** 借用被存储、返回或在合成它的语句窗口之外被读取 */
    BORROW_ESCAPE,
    /** 释放操作的操作数不是手动句柄，或局部变量制式与类型不符 */
    REGIME_MISMATCH,
    /** 读取可能已被移动的局部变量（仅严格模式） */
    USE_AFTER_MOVE
}
