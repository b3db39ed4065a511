package com.keellang.compiler.types;

/**
 * 类型的存储/所有权制式。
 * 制式之间从不隐式转换，所有转换都是 IR 中的显式操作。
 */
public enum Regime {
    /** 内联值，复制即整体复制 */
    VALUE,
    /** GC 堆句柄，由收集器追踪 */
    GC_HANDLE,
    /** 手动管理的堆句柄，需要显式释放 */
    MANUAL_HANDLE,
    /** 内部借用：不分配、不跨语句复制、不可存储或返回 */
    BORROW;

    public boolean isHandle() {
        return this == GC_HANDLE || this == MANUAL_HANDLE;
    }
}
