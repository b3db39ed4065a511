package com.keellang.ir.pass;

import com.keellang.ir.mir.MirFunction;

/**
 * MIR 优化 pass 接口。
 */
public interface MirPass {

    /**
     * Pass 名称。
     */
    String getName();

    /**
     * 对 MIR 函数执行优化，返回新的函数；输入不被修改。
     */
    MirFunction run(MirFunction function, PassContext context);
}
