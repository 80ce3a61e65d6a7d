package com.astrallang.compiler.analysis;

/**
 * 变量来源
 */
public enum VariableKind {
    LOCAL,              // let
    PARAMETER,          // 函数参数
    LOOP_VARIABLE,      // for 循环变量
    PATTERN_BINDING     // match 模式绑定
}
