package com.astrallang.compiler.analysis;

/**
 * 所有权检查错误分类
 */
public enum ErrorKind {
    UNDEFINED_VARIABLE,
    USE_OF_MOVED_VALUE,
    ASSIGN_TO_IMMUTABLE,
    MUTATE_WHILE_BORROWED,
    MOVE_WHILE_BORROWED,
    BREAK_OUTSIDE_LOOP,
    CONTINUE_OUTSIDE_LOOP
}
