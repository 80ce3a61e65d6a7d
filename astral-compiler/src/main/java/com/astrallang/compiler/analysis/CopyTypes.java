package com.astrallang.compiler.analysis;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Copy 类型判定：标量与共享引用可自由复制，其余类型（string、数组、结构体、枚举、unknown）按移动语义跟踪
 */
public final class CopyTypes {

    private static final Set<String> SCALARS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "int", "i8", "i16", "i32", "i64", "isize",
            "u8", "u16", "u32", "u64", "usize",
            "bool", "char"
    )));

    private CopyTypes() {}

    public static boolean isCopy(String typeName) {
        if (typeName == null) return false;
        // 引用不拥有其指向的值
        if (typeName.startsWith("&")) return true;
        return SCALARS.contains(typeName);
    }
}
