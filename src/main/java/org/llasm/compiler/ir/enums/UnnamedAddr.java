package org.llasm.compiler.ir.enums;

public enum UnnamedAddr {
    NONE,
    LOCAL_UNNAMED_ADDR,
    UNNAMED_ADDR,
}
