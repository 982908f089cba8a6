package org.llasm.compiler.ir.enums;

public enum DllStorageClass {
    NONE,
    DLL_EXPORT,
    DLL_IMPORT,
}
