package org.llasm.compiler.ir;

import org.llasm.compiler.ir.enums.DllStorageClass;
import org.llasm.compiler.ir.enums.Linkage;
import org.llasm.compiler.ir.enums.Preemption;
import org.llasm.compiler.ir.enums.UnnamedAddr;
import org.llasm.compiler.ir.enums.Visibility;

/**
 * Linkage-related attributes shared by global variables and functions.
 *
 * @param linkage The linkage.
 * @param preemption The preemption specifier.
 * @param visibility The visibility.
 * @param dllStorageClass The DLL storage class.
 * @param unnamedAddr The unnamed address kind.
 */
public record IrLinkageAttributes(
        Linkage linkage,
        Preemption preemption,
        Visibility visibility,
        DllStorageClass dllStorageClass,
        UnnamedAddr unnamedAddr
) {
    /** All attributes absent. */
    public static final IrLinkageAttributes NONE = new IrLinkageAttributes(
            Linkage.NONE, Preemption.NONE, Visibility.NONE, DllStorageClass.NONE, UnnamedAddr.NONE);
}
