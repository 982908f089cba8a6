package org.llasm.compiler.ir;

import java.util.List;

/**
 * A lowered module. The order of each list is source order.
 *
 * @param sourceName The name of the source the module was lowered from.
 * @param comdats The comdat definitions.
 * @param globals The global variables.
 * @param functions The functions.
 */
public record IrModule(String sourceName, List<IrComdat> comdats, List<IrGlobal> globals, List<IrFunction> functions) {
}
