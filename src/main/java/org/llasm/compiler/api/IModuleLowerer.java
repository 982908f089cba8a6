package org.llasm.compiler.api;

import org.llasm.compiler.frontend.parser.ast.ModuleNode;
import org.llasm.compiler.ir.IrModule;

/**
 * Public entry point of the lowering core.
 */
public interface IModuleLowerer {

    /**
     * Lowers a parsed module into the resolved program model.
     *
     * @param module The syntax tree produced by the parser.
     * @param sourceName The name of the source, used for diagnostics and model metadata.
     * @return The lowered module.
     * @throws LoweringFailedException if any unit failed to lower.
     */
    IrModule lower(ModuleNode module, String sourceName) throws LoweringFailedException;
}
