package org.llasm.compiler.frontend.semantics;

import org.llasm.compiler.api.InternalConsistencyException;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.api.SourceInfo;
import org.llasm.compiler.frontend.lexer.Token;
import org.llasm.compiler.ir.IrBasicBlock;
import org.llasm.compiler.ir.IrValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves references that may precede their definition within one function.
 * <p>
 * The resolver runs in two phases. While {@link Phase#DECLARING}, every named entity of the
 * function (parameters, basic blocks, instruction results) is declared. After
 * {@link #completeDeclarations()} the table is frozen and every reference can be resolved,
 * regardless of where in the function its target was declared. Lookups made while still
 * declaring only see the names declared so far.
 * <p>
 * One instance serves exactly one function and is discarded afterwards.
 */
public final class ForwardReferenceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ForwardReferenceResolver.class);

    /**
     * The lifecycle of a resolver.
     */
    public enum Phase {
        /** Entities are being declared. */
        DECLARING,
        /** Declarations are complete; the table is frozen. */
        RESOLVING
    }

    private final String scopeName;
    private final SymbolTable.Builder builder = SymbolTable.builder();
    private SymbolTable table;

    /**
     * @param scopeName The name of the function being lowered, for logging.
     */
    public ForwardReferenceResolver(String scopeName) {
        this.scopeName = scopeName;
    }

    public Phase phase() {
        return table == null ? Phase.DECLARING : Phase.RESOLVING;
    }

    /**
     * @param symbol The symbol to declare.
     * @throws LoweringException if the name is already declared in this function.
     * @throws InternalConsistencyException if declarations are already complete.
     */
    public void declare(Symbol symbol) throws LoweringException {
        if (table != null) {
            throw new InternalConsistencyException("cannot declare '" + symbol.name() + "' in " + scopeName
                    + " after declarations were completed");
        }
        builder.declare(symbol);
    }

    public void declareValue(String name, IrValue value, Token declaredAt) throws LoweringException {
        declare(Symbol.value(name, value, declaredAt));
    }

    public void declareBlock(String name, IrBasicBlock block, Token declaredAt) throws LoweringException {
        declare(Symbol.block(name, block, declaredAt));
    }

    /**
     * Freezes the table and switches to {@link Phase#RESOLVING}.
     *
     * @throws InternalConsistencyException if called twice.
     */
    public void completeDeclarations() {
        if (table != null) {
            throw new InternalConsistencyException("declarations of " + scopeName + " already completed");
        }
        table = builder.build();
        LOG.debug("Declared {} local names in {}", table.size(), scopeName);
    }

    public Symbol resolve(String name, String construct, SourceInfo at) throws LoweringException {
        return current().resolve(name, construct, at);
    }

    public IrValue resolveValue(String name, String construct, SourceInfo at) throws LoweringException {
        return current().resolveValue(name, construct, at);
    }

    public IrBasicBlock resolveBlock(String name, String construct, SourceInfo at) throws LoweringException {
        return current().resolveBlock(name, construct, at);
    }

    /**
     * @return The frozen table.
     * @throws InternalConsistencyException if declarations are not complete yet.
     */
    public SymbolTable table() {
        if (table == null) {
            throw new InternalConsistencyException("symbol table of " + scopeName + " requested before declarations were completed");
        }
        return table;
    }

    private SymbolTable current() {
        return table != null ? table : builder.build();
    }
}
