package org.llasm.compiler.frontend.semantics;

import org.llasm.compiler.api.LoweringErrorCode;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.api.SourceInfo;
import org.llasm.compiler.ir.IrBasicBlock;
import org.llasm.compiler.ir.IrValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable mapping from names to symbols.
 * <p>
 * Tables are built with a {@link Builder}; names are unique within one table. Lookups report
 * failures as {@link LoweringException}s naming the construct that performed the lookup.
 */
public final class SymbolTable {

    private static final SymbolTable EMPTY = new SymbolTable(Map.of());

    private final Map<String, Symbol> symbols;

    private SymbolTable(Map<String, Symbol> symbols) {
        this.symbols = symbols;
    }

    public static SymbolTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param name A decoded name.
     * @return The symbol, or empty if the name is not declared.
     */
    public Optional<Symbol> lookup(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * Resolves a name regardless of its kind.
     *
     * @param name A decoded name.
     * @param construct The construct containing the reference, e.g. "phi incoming".
     * @param at The position of the reference.
     * @return The symbol.
     * @throws LoweringException with {@link LoweringErrorCode#UNRESOLVED_REFERENCE} if undeclared.
     */
    public Symbol resolve(String name, String construct, SourceInfo at) throws LoweringException {
        Symbol symbol = symbols.get(name);
        if (symbol == null) {
            throw new LoweringException(LoweringErrorCode.UNRESOLVED_REFERENCE, name, construct,
                    String.format("unable to locate %s %s", construct, quote(name)), at);
        }
        return symbol;
    }

    /**
     * @return The basic block bound to {@code name}.
     * @throws LoweringException if undeclared, or with {@link LoweringErrorCode#KIND_MISMATCH} if
     *         the name does not denote a basic block.
     */
    public IrBasicBlock resolveBlock(String name, String construct, SourceInfo at) throws LoweringException {
        Symbol symbol = resolve(name, construct, at);
        if (symbol.kind() != Symbol.Kind.BASIC_BLOCK || !(symbol.entity() instanceof IrBasicBlock block)) {
            throw kindMismatch(symbol, Symbol.Kind.BASIC_BLOCK, construct, at);
        }
        return block;
    }

    /**
     * @return The value bound to {@code name}.
     * @throws LoweringException if undeclared, or with {@link LoweringErrorCode#KIND_MISMATCH} if
     *         the name does not denote a value.
     */
    public IrValue resolveValue(String name, String construct, SourceInfo at) throws LoweringException {
        Symbol symbol = resolve(name, construct, at);
        if (symbol.kind() != Symbol.Kind.VALUE) {
            throw kindMismatch(symbol, Symbol.Kind.VALUE, construct, at);
        }
        return symbol.entity();
    }

    public boolean contains(String name) {
        return symbols.containsKey(name);
    }

    /**
     * @return The declared names in declaration order.
     */
    public Set<String> names() {
        return symbols.keySet();
    }

    public int size() {
        return symbols.size();
    }

    private static LoweringException kindMismatch(Symbol symbol, Symbol.Kind expected, String construct, SourceInfo at) {
        return new LoweringException(LoweringErrorCode.KIND_MISMATCH, symbol.name(), construct,
                String.format("invalid %s %s; expected %s, got %s", construct, quote(symbol.name()),
                        describe(expected), describe(symbol.kind())), at);
    }

    private static String describe(Symbol.Kind kind) {
        switch (kind) {
            case VALUE:
                return "value";
            case BASIC_BLOCK:
                return "basic block";
            default:
                return "other entity";
        }
    }

    private static String quote(String name) {
        return "'" + name + "'";
    }

    @Override
    public String toString() {
        return "SymbolTable" + symbols.keySet();
    }

    /**
     * Accumulates declarations. Not thread-safe.
     */
    public static final class Builder {
        private final Map<String, Symbol> symbols = new LinkedHashMap<>();

        private Builder() {}

        /**
         * @param symbol The symbol to add.
         * @return This builder.
         * @throws LoweringException with {@link LoweringErrorCode#REDEFINITION} if the name is taken.
         */
        public Builder declare(Symbol symbol) throws LoweringException {
            Symbol previous = symbols.get(symbol.name());
            if (previous != null) {
                SourceInfo at = symbol.declaredAt() != null ? symbol.declaredAt().source() : SourceInfo.UNKNOWN;
                String where = previous.declaredAt() != null
                        ? " (first declared at line " + previous.declaredAt().line() + ")"
                        : "";
                throw new LoweringException(LoweringErrorCode.REDEFINITION, symbol.name(), "declaration",
                        String.format("redefinition of %s%s", quote(symbol.name()), where), at);
            }
            symbols.put(symbol.name(), symbol);
            return this;
        }

        public boolean contains(String name) {
            return symbols.containsKey(name);
        }

        /**
         * @return An immutable table of the symbols declared so far; the builder stays usable.
         */
        public SymbolTable build() {
            return new SymbolTable(Collections.unmodifiableMap(new LinkedHashMap<>(symbols)));
        }
    }
}
