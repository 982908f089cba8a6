package org.llasm.compiler.frontend.semantics;

import org.llasm.compiler.api.LoweringErrorCode;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.api.SourceInfo;
import org.llasm.compiler.frontend.lexer.TokenType;
import org.llasm.compiler.ir.IrBasicBlock;
import org.llasm.compiler.ir.IrIntType;
import org.llasm.compiler.ir.IrParam;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.llasm.compiler.frontend.parser.ast.Nodes.tok;

/**
 * Unit tests for {@link SymbolTable}: declaration, resolution and kind checking.
 */
@Tag("unit")
class SymbolTableTest {

    private final IrParam x = new IrParam("x", new IrIntType(32));
    private final IrBasicBlock entry = new IrBasicBlock("entry");
    private SymbolTable table;

    @BeforeEach
    void setUp() throws LoweringException {
        table = SymbolTable.builder()
                .declare(Symbol.value("x", x, tok(TokenType.LOCAL_IDENT, "%x", 1)))
                .declare(Symbol.block("entry", entry, tok(TokenType.LABEL_IDENT, "entry:", 2)))
                .build();
    }

    @Test
    void resolvesByKind() throws LoweringException {
        assertThat(table.resolveValue("x", "operand", SourceInfo.UNKNOWN)).isSameAs(x);
        assertThat(table.resolveBlock("entry", "branch target", SourceInfo.UNKNOWN)).isSameAs(entry);
        assertThat(table.names()).containsExactly("x", "entry");
    }

    @Test
    void missingNameIsUnresolvedReference() {
        LoweringException e = catchThrowableOfType(
                () -> table.resolve("y", "phi incoming", SourceInfo.UNKNOWN), LoweringException.class);

        assertThat(e.code()).isEqualTo(LoweringErrorCode.UNRESOLVED_REFERENCE);
        assertThat(e.offending()).isEqualTo("y");
        assertThat(e.construct()).isEqualTo("phi incoming");
    }

    @Test
    void valueUsedAsBlockIsKindMismatch() {
        LoweringException e = catchThrowableOfType(
                () -> table.resolveBlock("x", "branch target", SourceInfo.UNKNOWN), LoweringException.class);

        assertThat(e.code()).isEqualTo(LoweringErrorCode.KIND_MISMATCH);
        assertThat(e.getMessage()).contains("expected basic block, got value");
    }

    @Test
    void blockUsedAsValueIsKindMismatch() {
        LoweringException e = catchThrowableOfType(
                () -> table.resolveValue("entry", "add operand", SourceInfo.UNKNOWN), LoweringException.class);

        assertThat(e.code()).isEqualTo(LoweringErrorCode.KIND_MISMATCH);
    }

    @Test
    void redeclarationIsRedefinition() {
        SymbolTable.Builder builder = SymbolTable.builder();

        LoweringException e = catchThrowableOfType(() -> builder
                .declare(Symbol.value("x", x, tok(TokenType.LOCAL_IDENT, "%x", 3)))
                .declare(Symbol.block("x", entry, tok(TokenType.LABEL_IDENT, "x:", 7))), LoweringException.class);

        assertThat(e.code()).isEqualTo(LoweringErrorCode.REDEFINITION);
        assertThat(e.source().lineNumber()).isEqualTo(7);
        assertThat(e.getMessage()).contains("line 3");
    }

    @Test
    void builtTableIsUnaffectedByLaterDeclarations() throws LoweringException {
        SymbolTable.Builder builder = SymbolTable.builder().declare(Symbol.value("a", x, null));
        SymbolTable snapshot = builder.build();

        builder.declare(Symbol.value("b", x, null));

        assertThat(snapshot.contains("b")).isFalse();
        assertThat(builder.build().size()).isEqualTo(2);
    }
}
