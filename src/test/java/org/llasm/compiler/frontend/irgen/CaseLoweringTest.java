package org.llasm.compiler.frontend.irgen;

import org.llasm.compiler.api.LoweringErrorCode;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.api.SourceInfo;
import org.llasm.compiler.frontend.parser.ast.CaseNode;
import org.llasm.compiler.frontend.semantics.ForwardReferenceResolver;
import org.llasm.compiler.ir.IrBasicBlock;
import org.llasm.compiler.ir.IrCase;
import org.llasm.compiler.ir.IrIntConst;
import org.llasm.compiler.ir.IrIntType;
import org.llasm.compiler.ir.IrParam;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.llasm.compiler.frontend.parser.ast.Nodes.caseOf;
import static org.llasm.compiler.frontend.parser.ast.Nodes.i;
import static org.llasm.compiler.frontend.parser.ast.Nodes.intLit;
import static org.llasm.compiler.frontend.parser.ast.Nodes.intType;
import static org.llasm.compiler.frontend.parser.ast.Nodes.typed;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link CaseLowering}. The constant lowerer is mocked so that each half of a
 * switch arm can be made to fail independently.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class CaseLoweringTest {

    private static final IrIntType I32 = new IrIntType(32);

    @Mock
    private ConstantLowerer constants;

    private final IrBasicBlock one = new IrBasicBlock("one");
    private ForwardReferenceResolver locals;
    private CaseLowering cases;

    @BeforeEach
    void setUp() throws LoweringException {
        locals = new ForwardReferenceResolver("@f");
        locals.declareBlock("one", one, null);
        locals.declareValue("v", new IrParam("v", I32), null);
        locals.completeDeclarations();
        cases = new CaseLowering(constants, locals);
    }

    @Test
    void lowersDiscriminantAndTarget() throws LoweringException {
        CaseNode n = caseOf(typed(i(32), intLit("1")), "%one");
        IrIntConst c = new IrIntConst(I32, 1);
        when(constants.lower(eq(I32), any())).thenReturn(c);

        IrCase result = cases.lower(n);

        assertThat(result.x()).isSameAs(c);
        assertThat(result.target()).isSameAs(one);
        verify(constants).lower(I32, n.x().value());
    }

    @Test
    void unresolvedTargetFailsWholeCase() throws LoweringException {
        when(constants.lower(eq(I32), any())).thenReturn(new IrIntConst(I32, 2));

        LoweringException e = catchThrowableOfType(
                () -> cases.lower(caseOf(typed(i(32), intLit("2")), "%missing")), LoweringException.class);

        assertThat(e.code()).isEqualTo(LoweringErrorCode.UNRESOLVED_REFERENCE);
        assertThat(e.construct()).isEqualTo("switch case target");
        assertThat(e.offending()).isEqualTo("missing");
    }

    @Test
    void targetNamingValueIsKindMismatch() throws LoweringException {
        when(constants.lower(eq(I32), any())).thenReturn(new IrIntConst(I32, 3));

        LoweringException e = catchThrowableOfType(
                () -> cases.lower(caseOf(typed(i(32), intLit("3")), "%v")), LoweringException.class);

        assertThat(e.code()).isEqualTo(LoweringErrorCode.KIND_MISMATCH);
        assertThat(e.construct()).isEqualTo("switch case target");
    }

    @Test
    void failingDiscriminantKeepsErrorCodeAndSkipsTarget() throws LoweringException {
        LoweringException cause = new LoweringException(LoweringErrorCode.INVALID_INTEGER_CONSTANT, "99999999999",
                "integer constant", "value out of range", SourceInfo.UNKNOWN);
        when(constants.lower(eq(I32), any())).thenThrow(cause);

        LoweringException e = catchThrowableOfType(
                () -> cases.lower(caseOf(typed(i(32), intLit("99999999999")), "%missing")), LoweringException.class);

        assertThat(e.code()).isEqualTo(LoweringErrorCode.INVALID_INTEGER_CONSTANT);
        assertThat(e.construct()).isEqualTo("switch case discriminant");
        assertThat(e).hasCause(cause);
    }

    @Test
    void invalidDiscriminantTypeNeverReachesConstantLowerer() {
        LoweringException e = catchThrowableOfType(
                () -> cases.lower(caseOf(typed(intType("i0"), intLit("1")), "%one")),
                LoweringException.class);

        assertThat(e.code()).isEqualTo(LoweringErrorCode.INVALID_TYPE);
        assertThat(e.construct()).isEqualTo("switch case discriminant");
        verifyNoInteractions(constants);
    }
}
