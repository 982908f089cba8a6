package org.llasm.compiler.frontend.semantics;

import org.llasm.compiler.api.InternalConsistencyException;
import org.llasm.compiler.api.LoweringErrorCode;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.api.SourceInfo;
import org.llasm.compiler.ir.IrBasicBlock;
import org.llasm.compiler.ir.IrIntType;
import org.llasm.compiler.ir.IrParam;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@Tag("unit")
class ForwardReferenceResolverTest {

    private final ForwardReferenceResolver resolver = new ForwardReferenceResolver("@f");

    @Test
    void forwardReferenceResolvesAfterDeclarationsComplete() throws LoweringException {
        IrBasicBlock entry = new IrBasicBlock("entry");
        IrBasicBlock exit = new IrBasicBlock("exit");
        resolver.declareBlock("entry", entry, null);
        resolver.declareBlock("exit", exit, null);

        resolver.completeDeclarations();

        assertThat(resolver.phase()).isEqualTo(ForwardReferenceResolver.Phase.RESOLVING);
        assertThat(resolver.resolveBlock("exit", "branch target", SourceInfo.UNKNOWN)).isSameAs(exit);
    }

    @Test
    void lookupWhileDeclaringSeesOnlyEarlierNames() throws LoweringException {
        resolver.declareBlock("entry", new IrBasicBlock("entry"), null);

        LoweringException e = catchThrowableOfType(
                () -> resolver.resolveBlock("exit", "branch target", SourceInfo.UNKNOWN), LoweringException.class);
        assertThat(e.code()).isEqualTo(LoweringErrorCode.UNRESOLVED_REFERENCE);
        assertThat(resolver.resolveBlock("entry", "branch target", SourceInfo.UNKNOWN)).isNotNull();
    }

    @Test
    void kindIsCheckedOnResolution() throws LoweringException {
        resolver.declareValue("v", new IrParam("v", IrIntType.I1), null);
        resolver.completeDeclarations();

        LoweringException e = catchThrowableOfType(
                () -> resolver.resolveBlock("v", "phi incoming predecessor", SourceInfo.UNKNOWN), LoweringException.class);
        assertThat(e.code()).isEqualTo(LoweringErrorCode.KIND_MISMATCH);
    }

    @Test
    void declaringAfterCompletionIsInternalError() {
        resolver.completeDeclarations();

        assertThatThrownBy(() -> resolver.declareBlock("late", new IrBasicBlock("late"), null))
                .isInstanceOf(InternalConsistencyException.class);
        assertThatThrownBy(resolver::completeDeclarations).isInstanceOf(InternalConsistencyException.class);
    }

    @Test
    void tableIsOnlyAvailableAfterCompletion() {
        assertThatThrownBy(resolver::table).isInstanceOf(InternalConsistencyException.class);

        resolver.completeDeclarations();

        assertThat(resolver.table().size()).isZero();
    }
}
