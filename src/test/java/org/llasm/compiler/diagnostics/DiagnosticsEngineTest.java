package org.llasm.compiler.diagnostics;

import org.llasm.compiler.api.LoweringErrorCode;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.api.SourceInfo;
import org.llasm.compiler.api.UnimplementedFeatureException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DiagnosticsEngineTest {

    @Test
    void freshEngineHasNoErrors() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.errorCount()).isZero();
        assertThat(engine.summary()).isEmpty();
    }

    @Test
    void loweringFailuresCarryTheirCodeAndPosition() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        SourceInfo at = new SourceInfo("a.ll", 7, 3, "%x");

        engine.report(new LoweringException(LoweringErrorCode.UNRESOLVED_REFERENCE, "x", "operand",
                "unable to locate local 'x'", at));
        engine.report(new UnimplementedFeatureException("instruction", "store"), at);

        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.errorCount()).isEqualTo(2);
        assertThat(engine.getDiagnostics()).extracting(Diagnostic::type).containsOnly(Diagnostic.Type.ERROR);
        assertThat(engine.getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly("UNRESOLVED_REFERENCE", DiagnosticsEngine.UNIMPLEMENTED);
        assertThat(engine.summary()).isEqualTo(
                "[ERROR] a.ll:7: unable to locate local 'x' (UNRESOLVED_REFERENCE)\n"
                        + "[ERROR] a.ll:7: support for instruction store not yet implemented (UNIMPLEMENTED)");
    }
}
