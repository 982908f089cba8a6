package org.llasm.compiler.frontend.lowering;

import org.llasm.compiler.api.InternalConsistencyException;
import org.llasm.compiler.api.UnimplementedFeatureException;
import org.llasm.compiler.ir.enums.AtomicOp;
import org.llasm.compiler.ir.enums.AtomicOrdering;
import org.llasm.compiler.ir.enums.CallingConvention;
import org.llasm.compiler.ir.enums.DllStorageClass;
import org.llasm.compiler.ir.enums.FastMathFlag;
import org.llasm.compiler.ir.enums.FloatPredicate;
import org.llasm.compiler.ir.enums.IntPredicate;
import org.llasm.compiler.ir.enums.Linkage;
import org.llasm.compiler.ir.enums.OverflowFlag;
import org.llasm.compiler.ir.enums.Preemption;
import org.llasm.compiler.ir.enums.SelectionKind;
import org.llasm.compiler.ir.enums.Tail;
import org.llasm.compiler.ir.enums.TlsModel;
import org.llasm.compiler.ir.enums.UnnamedAddr;
import org.llasm.compiler.ir.enums.Visibility;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.llasm.compiler.frontend.parser.ast.Nodes.cc;
import static org.llasm.compiler.frontend.parser.ast.Nodes.ccNumber;
import static org.llasm.compiler.frontend.parser.ast.Nodes.kw;
import static org.llasm.compiler.frontend.parser.ast.Nodes.kws;
import static org.llasm.compiler.frontend.parser.ast.Nodes.threadLocal;

/**
 * Unit tests for {@link EnumResolver}: every vocabulary, the optional forms and the numeric
 * calling convention range.
 */
@Tag("unit")
class EnumResolverTest {

    @Test
    void everyTableRoundTripsItsSpellings() {
        for (KeywordTable<?> table : EnumResolver.tables()) {
            assertThat(table.spellings()).as(table.category()).isNotEmpty();
            for (String spelling : table.spellings()) {
                assertRoundTrip(table, spelling);
            }
        }
    }

    private static <E extends Enum<E>> void assertRoundTrip(KeywordTable<E> table, String spelling) {
        assertThat(table.spellingOf(table.lookup(spelling))).as(table.category()).contains(spelling);
    }

    @Test
    void everyTableRejectsUnknownSpelling() {
        for (KeywordTable<?> table : EnumResolver.tables()) {
            assertThatThrownBy(() -> table.lookup("no_such_keyword"))
                    .as(table.category())
                    .isInstanceOf(InternalConsistencyException.class)
                    .hasMessageContaining(table.category());
        }
    }

    @Test
    void tablesCoverAllSpelledValues() {
        assertThat(EnumResolver.LINKAGES.spellings()).hasSize(Linkage.values().length - 1);
        assertThat(EnumResolver.ATOMIC_OPS.spellings()).hasSize(AtomicOp.values().length);
        assertThat(EnumResolver.ATOMIC_ORDERINGS.spellings()).hasSize(AtomicOrdering.values().length);
        assertThat(EnumResolver.INT_PREDICATES.spellings()).hasSize(IntPredicate.values().length);
        assertThat(EnumResolver.FLOAT_PREDICATES.spellings()).hasSize(FloatPredicate.values().length);
        assertThat(EnumResolver.FAST_MATH_FLAGS.spellings()).hasSize(FastMathFlag.values().length);
        assertThat(EnumResolver.SELECTION_KINDS.spellings()).hasSize(SelectionKind.values().length);
    }

    @Test
    void resolvesRepresentativeKeywords() {
        assertThat(EnumResolver.linkage(kw("linkonce_odr"))).isEqualTo(Linkage.LINK_ONCE_ODR);
        assertThat(EnumResolver.visibility(kw("hidden"))).isEqualTo(Visibility.HIDDEN);
        assertThat(EnumResolver.atomicOrdering(kw("seq_cst"))).isEqualTo(AtomicOrdering.SEQ_CST);
        assertThat(EnumResolver.atomicOp(kw("umin"))).isEqualTo(AtomicOp.UMIN);
        assertThat(EnumResolver.intPredicate(kw("sle"))).isEqualTo(IntPredicate.SIGNED_LESS_THAN_OR_EQUAL);
        assertThat(EnumResolver.floatPredicate(kw("uno"))).isEqualTo(FloatPredicate.UNO);
        assertThat(EnumResolver.tail(kw("musttail"))).isEqualTo(Tail.MUST_TAIL);
    }

    @Test
    void optionalResolversReturnNoneWhenAbsent() throws UnimplementedFeatureException {
        assertThat(EnumResolver.optLinkage(null)).isEqualTo(Linkage.NONE);
        assertThat(EnumResolver.optVisibility(null)).isEqualTo(Visibility.NONE);
        assertThat(EnumResolver.optDllStorageClass(null)).isEqualTo(DllStorageClass.NONE);
        assertThat(EnumResolver.optPreemption(null)).isEqualTo(Preemption.NONE);
        assertThat(EnumResolver.optUnnamedAddr(null)).isEqualTo(UnnamedAddr.NONE);
        assertThat(EnumResolver.optTlsModel(null)).isEqualTo(TlsModel.NONE);
        assertThat(EnumResolver.optTail(null)).isEqualTo(Tail.NONE);
        assertThat(EnumResolver.optCallingConvention(null)).isEqualTo(CallingConvention.NONE);
    }

    @Test
    void optionalResolversResolvePresentKeyword() {
        assertThat(EnumResolver.optLinkage(kw("internal"))).isEqualTo(Linkage.INTERNAL);
        assertThat(EnumResolver.optDllStorageClass(kw("dllimport"))).isEqualTo(DllStorageClass.DLL_IMPORT);
        assertThat(EnumResolver.optPreemption(kw("dso_local"))).isEqualTo(Preemption.DSO_LOCAL);
        assertThat(EnumResolver.optUnnamedAddr(kw("local_unnamed_addr"))).isEqualTo(UnnamedAddr.LOCAL_UNNAMED_ADDR);
    }

    @Test
    void absentSelectionKindIsAny() {
        assertThat(EnumResolver.optSelectionKind(null)).isEqualTo(SelectionKind.ANY);
        assertThat(EnumResolver.optSelectionKind(kw("largest"))).isEqualTo(SelectionKind.LARGEST);
    }

    @Test
    @DisplayName("thread_local resolves to none, general dynamic or the explicit model")
    void threadLocalHasThreeStates() {
        assertThat(EnumResolver.optTlsModelFromThreadLocal(null)).isEqualTo(TlsModel.NONE);
        assertThat(EnumResolver.optTlsModelFromThreadLocal(threadLocal(null))).isEqualTo(TlsModel.GENERAL_DYNAMIC);
        assertThat(EnumResolver.optTlsModelFromThreadLocal(threadLocal("initialexec"))).isEqualTo(TlsModel.INITIAL_EXEC);
        assertThatThrownBy(() -> EnumResolver.optTlsModelFromThreadLocal(threadLocal("generaldynamic")))
                .isInstanceOf(InternalConsistencyException.class);
    }

    @Test
    void flagsAreCollectedIntoSets() {
        assertThat(EnumResolver.fastMathFlags(kws("nnan", "ninf", "nnan"))).containsExactlyInAnyOrder(FastMathFlag.NNAN, FastMathFlag.NINF);
        assertThat(EnumResolver.fastMathFlags(List.of())).isEmpty();
        assertThat(EnumResolver.overflowFlags(kws("nuw", "nsw"))).containsExactlyInAnyOrder(OverflowFlag.NSW, OverflowFlag.NUW);
        assertThatThrownBy(() -> EnumResolver.overflowFlags(kws("nsw", "exact")))
                .isInstanceOf(InternalConsistencyException.class);
    }

    @Test
    void keywordCallingConvention() throws UnimplementedFeatureException {
        assertThat(EnumResolver.callingConvention(cc("fastcc"))).isEqualTo(CallingConvention.FAST);
        assertThat(EnumResolver.callingConvention(cc("amdgpu_kernel"))).isEqualTo(CallingConvention.AMDGPU_KERNEL);
        assertThatThrownBy(() -> EnumResolver.callingConvention(cc("cc")))
                .isInstanceOf(InternalConsistencyException.class);
    }

    @ParameterizedTest
    @CsvSource({
            "11, HIPE",
            "86, AVR_BUILTIN",
            "87, AMDGPU_VS",
            "88, AMDGPU_GS",
            "89, AMDGPU_PS",
            "90, AMDGPU_CS",
            "91, AMDGPU_KERNEL",
            "93, AMDGPU_HS",
            "94, MSP430_BUILTIN",
            "95, AMDGPU_LS",
            "96, AMDGPU_ES"
    })
    void numericCallingConventionTable(String code, CallingConvention expected) throws UnimplementedFeatureException {
        assertThat(EnumResolver.callingConvention(ccNumber(code))).isEqualTo(expected);
        assertThat(EnumResolver.numericCodeOf(expected)).contains(Long.parseLong(code));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "10", "12", "85", "92", "97", "1000"})
    void numericCallingConventionOutsideTableIsUnimplemented(String code) {
        assertThatThrownBy(() -> EnumResolver.callingConvention(ccNumber(code)))
                .isInstanceOf(UnimplementedFeatureException.class)
                .hasMessageContaining("cc " + code);
    }

    @Test
    void numericTableIsInjective() {
        Map<Long, CallingConvention> table = EnumResolver.NUMERIC_CALLING_CONVENTIONS;
        assertThat(table).hasSize(11);
        assertThat(table.values()).doesNotHaveDuplicates();
        assertThat(EnumResolver.numericCodeOf(CallingConvention.C)).isEqualTo(Optional.empty());
    }

    @Test
    void immutableDistinguishesConstantFromGlobal() {
        assertThat(EnumResolver.immutable(kw("constant"))).isTrue();
        assertThat(EnumResolver.immutable(kw("global"))).isFalse();
        assertThatThrownBy(() -> EnumResolver.immutable(kw("const")))
                .isInstanceOf(InternalConsistencyException.class);
    }
}
