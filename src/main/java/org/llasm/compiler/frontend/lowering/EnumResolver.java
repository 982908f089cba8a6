package org.llasm.compiler.frontend.lowering;

import org.llasm.compiler.api.InternalConsistencyException;
import org.llasm.compiler.api.UnimplementedFeatureException;
import org.llasm.compiler.frontend.parser.ast.CallingConvIntNode;
import org.llasm.compiler.frontend.parser.ast.CallingConvKeywordNode;
import org.llasm.compiler.frontend.parser.ast.CallingConvNode;
import org.llasm.compiler.frontend.parser.ast.KeywordNode;
import org.llasm.compiler.frontend.parser.ast.ThreadLocalNode;
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

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps the keywords of every closed attribute vocabulary to their enumeration values.
 * <p>
 * The parser guarantees that a keyword in a given position belongs to the vocabulary of that
 * position, so an unknown spelling is an {@link InternalConsistencyException}. The one open
 * vocabulary is the numeric calling convention {@code cc <n>}: only the vendor range listed in
 * {@link #NUMERIC_CALLING_CONVENTIONS} is supported, and any other code is reported as an
 * {@link UnimplementedFeatureException}.
 * <p>
 * All methods are stateless and thread-safe.
 */
public final class EnumResolver {

    public static final KeywordTable<Linkage> LINKAGES = KeywordTable.builder("linkage", Linkage.class)
            .put("appending", Linkage.APPENDING)
            .put("available_externally", Linkage.AVAILABLE_EXTERNALLY)
            .put("common", Linkage.COMMON)
            .put("internal", Linkage.INTERNAL)
            .put("linkonce", Linkage.LINK_ONCE)
            .put("linkonce_odr", Linkage.LINK_ONCE_ODR)
            .put("private", Linkage.PRIVATE)
            .put("weak", Linkage.WEAK)
            .put("weak_odr", Linkage.WEAK_ODR)
            .put("external", Linkage.EXTERNAL)
            .put("extern_weak", Linkage.EXTERN_WEAK)
            .build();

    public static final KeywordTable<Visibility> VISIBILITIES = KeywordTable.builder("visibility", Visibility.class)
            .put("default", Visibility.DEFAULT)
            .put("hidden", Visibility.HIDDEN)
            .put("protected", Visibility.PROTECTED)
            .build();

    public static final KeywordTable<DllStorageClass> DLL_STORAGE_CLASSES = KeywordTable.builder("DLL storage class", DllStorageClass.class)
            .put("dllexport", DllStorageClass.DLL_EXPORT)
            .put("dllimport", DllStorageClass.DLL_IMPORT)
            .build();

    public static final KeywordTable<Preemption> PREEMPTIONS = KeywordTable.builder("preemption specifier", Preemption.class)
            .put("dso_local", Preemption.DSO_LOCAL)
            .put("dso_preemptable", Preemption.DSO_PREEMPTABLE)
            .build();

    public static final KeywordTable<SelectionKind> SELECTION_KINDS = KeywordTable.builder("comdat selection kind", SelectionKind.class)
            .put("any", SelectionKind.ANY)
            .put("exactmatch", SelectionKind.EXACT_MATCH)
            .put("largest", SelectionKind.LARGEST)
            .put("nodeduplicate", SelectionKind.NO_DEDUPLICATE)
            .put("samesize", SelectionKind.SAME_SIZE)
            .build();

    public static final KeywordTable<Tail> TAILS = KeywordTable.builder("tail call marker", Tail.class)
            .put("musttail", Tail.MUST_TAIL)
            .put("notail", Tail.NO_TAIL)
            .put("tail", Tail.TAIL)
            .build();

    public static final KeywordTable<TlsModel> TLS_MODELS = KeywordTable.builder("thread local storage model", TlsModel.class)
            .put("localdynamic", TlsModel.LOCAL_DYNAMIC)
            .put("initialexec", TlsModel.INITIAL_EXEC)
            .put("localexec", TlsModel.LOCAL_EXEC)
            .build();

    public static final KeywordTable<UnnamedAddr> UNNAMED_ADDRS = KeywordTable.builder("unnamed address", UnnamedAddr.class)
            .put("local_unnamed_addr", UnnamedAddr.LOCAL_UNNAMED_ADDR)
            .put("unnamed_addr", UnnamedAddr.UNNAMED_ADDR)
            .build();

    public static final KeywordTable<AtomicOrdering> ATOMIC_ORDERINGS = KeywordTable.builder("atomic ordering", AtomicOrdering.class)
            .put("unordered", AtomicOrdering.UNORDERED)
            .put("monotonic", AtomicOrdering.MONOTONIC)
            .put("acquire", AtomicOrdering.ACQUIRE)
            .put("release", AtomicOrdering.RELEASE)
            .put("acq_rel", AtomicOrdering.ACQ_REL)
            .put("seq_cst", AtomicOrdering.SEQ_CST)
            .build();

    public static final KeywordTable<AtomicOp> ATOMIC_OPS = KeywordTable.builder("atomic operation", AtomicOp.class)
            .put("xchg", AtomicOp.XCHG)
            .put("add", AtomicOp.ADD)
            .put("sub", AtomicOp.SUB)
            .put("and", AtomicOp.AND)
            .put("nand", AtomicOp.NAND)
            .put("or", AtomicOp.OR)
            .put("xor", AtomicOp.XOR)
            .put("max", AtomicOp.MAX)
            .put("min", AtomicOp.MIN)
            .put("umax", AtomicOp.UMAX)
            .put("umin", AtomicOp.UMIN)
            .put("fadd", AtomicOp.FADD)
            .put("fsub", AtomicOp.FSUB)
            .put("fmax", AtomicOp.FMAX)
            .put("fmin", AtomicOp.FMIN)
            .build();

    public static final KeywordTable<IntPredicate> INT_PREDICATES = KeywordTable.builder("integer comparison predicate", IntPredicate.class)
            .put("eq", IntPredicate.EQUAL)
            .put("ne", IntPredicate.NOT_EQUAL)
            .put("ugt", IntPredicate.UNSIGNED_GREATER_THAN)
            .put("uge", IntPredicate.UNSIGNED_GREATER_THAN_OR_EQUAL)
            .put("ult", IntPredicate.UNSIGNED_LESS_THAN)
            .put("ule", IntPredicate.UNSIGNED_LESS_THAN_OR_EQUAL)
            .put("sgt", IntPredicate.SIGNED_GREATER_THAN)
            .put("sge", IntPredicate.SIGNED_GREATER_THAN_OR_EQUAL)
            .put("slt", IntPredicate.SIGNED_LESS_THAN)
            .put("sle", IntPredicate.SIGNED_LESS_THAN_OR_EQUAL)
            .build();

    public static final KeywordTable<FloatPredicate> FLOAT_PREDICATES = KeywordTable.builder("floating-point comparison predicate", FloatPredicate.class)
            .put("false", FloatPredicate.FALSE)
            .put("oeq", FloatPredicate.OEQ)
            .put("ogt", FloatPredicate.OGT)
            .put("oge", FloatPredicate.OGE)
            .put("olt", FloatPredicate.OLT)
            .put("ole", FloatPredicate.OLE)
            .put("one", FloatPredicate.ONE)
            .put("ord", FloatPredicate.ORD)
            .put("ueq", FloatPredicate.UEQ)
            .put("ugt", FloatPredicate.UGT)
            .put("uge", FloatPredicate.UGE)
            .put("ult", FloatPredicate.ULT)
            .put("ule", FloatPredicate.ULE)
            .put("une", FloatPredicate.UNE)
            .put("uno", FloatPredicate.UNO)
            .put("true", FloatPredicate.TRUE)
            .build();

    public static final KeywordTable<FastMathFlag> FAST_MATH_FLAGS = KeywordTable.builder("fast-math flag", FastMathFlag.class)
            .put("afn", FastMathFlag.AFN)
            .put("arcp", FastMathFlag.ARCP)
            .put("contract", FastMathFlag.CONTRACT)
            .put("fast", FastMathFlag.FAST)
            .put("ninf", FastMathFlag.NINF)
            .put("nnan", FastMathFlag.NNAN)
            .put("nsz", FastMathFlag.NSZ)
            .put("reassoc", FastMathFlag.REASSOC)
            .build();

    public static final KeywordTable<OverflowFlag> OVERFLOW_FLAGS = KeywordTable.builder("overflow flag", OverflowFlag.class)
            .put("nsw", OverflowFlag.NSW)
            .put("nuw", OverflowFlag.NUW)
            .build();

    public static final KeywordTable<CallingConvention> CALLING_CONVENTIONS = KeywordTable.builder("calling convention", CallingConvention.class)
            .put("ccc", CallingConvention.C)
            .put("fastcc", CallingConvention.FAST)
            .put("coldcc", CallingConvention.COLD)
            .put("ghccc", CallingConvention.GHC)
            .put("webkit_jscc", CallingConvention.WEBKIT_JS)
            .put("anyregcc", CallingConvention.ANY_REG)
            .put("preserve_mostcc", CallingConvention.PRESERVE_MOST)
            .put("preserve_allcc", CallingConvention.PRESERVE_ALL)
            .put("swiftcc", CallingConvention.SWIFT)
            .put("cxx_fast_tlscc", CallingConvention.CXX_FAST_TLS)
            .put("tailcc", CallingConvention.TAIL)
            .put("cfguard_checkcc", CallingConvention.CFGUARD_CHECK)
            .put("x86_stdcallcc", CallingConvention.X86_STDCALL)
            .put("x86_fastcallcc", CallingConvention.X86_FASTCALL)
            .put("x86_thiscallcc", CallingConvention.X86_THISCALL)
            .put("x86_vectorcallcc", CallingConvention.X86_VECTORCALL)
            .put("x86_regcallcc", CallingConvention.X86_REGCALL)
            .put("x86_intrcc", CallingConvention.X86_INTR)
            .put("x86_64_sysvcc", CallingConvention.X86_64_SYSV)
            .put("win64cc", CallingConvention.WIN64)
            .put("arm_apcscc", CallingConvention.ARM_APCS)
            .put("arm_aapcscc", CallingConvention.ARM_AAPCS)
            .put("arm_aapcs_vfpcc", CallingConvention.ARM_AAPCS_VFP)
            .put("aarch64_vector_pcs", CallingConvention.AARCH64_VECTOR_PCS)
            .put("msp430_intrcc", CallingConvention.MSP430_INTR)
            .put("ptx_kernel", CallingConvention.PTX_KERNEL)
            .put("ptx_device", CallingConvention.PTX_DEVICE)
            .put("spir_func", CallingConvention.SPIR_FUNC)
            .put("spir_kernel", CallingConvention.SPIR_KERNEL)
            .put("intel_ocl_bicc", CallingConvention.INTEL_OCL_BI)
            .put("avr_intrcc", CallingConvention.AVR_INTR)
            .put("avr_signalcc", CallingConvention.AVR_SIGNAL)
            .put("hhvmcc", CallingConvention.HHVM)
            .put("hhvm_ccc", CallingConvention.HHVM_C)
            .put("amdgpu_vs", CallingConvention.AMDGPU_VS)
            .put("amdgpu_gs", CallingConvention.AMDGPU_GS)
            .put("amdgpu_ps", CallingConvention.AMDGPU_PS)
            .put("amdgpu_cs", CallingConvention.AMDGPU_CS)
            .put("amdgpu_kernel", CallingConvention.AMDGPU_KERNEL)
            .put("amdgpu_hs", CallingConvention.AMDGPU_HS)
            .put("amdgpu_ls", CallingConvention.AMDGPU_LS)
            .put("amdgpu_es", CallingConvention.AMDGPU_ES)
            .build();

    /**
     * Vendor calling conventions that only have a numeric spelling ({@code cc <n>}).
     * Codes 11 and 86 to 96 except 92.
     */
    public static final Map<Long, CallingConvention> NUMERIC_CALLING_CONVENTIONS;

    static {
        Map<Long, CallingConvention> numeric = new LinkedHashMap<>();
        numeric.put(11L, CallingConvention.HIPE);
        numeric.put(86L, CallingConvention.AVR_BUILTIN);
        numeric.put(87L, CallingConvention.AMDGPU_VS);
        numeric.put(88L, CallingConvention.AMDGPU_GS);
        numeric.put(89L, CallingConvention.AMDGPU_PS);
        numeric.put(90L, CallingConvention.AMDGPU_CS);
        numeric.put(91L, CallingConvention.AMDGPU_KERNEL);
        numeric.put(93L, CallingConvention.AMDGPU_HS);
        numeric.put(94L, CallingConvention.MSP430_BUILTIN);
        numeric.put(95L, CallingConvention.AMDGPU_LS);
        numeric.put(96L, CallingConvention.AMDGPU_ES);
        NUMERIC_CALLING_CONVENTIONS = Collections.unmodifiableMap(numeric);
    }

    private static final List<KeywordTable<?>> ALL_TABLES = List.of(
            LINKAGES, VISIBILITIES, DLL_STORAGE_CLASSES, PREEMPTIONS, SELECTION_KINDS, TAILS, TLS_MODELS,
            UNNAMED_ADDRS, ATOMIC_ORDERINGS, ATOMIC_OPS, INT_PREDICATES, FLOAT_PREDICATES, FAST_MATH_FLAGS,
            OVERFLOW_FLAGS, CALLING_CONVENTIONS);

    private EnumResolver() {}

    /**
     * @return Every keyword table, one per vocabulary.
     */
    public static List<KeywordTable<?>> tables() {
        return ALL_TABLES;
    }

    // --- Linkage and visibility --------------------------------------------

    public static Linkage linkage(KeywordNode n) {
        return LINKAGES.lookup(n.text());
    }

    public static Linkage optLinkage(KeywordNode n) {
        return n == null ? Linkage.NONE : linkage(n);
    }

    public static Visibility visibility(KeywordNode n) {
        return VISIBILITIES.lookup(n.text());
    }

    public static Visibility optVisibility(KeywordNode n) {
        return n == null ? Visibility.NONE : visibility(n);
    }

    public static DllStorageClass dllStorageClass(KeywordNode n) {
        return DLL_STORAGE_CLASSES.lookup(n.text());
    }

    public static DllStorageClass optDllStorageClass(KeywordNode n) {
        return n == null ? DllStorageClass.NONE : dllStorageClass(n);
    }

    public static Preemption preemption(KeywordNode n) {
        return PREEMPTIONS.lookup(n.text());
    }

    public static Preemption optPreemption(KeywordNode n) {
        return n == null ? Preemption.NONE : preemption(n);
    }

    public static UnnamedAddr unnamedAddr(KeywordNode n) {
        return UNNAMED_ADDRS.lookup(n.text());
    }

    public static UnnamedAddr optUnnamedAddr(KeywordNode n) {
        return n == null ? UnnamedAddr.NONE : unnamedAddr(n);
    }

    public static SelectionKind selectionKind(KeywordNode n) {
        return SELECTION_KINDS.lookup(n.text());
    }

    /**
     * A comdat without explicit selection kind behaves as {@code any}.
     */
    public static SelectionKind optSelectionKind(KeywordNode n) {
        return n == null ? SelectionKind.ANY : selectionKind(n);
    }

    // --- Thread local storage ----------------------------------------------

    public static TlsModel tlsModel(KeywordNode n) {
        return TLS_MODELS.lookup(n.text());
    }

    public static TlsModel optTlsModel(KeywordNode n) {
        return n == null ? TlsModel.NONE : tlsModel(n);
    }

    /**
     * Resolves the {@code thread_local} marker of a global variable.
     *
     * @param n The marker, or {@code null}.
     * @return {@link TlsModel#NONE} if absent, {@link TlsModel#GENERAL_DYNAMIC} for a bare
     *         {@code thread_local}, otherwise the explicit model.
     */
    public static TlsModel optTlsModelFromThreadLocal(ThreadLocalNode n) {
        if (n == null) {
            return TlsModel.NONE;
        }
        if (n.model() == null) {
            return TlsModel.GENERAL_DYNAMIC;
        }
        return tlsModel(n.model());
    }

    // --- Instructions ------------------------------------------------------

    public static Tail tail(KeywordNode n) {
        return TAILS.lookup(n.text());
    }

    public static Tail optTail(KeywordNode n) {
        return n == null ? Tail.NONE : tail(n);
    }

    public static AtomicOrdering atomicOrdering(KeywordNode n) {
        return ATOMIC_ORDERINGS.lookup(n.text());
    }

    public static AtomicOp atomicOp(KeywordNode n) {
        return ATOMIC_OPS.lookup(n.text());
    }

    public static IntPredicate intPredicate(KeywordNode n) {
        return INT_PREDICATES.lookup(n.text());
    }

    public static FloatPredicate floatPredicate(KeywordNode n) {
        return FLOAT_PREDICATES.lookup(n.text());
    }

    /**
     * @param ns The flag keywords in source order; may repeat.
     * @return The set of flags, empty if none were given.
     */
    public static Set<FastMathFlag> fastMathFlags(List<KeywordNode> ns) {
        EnumSet<FastMathFlag> flags = EnumSet.noneOf(FastMathFlag.class);
        for (KeywordNode n : ns) {
            flags.add(FAST_MATH_FLAGS.lookup(n.text()));
        }
        return flags;
    }

    /**
     * @param ns The flag keywords in source order; may repeat.
     * @return The set of flags, empty if none were given.
     */
    public static Set<OverflowFlag> overflowFlags(List<KeywordNode> ns) {
        EnumSet<OverflowFlag> flags = EnumSet.noneOf(OverflowFlag.class);
        for (KeywordNode n : ns) {
            flags.add(OVERFLOW_FLAGS.lookup(n.text()));
        }
        return flags;
    }

    // --- Calling conventions -----------------------------------------------

    /**
     * @param n A calling convention in keyword or numeric form.
     * @return The calling convention.
     * @throws UnimplementedFeatureException for a numeric code outside the supported range.
     */
    public static CallingConvention callingConvention(CallingConvNode n) throws UnimplementedFeatureException {
        if (n instanceof CallingConvKeywordNode k) {
            return CALLING_CONVENTIONS.lookup(k.keyword().text());
        }
        if (n instanceof CallingConvIntNode i) {
            return numericCallingConvention(LiteralDecoder.uint(i.code()));
        }
        throw new InternalConsistencyException("unknown calling convention node " + n.getClass().getName());
    }

    /**
     * @param n A calling convention, or {@code null}.
     * @return {@link CallingConvention#NONE} if absent.
     * @throws UnimplementedFeatureException for a numeric code outside the supported range.
     */
    public static CallingConvention optCallingConvention(CallingConvNode n) throws UnimplementedFeatureException {
        return n == null ? CallingConvention.NONE : callingConvention(n);
    }

    /**
     * @param code The code of a {@code cc <n>} calling convention, read as unsigned.
     * @return The calling convention.
     * @throws UnimplementedFeatureException if the code is not in {@link #NUMERIC_CALLING_CONVENTIONS}.
     */
    public static CallingConvention numericCallingConvention(long code) throws UnimplementedFeatureException {
        CallingConvention cc = NUMERIC_CALLING_CONVENTIONS.get(code);
        if (cc == null) {
            throw new UnimplementedFeatureException("calling convention", "cc " + Long.toUnsignedString(code));
        }
        return cc;
    }

    /**
     * @param cc A calling convention.
     * @return The numeric code of {@code cc}, if it has one.
     */
    public static Optional<Long> numericCodeOf(CallingConvention cc) {
        return NUMERIC_CALLING_CONVENTIONS.entrySet().stream()
                .filter(e -> e.getValue() == cc)
                .map(Map.Entry::getKey)
                .findFirst();
    }

    // --- Global variables --------------------------------------------------

    /**
     * @param n {@code constant} or {@code global}.
     * @return {@code true} for {@code constant}.
     */
    public static boolean immutable(KeywordNode n) {
        switch (n.text()) {
            case "constant":
                return true;
            case "global":
                return false;
            default:
                throw new InternalConsistencyException(String.format(
                        "invalid immutability keyword; expected `constant` or `global`, got `%s`", n.text()));
        }
    }
}
