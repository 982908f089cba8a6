package org.llasm.compiler.ir.enums;

/**
 * Calling convention of a function or call site.
 * <p>
 * Some vendor conventions have no keyword and can only be written as a numeric code
 * ({@link #HIPE}, {@link #AVR_BUILTIN}, {@link #MSP430_BUILTIN}).
 */
public enum CallingConvention {
    NONE,
    C,
    FAST,
    COLD,
    GHC,
    HIPE,
    WEBKIT_JS,
    ANY_REG,
    PRESERVE_MOST,
    PRESERVE_ALL,
    SWIFT,
    CXX_FAST_TLS,
    TAIL,
    CFGUARD_CHECK,
    X86_STDCALL,
    X86_FASTCALL,
    X86_THISCALL,
    X86_VECTORCALL,
    X86_REGCALL,
    X86_INTR,
    X86_64_SYSV,
    WIN64,
    ARM_APCS,
    ARM_AAPCS,
    ARM_AAPCS_VFP,
    AARCH64_VECTOR_PCS,
    MSP430_INTR,
    MSP430_BUILTIN,
    PTX_KERNEL,
    PTX_DEVICE,
    SPIR_FUNC,
    SPIR_KERNEL,
    INTEL_OCL_BI,
    AVR_INTR,
    AVR_SIGNAL,
    AVR_BUILTIN,
    HHVM,
    HHVM_C,
    AMDGPU_VS,
    AMDGPU_GS,
    AMDGPU_PS,
    AMDGPU_CS,
    AMDGPU_KERNEL,
    AMDGPU_HS,
    AMDGPU_LS,
    AMDGPU_ES,
}
