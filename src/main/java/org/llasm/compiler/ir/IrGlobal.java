package org.llasm.compiler.ir;

import org.llasm.compiler.ir.enums.TlsModel;

/**
 * A global variable. Created with its header attributes; initializer and comdat are attached
 * once every global of the module has been declared.
 */
public final class IrGlobal implements IrValue {

    private final String name;
    private final IrType contentType;
    private final IrLinkageAttributes attributes;
    private final TlsModel tlsModel;
    private final long addrSpace;
    private final boolean externallyInitialized;
    private final boolean immutable;
    private final long alignment;
    private IrConstant init;
    private IrComdat comdat;

    /**
     * @param name The global name, without {@code @}.
     * @param contentType The type of the stored value.
     * @param attributes Linkage-related attributes.
     * @param tlsModel The thread-local storage model.
     * @param addrSpace The address space.
     * @param externallyInitialized Whether the variable is externally initialized.
     * @param immutable {@code true} for {@code constant}, {@code false} for {@code global}.
     * @param alignment The alignment in bytes, 0 if unspecified.
     */
    public IrGlobal(String name, IrType contentType, IrLinkageAttributes attributes, TlsModel tlsModel,
                    long addrSpace, boolean externallyInitialized, boolean immutable, long alignment) {
        this.name = name;
        this.contentType = contentType;
        this.attributes = attributes;
        this.tlsModel = tlsModel;
        this.addrSpace = addrSpace;
        this.externallyInitialized = externallyInitialized;
        this.immutable = immutable;
        this.alignment = alignment;
    }

    public String name() {
        return name;
    }

    public IrType contentType() {
        return contentType;
    }

    public IrLinkageAttributes attributes() {
        return attributes;
    }

    public TlsModel tlsModel() {
        return tlsModel;
    }

    public long addrSpace() {
        return addrSpace;
    }

    public boolean externallyInitialized() {
        return externallyInitialized;
    }

    public boolean immutable() {
        return immutable;
    }

    public long alignment() {
        return alignment;
    }

    /**
     * @return The initializer, or {@code null} for a declaration.
     */
    public IrConstant init() {
        return init;
    }

    public void setInit(IrConstant init) {
        this.init = init;
    }

    /**
     * @return The comdat, or {@code null}.
     */
    public IrComdat comdat() {
        return comdat;
    }

    public void setComdat(IrComdat comdat) {
        this.comdat = comdat;
    }

    @Override
    public IrType type() {
        return new IrPointerType(addrSpace);
    }

    @Override
    public String ident() {
        return "@" + name;
    }

    @Override
    public String toString() {
        return "IrGlobal{" + ident() + ", " + contentType + "}";
    }
}
