package org.llasm.compiler;

import org.llasm.compiler.api.IModuleLowerer;
import org.llasm.compiler.api.LoweringErrorCode;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.api.LoweringFailedException;
import org.llasm.compiler.api.SourceInfo;
import org.llasm.compiler.api.UnimplementedFeatureException;
import org.llasm.compiler.config.ConfigLoader;
import org.llasm.compiler.config.LoweringOptions;
import org.llasm.compiler.diagnostics.DiagnosticsEngine;
import org.llasm.compiler.frontend.irgen.ConstantLowerer;
import org.llasm.compiler.frontend.irgen.FunctionLowering;
import org.llasm.compiler.frontend.irgen.InstructionLowererRegistry;
import org.llasm.compiler.frontend.irgen.TypedConstantLowerer;
import org.llasm.compiler.frontend.lowering.AttributeDecoder;
import org.llasm.compiler.frontend.lowering.EnumResolver;
import org.llasm.compiler.frontend.lowering.IdentifierDecoder;
import org.llasm.compiler.frontend.lowering.TypeLowering;
import org.llasm.compiler.frontend.parser.ast.BoolLitNode;
import org.llasm.compiler.frontend.parser.ast.ComdatDefNode;
import org.llasm.compiler.frontend.parser.ast.ComdatNameNode;
import org.llasm.compiler.frontend.parser.ast.FunctionNode;
import org.llasm.compiler.frontend.parser.ast.GlobalVarNode;
import org.llasm.compiler.frontend.parser.ast.IntLitNode;
import org.llasm.compiler.frontend.parser.ast.ModuleNode;
import org.llasm.compiler.frontend.parser.ast.TopLevelEntityNode;
import org.llasm.compiler.frontend.semantics.Symbol;
import org.llasm.compiler.frontend.semantics.SymbolTable;
import org.llasm.compiler.ir.IrComdat;
import org.llasm.compiler.ir.IrFunction;
import org.llasm.compiler.ir.IrGlobal;
import org.llasm.compiler.ir.IrLinkageAttributes;
import org.llasm.compiler.ir.IrModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The main lowering implementation. Lowers a parsed module in two passes:
 * <ol>
 *   <li>Declaration: comdats, global variables and function headers are lowered and their
 *       names entered into the module table.</li>
 *   <li>Definition: global initializers, comdat references and function bodies are lowered
 *       against the complete module table.</li>
 * </ol>
 * Each global, function header and function body is a unit. Semantic and unimplemented
 * failures of a unit are recorded as diagnostics, and lowering continues with the next unit
 * as configured by {@link LoweringOptions}. {@link org.llasm.compiler.api.InternalConsistencyException}s
 * are not caught. This class is not thread-safe.
 */
public class ModuleLowerer implements IModuleLowerer {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleLowerer.class);

    private final LoweringOptions options;
    private final ConstantLowerer constants;
    private final InstructionLowererRegistry registry;
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private boolean stopped;

    @FunctionalInterface
    private interface Unit {
        void lower() throws LoweringException, UnimplementedFeatureException;
    }

    /**
     * Creates a lowerer configured from {@link ConfigLoader#load()}.
     */
    public ModuleLowerer() {
        this(LoweringOptions.from(ConfigLoader.load()));
    }

    public ModuleLowerer(LoweringOptions options) {
        this(options, new TypedConstantLowerer(), InstructionLowererRegistry.initializeWithDefaults());
    }

    /**
     * @param options   The error policy.
     * @param constants The constant lowerer.
     * @param registry  The instruction lowerers.
     */
    public ModuleLowerer(LoweringOptions options, ConstantLowerer constants, InstructionLowererRegistry registry) {
        this.options = options;
        this.constants = constants;
        this.registry = registry;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public IrModule lower(ModuleNode module, String sourceName) throws LoweringFailedException {
        diagnostics = new DiagnosticsEngine();
        stopped = false;
        LOG.debug("Lowering {} ({} top-level entities)", sourceName, module.entities().size());

        // Pass 1: declarations.
        Map<String, IrComdat> comdats = new LinkedHashMap<>();
        SymbolTable.Builder names = SymbolTable.builder();
        Map<GlobalVarNode, IrGlobal> globals = new LinkedHashMap<>();
        Map<FunctionNode, FunctionLowering> functions = new LinkedHashMap<>();

        for (TopLevelEntityNode entity : module.entities()) {
            if (entity instanceof ComdatDefNode c) {
                attempt(c.source(), () -> declareComdat(c, comdats));
            }
        }
        for (TopLevelEntityNode entity : module.entities()) {
            if (entity instanceof GlobalVarNode g) {
                attempt(g.source(), () -> {
                    IrGlobal global = declareGlobal(g);
                    names.declare(Symbol.value(global.name(), global, g.name().token()));
                    globals.put(g, global);
                });
            } else if (entity instanceof FunctionNode f) {
                attempt(f.source(), () -> {
                    FunctionLowering lowering = new FunctionLowering(f, registry);
                    IrFunction function = lowering.lowerHeader();
                    names.declare(Symbol.value(function.name(), function, f.header().name().token()));
                    functions.put(f, lowering);
                });
            }
        }
        SymbolTable moduleTable = names.build();
        LOG.debug("Declared {} comdats and {} globals/functions in {}", comdats.size(), moduleTable.size(), sourceName);

        // Pass 2: definitions.
        List<IrGlobal> loweredGlobals = new ArrayList<>();
        for (Map.Entry<GlobalVarNode, IrGlobal> e : globals.entrySet()) {
            GlobalVarNode g = e.getKey();
            IrGlobal global = e.getValue();
            if (attempt(g.source(), () -> defineGlobal(g, global, comdats))) {
                loweredGlobals.add(global);
            }
        }
        List<IrFunction> loweredFunctions = new ArrayList<>();
        for (FunctionLowering lowering : functions.values()) {
            FunctionNode f = lowering.node();
            boolean ok = attempt(f.source(), () -> {
                if (f.header().comdat() != null) {
                    lowering.function().setComdat(resolveComdat(f.header().comdat(), comdats));
                }
                if (f.isDefinition()) {
                    lowering.lowerBody(moduleTable, constants);
                }
            });
            if (ok) {
                loweredFunctions.add(lowering.function());
            }
        }

        if (diagnostics.hasErrors()) {
            LOG.warn("Lowering of {} failed with {} error(s)", sourceName, diagnostics.errorCount());
            throw new LoweringFailedException(diagnostics.summary(), diagnostics.errorCount());
        }
        LOG.debug("Lowered {}: {} globals, {} functions", sourceName, loweredGlobals.size(), loweredFunctions.size());
        return new IrModule(sourceName, List.copyOf(comdats.values()), loweredGlobals, loweredFunctions);
    }

    /**
     * @return The diagnostics of the most recent {@link #lower} call.
     */
    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    private boolean attempt(SourceInfo at, Unit unit) {
        if (stopped) {
            return false;
        }
        try {
            unit.lower();
            return true;
        } catch (LoweringException e) {
            LOG.debug("Lowering failed at {}:{}: {}", e.source().fileName(), e.source().lineNumber(), e.getMessage());
            diagnostics.report(e);
        } catch (UnimplementedFeatureException e) {
            LOG.debug("Unsupported input at {}:{}: {}", at.fileName(), at.lineNumber(), e.getMessage());
            diagnostics.report(e, at);
        }
        if (!options.continueAfterError() || diagnostics.errorCount() >= options.maxErrors()) {
            stopped = true;
            LOG.debug("Stopping after {} error(s)", diagnostics.errorCount());
        }
        return false;
    }

    private static void declareComdat(ComdatDefNode c, Map<String, IrComdat> comdats) throws LoweringException {
        String name = IdentifierDecoder.comdat(c.name());
        if (comdats.containsKey(name)) {
            throw new LoweringException(LoweringErrorCode.REDEFINITION, name, "comdat definition",
                    "redefinition of comdat $" + name, c.source());
        }
        comdats.put(name, new IrComdat(name, EnumResolver.optSelectionKind(c.selectionKind())));
    }

    private static IrComdat resolveComdat(ComdatNameNode n, Map<String, IrComdat> comdats) throws LoweringException {
        String name = IdentifierDecoder.comdat(n);
        IrComdat comdat = comdats.get(name);
        if (comdat == null) {
            throw new LoweringException(LoweringErrorCode.UNRESOLVED_REFERENCE, name, "comdat reference",
                    "unable to locate comdat $" + name, n.source());
        }
        return comdat;
    }

    private static IrGlobal declareGlobal(GlobalVarNode g) throws LoweringException {
        IrLinkageAttributes attributes = new IrLinkageAttributes(
                EnumResolver.optLinkage(g.linkage()),
                EnumResolver.optPreemption(g.preemption()),
                EnumResolver.optVisibility(g.visibility()),
                EnumResolver.optDllStorageClass(g.dllStorageClass()),
                EnumResolver.optUnnamedAddr(g.unnamedAddr()));
        return new IrGlobal(IdentifierDecoder.global(g.name()), TypeLowering.lower(g.contentType()), attributes,
                EnumResolver.optTlsModelFromThreadLocal(g.threadLocal()), AttributeDecoder.optAddrSpace(g.addrSpace()),
                AttributeDecoder.isPresent(g.externallyInitialized()), EnumResolver.immutable(g.immutable()),
                AttributeDecoder.optAlignment(g.align()));
    }

    private void defineGlobal(GlobalVarNode g, IrGlobal global, Map<String, IrComdat> comdats)
            throws LoweringException, UnimplementedFeatureException {
        if (g.init() != null) {
            if (!(g.init() instanceof IntLitNode) && !(g.init() instanceof BoolLitNode)) {
                throw new UnimplementedFeatureException("global initializer", g.init().anchor().text());
            }
            global.setInit(constants.lower(global.contentType(), g.init()));
        }
        if (g.comdat() != null) {
            global.setComdat(resolveComdat(g.comdat(), comdats));
        }
    }
}
