package org.llasm.compiler.frontend.irgen;

import org.llasm.compiler.api.InternalConsistencyException;
import org.llasm.compiler.api.LoweringErrorCode;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.api.UnimplementedFeatureException;
import org.llasm.compiler.frontend.lowering.AttributeDecoder;
import org.llasm.compiler.frontend.lowering.EnumResolver;
import org.llasm.compiler.frontend.lowering.IdentifierDecoder;
import org.llasm.compiler.frontend.lowering.TypeLowering;
import org.llasm.compiler.frontend.parser.ast.BasicBlockNode;
import org.llasm.compiler.frontend.parser.ast.FunctionHeaderNode;
import org.llasm.compiler.frontend.parser.ast.FunctionNode;
import org.llasm.compiler.frontend.parser.ast.InstructionNode;
import org.llasm.compiler.frontend.parser.ast.ParamNode;
import org.llasm.compiler.frontend.semantics.ForwardReferenceResolver;
import org.llasm.compiler.frontend.semantics.LocalIdAssigner;
import org.llasm.compiler.frontend.semantics.SymbolTable;
import org.llasm.compiler.ir.IrBasicBlock;
import org.llasm.compiler.ir.IrFunction;
import org.llasm.compiler.ir.IrInstruction;
import org.llasm.compiler.ir.IrLinkageAttributes;
import org.llasm.compiler.ir.IrParam;
import org.llasm.compiler.ir.IrType;
import org.llasm.compiler.ir.IrVoidType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers one function: its header when the module's names are collected, and its body
 * afterwards.
 * <p>
 * The body is lowered in two passes over one {@link ForwardReferenceResolver}. The first pass
 * names and declares every parameter, basic block and instruction result, creating each
 * instruction as an operand-less shell. The second pass resolves operands, incoming arms and
 * branch targets against the complete table and fills in the shells. This lets any local
 * refer to any other local of the function regardless of order.
 * <p>
 * An instance is used for exactly one function and is not thread-safe.
 */
public final class FunctionLowering {

	private static final Logger LOG = LoggerFactory.getLogger(FunctionLowering.class);

	private final FunctionNode node;
	private final InstructionLowererRegistry registry;
	private final LocalIdAssigner ids = new LocalIdAssigner();
	private IrFunction function;
	private ForwardReferenceResolver locals;
	private final List<BlockShell> blocks = new ArrayList<>();

	private record PendingInstruction(InstructionNode node, IrInstruction shell) {}

	private record BlockShell(BasicBlockNode node, IrBasicBlock block, List<PendingInstruction> instructions) {}

	/**
	 * @param node     The function.
	 * @param registry The instruction lowerers.
	 */
	public FunctionLowering(FunctionNode node, InstructionLowererRegistry registry) {
		this.node = node;
		this.registry = registry;
	}

	/**
	 * Lowers the function header. Unnamed parameters receive the first local ids.
	 *
	 * @return The function, without comdat and blocks.
	 * @throws LoweringException if a type, parameter name or alignment is invalid.
	 * @throws UnimplementedFeatureException if the calling convention is not supported.
	 */
	public IrFunction lowerHeader() throws LoweringException, UnimplementedFeatureException {
		FunctionHeaderNode h = node.header();
		String name = IdentifierDecoder.global(h.name());
		IrLinkageAttributes attributes = new IrLinkageAttributes(
				EnumResolver.optLinkage(h.linkage()),
				EnumResolver.optPreemption(h.preemption()),
				EnumResolver.optVisibility(h.visibility()),
				EnumResolver.optDllStorageClass(h.dllStorageClass()),
				EnumResolver.optUnnamedAddr(h.unnamedAddr()));
		IrType returnType = TypeLowering.lower(h.returnType());
		List<IrParam> params = new ArrayList<>(h.params().size());
		for (ParamNode p : h.params()) {
			String paramName = ids.assign(IdentifierDecoder.optionalLocal(p.name()), "function parameter", p.source());
			params.add(new IrParam(paramName, TypeLowering.lower(p.type())));
		}
		function = new IrFunction(name, attributes, EnumResolver.optCallingConvention(h.callingConv()), returnType, params,
				AttributeDecoder.isPresent(h.ellipsis()), AttributeDecoder.optAddrSpace(h.addrSpace()),
				AttributeDecoder.optAlignment(h.align()));
		return function;
	}

	/**
	 * First pass over the body: declares every local name and creates instruction shells.
	 *
	 * @throws LoweringException on a redefinition, an out-of-sequence local id or an invalid type.
	 * @throws UnimplementedFeatureException if an instruction has no lowerer.
	 */
	public void declareBody() throws LoweringException, UnimplementedFeatureException {
		if (function == null) {
			throw new InternalConsistencyException("header of " + node.header().name().token().text() + " not lowered yet");
		}
		locals = new ForwardReferenceResolver(function.ident());
		List<ParamNode> paramNodes = node.header().params();
		for (int i = 0; i < paramNodes.size(); i++) {
			IrParam param = function.params().get(i);
			ParamNode p = paramNodes.get(i);
			locals.declareValue(param.name(), param, p.name() != null ? p.name().token() : null);
		}
		for (BasicBlockNode b : node.blocks()) {
			String blockName = ids.assign(IdentifierDecoder.optionalLabel(b.label()), "basic block", b.source());
			IrBasicBlock block = new IrBasicBlock(blockName);
			locals.declareBlock(blockName, block, b.label() != null ? b.label().token() : null);
			List<PendingInstruction> pending = new ArrayList<>(b.instructions().size());
			for (InstructionNode inst : b.instructions()) {
				IrInstruction shell = declareInstruction(inst);
				block.addInstruction(shell);
				pending.add(new PendingInstruction(inst, shell));
			}
			blocks.add(new BlockShell(b, block, pending));
		}
		locals.completeDeclarations();
		LOG.debug("Declared {} blocks of {}", blocks.size(), function.ident());
	}

	private IrInstruction declareInstruction(InstructionNode inst) throws LoweringException, UnimplementedFeatureException {
		IInstructionLowerer<InstructionNode, IrInstruction> lowerer = registry.resolve(inst);
		IrType type = lowerer.resultType(inst);
		String name = null;
		if (type instanceof IrVoidType) {
			if (inst.name() != null) {
				throw new LoweringException(LoweringErrorCode.TYPE_MISMATCH, IdentifierDecoder.local(inst.name()),
						inst.opcode().text() + " instruction",
						"instructions returning void cannot have a name", inst.name().source());
			}
		} else {
			name = ids.assign(IdentifierDecoder.optionalLocal(inst.name()), inst.opcode().text() + " instruction", inst.source());
		}
		IrInstruction shell = lowerer.declare(inst, name, type);
		if (name != null) {
			locals.declareValue(name, shell, inst.name() != null ? inst.name().token() : inst.opcode());
		}
		return shell;
	}

	/**
	 * Second pass over the body: completes every instruction and lowers every terminator.
	 *
	 * @param globals   The module's globals and functions.
	 * @param constants The constant lowerer.
	 * @return The completed function.
	 * @throws LoweringException if an operand or target does not resolve.
	 * @throws UnimplementedFeatureException if an instruction uses an unsupported feature.
	 */
	public IrFunction resolveBody(SymbolTable globals, ConstantLowerer constants)
			throws LoweringException, UnimplementedFeatureException {
		if (locals == null || locals.phase() != ForwardReferenceResolver.Phase.RESOLVING) {
			throw new InternalConsistencyException("body of " + node.header().name().token().text() + " not declared yet");
		}
		FunctionLoweringContext ctx = new FunctionLoweringContext(function.ident(), locals, globals, constants);
		List<IrBasicBlock> result = new ArrayList<>(blocks.size());
		for (BlockShell b : blocks) {
			for (PendingInstruction p : b.instructions()) {
				registry.resolve(p.node()).complete(p.node(), p.shell(), ctx);
			}
			b.block().setTerminator(registry.resolve(b.node().terminator()).lower(b.node().terminator(), ctx));
			result.add(b.block());
		}
		function.setBlocks(result);
		LOG.debug("Lowered body of {}", function.ident());
		return function;
	}

	/**
	 * Runs both passes over the body.
	 */
	public IrFunction lowerBody(SymbolTable globals, ConstantLowerer constants)
			throws LoweringException, UnimplementedFeatureException {
		declareBody();
		return resolveBody(globals, constants);
	}

	public FunctionNode node() {
		return node;
	}

	/**
	 * @return The function, or {@code null} before {@link #lowerHeader()}.
	 */
	public IrFunction function() {
		return function;
	}
}
