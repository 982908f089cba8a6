package org.llasm.compiler.frontend.irgen;

import org.llasm.compiler.frontend.irgen.converters.AddInstLowerer;
import org.llasm.compiler.frontend.irgen.converters.AtomicRmwInstLowerer;
import org.llasm.compiler.frontend.irgen.converters.BrTermLowerer;
import org.llasm.compiler.frontend.irgen.converters.CallInstLowerer;
import org.llasm.compiler.frontend.irgen.converters.CondBrTermLowerer;
import org.llasm.compiler.frontend.irgen.converters.FCmpInstLowerer;
import org.llasm.compiler.frontend.irgen.converters.ICmpInstLowerer;
import org.llasm.compiler.frontend.irgen.converters.PhiInstLowerer;
import org.llasm.compiler.frontend.irgen.converters.RetTermLowerer;
import org.llasm.compiler.frontend.irgen.converters.SwitchTermLowerer;
import org.llasm.compiler.frontend.parser.ast.AddInstNode;
import org.llasm.compiler.frontend.parser.ast.AtomicRmwInstNode;
import org.llasm.compiler.frontend.parser.ast.BrTermNode;
import org.llasm.compiler.frontend.parser.ast.CallInstNode;
import org.llasm.compiler.frontend.parser.ast.CondBrTermNode;
import org.llasm.compiler.frontend.parser.ast.FCmpInstNode;
import org.llasm.compiler.frontend.parser.ast.ICmpInstNode;
import org.llasm.compiler.frontend.parser.ast.InstructionNode;
import org.llasm.compiler.frontend.parser.ast.PhiInstNode;
import org.llasm.compiler.frontend.parser.ast.RetTermNode;
import org.llasm.compiler.frontend.parser.ast.SwitchTermNode;
import org.llasm.compiler.frontend.parser.ast.TerminatorNode;
import org.llasm.compiler.ir.IrInstruction;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping instruction and terminator node classes to their lowerers.
 * <p>
 * Provides explicit registration and a default lowerer fallback that reports the node as
 * not yet supported.
 */
public final class InstructionLowererRegistry {

	private final Map<Class<? extends InstructionNode>, IInstructionLowerer<?, ?>> instructions = new HashMap<>();
	private final Map<Class<? extends TerminatorNode>, ITerminatorLowerer<?>> terminators = new HashMap<>();
	private final DefaultInstructionLowerer defaultLowerer;

	private InstructionLowererRegistry(DefaultInstructionLowerer defaultLowerer) {
		this.defaultLowerer = defaultLowerer;
	}

	/**
	 * Registers a lowerer for the given instruction node class.
	 *
	 * @param nodeType The concrete instruction node class.
	 * @param lowerer  The lowerer handling that class.
	 * @param <T>      Concrete node type parameter.
	 * @param <I>      Produced instruction type parameter.
	 */
	public <T extends InstructionNode, I extends IrInstruction> void register(Class<T> nodeType, IInstructionLowerer<T, I> lowerer) {
		instructions.put(nodeType, lowerer);
	}

	/**
	 * Registers a lowerer for the given terminator node class.
	 *
	 * @param nodeType The concrete terminator node class.
	 * @param lowerer  The lowerer handling that class.
	 * @param <T>      Concrete node type parameter.
	 */
	public <T extends TerminatorNode> void registerTerminator(Class<T> nodeType, ITerminatorLowerer<T> lowerer) {
		terminators.put(nodeType, lowerer);
	}

	/**
	 * Retrieves the lowerer strictly registered for the given class.
	 *
	 * @param nodeType The instruction node class to look up.
	 * @return Optional lowerer if present.
	 */
	public Optional<IInstructionLowerer<?, ?>> get(Class<? extends InstructionNode> nodeType) {
		return Optional.ofNullable(instructions.get(nodeType));
	}

	/**
	 * @param node The instruction.
	 * @return The registered lowerer for the node's class, or the default lowerer.
	 */
	@SuppressWarnings("unchecked")
	public IInstructionLowerer<InstructionNode, IrInstruction> resolve(InstructionNode node) {
		IInstructionLowerer<?, ?> found = instructions.get(node.getClass());
		if (found != null) return (IInstructionLowerer<InstructionNode, IrInstruction>) found;
		return defaultLowerer;
	}

	/**
	 * @param node The terminator.
	 * @return The registered lowerer for the node's class, or the default lowerer.
	 */
	@SuppressWarnings("unchecked")
	public ITerminatorLowerer<TerminatorNode> resolve(TerminatorNode node) {
		ITerminatorLowerer<?> found = terminators.get(node.getClass());
		if (found != null) return (ITerminatorLowerer<TerminatorNode>) found;
		return defaultLowerer;
	}

	/**
	 * Creates a registry with no lowerers besides the default one.
	 *
	 * @return A new, empty registry.
	 */
	public static InstructionLowererRegistry initialize() {
		return new InstructionLowererRegistry(new DefaultInstructionLowerer());
	}

	/**
	 * Initializes a registry with the default lowerer and registers all built-in lowerers.
	 *
	 * @return A registry pre-populated with the standard lowerers.
	 */
	public static InstructionLowererRegistry initializeWithDefaults() {
		InstructionLowererRegistry reg = initialize();
		reg.register(PhiInstNode.class, new PhiInstLowerer());
		reg.register(AddInstNode.class, new AddInstLowerer());
		reg.register(ICmpInstNode.class, new ICmpInstLowerer());
		reg.register(FCmpInstNode.class, new FCmpInstLowerer());
		reg.register(AtomicRmwInstNode.class, new AtomicRmwInstLowerer());
		reg.register(CallInstNode.class, new CallInstLowerer());
		reg.registerTerminator(RetTermNode.class, new RetTermLowerer());
		reg.registerTerminator(BrTermNode.class, new BrTermLowerer());
		reg.registerTerminator(CondBrTermNode.class, new CondBrTermLowerer());
		reg.registerTerminator(SwitchTermNode.class, new SwitchTermLowerer());
		return reg;
	}
}
