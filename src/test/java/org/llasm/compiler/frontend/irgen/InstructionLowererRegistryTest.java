package org.llasm.compiler.frontend.irgen;

import org.llasm.compiler.api.UnimplementedFeatureException;
import org.llasm.compiler.frontend.irgen.converters.AddInstLowerer;
import org.llasm.compiler.frontend.irgen.converters.BrTermLowerer;
import org.llasm.compiler.frontend.parser.ast.AddInstNode;
import org.llasm.compiler.frontend.parser.ast.BrTermNode;
import org.llasm.compiler.frontend.parser.ast.PhiInstNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.llasm.compiler.frontend.parser.ast.Nodes.add;
import static org.llasm.compiler.frontend.parser.ast.Nodes.br;
import static org.llasm.compiler.frontend.parser.ast.Nodes.i;
import static org.llasm.compiler.frontend.parser.ast.Nodes.intLit;
import static org.llasm.compiler.frontend.parser.ast.Nodes.retVoid;

@Tag("unit")
class InstructionLowererRegistryTest {

    @Test
    void emptyRegistryFallsBackToDefaultLowerer() {
        InstructionLowererRegistry registry = InstructionLowererRegistry.initialize();

        assertThat(registry.get(AddInstNode.class)).isEmpty();
        assertThat(registry.resolve(add("%x", i(32), intLit("1"), intLit("2")))).isInstanceOf(DefaultInstructionLowerer.class);
        assertThatThrownBy(() -> registry.resolve(add("%x", i(32), intLit("1"), intLit("2")))
                .resultType(add("%x", i(32), intLit("1"), intLit("2"))))
                .isInstanceOf(UnimplementedFeatureException.class)
                .hasMessage("support for instruction add not yet implemented");
        assertThatThrownBy(() -> registry.resolve(retVoid()).lower(retVoid(), null))
                .isInstanceOf(UnimplementedFeatureException.class)
                .hasMessageContaining("terminator ret");
    }

    @Test
    void registeredLowerersAreResolvedByNodeClass() {
        InstructionLowererRegistry registry = InstructionLowererRegistry.initialize();
        AddInstLowerer addLowerer = new AddInstLowerer();
        registry.register(AddInstNode.class, addLowerer);
        registry.registerTerminator(BrTermNode.class, new BrTermLowerer());

        assertThat(registry.get(AddInstNode.class)).containsSame(addLowerer);
        assertThat(registry.resolve(add("%x", i(32), intLit("1"), intLit("2")))).isSameAs(addLowerer);
        assertThat(registry.resolve(br("%next"))).isInstanceOf(BrTermLowerer.class);
    }

    @Test
    void defaultsCoverEverySupportedInstruction() {
        InstructionLowererRegistry registry = InstructionLowererRegistry.initializeWithDefaults();

        assertThat(registry.get(PhiInstNode.class)).isPresent();
        assertThat(registry.resolve(retVoid())).isNotInstanceOf(DefaultInstructionLowerer.class);
    }
}
