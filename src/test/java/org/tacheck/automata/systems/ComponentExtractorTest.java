package org.tacheck.automata.systems;

import org.tacheck.Fixtures;
import org.tacheck.automata.base.Action;
import org.tacheck.automata.base.Edge;
import org.tacheck.automata.models.TimedAutomaton;
import org.tacheck.core.Clock;
import org.tacheck.expressions.dcs.ClockConstraint;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ComponentExtractorTest {

    @Test
    @DisplayName("名称规范化为标识符")
    void testSanitize() {
        assertAll(
                () -> assertEquals("A_2_x", ComponentExtractor.sanitize("A#2.x")),
                () -> assertEquals("A_L0_B_L1", ComponentExtractor.sanitize("(A.L0 && B.L1)")),
                () -> assertEquals("_1abc", ComponentExtractor.sanitize("1abc")),
                () -> assertEquals("L", ComponentExtractor.sanitize("##"))
        );
    }

    @Test
    @DisplayName("单个组件展开后保持位置、不变量与守卫")
    void testExtract_SingleComponent_ShouldPreserveStructure() {
        // 1. 准备
        TimedAutomaton machine = Fixtures.load("coffee.json").getComponent("Machine");

        // 2. 执行
        TimedAutomaton copy = ComponentExtractor.extract(CompiledComponent.standalone(machine), "Copy");

        // 3. 断言
        Clock y = Clock.of("Copy", "Machine_y");
        assertAll(
                () -> assertEquals(List.of(y), copy.getClocks()),
                () -> assertEquals(machine.getInputs(), copy.getInputs()),
                () -> assertEquals(machine.getOutputs(), copy.getOutputs()),
                () -> assertEquals("Machine_Idle", copy.getInitialLocation().getName()),
                () -> assertEquals(List.of(ClockConstraint.lessEqual(y, 6)),
                        copy.getLocation("Machine_Brew").getInvariant()),
                () -> assertEquals(3, copy.getEdges().size())
        );
        Edge coffee = copy.getEdges().stream()
                .filter(edge -> edge.getAction().equals(Action.of("cof")))
                .findFirst()
                .orElseThrow();
        assertTrue(coffee.getGuard().contains(ClockConstraint.greaterEqual(y, 4)), coffee.getGuard().toString());
    }

    @Test
    @DisplayName("重复出现的组件时钟名带序号")
    void testExtract_WhenComponentRepeated_ShouldKeepClocksApart() {
        TimedAutomaton a = Fixtures.load("conjunction.json").getComponent("A");
        ClockIndexTable.Builder builder = ClockIndexTable.builder();
        ClockIndexTable.Allocation first = builder.allocate(a);
        ClockIndexTable.Allocation second = builder.allocate(a);
        ClockIndexTable table = builder.build();

        TransitionSystem conjunction = new Pruned(new Conjunction(
                CompiledComponent.of(a, first, table), CompiledComponent.of(a, second, table)));
        TimedAutomaton extracted = ComponentExtractor.extract(conjunction, "AA");

        assertAll(
                () -> assertEquals("A#2", second.getInstanceName()),
                () -> assertEquals(List.of(Clock.of("AA", "A_x"), Clock.of("AA", "A_2_x")), extracted.getClocks()),
                () -> assertEquals(1, extracted.getLocations().size())
        );
    }
}
