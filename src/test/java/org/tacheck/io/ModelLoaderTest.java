package org.tacheck.io;

import org.tacheck.Fixtures;
import org.tacheck.automata.base.Action;
import org.tacheck.automata.base.Edge;
import org.tacheck.automata.base.SyncType;
import org.tacheck.automata.models.SystemModel;
import org.tacheck.automata.models.TimedAutomaton;
import org.tacheck.core.Clock;
import org.tacheck.exceptions.ModelException;
import org.tacheck.expressions.dcs.ClockConstraint;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ModelLoaderTest {

    private ModelLoader loader;

    @BeforeAll
    void setUp() {
        loader = new ModelLoader();
    }

    @Nested
    @DisplayName("读取模型")
    class LoadTests {

        @Test
        @DisplayName("读取组件的时钟、字母表、位置与边")
        void testLoad_ShouldReadAllParts() {
            // 1. 准备 & 2. 执行
            SystemModel model = Fixtures.load("coffee.json");
            TimedAutomaton machine = model.getComponent("Machine");
            Clock y = Clock.of("Machine", "y");

            // 3. 断言
            assertAll(
                    () -> assertEquals(Set.of("Machine", "Researcher", "Spec"), model.getComponentNames()),
                    () -> assertEquals(List.of(y), machine.getClocks()),
                    () -> assertEquals(Set.of(Action.of("coin")), machine.getInputs()),
                    () -> assertEquals(Set.of(Action.of("cof")), machine.getOutputs()),
                    () -> assertEquals("Idle", machine.getInitialLocation().getName()),
                    () -> assertEquals(List.of(ClockConstraint.lessEqual(y, 6)),
                            machine.getLocation("Brew").getInvariant()),
                    () -> assertEquals(3, machine.getEdges().size())
            );
            Edge brew = machine.getEdgesFrom(machine.getLocation("Idle")).get(0);
            assertAll(
                    () -> assertEquals(SyncType.INPUT, brew.getSyncType()),
                    () -> assertEquals(Integer.valueOf(0), brew.getResetSet().getResets().get(y)),
                    () -> assertTrue(brew.getGuard().isEmpty())
            );
        }

        @Test
        @DisplayName("缺省的方向由字母表推断，缺省的 sync 是静默边")
        void testReadComponent_WhenTypeOmitted_ShouldInferFromAlphabet() {
            String json = "{\"components\": [{\"name\": \"P\", \"clocks\": [\"x\"], \"inputs\": [\"a\"], \"outputs\": [\"b\"],"
                    + "\"locations\": [{\"id\": \"L0\", \"initial\": true}, {\"id\": \"L1\"}],"
                    + "\"edges\": [{\"source\": \"L0\", \"target\": \"L1\", \"sync\": \"a\"},"
                    + "{\"source\": \"L1\", \"target\": \"L0\", \"sync\": \"b\", \"guard\": \"x > 1 && x <= 4\"},"
                    + "{\"source\": \"L1\", \"target\": \"L1\", \"update\": \"x := 0\"}]}]}";

            TimedAutomaton p = loader.fromJson(json).getComponent("P");

            assertAll(
                    () -> assertEquals(SyncType.INPUT, p.getEdges().get(0).getSyncType()),
                    () -> assertEquals(SyncType.OUTPUT, p.getEdges().get(1).getSyncType()),
                    () -> assertEquals(2, p.getEdges().get(1).getGuard().size()),
                    () -> assertTrue(p.getEdges().get(2).isSilent())
            );
        }
    }

    @Nested
    @DisplayName("非法模型")
    class ErrorTests {

        @Test
        @DisplayName("不是 JSON 或缺少 components")
        void testFromJson_WhenStructureInvalid_ShouldThrowModelException() {
            assertAll(
                    () -> assertThrows(ModelException.class, () -> loader.fromJson("{not json")),
                    () -> assertThrows(ModelException.class, () -> loader.fromJson("{}")),
                    () -> assertThrows(ModelException.class, () -> loader.fromJson("{\"components\": {}}"))
            );
        }

        @Test
        @DisplayName("引用不存在的位置")
        void testFromJson_WhenLocationUnknown_ShouldThrow() {
            String json = "{\"components\": [{\"name\": \"P\", \"outputs\": [\"b\"],"
                    + "\"locations\": [{\"id\": \"L0\", \"initial\": true}],"
                    + "\"edges\": [{\"source\": \"L0\", \"target\": \"Nowhere\", \"sync\": \"b\"}]}]}";

            ModelException e = assertThrows(ModelException.class, () -> loader.fromJson(json));
            assertTrue(e.getMessage().contains("Nowhere"));
        }

        @Test
        @DisplayName("约束引用未声明的时钟或格式错误")
        void testFromJson_WhenConstraintInvalid_ShouldThrow() {
            String undeclared = "{\"components\": [{\"name\": \"P\", \"clocks\": [\"x\"],"
                    + "\"locations\": [{\"id\": \"L0\", \"initial\": true, \"invariant\": \"y <= 3\"}]}]}";
            String malformed = "{\"components\": [{\"name\": \"P\", \"clocks\": [\"x\"],"
                    + "\"locations\": [{\"id\": \"L0\", \"initial\": true, \"invariant\": \"x <=\"}]}]}";

            assertThrows(ModelException.class, () -> loader.fromJson(undeclared));
            assertThrows(ModelException.class, () -> loader.fromJson(malformed));
        }

        @Test
        @DisplayName("没有初始位置、方向非法或输入输出重叠")
        void testFromJson_WhenComponentInvalid_ShouldThrow() {
            String noInitial = "{\"components\": [{\"name\": \"P\", \"locations\": [{\"id\": \"L0\"}]}]}";
            String badType = "{\"components\": [{\"name\": \"P\", \"outputs\": [\"b\"],"
                    + "\"locations\": [{\"id\": \"L0\", \"initial\": true}],"
                    + "\"edges\": [{\"source\": \"L0\", \"target\": \"L0\", \"sync\": \"b\", \"type\": \"SIDEWAYS\"}]}]}";
            String overlap = "{\"components\": [{\"name\": \"P\", \"inputs\": [\"a\"], \"outputs\": [\"a\"],"
                    + "\"locations\": [{\"id\": \"L0\", \"initial\": true}]}]}";

            assertAll(
                    () -> assertThrows(ModelException.class, () -> loader.fromJson(noInitial)),
                    () -> assertThrows(ModelException.class, () -> loader.fromJson(badType)),
                    () -> assertThrows(ModelException.class, () -> loader.fromJson(overlap))
            );
        }
    }

    @Nested
    @DisplayName("写出模型")
    class WriteTests {

        @Test
        @DisplayName("写出的文件可以被重新读取，结构保持不变")
        void testWrite_ThenLoad_ShouldPreserveStructure(@TempDir Path dir) throws IOException {
            // 1. 准备
            TimedAutomaton machine = Fixtures.load("coffee.json").getComponent("Machine");
            Path file = dir.resolve("out/saved.json");

            // 2. 执行
            new ModelWriter().write(List.of(machine), file);
            TimedAutomaton reloaded = loader.load(file).getComponent("Machine");

            // 3. 断言
            assertAll(
                    () -> assertEquals(machine.getClocks(), reloaded.getClocks()),
                    () -> assertEquals(machine.getAlphabet(), reloaded.getAlphabet()),
                    () -> assertEquals(machine.getLocations(), reloaded.getLocations()),
                    () -> assertEquals(machine.getEdges(), reloaded.getEdges())
            );
        }

        @Test
        @DisplayName("守卫与更新以文本形式写出")
        void testToJson_ShouldFormatConstraintsAndUpdates() {
            TimedAutomaton machine = Fixtures.load("coffee.json").getComponent("Machine");

            String json = new ModelWriter().toJson(machine).toString();

            assertAll(
                    () -> assertTrue(json.contains("\"guard\":\"y >= 4\"")),
                    () -> assertTrue(json.contains("\"update\":\"y = 0\"")),
                    () -> assertTrue(json.contains("\"invariant\":\"y <= 6\""))
            );
        }
    }
}
