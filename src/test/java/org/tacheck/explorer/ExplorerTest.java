package org.tacheck.explorer;

import org.tacheck.Fixtures;
import org.tacheck.automata.base.Action;
import org.tacheck.automata.symbolic.SymbolicState;
import org.tacheck.automata.systems.CompiledComponent;
import org.tacheck.automata.systems.TransitionSystem;
import org.tacheck.exceptions.ExplorationLimitExceededException;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ExplorerTest {

    private TransitionSystem machine;

    @BeforeAll
    void setUp() {
        machine = CompiledComponent.standalone(Fixtures.load("machine.json").getComponent("M"));
    }

    @Nested
    @DisplayName("后继")
    class SuccessorTests {

        @Test
        @DisplayName("守卫为空的迁移不产生后继，同一动作内按边的声明顺序")
        void testSuccessors_ShouldSkipEmptyGuardsAndKeepOrder() {
            // 1. 准备
            Explorer explorer = new Explorer(machine, ExplorationLimits.unbounded());
            SymbolicState initial = explorer.initialStates().get(0);

            // 2. 执行
            List<Explorer.Successor> successors = explorer.successors(initial);

            // 3. 断言
            assertAll(
                    () -> assertEquals(2, successors.size()),
                    () -> assertEquals("M.L1", successors.get(0).getState().getLocation().getId()),
                    () -> assertEquals("M.L2", successors.get(1).getState().getLocation().getId()),
                    () -> assertEquals(Action.of("a"), successors.get(0).getAction()),
                    () -> assertTrue(explorer.successors(initial, Action.of("b")).isEmpty())
            );
        }
    }

    @Nested
    @DisplayName("探索")
    class ExploreTests {

        @Test
        @DisplayName("访问每个可达位置一次，被包含的状态不再访问")
        void testExplore_ShouldVisitReachableLocationsOnce() {
            Explorer explorer = new Explorer(machine, ExplorationLimits.unbounded());
            List<String> visited = new ArrayList<>();

            Explorer.Result result = explorer.explore((index, state) -> {
                visited.add(state.getLocation().getId());
                return false;
            });

            Set<String> distinct = new LinkedHashSet<>(visited);
            assertAll(
                    () -> assertFalse(result.isTargetFound()),
                    () -> assertEquals(Set.of("M.L0", "M.L1", "M.L2"), distinct),
                    () -> assertEquals(visited.size(), distinct.size(), "重复访问: " + visited),
                    () -> assertEquals(3, result.getArena().size())
            );
        }

        @Test
        @DisplayName("访问者返回 true 时停止，并能还原到初始状态的路径")
        void testExplore_WhenTargetFound_ShouldStopWithPath() {
            Explorer explorer = new Explorer(machine, ExplorationLimits.unbounded());

            Explorer.Result result = explorer.explore(
                    (index, state) -> state.getLocation().getId().equals("M.L2"));

            assertTrue(result.isTargetFound());
            List<Integer> path = result.getArena().pathTo(result.getTargetIndex());
            assertAll(
                    () -> assertEquals(2, path.size()),
                    () -> assertEquals(0, path.get(0)),
                    () -> assertNull(result.getArena().getAction(path.get(0))),
                    () -> assertEquals(Action.of("a"), result.getArena().getAction(path.get(1)))
            );
        }

        @Test
        @DisplayName("超过状态数上限时抛出异常")
        void testExplore_WhenStateLimitExceeded_ShouldThrow() {
            Explorer explorer = new Explorer(machine, ExplorationLimits.of(1, 0));

            ExplorationLimitExceededException e = assertThrows(ExplorationLimitExceededException.class,
                    () -> explorer.explore((index, state) -> false));

            assertEquals(2, e.getExploredStates());
        }
    }

    @Nested
    @DisplayName("探索上限")
    class LimitTests {

        @Test
        @DisplayName("非法的上限")
        void testOf_WhenArgumentsInvalid_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> ExplorationLimits.of(0, 0));
            assertThrows(IllegalArgumentException.class, () -> ExplorationLimits.of(10, -1));
        }

        @Test
        @DisplayName("线程被中断时停止")
        void testCheck_WhenInterrupted_ShouldThrow() {
            ExplorationLimits limits = ExplorationLimits.of(10, 0);
            Thread.currentThread().interrupt();
            try {
                assertThrows(ExplorationLimitExceededException.class, () -> limits.check(1));
            } finally {
                Thread.interrupted();
            }
        }

        @Test
        @DisplayName("未超出上限时不抛出")
        void testCheck_WithinLimits_ShouldPass() {
            assertDoesNotThrow(() -> ExplorationLimits.of(10, 60_000).check(10));
            assertDoesNotThrow(() -> ExplorationLimits.unbounded().check(Integer.MAX_VALUE));
        }
    }
}
