package org.tacheck.query;

import org.tacheck.Fixtures;
import org.tacheck.automata.base.Action;
import org.tacheck.automata.models.SystemModel;
import org.tacheck.automata.models.TimedAutomaton;
import org.tacheck.checkers.TraceStep;
import org.tacheck.service.EngineConfig;
import org.tacheck.utils.Rational;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class QueryDispatcherTest {

    private QueryDispatcher dispatcher;

    @BeforeAll
    void setUp() {
        dispatcher = new QueryDispatcher(EngineConfig.builder().concretizeWitnesses(false).build());
    }

    private QueryResult single(SystemModel model, String query) {
        List<QueryResult> results = dispatcher.evaluate(model, query);
        assertEquals(1, results.size());
        return results.get(0);
    }

    private static TraceStep last(QueryResult result) {
        List<TraceStep> witness = result.getWitness();
        return witness.get(witness.size() - 1);
    }

    @Nested
    @DisplayName("精化")
    class RefinementTests {

        private SystemModel model;

        @BeforeEach
        void load() {
            model = Fixtures.load("refinement.json");
        }

        @Test
        @DisplayName("输出窗口更小的一侧精化更大的一侧")
        void testRefinement_WhenOutputWindowNarrower_ShouldSucceed() {
            QueryResult result = single(model, "refinement: G1 <= G2");

            assertEquals(QueryResult.Status.SUCCESS, result.getStatus(), result.toString());
        }

        @Test
        @DisplayName("左侧可以在右侧不允许的时刻输出时失败，并给出见证")
        void testRefinement_WhenLeftOutputsTooLate_ShouldFailWithWitness() {
            // 1. 准备 & 2. 执行
            QueryResult result = single(model, "refinement: G2 <= G1");

            // 3. 断言: 最后一步的区域是 G1 无法匹配的部分，例如 x == 7
            assertEquals(QueryResult.Status.FAILURE, result.getStatus(), result.toString());
            assertAll(
                    () -> assertTrue(result.getDiagnostics().contains("output o"), result.getDiagnostics()),
                    () -> assertTrue(result.hasWitness()),
                    () -> assertTrue(last(result).getZone().contains(new Rational[]{
                            Rational.ZERO, Rational.valueOf(7), Rational.valueOf(7)})),
                    () -> assertFalse(last(result).getZone().contains(new Rational[]{
                            Rational.ZERO, Rational.valueOf(3), Rational.valueOf(3)}))
            );
        }

        @Test
        @DisplayName("精化是自反且传递的")
        void testRefinement_ShouldBeReflexiveAndTransitive() {
            List<QueryResult> results = dispatcher.evaluate(model,
                    "refinement: G1 <= G1; refinement: G3 <= G1; refinement: G1 <= G2; refinement: G3 <= G2");

            assertEquals(4, results.size());
            for (QueryResult result : results) {
                assertEquals(QueryResult.Status.SUCCESS, result.getStatus(), result.toString());
            }
        }

        @Test
        @DisplayName("组合系统精化规约，反之不成立")
        void testRefinement_CompositionAgainstSpecification() {
            SystemModel coffee = Fixtures.load("coffee.json");

            QueryResult forward = single(coffee, "refinement: Machine // Researcher <= Spec");
            QueryResult backward = single(coffee, "refinement: Spec <= Machine // Researcher");

            assertAll(
                    () -> assertEquals(QueryResult.Status.SUCCESS, forward.getStatus(), forward.toString()),
                    () -> assertEquals(QueryResult.Status.FAILURE, backward.getStatus(), backward.toString())
            );
        }

        @Test
        @DisplayName("进入位置时不满足下界不变式的点不能靠延迟进入该位置")
        void testRefinement_WhenTargetInvariantHasLowerBound_ShouldOnlyDelayFromEnteredPoints() {
            // 1. 准备: A 在 L1 的不变式 x >= 5 保证 x - y >= 5，因此 b 的守卫 x - y < 4 永远不可满足
            SystemModel lowerBound = Fixtures.load("lowerbound.json");

            // 2. 执行
            QueryResult result = single(lowerBound, "refinement: A <= B");

            // 3. 断言
            assertEquals(QueryResult.Status.SUCCESS, result.getStatus(), result.toString());
        }
    }

    @Nested
    @DisplayName("一致性")
    class ConsistencyTests {

        @Test
        @DisplayName("合取的初始不变量不成立时失败")
        void testConsistency_WhenConjunctionInitiallyInconsistent_ShouldFail() {
            QueryResult result = single(Fixtures.load("conjunction.json"), "consistency: A && B");

            assertEquals(QueryResult.Status.FAILURE, result.getStatus());
            assertTrue(result.getDiagnostics().startsWith("The initial state is inconsistent"), result.getDiagnostics());
        }

        @Test
        @DisplayName("可以一直输出的合取是一致的")
        void testConsistency_WhenOutputsKeepSystemAlive_ShouldSucceed() {
            QueryResult result = single(Fixtures.load("conjunction.json"), "consistency: A && C");

            assertEquals(QueryResult.Status.SUCCESS, result.getStatus(), result.toString());
        }

        @Test
        @DisplayName("咖啡机与研究员的并行组合是一致的")
        void testConsistency_Composition_ShouldSucceed() {
            QueryResult result = single(Fixtures.load("coffee.json"), "consistency: Machine // Researcher");

            assertEquals(QueryResult.Status.SUCCESS, result.getStatus(), result.toString());
        }

        @Test
        @DisplayName("两条路径到达同一个时间锁区域时都判定为不一致")
        void testConsistency_WhenTimelockReachedTwice_ShouldFail() {
            // 1. 准备: C 先经 o1 直接到达 Bad，再经 o2、o3 以相同区域到达 Bad；D 只有后一条路径
            SystemModel timelock = Fixtures.load("timelock.json");

            // 2. 执行
            QueryResult shared = single(timelock, "consistency: C");
            QueryResult single = single(timelock, "consistency: D");

            // 3. 断言
            assertAll(
                    () -> assertEquals(QueryResult.Status.FAILURE, shared.getStatus(), shared.toString()),
                    () -> assertTrue(shared.getDiagnostics().startsWith("A timelock is reachable"),
                            shared.getDiagnostics()),
                    () -> assertEquals(QueryResult.Status.FAILURE, single.getStatus(), single.toString()),
                    () -> assertTrue(single.getDiagnostics().startsWith("A timelock is reachable"),
                            single.getDiagnostics())
            );
        }
    }

    @Nested
    @DisplayName("确定性")
    class DeterminismTests {

        private SystemModel model;

        @BeforeEach
        void load() {
            model = Fixtures.load("machine.json");
        }

        @Test
        @DisplayName("同一动作的两条边守卫重叠时失败，见证落在重叠区域")
        void testDeterminism_WhenGuardsOverlap_ShouldFail() {
            QueryResult result = single(model, "determinism: M");

            assertEquals(QueryResult.Status.FAILURE, result.getStatus());
            assertAll(
                    () -> assertTrue(result.getDiagnostics().contains("Non-deterministic choice on action a"),
                            result.getDiagnostics()),
                    () -> assertTrue(last(result).getZone().contains(new Rational[]{
                            Rational.ZERO, Rational.valueOf("3/2")})),
                    () -> assertFalse(last(result).getZone().contains(new Rational[]{
                            Rational.ZERO, Rational.valueOf("1/2")}))
            );
        }

        @Test
        @DisplayName("守卫互不相交时成立")
        void testDeterminism_WhenGuardsDisjoint_ShouldSucceed() {
            QueryResult result = single(model, "determinism: D");

            assertEquals(QueryResult.Status.SUCCESS, result.getStatus(), result.toString());
        }
    }

    @Nested
    @DisplayName("可达性")
    class ReachabilityTests {

        private SystemModel model;

        @BeforeEach
        void load() {
            model = Fixtures.load("machine.json");
        }

        @Test
        @DisplayName("守卫不可满足的位置不可达，没有见证")
        void testReachability_WhenGuardUnsatisfiable_ShouldFail() {
            QueryResult result = single(model, "reachability: M.L5");

            assertEquals(QueryResult.Status.FAILURE, result.getStatus());
            assertFalse(result.hasWitness());
        }

        @Test
        @DisplayName("可达的位置给出从初始状态出发的路径")
        void testReachability_WhenReachable_ShouldReturnPath() {
            QueryResult result = single(model, "reachability: M.L2");

            assertEquals(QueryResult.Status.SUCCESS, result.getStatus(), result.toString());
            assertAll(
                    () -> assertNull(result.getWitness().get(0).getAction()),
                    () -> assertEquals(Action.of("a"), last(result).getAction())
            );
        }

        @Test
        @DisplayName("目标中的时钟约束")
        void testReachability_WithClockConstraint() {
            QueryResult result = single(model, "reachability: M -> M.L1 && M.x > 5");

            assertEquals(QueryResult.Status.SUCCESS, result.getStatus(), result.toString());
        }
    }

    @Nested
    @DisplayName("保存组件")
    class SaveTests {

        @Test
        @DisplayName("get-components 保存的组件对之后的查询可见")
        void testGetComponents_SavedComponentUsableLater() {
            // 1. 准备
            SystemModel model = Fixtures.load("conjunction.json");

            // 2. 执行
            List<QueryResult> results = dispatcher.evaluate(model,
                    "get-components: A && C save-as AC; consistency: AC");

            // 3. 断言
            assertEquals(2, results.size());
            QueryResult saved = results.get(0);
            assertEquals(QueryResult.Status.SUCCESS, saved.getStatus(), saved.toString());
            TimedAutomaton component = saved.getSavedComponent().orElseThrow();
            assertAll(
                    () -> assertEquals("AC", component.getName()),
                    () -> assertEquals(1, component.getLocations().size()),
                    () -> assertEquals(2, component.getClocks().size()),
                    () -> assertEquals(Set.of(Action.of("req")), component.getInputs()),
                    () -> assertEquals(Set.of(Action.of("ack")), component.getOutputs()),
                    () -> assertEquals(QueryResult.Status.SUCCESS, results.get(1).getStatus(), results.get(1).toString())
            );
        }

        @Test
        @DisplayName("剪枝去掉初始状态时失败，否则保存组件")
        void testPrune() {
            SystemModel model = Fixtures.load("conjunction.json");

            QueryResult removed = single(model, "prune: A && B save-as P");
            QueryResult kept = single(model, "prune: A && C save-as Q");

            assertAll(
                    () -> assertEquals(QueryResult.Status.FAILURE, removed.getStatus()),
                    () -> assertTrue(removed.getSavedComponent().isEmpty()),
                    () -> assertEquals(QueryResult.Status.SUCCESS, kept.getStatus(), kept.toString()),
                    () -> assertEquals("Q", kept.getSavedComponent().orElseThrow().getName())
            );
        }

        @Test
        @DisplayName("不一致的系统不能保存")
        void testGetComponents_WhenInconsistent_ShouldFail() {
            QueryResult result = single(Fixtures.load("conjunction.json"), "get-components: A && B save-as AB");

            assertEquals(QueryResult.Status.FAILURE, result.getStatus());
            assertTrue(result.getSavedComponent().isEmpty());
        }
    }

    @Nested
    @DisplayName("拒绝与无结论")
    class RejectionTests {

        @Test
        @DisplayName("无法解析的段被拒绝，其余段照常求值")
        void testEvaluate_WhenSegmentUnparsable_ShouldContinue() {
            List<QueryResult> results = dispatcher.evaluate(Fixtures.load("refinement.json"),
                    "refinement: G1 <= ; refinement: G1 <= G2");

            assertAll(
                    () -> assertEquals(2, results.size()),
                    () -> assertEquals(QueryResult.Status.REJECTED, results.get(0).getStatus()),
                    () -> assertTrue(results.get(0).getDiagnostics().startsWith("Parse error")),
                    () -> assertEquals(QueryResult.Status.SUCCESS, results.get(1).getStatus())
            );
        }

        @Test
        @DisplayName("未知组件与不满足前提的运算被拒绝")
        void testEvaluate_WhenModelInvalidForQuery_ShouldReject() {
            SystemModel coffee = Fixtures.load("coffee.json");

            QueryResult unknown = single(coffee, "consistency: Nobody");
            QueryResult badQuotient = single(coffee, "consistency: Machine \\\\ Spec");
            QueryResult badComposition = single(coffee, "consistency: Machine // Machine");

            assertAll(
                    () -> assertEquals(QueryResult.Status.REJECTED, unknown.getStatus()),
                    () -> assertTrue(unknown.getDiagnostics().startsWith("Model error")),
                    () -> assertEquals(QueryResult.Status.REJECTED, badQuotient.getStatus()),
                    () -> assertEquals(QueryResult.Status.REJECTED, badComposition.getStatus())
            );
        }

        @Test
        @DisplayName("超过状态上限时没有结论")
        void testEvaluate_WhenStateLimitReached_ShouldBeInconclusive() {
            QueryDispatcher limited = new QueryDispatcher(
                    EngineConfig.builder().maxStates(1).concretizeWitnesses(false).build());

            List<QueryResult> results = limited.evaluate(Fixtures.load("coffee.json"),
                    "consistency: Machine // Researcher");

            assertEquals(QueryResult.Status.INCONCLUSIVE, results.get(0).getStatus());
            assertTrue(results.get(0).getDiagnostics().startsWith("Inconclusive"));
        }

        @Test
        @DisplayName("剪枝的不动点迭代同样受状态上限约束")
        void testPrune_WhenStateLimitReached_ShouldBeInconclusive() {
            // 1. 准备: M 有多个位置，第二个位置的求值就超出上限
            QueryDispatcher limited = new QueryDispatcher(
                    EngineConfig.builder().maxStates(1).concretizeWitnesses(false).build());

            // 2. 执行
            List<QueryResult> results = limited.evaluate(Fixtures.load("machine.json"), "prune: M save-as P");

            // 3. 断言
            assertAll(
                    () -> assertEquals(1, results.size()),
                    () -> assertEquals(QueryResult.Status.INCONCLUSIVE, results.get(0).getStatus()),
                    () -> assertTrue(results.get(0).getDiagnostics().startsWith("Inconclusive")),
                    () -> assertTrue(results.get(0).getSavedComponent().isEmpty())
            );
        }
    }

    @Nested
    @DisplayName("具体见证")
    class ConcreteWitnessTests {

        @Test
        @DisplayName("启用 Z3 时见证的每一步都有落在区域内的时钟赋值")
        void testEvaluate_WhenConcretizing_ShouldAttachValuations() {
            QueryDispatcher concretizing = new QueryDispatcher(EngineConfig.builder().concretizeWitnesses(true).build());

            QueryResult result = concretizing.evaluate(Fixtures.load("machine.json"), "determinism: M").get(0);

            assertEquals(QueryResult.Status.FAILURE, result.getStatus());
            for (TraceStep step : result.getWitness()) {
                assertTrue(step.hasValuation(), step.toString());
            }
        }
    }
}
