package org.tacheck.service;

import org.tacheck.Fixtures;
import org.tacheck.automata.models.SystemModel;
import org.tacheck.query.QueryDispatcher;
import org.tacheck.query.QueryResult;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class QueryServiceTest {

    private EngineConfig config;
    private SystemModel model;

    @BeforeAll
    void setUp() {
        config = EngineConfig.builder().workerThreads(4).concretizeWitnesses(false).build();
        model = Fixtures.load("refinement.json");
    }

    @Test
    @DisplayName("并发求值的结果与顺序求值一致，且按提交顺序返回")
    void testEvaluateAll_ShouldMatchSequentialResults() throws InterruptedException {
        // 1. 准备
        List<String> queries = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            queries.add("refinement: G1 <= G2");
            queries.add("refinement: G2 <= G1");
            queries.add("determinism: G3");
        }
        QueryDispatcher sequential = new QueryDispatcher(config);

        // 2. 执行
        List<QueryResult> concurrent;
        try (QueryService service = new QueryService(config)) {
            concurrent = service.evaluateAll(model, queries);
        }

        // 3. 断言
        assertEquals(queries.size(), concurrent.size());
        for (int i = 0; i < queries.size(); i++) {
            QueryResult expected = sequential.evaluate(model, queries.get(i)).get(0);
            assertEquals(expected.getStatus(), concurrent.get(i).getStatus(), queries.get(i));
            assertEquals(expected.getDiagnostics(), concurrent.get(i).getDiagnostics(), queries.get(i));
            assertEquals(queries.get(i), concurrent.get(i).getQuery());
        }
    }

    @Test
    @DisplayName("无法解析的查询直接得到 REJECTED")
    void testSubmit_WhenUnparsable_ShouldBeRejected() throws Exception {
        try (QueryService service = new QueryService(config)) {
            QueryResult result = service.submit(model, "refinement G1").get();

            assertEquals(QueryResult.Status.REJECTED, result.getStatus());
        }
    }

    @Test
    @DisplayName("被取消或超时的任务没有结论")
    void testAwait_WhenCancelledOrTimedOut_ShouldBeInconclusive() throws InterruptedException {
        CompletableFuture<QueryResult> cancelled = new CompletableFuture<>();
        cancelled.cancel(true);
        CompletableFuture<QueryResult> never = new CompletableFuture<>();

        try (QueryService service = new QueryService(config);
             QueryService bounded = new QueryService(config.toBuilder().timeoutMillis(1).build())) {
            QueryResult cancelledResult = service.await(cancelled, "q1");
            QueryResult timedOut = bounded.await(never, "q2");

            assertAll(
                    () -> assertEquals(QueryResult.Status.INCONCLUSIVE, cancelledResult.getStatus()),
                    () -> assertEquals(QueryResult.Status.INCONCLUSIVE, timedOut.getStatus()),
                    () -> assertTrue(timedOut.getDiagnostics().contains("timed out")),
                    () -> assertTrue(never.isCancelled())
            );
        }
    }

    @Test
    @DisplayName("任务内部的异常作为 IllegalStateException 抛出")
    void testAwait_WhenTaskFails_ShouldThrow() {
        CompletableFuture<QueryResult> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalArgumentException("boom"));

        try (QueryService service = new QueryService(config)) {
            IllegalStateException e = assertThrows(IllegalStateException.class, () -> service.await(failed, "q"));
            assertTrue(e.getCause() instanceof IllegalArgumentException);
        }
    }

    @Test
    @DisplayName("工作线程数必须为正")
    void testConstructor_WhenNoWorkers_ShouldThrow() {
        EngineConfig invalid = config.toBuilder().workerThreads(0).build();

        assertThrows(IllegalArgumentException.class, () -> new QueryService(invalid));
    }
}
