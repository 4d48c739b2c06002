package org.tacheck.service;

import org.tacheck.automata.models.SystemModel;
import org.tacheck.exceptions.QueryParseException;
import org.tacheck.query.Query;
import org.tacheck.query.QueryDispatcher;
import org.tacheck.query.QueryParser;
import org.tacheck.query.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 并发求值查询的服务。每个查询是线程池中的一个独立任务，只读共享已加载的模型，
 * 探索状态属于任务自身，任务结束或被取消后即被丢弃。
 * <p>
 * 配置了时间上限时，超时的查询被中断并得到 INCONCLUSIVE 结果。
 */
public final class QueryService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

    private final EngineConfig config;
    private final QueryDispatcher dispatcher;
    private final ExecutorService executor;

    public QueryService(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null.");
        if (config.getWorkerThreads() <= 0) {
            throw new IllegalArgumentException("工作线程数必须为正: " + config.getWorkerThreads());
        }
        this.dispatcher = new QueryDispatcher(config);
        this.executor = Executors.newFixedThreadPool(config.getWorkerThreads(), new WorkerFactory());
        logger.info("查询服务启动: {}", config);
    }

    /**
     * 异步求值一个查询。返回的 Future 可以被取消，取消会中断正在进行的探索。
     */
    public Future<QueryResult> submit(SystemModel model, Query query) {
        Objects.requireNonNull(model, "Model cannot be null.");
        Objects.requireNonNull(query, "Query cannot be null.");
        return executor.submit(() -> dispatcher.evaluate(model, query));
    }

    /**
     * 解析并异步求值一个查询；无法解析时直接返回已完成的 REJECTED 结果。
     */
    public Future<QueryResult> submit(SystemModel model, String queryText) {
        Query query;
        try {
            query = QueryParser.parse(queryText);
        } catch (QueryParseException e) {
            logger.warn("查询 '{}' 无法解析: {}", queryText, e.getMessage());
            return CompletableFuture.completedFuture(
                    QueryResult.rejected(queryText, "Parse error: " + e.getMessage()));
        }
        return submit(model, query);
    }

    /**
     * 并发求值一组互相独立的查询，按提交顺序返回结果。
     * 查询之间不传递 save-as 保存的组件；需要依赖关系时使用 {@link QueryDispatcher#evaluate(SystemModel, String)}。
     */
    public List<QueryResult> evaluateAll(SystemModel model, List<String> queries) throws InterruptedException {
        List<Future<QueryResult>> futures = new ArrayList<>();
        for (String query : queries) {
            futures.add(submit(model, query));
        }
        List<QueryResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            results.add(await(futures.get(i), queries.get(i)));
        }
        return results;
    }

    /**
     * 等待结果。配置了时间上限时最多等待该时长 (另留一秒给任务自行结束)，超时则取消任务。
     */
    public QueryResult await(Future<QueryResult> future, String queryText) throws InterruptedException {
        try {
            if (config.getTimeoutMillis() > 0) {
                return future.get(config.getTimeoutMillis() + 1000L, TimeUnit.MILLISECONDS);
            }
            return future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("查询 '{}' 超时，已取消", queryText);
            return QueryResult.inconclusive(queryText, "Inconclusive: timed out after "
                    + config.getTimeoutMillis() + " ms");
        } catch (CancellationException e) {
            logger.warn("查询 '{}' 已被取消", queryText);
            return QueryResult.inconclusive(queryText, "Inconclusive: cancelled");
        } catch (ExecutionException e) {
            logger.error("查询 '{}' 求值失败", queryText, e.getCause());
            throw new IllegalStateException("查询 '" + queryText + "' 求值失败", e.getCause());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("查询服务已关闭");
    }

    private static final class WorkerFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "tacheck-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
