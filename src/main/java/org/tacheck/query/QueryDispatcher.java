package org.tacheck.query;

import org.tacheck.automata.models.SystemModel;
import org.tacheck.automata.models.TimedAutomaton;
import org.tacheck.automata.systems.ComponentExtractor;
import org.tacheck.automata.systems.Pruned;
import org.tacheck.automata.systems.TransitionSystem;
import org.tacheck.checkers.CheckResult;
import org.tacheck.checkers.ConsistencyChecker;
import org.tacheck.checkers.DeterminismChecker;
import org.tacheck.checkers.ReachabilityChecker;
import org.tacheck.checkers.RefinementChecker;
import org.tacheck.checkers.TraceStep;
import org.tacheck.exceptions.ExplorationLimitExceededException;
import org.tacheck.exceptions.ModelException;
import org.tacheck.exceptions.QueryParseException;
import org.tacheck.explorer.ExplorationLimits;
import org.tacheck.service.EngineConfig;
import org.tacheck.symbolic.Z3Oracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 把查询映射为系统构造与检查器调用，并把结论包装为 {@link QueryResult}。
 * <p>
 * 求值没有隐藏状态：每次调用都重新编译所需的系统，使用自己的探索状态，
 * 因此同一个 QueryDispatcher 可以被多个线程同时调用。
 */
public final class QueryDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(QueryDispatcher.class);

    private final EngineConfig config;

    public QueryDispatcher(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null.");
    }

    public QueryDispatcher() {
        this(EngineConfig.defaults());
    }

    /**
     * 解析并依次求值分号分隔的查询。get-components 与 prune 查询保存的组件对其后的查询可见。
     * 某一段无法解析时，该段得到 REJECTED 结果，其余各段照常求值。
     */
    public List<QueryResult> evaluate(SystemModel model, String queries) {
        Objects.requireNonNull(model, "Model cannot be null.");
        Objects.requireNonNull(queries, "Queries cannot be null.");
        List<QueryResult> results = new ArrayList<>();
        SystemModel current = model;
        for (QueryParser.Segment segment : QueryParser.split(queries)) {
            Query query;
            try {
                query = QueryParser.parse(segment);
            } catch (QueryParseException e) {
                logger.warn("查询 '{}' 无法解析: {}", segment, e.getMessage());
                results.add(QueryResult.rejected(segment.toString(), "Parse error: " + e.getMessage()));
                continue;
            }
            QueryResult result = evaluate(current, query);
            if (result.isSuccess() && result.getSavedComponent().isPresent()) {
                current = current.withComponent(result.getSavedComponent().get());
            }
            results.add(result);
        }
        return results;
    }

    /**
     * 求值单个查询。逻辑上的否定结论、资源耗尽与模型错误都以结果的形式返回，不抛出异常。
     */
    public QueryResult evaluate(SystemModel model, Query query) {
        Objects.requireNonNull(model, "Model cannot be null.");
        Objects.requireNonNull(query, "Query cannot be null.");
        long startNanos = System.nanoTime();
        QueryResult result;
        try {
            result = dispatch(model, query, config.newLimits());
        } catch (ModelException e) {
            logger.warn("查询 '{}' 被拒绝: {}", query, e.getMessage());
            result = QueryResult.rejected(query.getText(), "Model error: " + e.getMessage());
        } catch (ExplorationLimitExceededException e) {
            logger.warn("查询 '{}' 在探索 {} 个状态后中止: {}", query, e.getExploredStates(), e.getMessage());
            result = QueryResult.inconclusive(query.getText(),
                    "Inconclusive: exploration limit reached after " + e.getExploredStates() + " states ("
                            + e.getMessage() + ")");
        }
        logger.info("查询 '{}' -> {} ({} ms)", query, result.getStatus(), (System.nanoTime() - startNanos) / 1_000_000);
        return result;
    }

    private QueryResult dispatch(SystemModel model, Query query, ExplorationLimits limits) {
        String text = query.getText();
        List<TransitionSystem> systems = SystemCompiler.compile(model, query.getSystems(), limits);
        TransitionSystem system = systems.get(0);
        boolean reduce = config.isReduceClocks();
        return switch (query.getKind()) {
            case REFINEMENT -> withConcreteWitness(system, QueryResult.of(text,
                    new RefinementChecker(system, systems.get(1), limits, reduce).check()));
            case CONSISTENCY -> withConcreteWitness(system, QueryResult.of(text,
                    new ConsistencyChecker(system, limits, reduce).check()));
            case DETERMINISM -> withConcreteWitness(system, QueryResult.of(text,
                    new DeterminismChecker(system, limits, reduce).check()));
            case REACHABILITY -> withConcreteWitness(system, QueryResult.of(text,
                    new ReachabilityChecker(system, limits, reduce).check(query.getStart(), query.getTarget())));
            case GET_COMPONENTS -> getComponents(system, query, limits);
            case PRUNE -> prune(system, query, limits);
        };
    }

    private QueryResult getComponents(TransitionSystem system, Query query, ExplorationLimits limits) {
        CheckResult consistency = new ConsistencyChecker(system, limits, config.isReduceClocks()).check();
        if (!consistency.isSatisfied()) {
            return withConcreteWitness(system, QueryResult.failure(query.getText(),
                    "The system is not consistent: " + consistency.getMessage(), consistency.getWitness()));
        }
        TimedAutomaton component = ComponentExtractor.extract(system, query.getSaveAs());
        return QueryResult.success(query.getText(), "Saved component " + component.getName()
                + " with " + component.getLocations().size() + " locations", component);
    }

    private QueryResult prune(TransitionSystem system, Query query, ExplorationLimits limits) {
        Pruned pruned = system instanceof Pruned ? (Pruned) system : new Pruned(system, limits);
        if (!pruned.isInitialStateConsistent()) {
            return QueryResult.failure(query.getText(),
                    "Pruning removes the initial state: the system has no consistent part", List.of());
        }
        TimedAutomaton component = ComponentExtractor.extract(pruned, query.getSaveAs());
        return QueryResult.success(query.getText(), "Saved pruned component " + component.getName()
                + " with " + component.getLocations().size() + " locations", component);
    }

    /**
     * 为见证路径的每一步用 Z3 采样一个具体时钟赋值。
     */
    private QueryResult withConcreteWitness(TransitionSystem system, QueryResult result) {
        if (!config.isConcretizeWitnesses() || !result.hasWitness()) {
            return result;
        }
        List<TraceStep> concrete = new ArrayList<>();
        try (Z3Oracle oracle = new Z3Oracle(system.getClockTable().getClocks())) {
            for (TraceStep step : result.getWitness()) {
                concrete.add(oracle.sample(step.getZone()).map(step::withValuation).orElse(step));
            }
        }
        return result.withWitness(concrete);
    }
}
