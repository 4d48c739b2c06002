package org.tacheck.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;
import com.microsoft.z3.RatNum;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import lombok.Getter;
import org.tacheck.core.Clock;
import org.tacheck.core.ClockValuation;
import org.tacheck.expressions.dcs.DBM;
import org.tacheck.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 封装一个 Z3 Context，用于从区域中采样具体时钟赋值，以及独立地检查区域的可满足性。
 * Z3 Context 不是线程安全的：每个查询使用自己的 Z3Oracle，用完后关闭。
 */
public class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    @Getter
    private final Context context;
    @Getter
    private final Z3VariableManager varManager;

    /**
     * @param clockOrder 区域矩阵下标 1..n 对应的时钟。
     */
    public Z3Oracle(List<Clock> clockOrder) {
        this.context = new Context();
        this.varManager = new Z3VariableManager(context, clockOrder);
    }

    /**
     * 在全局约束 (x0 == 0, xi >= 0) 下检查表达式。
     */
    public Status check(BoolExpr expr) {
        Solver solver = context.mkSolver();
        varManager.assertGlobalConstraints(solver);
        solver.add(expr);
        Status status = solver.check();
        logger.debug("Z3Oracle.check: {} -> {}", expr, status);
        return status;
    }

    public boolean isSatisfiable(DBM zone) {
        return check(zone.toZ3BoolExpr(context, varManager)) == Status.SATISFIABLE;
    }

    /**
     * 从区域中取一个具体赋值。
     * @return 区域为空或 Z3 无法给出模型时返回 empty
     */
    public Optional<ClockValuation> sample(DBM zone) {
        if (zone.isEmpty()) {
            return Optional.empty();
        }
        Solver solver = context.mkSolver();
        varManager.assertGlobalConstraints(solver);
        solver.add(zone.toZ3BoolExpr(context, varManager));
        Status status = solver.check();
        if (status != Status.SATISFIABLE) {
            logger.warn("Z3Oracle.sample: 非空区域 {} 的求解结果为 {}", zone, status);
            return Optional.empty();
        }
        Model model = solver.getModel();
        Map<Clock, Rational> values = new HashMap<>();
        for (Clock clock : varManager.getClockOrder()) {
            Expr<?> value = model.eval(varManager.getZ3Var(clock), true);
            Rational rational = toRational(value);
            if (rational == null) {
                logger.warn("Z3Oracle.sample: 无法把 {} 的取值 {} 转换为有理数", clock, value);
                return Optional.empty();
            }
            values.put(clock, rational);
        }
        return Optional.of(ClockValuation.of(values));
    }

    private static Rational toRational(Expr<?> value) {
        if (value instanceof RatNum) {
            return Rational.fromZ3((RatNum) value);
        }
        if (value instanceof IntNum) {
            return Rational.valueOf(((IntNum) value).getBigInteger(), BigInteger.ONE);
        }
        return null;
    }

    @Override
    public void close() {
        context.close();
    }
}
