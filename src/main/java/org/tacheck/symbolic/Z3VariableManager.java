package org.tacheck.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;
import lombok.Getter;
import org.tacheck.core.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 负责管理 Clock 对象 (以及它们在区域矩阵中的下标) 到 Z3 ArithExpr 变量的映射。
 * 确保每个时钟在 Z3 Context 中有唯一的对应 Z3 变量。
 * 在 Solver 初始化时，断言零时钟和所有已知时钟的非负约束。
 * @author Ayalyt
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 实例只属于一个 Z3Oracle，不会有并发问题
    private final Map<Clock, ArithExpr> clockZ3Vars;

    /** 下标 i (从 1 开始) 对应 clockOrder.get(i - 1) */
    private final List<Clock> clockOrder;

    /**
     * @param ctx Z3 Context 实例。
     * @param clockOrder 区域矩阵下标 1..n 对应的时钟。
     */
    public Z3VariableManager(Context ctx, List<Clock> clockOrder) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.clockOrder = List.copyOf(clockOrder);
        this.clockZ3Vars = new HashMap<>();

        getZ3Var(Clock.ZERO_CLOCK);
        for (Clock clock : this.clockOrder) {
            getZ3Var(clock);
        }
        logger.debug("Z3VariableManager 初始化完成，管理 {} 个时钟。", this.clockOrder.size());
    }

    /**
     * 获取指定 Clock 对应的 Z3 ArithExpr 变量。
     * 如果变量尚未创建，则会创建并缓存。
     */
    public ArithExpr getZ3Var(Clock clock) {
        return clockZ3Vars.computeIfAbsent(clock, c -> {
            logger.debug("创建 Z3 时钟变量: {}", c.getQualifiedName());
            return ctx.mkRealConst(c.getQualifiedName());
        });
    }

    /**
     * 获取区域矩阵下标对应的 Z3 变量，下标 0 是零时钟。
     */
    public ArithExpr getZ3Var(int index) {
        if (index == 0) {
            return getZ3Var(Clock.ZERO_CLOCK);
        }
        if (index < 0 || index > clockOrder.size()) {
            throw new IndexOutOfBoundsException("时钟下标越界: " + index);
        }
        return getZ3Var(clockOrder.get(index - 1));
    }

    /**
     * 向 Solver 断言零时钟 (x0) 的约束 (x0 == 0)
     * 和所有已知普通时钟的非负约束 (xi >= 0)。
     * @param solver Z3 Solver 实例。
     */
    public void assertGlobalConstraints(Solver solver) {
        solver.add(ctx.mkEq(getZ3Var(Clock.ZERO_CLOCK), ctx.mkReal(0)));
        for (Clock clock : clockOrder) {
            solver.add(ctx.mkGe(getZ3Var(clock), ctx.mkReal(0)));
        }
    }
}
