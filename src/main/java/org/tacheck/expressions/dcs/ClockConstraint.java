package org.tacheck.expressions.dcs;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.tacheck.core.Clock;
import org.tacheck.expressions.RelationType;
import org.tacheck.expressions.ToZ3BoolExpr;
import org.tacheck.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * 代表一个原子时钟差分约束, 形如 c1 - c2 ~ k，k 为整数常量。
 * c2 为零时钟时表示简单约束 c1 ~ k。
 * 守卫与不变量都是 ClockConstraint 的合取。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class ClockConstraint implements Comparable<ClockConstraint>, ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(ClockConstraint.class);

    private final Clock clock1;       // 第一个时钟 (c_i)
    private final Clock clock2;       // 第二个时钟 (c_j)，可以是零时钟
    private final int bound;          // 边界常量 (k)
    private final RelationType relation; // 关系类型 (<, <=, >, >=, ==)

    /**
     * @throws NullPointerException     如果任何参数为 null。
     * @throws IllegalArgumentException 如果约束自身矛盾 (例如 x - x < 0) 或两侧都是零时钟。
     */
    private ClockConstraint(Clock c1, Clock c2, int bound, RelationType relation) {
        this.clock1 = Objects.requireNonNull(c1, "ClockConstraint-构造函数: clock1 不能为 null");
        this.clock2 = Objects.requireNonNull(c2, "ClockConstraint-构造函数: clock2 不能为 null");
        this.relation = Objects.requireNonNull(relation, "ClockConstraint-构造函数: relation 不能为 null");
        this.bound = bound;
        if (c1.isZeroClock() && c2.isZeroClock()) {
            throw new IllegalArgumentException("ClockConstraint-构造函数: 约束两侧不能都是零时钟");
        }
        if (c1.equals(c2)) {
            // x - x ~ k 只有在常量上可判定
            boolean contradictory = switch (relation) {
                case LT -> bound <= 0;
                case LE -> bound < 0;
                case GT -> bound >= 0;
                case GE -> bound > 0;
                case EQ -> bound != 0;
            };
            if (contradictory) {
                logger.error("ClockConstraint-构造函数: 约束 {} - {} {} {} 自身矛盾",
                        c1.getName(), c2.getName(), relation.getSymbol(), bound);
                throw new IllegalArgumentException("ClockConstraint-构造函数: 约束 " + this + " 自身矛盾");
            }
        }
    }

    // --- 工厂方法 ---
    public static ClockConstraint of(Clock c1, Clock c2, RelationType relation, int bound) {
        return new ClockConstraint(c1, c2, bound, relation);
    }

    public static ClockConstraint of(Clock c, RelationType relation, int bound) {
        return new ClockConstraint(c, Clock.ZERO_CLOCK, bound, relation);
    }

    public static ClockConstraint lessThan(Clock c, int value) { return of(c, RelationType.LT, value); }
    public static ClockConstraint lessEqual(Clock c, int value) { return of(c, RelationType.LE, value); }
    public static ClockConstraint greaterThan(Clock c, int value) { return of(c, RelationType.GT, value); }
    public static ClockConstraint greaterEqual(Clock c, int value) { return of(c, RelationType.GE, value); }
    public static ClockConstraint equalTo(Clock c, int value) { return of(c, RelationType.EQ, value); }

    public boolean isDiagonal() {
        return !clock1.isZeroClock() && !clock2.isZeroClock();
    }

    /**
     * 转换为区域矩阵边界。每个元素是 {i, j, raw}，表示 x_i - x_j ≺ c。
     * 上界约束给出一个边界，下界约束翻转方向后给出一个边界，等式给出两个。
     *
     * @param indexOf 时钟到矩阵下标的映射，零时钟必须映射到 0。
     */
    public List<int[]> toBounds(ToIntFunction<Clock> indexOf) {
        int i = clock1.isZeroClock() ? 0 : indexOf.applyAsInt(clock1);
        int j = clock2.isZeroClock() ? 0 : indexOf.applyAsInt(clock2);
        List<int[]> bounds = new ArrayList<>(2);
        switch (relation) {
            case LT -> bounds.add(new int[]{i, j, Bound.lessThan(bound)});
            case LE -> bounds.add(new int[]{i, j, Bound.lessEqual(bound)});
            case GT -> bounds.add(new int[]{j, i, Bound.lessThan(-bound)});
            case GE -> bounds.add(new int[]{j, i, Bound.lessEqual(-bound)});
            case EQ -> {
                bounds.add(new int[]{i, j, Bound.lessEqual(bound)});
                bounds.add(new int[]{j, i, Bound.lessEqual(-bound)});
            }
        }
        return bounds;
    }

    // --- Z3 转换 ---
    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr diffZ3 = ctx.mkSub(varManager.getZ3Var(clock1), varManager.getZ3Var(clock2));
        ArithExpr z3Bound = ctx.mkReal(bound);
        return switch (relation) {
            case LT -> ctx.mkLt(diffZ3, z3Bound);
            case LE -> ctx.mkLe(diffZ3, z3Bound);
            case GT -> ctx.mkGt(diffZ3, z3Bound);
            case GE -> ctx.mkGe(diffZ3, z3Bound);
            case EQ -> ctx.mkEq(diffZ3, z3Bound);
        };
    }

    // --- Object 方法 ---
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ClockConstraint that = (ClockConstraint) o;
        return relation == that.relation &&
                bound == that.bound &&
                clock1.equals(that.clock1) &&
                clock2.equals(that.clock2);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clock1, clock2, bound, relation);
    }

    @Override
    public String toString() {
        String op = relation.getSymbol();
        if (clock2.isZeroClock()) { // 形式为 clock1 - x0 ~ bound => clock1 ~ bound
            return clock1.getName() + " " + op + " " + bound;
        } else if (clock1.isZeroClock()) {
            return clock2.getName() + " " + relation.flip().getSymbol() + " " + (-bound);
        }
        return clock1.getName() + " - " + clock2.getName() + " " + op + " " + bound;
    }

    @Override
    public int compareTo(ClockConstraint other) {
        int cmp = clock1.compareTo(other.clock1);
        if (cmp != 0) {
            return cmp;
        }
        cmp = clock2.compareTo(other.clock2);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compare(bound, other.bound);
        if (cmp != 0) {
            return cmp;
        }
        return relation.compareTo(other.relation);
    }
}
