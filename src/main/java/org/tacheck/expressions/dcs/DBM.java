package org.tacheck.expressions.dcs;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import org.tacheck.core.Clock;
import org.tacheck.expressions.ToZ3BoolExpr;
import org.tacheck.symbolic.Z3VariableManager;
import org.tacheck.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * 差分界限矩阵 (Difference-Bound Matrix, DBM)，表示一个凸的时钟区域 (zone)。
 * 维度为 n+1，下标 0 是零时钟；元素 (i, j) 是 x_i - x_j 的上界，编码见 {@link Bound}。
 * <p>
 * 对外可见的 DBM 总是规范形式 (最短路闭包)。不可满足的区域统一表示为该维度的空哨兵，
 * 因此判空是 O(1) 的。此类是不可变的，所有操作都返回新实例。
 */
public final class DBM implements ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(DBM.class);

    /** 矩阵大小 (时钟数量 + 1) */
    private final int dimension;

    /** 行优先存储，matrix[i * dimension + j] 是 x_i - x_j 的上界。空哨兵为 null。 */
    private final int[] matrix;

    private final int hashCode;

    // --- 构造函数 ---

    /**
     * 私有构造函数，matrix 必须已经是规范形式 (或为 null 表示空)，不做拷贝。
     */
    private DBM(int dimension, int[] matrix) {
        this.dimension = dimension;
        this.matrix = matrix;
        this.hashCode = matrix == null ? 31 * dimension : 31 * dimension + Arrays.hashCode(matrix);
    }

    /**
     * 所有时钟都等于 0 的区域。
     */
    public static DBM zero(int dimension) {
        checkDimension(dimension);
        int[] m = new int[dimension * dimension];
        Arrays.fill(m, Bound.LE_ZERO);
        return new DBM(dimension, m);
    }

    /**
     * 所有时钟非负的区域 (ci >= 0)。
     */
    public static DBM universe(int dimension) {
        checkDimension(dimension);
        int[] m = new int[dimension * dimension];
        Arrays.fill(m, Bound.INFINITY);
        for (int i = 0; i < dimension; i++) {
            m[i * dimension + i] = Bound.LE_ZERO;
            // x0 - xj <= 0
            m[i] = Bound.LE_ZERO;
        }
        return new DBM(dimension, m);
    }

    public static DBM empty(int dimension) {
        checkDimension(dimension);
        return new DBM(dimension, null);
    }

    private static void checkDimension(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("DBM 维度至少为 1 (零时钟): " + dimension);
        }
    }

    // === 查询 ===

    public int getDimension() {
        return dimension;
    }

    public boolean isEmpty() {
        return matrix == null;
    }

    /**
     * 获取 x_i - x_j 的上界 (原始编码)。
     */
    public int get(int i, int j) {
        if (i < 0 || i >= dimension || j < 0 || j >= dimension) {
            throw new IndexOutOfBoundsException("Index (" + i + ", " + j + ")越界：" + dimension);
        }
        if (matrix == null) {
            throw new IllegalStateException("空区域没有边界");
        }
        return matrix[i * dimension + j];
    }

    public boolean isUniverse() {
        return !isEmpty() && this.equals(universe(dimension));
    }

    /**
     * 所有时钟都没有上界时，区域中的每个点都可以无限延迟。
     */
    public boolean canDelayIndefinitely() {
        if (isEmpty()) {
            return false;
        }
        for (int i = 1; i < dimension; i++) {
            if (matrix[i * dimension] != Bound.INFINITY) {
                return false;
            }
        }
        return true;
    }

    public boolean isSubsetOf(DBM other) {
        checkSameDimension(other);
        if (this.isEmpty()) {
            return true;
        }
        if (other.isEmpty()) {
            return false;
        }
        for (int k = 0; k < matrix.length; k++) {
            if (matrix[k] > other.matrix[k]) {
                return false;
            }
        }
        return true;
    }

    public boolean hasIntersection(DBM other) {
        return !intersect(other).isEmpty();
    }

    /**
     * 检查具体赋值是否在区域内。
     * @param valuation 长度为 dimension 的取值数组，valuation[0] 为零时钟 (0)。
     */
    public boolean contains(Rational[] valuation) {
        if (valuation.length != dimension) {
            throw new IllegalArgumentException("赋值长度 " + valuation.length + " 与维度 " + dimension + " 不一致");
        }
        if (isEmpty()) {
            return false;
        }
        for (int i = 0; i < dimension; i++) {
            for (int j = 0; j < dimension; j++) {
                int raw = matrix[i * dimension + j];
                if (i == j || raw == Bound.INFINITY) {
                    continue;
                }
                int cmp = valuation[i].subtract(valuation[j]).compareTo(Rational.valueOf(Bound.value(raw)));
                if (cmp > 0 || (cmp == 0 && Bound.isStrict(raw))) {
                    return false;
                }
            }
        }
        return true;
    }

    // === 核心操作 ===

    /**
     * 合取约束 x_i - x_j ≺ c，增量式地保持规范形式，O(n²)。
     */
    public DBM constrain(int i, int j, int raw) {
        if (isEmpty() || raw == Bound.INFINITY || raw >= matrix[i * dimension + j]) {
            return this;
        }
        if (Bound.add(raw, matrix[j * dimension + i]) < Bound.LE_ZERO) {
            logger.debug("DBM.constrain: x{} - x{} {} 使区域为空", i, j, Bound.toString(raw));
            return empty(dimension);
        }
        int[] m = matrix.clone();
        m[i * dimension + j] = raw;
        for (int k = 0; k < dimension; k++) {
            int ki = m[k * dimension + i];
            if (ki == Bound.INFINITY) {
                continue;
            }
            int kiPlusRaw = Bound.add(ki, raw);
            for (int l = 0; l < dimension; l++) {
                int candidate = Bound.add(kiPlusRaw, m[j * dimension + l]);
                if (candidate < m[k * dimension + l]) {
                    m[k * dimension + l] = candidate;
                }
            }
        }
        return new DBM(dimension, m);
    }

    /**
     * 合取一个原子时钟约束。
     * @param indexOf 时钟到矩阵下标的映射。
     */
    public DBM constrain(ClockConstraint constraint, ToIntFunction<Clock> indexOf) {
        DBM result = this;
        for (int[] b : constraint.toBounds(indexOf)) {
            result = result.constrain(b[0], b[1], b[2]);
        }
        return result;
    }

    public DBM constrainAll(Iterable<ClockConstraint> constraints, ToIntFunction<Clock> indexOf) {
        DBM result = this;
        for (ClockConstraint constraint : constraints) {
            result = result.constrain(constraint, indexOf);
            if (result.isEmpty()) {
                break;
            }
        }
        return result;
    }

    public DBM intersect(DBM other) {
        checkSameDimension(other);
        if (this.isEmpty() || other.isEmpty()) {
            return empty(dimension);
        }
        if (this.isSubsetOf(other)) {
            return this;
        }
        if (other.isSubsetOf(this)) {
            return other;
        }
        int[] m = new int[matrix.length];
        for (int k = 0; k < m.length; k++) {
            m[k] = Math.min(matrix[k], other.matrix[k]);
        }
        return close(dimension, m);
    }

    /**
     * 时间流逝 (delay)：移除所有时钟的上界。规范形式保持不变。
     */
    public DBM up() {
        if (isEmpty()) {
            return this;
        }
        int[] m = matrix.clone();
        for (int i = 1; i < dimension; i++) {
            m[i * dimension] = Bound.INFINITY;
        }
        return new DBM(dimension, m);
    }

    /**
     * 时间前驱：所有可以通过延迟到达本区域的点。
     */
    public DBM down() {
        if (isEmpty()) {
            return this;
        }
        int[] m = matrix.clone();
        for (int j = 1; j < dimension; j++) {
            int lower = Bound.LE_ZERO;
            for (int i = 1; i < dimension; i++) {
                lower = Math.min(lower, m[i * dimension + j]);
            }
            m[j] = lower;
        }
        return new DBM(dimension, m);
    }

    /**
     * 把时钟 x 重置为 value。
     */
    public DBM reset(int clock, int value) {
        if (isEmpty()) {
            return this;
        }
        if (clock <= 0 || clock >= dimension) {
            throw new IndexOutOfBoundsException("无法重置时钟下标 " + clock);
        }
        int[] m = matrix.clone();
        int up = Bound.lessEqual(value);
        int down = Bound.lessEqual(-value);
        for (int j = 0; j < dimension; j++) {
            if (j == clock) {
                continue;
            }
            m[clock * dimension + j] = Bound.add(up, matrix[j]);
            m[j * dimension + clock] = Bound.add(matrix[j * dimension], down);
        }
        m[clock * dimension + clock] = Bound.LE_ZERO;
        return new DBM(dimension, m);
    }

    /**
     * 释放时钟 x 的所有约束 (保留非负)。
     */
    public DBM free(int clock) {
        if (isEmpty()) {
            return this;
        }
        int[] m = matrix.clone();
        for (int j = 0; j < dimension; j++) {
            if (j == clock) {
                continue;
            }
            m[clock * dimension + j] = Bound.INFINITY;
            m[j * dimension + clock] = matrix[j * dimension];
        }
        return new DBM(dimension, m);
    }

    /**
     * 最大常量外推 (Extra_M)：超过时钟最大常量的上界放宽为无穷，
     * 低于 -M 的下界放宽为 (-M, <)。结果包含原区域且重新规范化。
     */
    public DBM extrapolateMaxBounds(MaxBounds maxBounds) {
        if (isEmpty()) {
            return this;
        }
        if (maxBounds.getDimension() != dimension) {
            throw new IllegalArgumentException("MaxBounds 维度 " + maxBounds.getDimension() + " 与 DBM 维度 " + dimension + " 不一致");
        }
        int[] m = matrix.clone();
        boolean changed = false;
        for (int i = 0; i < dimension; i++) {
            for (int j = 0; j < dimension; j++) {
                if (i == j) {
                    continue;
                }
                int k = i * dimension + j;
                if (m[k] == Bound.INFINITY) {
                    continue;
                }
                if (i != 0 && m[k] > Bound.lessEqual(maxBounds.get(i))) {
                    m[k] = Bound.INFINITY;
                    changed = true;
                } else if (j != 0 && m[k] < Bound.lessThan(-maxBounds.get(j))) {
                    m[k] = Bound.lessThan(-maxBounds.get(j));
                    changed = true;
                }
            }
        }
        return changed ? close(dimension, m) : this;
    }

    /**
     * 使用 Floyd-Warshall 算法计算最短路闭包。对角线出现负值时返回空哨兵。
     */
    private static DBM close(int dimension, int[] m) {
        for (int k = 0; k < dimension; k++) {
            for (int i = 0; i < dimension; i++) {
                int ik = m[i * dimension + k];
                if (ik == Bound.INFINITY) {
                    continue;
                }
                for (int j = 0; j < dimension; j++) {
                    int candidate = Bound.add(ik, m[k * dimension + j]);
                    if (candidate < m[i * dimension + j]) {
                        m[i * dimension + j] = candidate;
                    }
                }
            }
            for (int i = 0; i < dimension; i++) {
                if (m[i * dimension + i] < Bound.LE_ZERO) {
                    return new DBM(dimension, null);
                }
            }
        }
        return new DBM(dimension, m);
    }

    /**
     * 从任意边界矩阵构造规范化的 DBM。
     * @param bounds bounds[i][j] 为 x_i - x_j 的原始编码边界
     */
    public static DBM fromBounds(int[][] bounds) {
        int dimension = bounds.length;
        checkDimension(dimension);
        int[] m = new int[dimension * dimension];
        for (int i = 0; i < dimension; i++) {
            if (bounds[i].length != dimension) {
                throw new IllegalArgumentException("边界矩阵不是方阵");
            }
            System.arraycopy(bounds[i], 0, m, i * dimension, dimension);
        }
        return close(dimension, m);
    }

    /**
     * 检查规范形式：闭包后不变。
     */
    public boolean isCanonical() {
        if (isEmpty()) {
            return true;
        }
        return close(dimension, matrix.clone()).equals(this);
    }

    private void checkSameDimension(DBM other) {
        if (other.dimension != dimension) {
            throw new IllegalArgumentException("DBM 维度不一致: " + dimension + " vs " + other.dimension);
        }
    }

    // === Z3 转换 ===

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        if (isEmpty()) {
            return ctx.mkFalse();
        }
        List<BoolExpr> z3Guards = new ArrayList<>();
        for (int i = 0; i < dimension; i++) {
            for (int j = 0; j < dimension; j++) {
                int raw = matrix[i * dimension + j];
                if (i == j || raw == Bound.INFINITY) {
                    continue;
                }
                ArithExpr diff = ctx.mkSub(varManager.getZ3Var(i), varManager.getZ3Var(j));
                ArithExpr c = ctx.mkReal(Bound.value(raw));
                z3Guards.add(Bound.isStrict(raw) ? ctx.mkLt(diff, c) : ctx.mkLe(diff, c));
            }
        }
        if (z3Guards.isEmpty()) {
            return ctx.mkTrue();
        }
        return ctx.mkAnd(z3Guards.toArray(new BoolExpr[0]));
    }

    // === 文本表示 ===

    /**
     * 以约束合取的形式输出，例如 "A.x <= 5 && A.x - B.y < 3"。
     * 平凡约束 (非负、无穷) 不输出。
     * @param clockNames 下标 1..n 的时钟名，clockNames.get(0) 对应下标 1
     */
    public String toConstraintString(List<String> clockNames) {
        if (isEmpty()) {
            return "false";
        }
        List<String> parts = new ArrayList<>();
        for (int i = 1; i < dimension; i++) {
            String name = clockNames.get(i - 1);
            int upper = matrix[i * dimension];
            int lower = matrix[i];
            if (upper != Bound.INFINITY && lower != Bound.LE_ZERO
                    && Bound.value(upper) == -Bound.value(lower) && !Bound.isStrict(upper) && !Bound.isStrict(lower)) {
                parts.add(name + " == " + Bound.value(upper));
                continue;
            }
            if (lower != Bound.LE_ZERO) {
                parts.add(name + (Bound.isStrict(lower) ? " > " : " >= ") + (-Bound.value(lower)));
            }
            if (upper != Bound.INFINITY) {
                parts.add(name + (Bound.isStrict(upper) ? " < " : " <= ") + Bound.value(upper));
            }
        }
        for (int i = 1; i < dimension; i++) {
            for (int j = 1; j < dimension; j++) {
                int raw = matrix[i * dimension + j];
                if (i == j || raw == Bound.INFINITY) {
                    continue;
                }
                // 由单时钟上下界推出的差分约束不再输出
                if (raw == Bound.add(matrix[i * dimension], matrix[j])) {
                    continue;
                }
                parts.add(clockNames.get(i - 1) + " - " + clockNames.get(j - 1)
                        + (Bound.isStrict(raw) ? " < " : " <= ") + Bound.value(raw));
            }
        }
        return parts.isEmpty() ? "true" : String.join(" && ", parts);
    }

    // === Object 方法 ===

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DBM dbm = (DBM) o;
        return dimension == dbm.dimension && Arrays.equals(matrix, dbm.matrix);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "DBM[empty, dim=" + dimension + "]";
        }
        int elementWidth = 6;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < dimension; i++) {
            sb.append(i == 0 ? "[" : " ");
            for (int j = 0; j < dimension; j++) {
                sb.append(String.format(" %-" + elementWidth + "s", Bound.toString(matrix[i * dimension + j])));
            }
            sb.append(i == dimension - 1 ? " ]" : "\n");
        }
        return sb.toString();
    }
}
