package org.tacheck.expressions.dcs;

/**
 * 区域矩阵中一个元素的打包编码：(value, strict) 压缩为 int，
 * raw = value << 1 | (strict ? 0 : 1)，无穷大为 {@link #INFINITY}。
 * raw 越小表示约束越紧，因此两个边界的比较就是 int 比较。
 */
public final class Bound {

    /** 无上界 (< ∞) */
    public static final int INFINITY = Integer.MAX_VALUE;

    /** (0, <=) */
    public static final int LE_ZERO = 1;

    /** (0, <) */
    public static final int LT_ZERO = 0;

    private Bound() {
    }

    public static int of(int value, boolean strict) {
        return (value << 1) | (strict ? 0 : 1);
    }

    public static int lessEqual(int value) {
        return of(value, false);
    }

    public static int lessThan(int value) {
        return of(value, true);
    }

    public static int value(int raw) {
        return raw >> 1;
    }

    public static boolean isStrict(int raw) {
        return (raw & 1) == 0;
    }

    public static boolean isInfinite(int raw) {
        return raw == INFINITY;
    }

    /**
     * 边界相加，路径长度的累加：(a, ≺1) + (b, ≺2) = (a + b, ≺1 ∧ ≺2)。
     */
    public static int add(int a, int b) {
        if (a == INFINITY || b == INFINITY) {
            return INFINITY;
        }
        return ((a & ~1) + (b & ~1)) | (a & b & 1);
    }

    /**
     * 约束 x_i - x_j ≺ c 的否定，写成反方向 x_j - x_i ≺' -c 的边界。
     * @throws IllegalArgumentException 无穷边界的否定为空集，不能表示为边界
     */
    public static int negate(int raw) {
        if (raw == INFINITY) {
            throw new IllegalArgumentException("无穷边界没有补集边界");
        }
        return of(-value(raw), !isStrict(raw));
    }

    public static String toString(int raw) {
        if (raw == INFINITY) {
            return "<∞";
        }
        return (isStrict(raw) ? "<" : "<=") + value(raw);
    }
}
