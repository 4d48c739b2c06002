package org.tacheck.utils;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.RatNum;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 精确有理数，用于表示具体时钟取值 (见证路径中的时钟赋值)。
 * 只表示有限值；区域中的无穷上界由 {@link org.tacheck.expressions.dcs.Bound} 负责。
 * 此类是不可变的。
 */
public final class Rational implements Comparable<Rational> {
    private static final Logger logger = LoggerFactory.getLogger(Rational.class);
    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(256);

    private static final BigInteger BIG_INT_ONE = BigInteger.ONE;
    private static final BigInteger BIG_INT_TEN = BigInteger.TEN;

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BIG_INT_ONE);
    public static final Rational ONE = new Rational(BIG_INT_ONE, BIG_INT_ONE);
    public static final Rational HALF = new Rational(BIG_INT_ONE, BigInteger.valueOf(2));

    static {
        CACHE.put(ZERO.getCacheKey(), ZERO);
        CACHE.put(ONE.getCacheKey(), ONE);
        CACHE.put(HALF.getCacheKey(), HALF);
        for (int i = -16; i <= 16; i++) {
            if (i != 0 && i != 1) {
                Rational r = new Rational(BigInteger.valueOf(i), BIG_INT_ONE);
                CACHE.put(r.getCacheKey(), r);
            }
        }
    }

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(long numerator) {
        if (numerator == 0L) {
            return ZERO;
        }
        if (numerator == 1L) {
            return ONE;
        }
        return valueOf(BigInteger.valueOf(numerator), BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "Numerator cannot be null.");
        Objects.requireNonNull(denominator, "Denominator cannot be null.");
        if (denominator.signum() == 0) {
            logger.error("Rational.valueOf: 分母为 0 ({} / {})", numerator, denominator);
            throw new ArithmeticException("Rational 分母不能为 0: " + numerator + "/" + denominator);
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }
        // 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BIG_INT_ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }

        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }
        Rational result = new Rational(numerator, denominator);
        if (numerator.bitLength() + denominator.bitLength() < 32) {
            CACHE.putIfAbsent(key, result);
        }
        return result;
    }

    /**
     * 解析整数、小数或分数形式 ("3", "1.5", "7/2")。
     */
    public static Rational valueOf(String s) {
        if (s == null || s.trim().isEmpty()) {
            throw new NumberFormatException("输入非法: " + s);
        }
        s = s.trim();
        if (s.contains("/")) {
            String[] parts = s.split("/", 2);
            if (parts[0].isEmpty() || parts[1].isEmpty()) {
                throw new NumberFormatException("无效分数格式: " + s);
            }
            return valueOf(new BigInteger(parts[0].trim()), new BigInteger(parts[1].trim()));
        }
        BigDecimal bd = new BigDecimal(s);
        int scale = bd.scale();
        if (scale <= 0) {
            return valueOf(bd.unscaledValue().multiply(BIG_INT_TEN.pow(-scale)), BIG_INT_ONE);
        }
        return valueOf(bd.unscaledValue(), BIG_INT_TEN.pow(scale));
    }

    /**
     * 从 Z3 模型中的有理数常量转换。
     */
    public static Rational fromZ3(RatNum ratNum) {
        return valueOf(ratNum.getBigIntNumerator(), ratNum.getBigIntDenominator());
    }

    // ========== 基础运算 ==========

    public Rational add(Rational other) {
        if (this == ZERO) {
            return other;
        }
        if (other == ZERO) {
            return this;
        }
        BigInteger newNum = numerator.multiply(other.denominator).add(other.numerator.multiply(denominator));
        return valueOf(newNum, denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return this.add(other.negate());
    }

    public Rational multiply(Rational other) {
        return valueOf(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    public Rational divide(Rational other) {
        if (other.isZero()) {
            throw new ArithmeticException("除数为 0: " + this + " / " + other);
        }
        return valueOf(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    public Rational negate() {
        if (isZero()) {
            return ZERO;
        }
        return valueOf(numerator.negate(), denominator);
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public int signum() {
        return numerator.signum();
    }

    /**
     *  判断该rational是否是整数
     */
    public boolean isInteger() {
        return denominator.equals(BIG_INT_ONE);
    }

    public ArithExpr toZ3Real(Context ctx) {
        return ctx.mkReal(this.toString());
    }

    // ========== 对象基础方法 ==========

    @Override
    public int compareTo(Rational other) {
        BigInteger ad = this.numerator.multiply(other.denominator);
        BigInteger cb = other.numerator.multiply(this.denominator);
        return ad.compareTo(cb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rational)) {
            return false;
        }
        Rational that = (Rational) o;
        return numerator.equals(that.numerator) && denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    private List<BigInteger> getCacheKey() {
        return List.of(this.numerator, this.denominator);
    }

    @Override
    public String toString() {
        if (isInteger()) {
            return numerator.toString();
        }
        return numerator + "/" + denominator;
    }
}
