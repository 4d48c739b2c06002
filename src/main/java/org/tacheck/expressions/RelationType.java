package org.tacheck.expressions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public enum RelationType {

    /**
     * 运算符枚举
     */
    LT("<"),    // Less Than
    LE("<="),   // Less Equal
    GT(">"),    // Greater Than
    GE(">="),   // Greater Equal
    EQ("==");   // Equal

    private static final Logger logger = LoggerFactory.getLogger(RelationType.class);

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 根据符号查找关系类型，"=" 视同 "=="。
     * @throws IllegalArgumentException 未知符号
     */
    public static RelationType fromSymbol(String symbol) {
        if ("=".equals(symbol)) {
            return EQ;
        }
        for (RelationType type : values()) {
            if (type.symbol.equals(symbol)) {
                return type;
            }
        }
        logger.error("RelationType.fromSymbol: 未知的关系符号 {}", symbol);
        throw new IllegalArgumentException("未知的关系符号: " + symbol);
    }

    /**
     * 返回此关系类型在交换操作数并取反边界后的等价关系。
     * 例如：(A - B < V) -> (B - A > -V)。
     */
    public RelationType flip() {
        return switch (this) {
            case LT -> GT;
            case LE -> GE;
            case GT -> LT;
            case GE -> LE;
            case EQ -> EQ;
        };
    }

    public boolean isStrict() {
        return this == LT || this == GT;
    }

    public boolean isUpper() {
        return this == LT || this == LE;
    }

    public boolean isLower() {
        return this == GT || this == GE;
    }
}
