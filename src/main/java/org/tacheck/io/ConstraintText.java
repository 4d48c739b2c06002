package org.tacheck.io;

import org.tacheck.automata.base.ResetSet;
import org.tacheck.core.Clock;
import org.tacheck.exceptions.ModelException;
import org.tacheck.expressions.RelationType;
import org.tacheck.expressions.dcs.ClockConstraint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 模型文件中守卫、不变量与更新的文本形式。
 * 约束是用 && 连接的原子 "x <= 5" 或 "y - x > 2"，空串与 "true" 表示 true；
 * 更新是用逗号分隔的 "x = 0" 或 "x := 0"。时钟名是组件内的局部名称。
 */
final class ConstraintText {

    private static final Pattern ATOM = Pattern.compile(
            "^\\s*([A-Za-z_]\\w*)\\s*(?:-\\s*([A-Za-z_]\\w*)\\s*)?(<=|>=|==|<|>|=)\\s*(-?\\d+)\\s*$");
    private static final Pattern ASSIGNMENT = Pattern.compile("^\\s*([A-Za-z_]\\w*)\\s*:?=\\s*(\\d+)\\s*$");

    private ConstraintText() {
    }

    /**
     * @param clocks 组件声明的时钟
     * @param where  出错时用于定位的描述
     * @throws ModelException 文本格式错误或引用了未声明的时钟
     */
    static List<ClockConstraint> parseConstraints(String text, String owner, List<Clock> clocks, String where) {
        List<ClockConstraint> constraints = new ArrayList<>();
        if (text == null || text.isBlank() || text.trim().equals("true")) {
            return constraints;
        }
        for (String part : text.split("&&")) {
            Matcher matcher = ATOM.matcher(part);
            if (!matcher.matches()) {
                throw new ModelException(where + " 中无法解析的约束: '" + part.trim() + "'");
            }
            Clock first = clock(matcher.group(1), owner, clocks, where);
            Clock second = matcher.group(2) == null ? Clock.ZERO_CLOCK : clock(matcher.group(2), owner, clocks, where);
            RelationType relation = RelationType.fromSymbol(matcher.group(3));
            int bound;
            try {
                bound = Integer.parseInt(matcher.group(4));
            } catch (NumberFormatException e) {
                throw new ModelException(where + " 中的常量超出范围: " + matcher.group(4), e);
            }
            try {
                constraints.add(ClockConstraint.of(first, second, relation, bound));
            } catch (IllegalArgumentException e) {
                throw new ModelException(where + " 中的约束不合法: " + e.getMessage(), e);
            }
        }
        return constraints;
    }

    static ResetSet parseUpdates(String text, String owner, List<Clock> clocks, String where) {
        if (text == null || text.isBlank()) {
            return ResetSet.EMPTY;
        }
        Map<Clock, Integer> resets = new LinkedHashMap<>();
        for (String part : text.split(",")) {
            Matcher matcher = ASSIGNMENT.matcher(part);
            if (!matcher.matches()) {
                throw new ModelException(where + " 中无法解析的更新: '" + part.trim() + "'");
            }
            try {
                resets.put(clock(matcher.group(1), owner, clocks, where), Integer.parseInt(matcher.group(2)));
            } catch (NumberFormatException e) {
                throw new ModelException(where + " 中的常量超出范围: " + matcher.group(2), e);
            }
        }
        return new ResetSet(resets);
    }

    private static Clock clock(String name, String owner, List<Clock> clocks, String where) {
        Clock clock = Clock.of(owner, name);
        if (!clocks.contains(clock)) {
            throw new ModelException(where + " 引用了未声明的时钟 " + name);
        }
        return clock;
    }

    static String formatConstraints(List<ClockConstraint> constraints) {
        return constraints.stream().map(ClockConstraint::toString).collect(Collectors.joining(" && "));
    }

    static String formatUpdates(ResetSet resets) {
        return resets.getResets().entrySet().stream()
                .map(entry -> entry.getKey().getName() + " = " + entry.getValue())
                .collect(Collectors.joining(", "));
    }
}
