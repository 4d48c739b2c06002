package org.tacheck.checkers;

import lombok.Getter;
import org.tacheck.automata.base.Action;
import org.tacheck.core.ClockValuation;
import org.tacheck.expressions.dcs.DBM;

import java.util.List;
import java.util.Objects;

/**
 * 见证路径中的一步：到达的位置向量、区域、到达这一步所用的动作 (第一步为 null)，
 * 以及可选的从区域中采样得到的具体时钟赋值。
 * 此类是不可变的。
 */
@Getter
public final class TraceStep {

    private final String location;
    private final DBM zone;
    private final String zoneText;
    private final Action action;
    private final ClockValuation valuation;

    private TraceStep(String location, DBM zone, String zoneText, Action action, ClockValuation valuation) {
        this.location = Objects.requireNonNull(location, "Location cannot be null.");
        this.zone = Objects.requireNonNull(zone, "Zone cannot be null.");
        this.zoneText = zoneText;
        this.action = action;
        this.valuation = valuation;
    }

    /**
     * @param clockNames 区域矩阵下标 1..n 对应的时钟名
     */
    public static TraceStep of(String location, DBM zone, Action action, List<String> clockNames) {
        return new TraceStep(location, zone, zone.toConstraintString(clockNames), action, null);
    }

    public TraceStep withValuation(ClockValuation newValuation) {
        return new TraceStep(location, zone, zoneText, action, newValuation);
    }

    public boolean hasValuation() {
        return valuation != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (action != null) {
            sb.append("--").append(action).append("--> ");
        }
        sb.append(location).append(" [").append(zoneText).append(']');
        if (valuation != null) {
            sb.append(" e.g. ").append(valuation);
        }
        return sb.toString();
    }
}
