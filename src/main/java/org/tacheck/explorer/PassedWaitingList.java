package org.tacheck.explorer;

import org.tacheck.expressions.dcs.DBM;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 已访问集合与待访问队列。已访问集合按位置键分组，每组是一个互不包含的区域列表 (反链)：
 * 新区域若被同一位置下某个已访问区域包含则直接丢弃，否则加入并移除被它包含的旧区域。
 *
 * @param <K> 位置键的类型
 */
public final class PassedWaitingList<K> {

    private static final Logger logger = LoggerFactory.getLogger(PassedWaitingList.class);

    public enum Order {
        BREADTH_FIRST,
        DEPTH_FIRST
    }

    private final Order order;
    private final Map<K, List<DBM>> passed = new HashMap<>();
    private final Deque<Integer> waiting = new ArrayDeque<>();
    private int subsumedCount;

    public PassedWaitingList(Order order) {
        this.order = order;
    }

    public PassedWaitingList() {
        this(Order.BREADTH_FIRST);
    }

    /**
     * 区域是否被同一位置下某个已访问区域包含。
     */
    public boolean isSubsumed(K key, DBM zone) {
        List<DBM> zones = passed.get(key);
        if (zones == null) {
            return false;
        }
        for (DBM visited : zones) {
            if (zone.isSubsetOf(visited)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 加入一个新状态。
     * @param index 状态在 {@link StateArena} 中的下标
     * @return 状态是否被加入；被已访问状态包含时返回 false
     */
    public boolean add(K key, DBM zone, int index) {
        if (zone.isEmpty() || isSubsumed(key, zone)) {
            subsumedCount++;
            return false;
        }
        List<DBM> zones = passed.computeIfAbsent(key, k -> new ArrayList<>());
        zones.removeIf(visited -> visited.isSubsetOf(zone));
        zones.add(zone);
        waiting.addLast(index);
        return true;
    }

    public boolean hasWaiting() {
        return !waiting.isEmpty();
    }

    /**
     * @return 下一个待处理状态的下标
     */
    public int next() {
        return order == Order.BREADTH_FIRST ? waiting.pollFirst() : waiting.pollLast();
    }

    public int passedSize() {
        int size = 0;
        for (List<DBM> zones : passed.values()) {
            size += zones.size();
        }
        return size;
    }

    public int getSubsumedCount() {
        return subsumedCount;
    }

    public void logStatistics(String label) {
        logger.debug("{}: {} 个位置, {} 个区域, {} 个状态被包含而丢弃", label, passed.size(), passedSize(), subsumedCount);
    }
}
