package org.tacheck.explorer;

import org.tacheck.expressions.dcs.Bound;
import org.tacheck.expressions.dcs.DBM;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class PassedWaitingListTest {

    private static DBM atMost(int value) {
        return DBM.universe(2).constrain(1, 0, Bound.lessEqual(value));
    }

    @Test
    @DisplayName("被包含的区域被丢弃，包含旧区域的新区域替换旧区域")
    void testAdd_ShouldKeepAntichainPerLocation() {
        // 1. 准备
        PassedWaitingList<String> list = new PassedWaitingList<>();

        // 2. 执行
        boolean first = list.add("L0", atMost(5), 0);
        boolean smaller = list.add("L0", atMost(3), 1);
        boolean larger = list.add("L0", atMost(7), 2);
        boolean otherLocation = list.add("L1", atMost(3), 3);

        // 3. 断言
        assertAll(
                () -> assertTrue(first),
                () -> assertFalse(smaller),
                () -> assertTrue(larger),
                () -> assertTrue(otherLocation),
                () -> assertEquals(2, list.passedSize()),
                () -> assertEquals(1, list.getSubsumedCount()),
                () -> assertTrue(list.isSubsumed("L0", atMost(6))),
                () -> assertFalse(list.isSubsumed("L1", atMost(4)))
        );
    }

    @Test
    @DisplayName("空区域不会加入")
    void testAdd_WhenZoneEmpty_ShouldReject() {
        PassedWaitingList<String> list = new PassedWaitingList<>();

        assertFalse(list.add("L0", DBM.empty(2), 0));
        assertFalse(list.hasWaiting());
    }

    @Test
    @DisplayName("广度优先按加入顺序取出，深度优先取最后加入的")
    void testNext_ShouldFollowOrder() {
        PassedWaitingList<String> breadth = new PassedWaitingList<>(PassedWaitingList.Order.BREADTH_FIRST);
        PassedWaitingList<String> depth = new PassedWaitingList<>(PassedWaitingList.Order.DEPTH_FIRST);
        for (int i = 0; i < 3; i++) {
            breadth.add("L" + i, atMost(i), i);
            depth.add("L" + i, atMost(i), i);
        }

        assertAll(
                () -> assertEquals(0, breadth.next()),
                () -> assertEquals(2, depth.next()),
                () -> assertEquals(1, depth.next())
        );
    }
}
