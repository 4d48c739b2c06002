package org.tacheck.expressions.dcs;

import org.tacheck.core.Clock;
import org.tacheck.expressions.RelationType;
import org.tacheck.utils.Rational;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class FederationTest {

    private Clock x, y;
    private List<Clock> clockOrder;

    @BeforeAll
    void setUp() {
        x = Clock.of("A", "x");
        y = Clock.of("A", "y");
        clockOrder = List.of(x, y);
    }

    private DBM zoneOf(ClockConstraint... constraints) {
        return DBM.universe(3).constrainAll(List.of(constraints),
                clock -> clock.isZeroClock() ? 0 : clockOrder.indexOf(clock) + 1);
    }

    private static Rational[] point(String xValue, String yValue) {
        return new Rational[]{Rational.ZERO, Rational.valueOf(xValue), Rational.valueOf(yValue)};
    }

    @Nested
    @DisplayName("集合运算")
    class SetOperationTests {

        @Test
        @DisplayName("并集丢弃被包含的成员")
        void testUnion_WhenZoneIsContained_ShouldNotGrow() {
            Federation federation = Federation.of(zoneOf(ClockConstraint.lessEqual(x, 5)));

            Federation union = federation.union(zoneOf(ClockConstraint.lessEqual(x, 2)));

            assertEquals(1, union.size());
            assertEquals(Federation.empty(3).size(), Federation.of(DBM.empty(3)).size());
        }

        @Test
        @DisplayName("凸区域相减得到互不相交的块，且覆盖差集")
        void testSubtract_ShouldProduceDisjointPiecesCoveringDifference() {
            // 1. 准备: [0,10]² 减去 [2,4]²
            DBM box = zoneOf(ClockConstraint.lessEqual(x, 10), ClockConstraint.lessEqual(y, 10));
            DBM hole = zoneOf(ClockConstraint.greaterEqual(x, 2), ClockConstraint.lessEqual(x, 4),
                    ClockConstraint.greaterEqual(y, 2), ClockConstraint.lessEqual(y, 4));

            // 2. 执行
            List<DBM> pieces = Federation.subtract(box, hole);
            Federation difference = Federation.of(box).subtract(hole);

            // 3. 断言
            for (int i = 0; i < pieces.size(); i++) {
                for (int j = i + 1; j < pieces.size(); j++) {
                    assertFalse(pieces.get(i).hasIntersection(pieces.get(j)), "块 " + i + " 与 " + j + " 相交");
                }
                assertFalse(pieces.get(i).hasIntersection(hole));
            }
            assertAll(
                    () -> assertTrue(difference.contains(point("1", "3"))),
                    () -> assertTrue(difference.contains(point("3", "5"))),
                    () -> assertTrue(difference.contains(point("10", "10"))),
                    () -> assertFalse(difference.contains(point("3", "3"))),
                    () -> assertFalse(difference.contains(point("2", "4"))),
                    () -> assertFalse(difference.contains(point("11", "0"))),
                    () -> assertTrue(difference.union(hole).sameSetAs(Federation.of(box)))
            );
        }

        @Test
        @DisplayName("减去不相交的区域时保持不变，减去自身得到空集")
        void testSubtract_EdgeCases() {
            DBM low = zoneOf(ClockConstraint.lessThan(x, 2));
            DBM high = zoneOf(ClockConstraint.greaterEqual(x, 2));

            assertAll(
                    () -> assertEquals(List.of(low), Federation.subtract(low, high)),
                    () -> assertTrue(Federation.of(low).subtract(low).isEmpty()),
                    () -> assertTrue(Federation.subtract(DBM.empty(3), low).isEmpty())
            );
        }

        @Test
        @DisplayName("补集与原集合互补")
        void testComplement_ShouldPartitionUniverse() {
            Federation federation = Federation.of(zoneOf(ClockConstraint.greaterThan(x, 1), ClockConstraint.lessThan(x, 3)));

            Federation complement = federation.complement();

            assertAll(
                    () -> assertFalse(complement.contains(point("2", "0"))),
                    () -> assertTrue(complement.contains(point("1", "7"))),
                    () -> assertTrue(complement.contains(point("3", "0"))),
                    () -> assertFalse(complement.hasIntersection(federation.getZones().get(0))),
                    () -> assertTrue(complement.union(federation).sameSetAs(Federation.universe(3))),
                    () -> assertTrue(Federation.universe(3).complement().isEmpty())
            );
        }

        @Test
        @DisplayName("由多个成员共同覆盖的区域也判定为子集")
        void testIsSubsetOf_WhenCoveredByUnion_ShouldBeTrue() {
            Federation cover = Federation.of(3, List.of(
                    zoneOf(ClockConstraint.lessEqual(x, 3)),
                    zoneOf(ClockConstraint.greaterEqual(x, 2))));
            DBM middle = zoneOf(ClockConstraint.greaterEqual(x, 1), ClockConstraint.lessEqual(x, 5));

            assertAll(
                    () -> assertTrue(Federation.of(middle).isSubsetOf(cover)),
                    () -> assertTrue(Federation.of(middle).isSubsetOf(Federation.universe(3))),
                    () -> assertFalse(Federation.universe(3).isSubsetOf(Federation.of(middle))),
                    () -> assertTrue(Federation.universe(3).isSubsetOf(cover))
            );
        }
    }

    @Nested
    @DisplayName("时间运算：predt 与 postt")
    class TimedPredecessorTests {

        @Test
        @DisplayName("没有 good 时 predt 就是 bad 的时间前驱")
        void testPredt_WhenNoGood_ShouldBeDown() {
            DBM bad = zoneOf(ClockConstraint.greaterEqual(x, 5), ClockConstraint.lessEqual(x, 6));

            Federation predt = Federation.predt(Federation.of(bad), Federation.empty(3));

            assertTrue(predt.sameSetAs(Federation.of(bad.down())));
        }

        @Test
        @DisplayName("good 挡在 bad 之前时，只有越过 good 之后的点能到达 bad")
        void testPredt_WhenGoodBlocksPath_ShouldExcludeEarlierPoints() {
            // 1. 准备: 单时钟视角, bad: x >= 5, good: 2 <= x <= 3, y 与 x 同步
            DBM sync = zoneOf(ClockConstraint.of(x, y, RelationType.EQ, 0));
            DBM bad = sync.intersect(zoneOf(ClockConstraint.greaterEqual(x, 5)));
            DBM good = sync.intersect(zoneOf(ClockConstraint.greaterEqual(x, 2), ClockConstraint.lessEqual(x, 3)));

            // 2. 执行
            Federation predt = Federation.predt(Federation.of(bad), Federation.of(good));

            // 3. 断言
            assertAll(
                    () -> assertFalse(predt.contains(point("1", "1")), "延迟到 bad 必经 good"),
                    () -> assertFalse(predt.contains(point("2", "2")), "已在 good 中"),
                    () -> assertTrue(predt.contains(point("7/2", "7/2"))),
                    () -> assertTrue(predt.contains(point("5", "5"))),
                    () -> assertTrue(predt.contains(point("9", "9")))
            );
        }

        @Test
        @DisplayName("postt 在到达 bad 之前停止")
        void testPostt_WhenBadAhead_ShouldStopBeforeBad() {
            // 1. 准备: 从 x == y == 0 出发, bad: 4 <= x <= 6
            DBM sync = zoneOf(ClockConstraint.of(x, y, RelationType.EQ, 0));
            DBM start = sync.intersect(zoneOf(ClockConstraint.equalTo(x, 0)));
            DBM bad = zoneOf(ClockConstraint.greaterEqual(x, 4), ClockConstraint.lessEqual(x, 6));

            // 2. 执行
            Federation postt = Federation.postt(start, Federation.of(bad));

            // 3. 断言
            assertAll(
                    () -> assertTrue(postt.contains(point("0", "0"))),
                    () -> assertTrue(postt.contains(point("39/10", "39/10"))),
                    () -> assertFalse(postt.contains(point("4", "4"))),
                    () -> assertFalse(postt.contains(point("7", "7")), "越过 bad 的点不可达")
            );
        }

        @Test
        @DisplayName("没有 bad 时 postt 就是时间后继")
        void testPostt_WhenNoBad_ShouldBeUp() {
            DBM start = DBM.zero(3);

            assertTrue(Federation.postt(start, Federation.empty(3)).sameSetAs(Federation.of(start.up())));
        }
    }
}
