package org.tacheck.expressions.dcs;

import org.tacheck.core.Clock;
import org.tacheck.expressions.RelationType;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ClockConstraintTest {

    private Clock x, y;

    @BeforeAll
    void setUp() {
        x = Clock.of("A", "x");
        y = Clock.of("A", "y");
    }

    @Nested
    @DisplayName("构造")
    class ConstructionTests {

        @Test
        @DisplayName("同一时钟的自相矛盾约束被拒绝")
        void testOf_WhenSelfContradictory_ShouldThrow() {
            assertAll(
                    () -> assertThrows(IllegalArgumentException.class, () -> ClockConstraint.of(x, x, RelationType.LT, 0)),
                    () -> assertThrows(IllegalArgumentException.class, () -> ClockConstraint.of(x, x, RelationType.EQ, 1)),
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> ClockConstraint.of(Clock.ZERO_CLOCK, Clock.ZERO_CLOCK, RelationType.LE, 1)),
                    () -> assertDoesNotThrow(() -> ClockConstraint.of(x, x, RelationType.LE, 0))
            );
        }

        @Test
        @DisplayName("参数为 null")
        void testOf_WhenNull_ShouldThrow() {
            assertThrows(NullPointerException.class, () -> ClockConstraint.of(x, null, 3));
            assertThrows(NullPointerException.class, () -> ClockConstraint.of(null, RelationType.LE, 3));
        }

        @Test
        @DisplayName("值相等的约束相等")
        void testEquals() {
            assertEquals(ClockConstraint.lessEqual(x, 3), ClockConstraint.of(x, RelationType.LE, 3));
            assertNotEquals(ClockConstraint.lessEqual(x, 3), ClockConstraint.lessThan(x, 3));
            assertFalse(ClockConstraint.lessEqual(x, 3).isDiagonal());
            assertTrue(ClockConstraint.of(x, y, RelationType.LE, 3).isDiagonal());
        }
    }

    @Nested
    @DisplayName("转换")
    class ConversionTests {

        @Test
        @DisplayName("下界翻转方向，等式给出两个边界")
        void testToBounds() {
            List<int[]> lower = ClockConstraint.greaterThan(x, 1).toBounds(clock -> 1);
            List<int[]> equal = ClockConstraint.equalTo(x, 2).toBounds(clock -> 1);

            assertAll(
                    () -> assertEquals(1, lower.size()),
                    () -> assertArrayEquals(new int[]{0, 1, Bound.lessThan(-1)}, lower.get(0)),
                    () -> assertEquals(2, equal.size()),
                    () -> assertArrayEquals(new int[]{1, 0, Bound.lessEqual(2)}, equal.get(0)),
                    () -> assertArrayEquals(new int[]{0, 1, Bound.lessEqual(-2)}, equal.get(1))
            );
        }

        @Test
        @DisplayName("文本形式")
        void testToString() {
            assertAll(
                    () -> assertEquals("x <= 3", ClockConstraint.lessEqual(x, 3).toString()),
                    () -> assertEquals("x - y > -2", ClockConstraint.of(x, y, RelationType.GT, -2).toString()),
                    () -> assertEquals("y >= 4", ClockConstraint.of(Clock.ZERO_CLOCK, y, RelationType.LE, -4).toString())
            );
        }
    }
}
