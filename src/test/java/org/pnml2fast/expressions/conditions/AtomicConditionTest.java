package org.pnml2fast.expressions.conditions;

import org.pnml2fast.expressions.RelationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AtomicConditionTest {

    @Nested
    @DisplayName("FAST 文本 (FAST Rendering)")
    class RenderingTests {

        @Test
        @DisplayName("守卫约束写作 p1>=1，无空格")
        void testToFast_AtLeast() {
            assertEquals("p1>=1", AtomicCondition.atLeast("p1", 1).toFast());
        }

        @Test
        @DisplayName("区域约束写作 p2=0")
        void testToFast_EqualTo() {
            assertEquals("p2=0", AtomicCondition.equalTo("p2", 0).toFast());
        }

        @Test
        @DisplayName("合取以 ' && ' 连接，空合取为空串")
        void testConjunction_ToFast() {
            Conjunction conjunction = Conjunction.of(List.of(
                    AtomicCondition.atLeast("a", 2),
                    AtomicCondition.of("b", RelationType.LT, 3)));

            assertAll("conjunction",
                    () -> assertEquals("a>=2 && b<3", conjunction.toFast()),
                    () -> assertEquals("", Conjunction.of(List.of()).toFast()),
                    () -> assertTrue(Conjunction.of(List.of()).isEmpty())
            );
        }
    }

    @Nested
    @DisplayName("对象方法 (Object Methods)")
    class ObjectMethodTests {

        @Test
        @DisplayName("equals 和 hashCode 基于变量、关系与边界")
        void testEqualsAndHashCode() {
            AtomicCondition c1 = AtomicCondition.atLeast("p", 2);
            AtomicCondition c2 = AtomicCondition.of("p", RelationType.GE, 2);

            assertEquals(c1, c2);
            assertEquals(c1.hashCode(), c2.hashCode());
            assertNotEquals(c1, AtomicCondition.equalTo("p", 2));
            assertNotEquals(c1, AtomicCondition.atLeast("q", 2));
            assertNotEquals(c1, AtomicCondition.atLeast("p", 3));
            assertNotEquals(c1, null);
        }

        @Test
        @DisplayName("toString 生成可读的字符串")
        void testToString() {
            assertEquals("p >= 2", AtomicCondition.atLeast("p", 2).toString());
        }

        @Test
        @DisplayName("null 变量被拒绝")
        void testNullVariable() {
            assertThrows(NullPointerException.class, () -> AtomicCondition.atLeast(null, 1));
        }
    }
}
