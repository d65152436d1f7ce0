package org.pnml2fast.translation;

import org.pnml2fast.petrinet.base.Arc;
import org.pnml2fast.petrinet.base.Place;
import org.pnml2fast.petrinet.base.Transition;
import org.pnml2fast.petrinet.models.PetriNet;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EffectCalculatorTest {

    // --- Test Setup ---
    private static Place p1, p2, p3;
    private static Transition t1, t2;
    private static EffectCalculator effects;

    @BeforeAll
    static void setUp() {
        p1 = Place.of("P1", "p1", 5);
        p2 = Place.of("P2", "p2");
        p3 = Place.of("P3", "p3");
        t1 = Transition.of("T1", "t1");
        t2 = Transition.of("T2", "t2");

        PetriNet net = new PetriNet("effects", List.of(p1, p2, p3), List.of(t1, t2), List.of(
                Arc.of("a1", "P1", "T1", 1),
                Arc.of("a2", "T1", "P2", 2),
                Arc.of("a3", "P3", "T1", 3),   // 消耗与产生相抵
                Arc.of("a4", "T1", "P3", 3),
                Arc.of("a5", "P1", "T1", 2),   // 同一对端点的第二条弧
                Arc.of("a6", "P1", "P2", 7),   // 库所到库所，从不匹配
                Arc.of("a7", "T1", "GHOST", 1) // 悬空
        ));
        effects = new EffectCalculator(net);
    }

    @Test
    @DisplayName("消耗弧给出负的净变化，多条弧的权重累加 (p1: -1 - 2)")
    void testConsumingArcsAreSummed() {
        assertEquals(-3, effects.effect(p1, t1));
    }

    @Test
    @DisplayName("产生弧给出正的净变化 (p2: +2)")
    void testProducingArc() {
        assertEquals(2, effects.effect(p2, t1));
    }

    @Test
    @DisplayName("等权的输入输出弧相抵为 0")
    void testSelfLoopCancels() {
        assertEquals(0, effects.effect(p3, t1));
    }

    @Test
    @DisplayName("没有相连弧的 (库所, 变迁) 对净变化为 0")
    void testUnconnectedPairIsZero() {
        assertAll("t2 has no arcs at all",
                () -> assertEquals(0, effects.effect(p1, t2)),
                () -> assertEquals(0, effects.effect(p2, t2)),
                () -> assertEquals(0, effects.effect(p3, t2))
        );
    }

    @Test
    @DisplayName("不在网中的库所也只得到 0，不抛异常")
    void testUnknownPlaceIsTotal() {
        assertEquals(0, effects.effect(Place.of("P9", "p9"), t1));
    }
}
