package org.pnml2fast.translation;

import org.pnml2fast.petrinet.base.Arc;
import org.pnml2fast.petrinet.base.Place;
import org.pnml2fast.petrinet.base.Transition;
import org.pnml2fast.petrinet.models.PetriNet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelEmitterTest {

    private final ModelEmitter emitter = new ModelEmitter();

    /**
     * 辅助方法：p1(5), p2(0)；t1 消耗 p1 一个托肯，向 p2 产生两个。
     */
    private static PetriNet scenarioNet() {
        return new PetriNet("scenario",
                List.of(Place.of("P1", "p1", 5), Place.of("P2", "p2", 0)),
                List.of(Transition.of("T1", "t1")),
                List.of(Arc.of("A", "P1", "T1", 1), Arc.of("B", "T1", "P2", 2)));
    }

    @Nested
    @DisplayName("变量声明 (Variable Declaration)")
    class VarDeclarationTests {

        @Test
        @DisplayName("按文档顺序列出所有库所名")
        void testVarDeclaration_InDocumentOrder() {
            PetriNet net = new PetriNet("n",
                    List.of(Place.of("Z", "zeta"), Place.of("A", "alpha"), Place.of("M", "mu")),
                    List.of(), List.of());
            assertEquals("var zeta, alpha, mu;", emitter.varDeclaration(net));
        }

        @Test
        @DisplayName("没有库所时声明为空")
        void testVarDeclaration_Empty() {
            PetriNet net = new PetriNet("n", List.of(), List.of(), List.of());
            assertEquals("var ;", emitter.varDeclaration(net));
        }
    }

    @Nested
    @DisplayName("变迁块 (Transition Blocks)")
    class TransitionBlockTests {

        @Test
        @DisplayName("场景变迁块包含守卫与动作")
        void testTransitionBlock_Scenario() {
            PetriNet net = scenarioNet();
            String expected = "transition t1 := {\n" +
                    " from := marking;\n" +
                    " to := marking;\n" +
                    " guard := p1>=1;\n" +
                    " action := p1'=p1-1, p2'=p2+2;\n" +
                    "};\n";
            assertEquals(expected, emitter.transitionBlock(net, net.getTransitions().get(0)));
        }

        @Test
        @DisplayName("没有弧的变迁：守卫为空，动作只剩分号")
        void testTransitionBlock_NoArcs() {
            Transition idle = Transition.of("T", "idle");
            PetriNet net = new PetriNet("n", List.of(Place.of("P", "p")), List.of(idle), List.of());
            String expected = "transition idle := {\n" +
                    " from := marking;\n" +
                    " to := marking;\n" +
                    " guard := \n" +
                    " action ;\n" +
                    "};\n";
            assertEquals(expected, emitter.transitionBlock(net, idle));
        }
    }

    @Test
    @DisplayName("完整 model 段：变迁块按文档顺序排列")
    void testEmitModel() {
        PetriNet net = new PetriNet("two",
                List.of(Place.of("P", "p", 1)),
                List.of(Transition.of("T2", "second"), Transition.of("T1", "first")),
                List.of(Arc.of("a", "P", "T2"), Arc.of("b", "T1", "P")));

        String expected = "model two {\n" +
                "\n" +
                "var p;\n" +
                "\n" +
                "states marking;\n" +
                "\n" +
                "transition second := {\n" +
                " from := marking;\n" +
                " to := marking;\n" +
                " guard := p>=1;\n" +
                " action := p'=p-1;\n" +
                "};\n" +
                "transition first := {\n" +
                " from := marking;\n" +
                " to := marking;\n" +
                " guard := \n" +
                " action := p'=p+1;\n" +
                "};\n" +
                "}\n";
        assertEquals(expected, emitter.emitModel(net));
    }

    @Test
    @DisplayName("缺失的网名原样输出为空")
    void testEmitModel_EmptyName() {
        PetriNet net = new PetriNet("", List.of(), List.of(), List.of());
        assertTrue(emitter.emitModel(net).startsWith("model  {\n"));
    }
}
