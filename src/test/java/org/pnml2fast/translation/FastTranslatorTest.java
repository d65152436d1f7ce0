package org.pnml2fast.translation;

import org.pnml2fast.io.PnmlReader;
import org.pnml2fast.petrinet.models.PetriNet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

class FastTranslatorTest {

    private static final String SIMPLE_FAST =
            "model simple {\n" +
            "\n" +
            "var p1, p2;\n" +
            "\n" +
            "states marking;\n" +
            "\n" +
            "transition t1 := {\n" +
            " from := marking;\n" +
            " to := marking;\n" +
            " guard := p1>=1;\n" +
            " action := p1'=p1-1, p2'=p2+2;\n" +
            "};\n" +
            "}\n" +
            "\n" +
            "strategy strat {\n" +
            " setMaxState(2000);\n" +
            " setMaxAcc(100);\n" +
            "\n" +
            " Region init := {p1=5 && p2=0&&state=marking};\n" +
            "\n" +
            " Transitions trans := {t1};\n" +
            "\n" +
            " Region reach := post*(init, trans, 1);\n" +
            "}\n";

    private static PetriNet load(String resource) throws IOException {
        try (InputStream in = FastTranslatorTest.class.getResourceAsStream(resource)) {
            assertNotNull(in, "missing fixture " + resource);
            return new PnmlReader().read(in);
        }
    }

    @Test
    @DisplayName("参考场景的完整输出")
    void testTranslate_Scenario() throws IOException {
        assertEquals(SIMPLE_FAST, new FastTranslator().translate(load("/nets/simple.pnml")));
    }

    @Test
    @DisplayName("带命名空间、带前缀与不带命名空间的文档输出逐字节相同")
    void testTranslate_NamespaceIndependent() throws IOException {
        FastTranslator translator = new FastTranslator();
        String qualified = translator.translate(load("/nets/simple.pnml"));

        assertAll("namespace variants",
                () -> assertEquals(qualified, translator.translate(load("/nets/simple-unqualified.pnml"))),
                () -> assertEquals(qualified, translator.translate(load("/nets/simple-prefixed.pnml")))
        );
    }

    @Test
    @DisplayName("同一文档翻译两次得到相同文本")
    void testTranslate_Deterministic() throws IOException {
        PetriNet net = load("/nets/defaults.pnml");
        String first = new FastTranslator().translate(net);
        String second = new FastTranslator().translate(load("/nets/defaults.pnml"));

        assertEquals(first, second);
        assertEquals(first, new FastTranslator().translate(net));
    }

    @Test
    @DisplayName("缺省值、跨 page 的库所与被忽略的弧")
    void testTranslate_Defaults() throws IOException {
        String fast = new FastTranslator().translate(load("/nets/defaults.pnml"));

        assertAll("defaults.pnml",
                () -> assertTrue(fast.startsWith("model  {\n"), "missing net name is emitted empty"),
                () -> assertTrue(fast.contains("var a, b, c;\n")),
                () -> assertTrue(fast.contains("transition loop := {\n from := marking;\n to := marking;\n guard := a>=1;\n action ;\n};\n")),
                () -> assertTrue(fast.contains("transition tau_fill := {\n from := marking;\n to := marking;\n guard := c>=2;\n action := b'=b+4, c'=c-2;\n};\n")),
                () -> assertTrue(fast.contains(" Region init := {a=0 && b=3 && c=0&&state=marking};\n")),
                () -> assertTrue(fast.contains(" Transitions trans := {loop, tau_fill};\n"))
        );
    }

    @Test
    @DisplayName("只保留静默变迁后的翻译")
    void testTranslate_SilentRestriction() throws IOException {
        PetriNet silent = load("/nets/defaults.pnml").restrictTo(t -> t.isSilent());
        String fast = new FastTranslator().translate(silent);

        assertAll("silent restriction",
                () -> assertTrue(fast.contains("var a, b, c;\n"), "places are kept"),
                () -> assertFalse(fast.contains("transition loop")),
                () -> assertTrue(fast.contains(" Transitions trans := {tau_fill};\n"))
        );
    }
}
