package org.pnml2fast.translation;

import org.pnml2fast.expressions.conditions.AtomicCondition;
import org.pnml2fast.expressions.conditions.Conjunction;
import org.pnml2fast.petrinet.base.Transition;
import org.pnml2fast.petrinet.models.PetriNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 生成 FAST 输出的 strategy 段：初始区域、变迁集合以及固定的可达性指令。
 * <pre>
 * strategy strat {
 *  setMaxState(2000);
 *  setMaxAcc(100);
 *
 *  Region init := {p1=5 &amp;&amp; p2=0&amp;&amp;state=marking};
 *
 *  Transitions trans := {t1};
 *
 *  Region reach := post*(init, trans, 1);
 * }
 * </pre>
 */
public final class StrategyEmitter {

    private static final Logger logger = LoggerFactory.getLogger(StrategyEmitter.class);

    public static final String STATE_CONSTRAINT = "state=" + ModelEmitter.STATE;

    private final StrategySettings settings;

    public StrategyEmitter(StrategySettings settings) {
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null.");
    }

    public StrategyEmitter() {
        this(StrategySettings.defaults());
    }

    /**
     * @param net P/T 网。
     * @return 以 "}\n" 结尾的完整 strategy 段。
     */
    public String emitStrategy(PetriNet net) {
        Objects.requireNonNull(net, "Net cannot be null.");
        logger.info("生成 strategy 段 '{}': {}", net.getName(), settings);
        return "strategy strat {\n" +
                " setMaxState(" + settings.getMaxState() + ");\n" +
                " setMaxAcc(" + settings.getMaxAcc() + ");\n" +
                "\n" +
                " Region init := {" + initRegion(net) + "};\n" +
                "\n" +
                " Transitions trans := {" + transitionSet(net) + "};\n" +
                "\n" +
                " Region reach := post*(init, trans, " + settings.getDepth() + ");\n" +
                "}\n";
    }

    /**
     * 初始区域花括号内的部分。
     * 缺省为每个库所一个 "name=初始标识" 项，以 " &amp;&amp; " 连接，后接 "&amp;&amp;state=marking"；
     * 设置了替换公式时为 "公式 &amp;&amp; state=marking"。
     */
    public String initRegion(PetriNet net) {
        if (settings.initialRegionOverride().isPresent()) {
            String formula = settings.initialRegionOverride().get();
            logger.debug("初始区域被替换为: {}", formula);
            return formula + Conjunction.SEPARATOR + STATE_CONSTRAINT;
        }
        Conjunction marking = Conjunction.of(net.getPlaces().stream()
                .map(place -> AtomicCondition.equalTo(place.getName(), place.getInitialMarking()))
                .collect(Collectors.toList()));
        return marking.toFast() + "&&" + STATE_CONSTRAINT;
    }

    /**
     * 按文档顺序以 ", " 连接所有变迁名。
     */
    public String transitionSet(PetriNet net) {
        return net.getTransitions().stream()
                .map(Transition::getName)
                .collect(Collectors.joining(", "));
    }
}
