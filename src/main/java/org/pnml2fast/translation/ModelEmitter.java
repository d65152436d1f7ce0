package org.pnml2fast.translation;

import org.pnml2fast.petrinet.base.Place;
import org.pnml2fast.petrinet.base.Transition;
import org.pnml2fast.petrinet.models.PetriNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 生成 FAST 输出的 model 段：状态变量声明与每个变迁的块。
 * <pre>
 * model &lt;net-name&gt; {
 *
 * var p1, p2;
 *
 * states marking;
 *
 * transition t1 := {
 *  from := marking;
 *  to := marking;
 *  guard := p1&gt;=1;
 *  action := p1'=p1-1, p2'=p2+2;
 * };
 * }
 * </pre>
 */
public final class ModelEmitter {

    private static final Logger logger = LoggerFactory.getLogger(ModelEmitter.class);

    // 唯一的控制状态
    public static final String STATE = "marking";

    /**
     * @param net P/T 网。
     * @return 以 "}\n" 结尾的完整 model 段。
     */
    public String emitModel(PetriNet net) {
        Objects.requireNonNull(net, "Net cannot be null.");
        logger.info("生成 model 段 '{}': {} 个变迁", net.getName(), net.getTransitions().size());
        GuardBuilder guards = new GuardBuilder(net);
        ActionBuilder actions = new ActionBuilder(net, new EffectCalculator(net));

        StringBuilder model = new StringBuilder();
        model.append("model ").append(net.getName()).append(" {\n");
        model.append('\n');
        model.append(varDeclaration(net)).append('\n');
        model.append('\n');
        model.append("states ").append(STATE).append(";\n");
        model.append('\n');
        for (Transition transition : net.getTransitions()) {
            model.append(transitionBlock(transition, guards, actions));
        }
        model.append("}\n");
        return model.toString();
    }

    /**
     * 按文档顺序以 ", " 连接所有库所名；没有库所时为 "var ;"。
     */
    public String varDeclaration(PetriNet net) {
        return "var " + net.getPlaces().stream()
                .map(Place::getName)
                .collect(Collectors.joining(", ")) + ";";
    }

    /**
     * 单个变迁块，以 "};\n" 结尾。
     */
    public String transitionBlock(PetriNet net, Transition transition) {
        return transitionBlock(transition, new GuardBuilder(net), new ActionBuilder(net));
    }

    private String transitionBlock(Transition transition, GuardBuilder guards, ActionBuilder actions) {
        logger.debug("生成变迁块: {}", transition);
        return "transition " + transition.getName() + " := {\n" +
                " from := " + STATE + ";\n" +
                " to := " + STATE + ";\n" +
                " guard := " + guards.guard(transition) + "\n" +
                " action " + actions.action(transition) + "\n" +
                "};\n";
    }
}
