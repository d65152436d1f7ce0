package org.pnml2fast.translation;

import org.pnml2fast.expressions.conditions.AtomicCondition;
import org.pnml2fast.expressions.conditions.Conjunction;
import org.pnml2fast.petrinet.base.Arc;
import org.pnml2fast.petrinet.base.Place;
import org.pnml2fast.petrinet.base.Transition;
import org.pnml2fast.petrinet.models.PetriNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 从变迁的消耗弧推导其使能条件。
 */
public final class GuardBuilder {

    private static final Logger logger = LoggerFactory.getLogger(GuardBuilder.class);

    public static final String TERMINATOR = ";";

    private final PetriNet net;

    public GuardBuilder(PetriNet net) {
        this.net = Objects.requireNonNull(net, "Net cannot be null.");
    }

    /**
     * 按文档顺序枚举以该变迁为目标的弧，每条弧给出 "源库所 >= 弧权"。
     * 源端不是已知库所的弧 (悬空或变迁到变迁) 被忽略。
     *
     * @param transition 变迁。
     * @return 使能条件的合取，可能为空。
     */
    public Conjunction conditions(Transition transition) {
        List<AtomicCondition> conditions = new ArrayList<>();
        for (Arc arc : net.getArcs()) {
            if (!arc.getTarget().equals(transition.getId())) {
                continue;
            }
            Optional<Place> source = net.findPlace(arc.getSource());
            if (source.isEmpty()) {
                logger.warn("弧 {} 指向变迁 {}，但源端 '{}' 不是库所，忽略。", arc.getId(), transition, arc.getSource());
                continue;
            }
            conditions.add(AtomicCondition.atLeast(source.get().getName(), arc.getWeight()));
        }
        return Conjunction.of(conditions);
    }

    /**
     * 守卫文本，例如 "p1>=1 && p2>=2;"。
     * 没有消耗弧的变迁守卫为空串，既无合取项也无结尾分号。
     *
     * @param transition 变迁。
     * @return 守卫文本。
     */
    public String guard(Transition transition) {
        Conjunction conditions = conditions(transition);
        if (conditions.isEmpty()) {
            logger.debug("变迁 {} 没有消耗弧，守卫为空。", transition);
            return "";
        }
        return conditions.toFast() + TERMINATOR;
    }
}
