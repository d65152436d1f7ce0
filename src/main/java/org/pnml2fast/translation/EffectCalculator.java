package org.pnml2fast.translation;

import org.pnml2fast.petrinet.base.Arc;
import org.pnml2fast.petrinet.base.Place;
import org.pnml2fast.petrinet.base.Transition;
import org.pnml2fast.petrinet.models.PetriNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 计算变迁一次发生对某个库所造成的托肯净变化。
 * <pre>
 * effect(p, t) = Σ weight(t -> p) − Σ weight(p -> t)
 * </pre>
 * 直接扫描弧列表按源/目标ID匹配；端点对不上的弧贡献 0。
 */
public final class EffectCalculator {

    private static final Logger logger = LoggerFactory.getLogger(EffectCalculator.class);

    private final PetriNet net;

    public EffectCalculator(PetriNet net) {
        this.net = Objects.requireNonNull(net, "Net cannot be null.");
    }

    /**
     * @param place      库所。
     * @param transition 变迁。
     * @return 产生弧权之和减去消耗弧权之和。
     */
    public int effect(Place place, Transition transition) {
        int produced = 0;
        int consumed = 0;
        for (Arc arc : net.getArcs()) {
            if (arc.produces(transition, place)) {
                produced += arc.getWeight();
            } else if (arc.consumes(place, transition)) {
                consumed += arc.getWeight();
            }
        }
        int effect = produced - consumed;
        logger.debug("effect({}, {}) = {} - {} = {}", place, transition, produced, consumed, effect);
        return effect;
    }
}
