package org.pnml2fast.translation;

import org.pnml2fast.expressions.updates.Update;
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
 * 根据所有净变化非零的库所推导变迁的状态更新。
 * 净变化为零的库所不出现 (帧规则)。
 */
public final class ActionBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ActionBuilder.class);

    public static final String OPENER = ":= ";
    public static final String SEPARATOR = ", ";
    public static final String TERMINATOR = ";";

    private final PetriNet net;
    private final EffectCalculator effects;

    public ActionBuilder(PetriNet net, EffectCalculator effects) {
        this.net = Objects.requireNonNull(net, "Net cannot be null.");
        this.effects = Objects.requireNonNull(effects, "EffectCalculator cannot be null.");
    }

    public ActionBuilder(PetriNet net) {
        this(net, new EffectCalculator(net));
    }

    /**
     * 按文档顺序找到第一个净变化非零的库所。
     * @param transition 变迁。
     * @return 该库所；变迁不改变任何标识时为空。
     */
    public Optional<Place> firstAffectedPlace(Transition transition) {
        List<Place> places = net.getPlaces();
        for (int i = 0; i < places.size(); i++) {
            if (effects.effect(places.get(i), transition) != 0) {
                return Optional.of(places.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * @param transition 变迁。
     * @return 按库所文档顺序排列的非零增量赋值。
     */
    public List<Update> updates(Transition transition) {
        List<Update> updates = new ArrayList<>();
        for (Place place : net.getPlaces()) {
            int effect = effects.effect(place, transition);
            if (effect != 0) {
                updates.add(Update.of(place.getName(), effect));
            }
        }
        return updates;
    }

    /**
     * 动作文本，例如 ":= p1'=p1-1, p2'=p2+2;"。
     * 第一个非零库所以 ":= " 引出，其后的以 ", " 引出；整体以 ";" 结尾。
     * 不改变任何标识的变迁只剩结尾的 ";"。
     *
     * @param transition 变迁。
     * @return 动作文本。
     */
    public String action(Transition transition) {
        Optional<Place> first = firstAffectedPlace(transition);
        StringBuilder action = new StringBuilder();
        for (Place place : net.getPlaces()) {
            int effect = effects.effect(place, transition);
            if (effect == 0) {
                continue;
            }
            action.append(first.get().equals(place) ? OPENER : SEPARATOR);
            action.append(Update.of(place.getName(), effect).toFast());
        }
        if (first.isEmpty()) {
            logger.debug("变迁 {} 不改变任何库所的标识，动作为空。", transition);
        }
        return action.append(TERMINATOR).toString();
    }
}
