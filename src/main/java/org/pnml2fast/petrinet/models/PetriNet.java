package org.pnml2fast.petrinet.models;

import lombok.AccessLevel;
import lombok.Getter;
import org.pnml2fast.petrinet.base.Arc;
import org.pnml2fast.petrinet.base.Place;
import org.pnml2fast.petrinet.base.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 代表一个 Place/Transition 网 (P/T net)。
 * PetriNet 是从输入文档读取出的一次性不可变快照：库所、变迁与弧均按文档顺序保存，
 * 之后只被各个构造器只读共享。
 * 它不维护邻接索引，弧关系只能按源/目标ID检索。
 */
@Getter
public final class PetriNet {

    private static final Logger logger = LoggerFactory.getLogger(PetriNet.class);

    private final String name;
    private final List<Place> places;
    private final List<Transition> transitions;
    private final List<Arc> arcs;

    @Getter(AccessLevel.NONE)
    private final Map<String, Place> placesById;
    @Getter(AccessLevel.NONE)
    private final Map<String, Transition> transitionsById;

    /**
     * 构造一个 P/T 网。
     *
     * @param name        网的名称，可以为空串。
     * @param places      按文档顺序排列的库所。
     * @param transitions 按文档顺序排列的变迁。
     * @param arcs        按文档顺序排列的弧。
     */
    public PetriNet(String name, List<Place> places, List<Transition> transitions, List<Arc> arcs) {
        this.name = Objects.requireNonNull(name, "Net name cannot be null.");
        this.places = List.copyOf(Objects.requireNonNull(places, "Places list cannot be null."));
        this.transitions = List.copyOf(Objects.requireNonNull(transitions, "Transitions list cannot be null."));
        this.arcs = List.copyOf(Objects.requireNonNull(arcs, "Arcs list cannot be null."));

        // 重复ID时保留文档中第一次出现的元素
        Map<String, Place> tempPlaces = new LinkedHashMap<>();
        for (Place place : this.places) {
            if (tempPlaces.putIfAbsent(place.getId(), place) != null) {
                logger.warn("库所ID '{}' 重复出现，按ID查询时只返回第一个。", place.getId());
            }
        }
        Map<String, Transition> tempTransitions = new LinkedHashMap<>();
        for (Transition transition : this.transitions) {
            if (tempTransitions.putIfAbsent(transition.getId(), transition) != null) {
                logger.warn("变迁ID '{}' 重复出现，按ID查询时只返回第一个。", transition.getId());
            }
        }
        this.placesById = Collections.unmodifiableMap(tempPlaces);
        this.transitionsById = Collections.unmodifiableMap(tempTransitions);

        logger.info("创建 PetriNet '{}': {} 个库所, {} 个变迁, {} 条弧",
                name, this.places.size(), this.transitions.size(), this.arcs.size());
    }

    /**
     * 按ID查找库所。
     * @param id 库所ID。
     * @return 对应的库所，不存在时为空。
     */
    public Optional<Place> findPlace(String id) {
        return Optional.ofNullable(placesById.get(id));
    }

    /**
     * 按ID查找变迁。
     * @param id 变迁ID。
     * @return 对应的变迁，不存在时为空。
     */
    public Optional<Transition> findTransition(String id) {
        return Optional.ofNullable(transitionsById.get(id));
    }

    /**
     * 按名称查找变迁 (名称在整个网中唯一)。
     */
    public Optional<Transition> findTransitionByName(String transitionName) {
        return transitions.stream()
                .filter(transition -> transition.getName().equals(transitionName))
                .findFirst();
    }

    /**
     * 构造只保留部分变迁的子网。
     * 库所全部保留，弧只保留至少一端是被保留变迁的那些。
     *
     * @param keep 决定变迁是否保留的谓词。
     * @return 新的 PetriNet，名称与库所不变。
     */
    public PetriNet restrictTo(Predicate<Transition> keep) {
        List<Transition> keptTransitions = transitions.stream()
                .filter(keep)
                .collect(Collectors.toList());
        Set<String> keptIds = keptTransitions.stream()
                .map(Transition::getId)
                .collect(Collectors.toSet());
        List<Arc> keptArcs = arcs.stream()
                .filter(arc -> keptIds.contains(arc.getSource()) || keptIds.contains(arc.getTarget()))
                .collect(Collectors.toList());
        logger.debug("限制 PetriNet '{}': 保留 {}/{} 个变迁", name, keptTransitions.size(), transitions.size());
        return new PetriNet(name, places, keptTransitions, keptArcs);
    }

    @Override
    public String toString() {
        return "PetriNet{" + name +
                ", places=" + places +
                ", transitions=" + transitions +
                ", arcs=" + arcs.size() +
                '}';
    }
}
