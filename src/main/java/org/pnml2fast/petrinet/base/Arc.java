package org.pnml2fast.petrinet.base;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表一条有向带权弧。
 * 方向由端点隐含：库所 -> 变迁 为消耗弧，变迁 -> 库所 为产生弧。
 * Arc 只记录端点的ID，不持有端点对象；端点是否存在由查询方判断。
 * 此类是不可变的。
 */
@Getter
public final class Arc {

    private static final Logger logger = LoggerFactory.getLogger(Arc.class);

    // 缺省弧权
    public static final int DEFAULT_WEIGHT = 1;

    private final String id;
    private final String source; // 源节点ID
    private final String target; // 目标节点ID
    private final int weight;

    private final int hashCode;

    /**
     * @param id     弧的ID
     * @param source 源节点ID (库所或变迁)
     * @param target 目标节点ID (库所或变迁)
     * @param weight 弧权，必须为正
     */
    private Arc(String id, String source, String target, int weight) {
        this.id = Objects.requireNonNull(id, "Arc id cannot be null.");
        this.source = Objects.requireNonNull(source, "Arc source cannot be null.");
        this.target = Objects.requireNonNull(target, "Arc target cannot be null.");
        if (weight <= 0) {
            throw new IllegalArgumentException("弧 '" + id + "' 的权重必须为正: " + weight);
        }
        this.weight = weight;
        this.hashCode = Objects.hash(id);
        logger.debug("创建 Arc: {} --{}--> {}", source, weight, target);
    }

    public static Arc of(String id, String source, String target, int weight) {
        return new Arc(id, source, target, weight);
    }

    public static Arc of(String id, String source, String target) {
        return new Arc(id, source, target, DEFAULT_WEIGHT);
    }

    /**
     * 解析弧权文本，缺失或为空时取缺省值 1。
     * @param text 文档中读到的弧权文本，可以为 null。
     * @return 弧权。
     * @throws NumberFormatException 如果文本不是整数。
     */
    public static int arcWeight(String text) {
        if (StringUtils.isBlank(text)) {
            return DEFAULT_WEIGHT;
        }
        return Integer.parseInt(text.trim());
    }

    /**
     * 检查此弧是否从指定库所指向指定变迁。
     */
    public boolean consumes(Place place, Transition transition) {
        return source.equals(place.getId()) && target.equals(transition.getId());
    }

    /**
     * 检查此弧是否从指定变迁指向指定库所。
     */
    public boolean produces(Transition transition, Place place) {
        return source.equals(transition.getId()) && target.equals(place.getId());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Arc arc = (Arc) o;
        return id.equals(arc.id) &&
                source.equals(arc.source) &&
                target.equals(arc.target) &&
                weight == arc.weight;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return String.format("%s --[%d]--> %s", source, weight, target);
    }
}
