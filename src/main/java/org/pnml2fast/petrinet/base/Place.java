package org.pnml2fast.petrinet.base; // 放在 petrinet.base 包下

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表 P/T 网中的一个库所。
 * Place 是不可变对象，一旦创建，其ID、名称和初始标识就不会改变。
 * 名称原样用作 FAST 模型中的状态变量。
 */
@Getter
public final class Place {

    private static final Logger logger = LoggerFactory.getLogger(Place.class);

    // 缺省初始标识
    public static final int DEFAULT_INITIAL_MARKING = 0;

    private final String id;
    private final String name;
    private final int initialMarking;

    private final int hashCode;

    /**
     * 私有构造函数，外部应通过工厂方法创建 Place。
     * @param id 库所的唯一ID。
     * @param name 库所的名称。
     * @param initialMarking 初始托肯数，必须非负。
     */
    private Place(String id, String name, int initialMarking) {
        this.id = Objects.requireNonNull(id, "Place id cannot be null");
        this.name = Objects.requireNonNull(name, "Place name cannot be null");
        if (initialMarking < 0) {
            throw new IllegalArgumentException("库所 '" + id + "' 的初始标识必须非负: " + initialMarking);
        }
        this.initialMarking = initialMarking;
        this.hashCode = Objects.hash(id);
        logger.debug("创建了一个Place: {} with id {}, 初始标识 {}", name, id, initialMarking);
    }

    /**
     * 创建一个库所。
     * @param id 库所ID。
     * @param name 库所名称。
     * @param initialMarking 初始托肯数。
     * @return 新的 Place 实例。
     */
    public static Place of(String id, String name, int initialMarking) {
        return new Place(id, name, initialMarking);
    }

    /**
     * 创建一个初始标识为 0 的库所。
     */
    public static Place of(String id, String name) {
        return new Place(id, name, DEFAULT_INITIAL_MARKING);
    }

    /**
     * 解析初始标识文本，缺失或为空时取缺省值 0。
     * @param text 文档中读到的初始标识文本，可以为 null。
     * @return 初始托肯数。
     * @throws NumberFormatException 如果文本不是整数。
     */
    public static int initialMarking(String text) {
        if (StringUtils.isBlank(text)) {
            return DEFAULT_INITIAL_MARKING;
        }
        return Integer.parseInt(text.trim());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Place place = (Place) o;
        return id.equals(place.id);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name;
    }
}
