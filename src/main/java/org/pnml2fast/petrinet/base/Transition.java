package org.pnml2fast.petrinet.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表 P/T 网中的一个变迁。
 * 名称原样用作 FAST 模型中的 transition 名。
 */
@Getter
public final class Transition {

    private static final Logger logger = LoggerFactory.getLogger(Transition.class);

    // 名称中含有此标记的变迁视为静默变迁
    public static final String SILENT_MARKER = "tau";

    private final String id;
    private final String name;

    private final int hashCode;

    private Transition(String id, String name) {
        this.id = Objects.requireNonNull(id, "Transition id cannot be null");
        this.name = Objects.requireNonNull(name, "Transition name cannot be null");
        this.hashCode = Objects.hash(id);
        logger.debug("创建 Transition: {} with id {}", name, id);
    }

    public static Transition of(String id, String name) {
        return new Transition(id, name);
    }

    /**
     * 检查此变迁是否为静默变迁 (名称含 "tau")。
     * @return 如果是静默变迁则返回 true。
     */
    public boolean isSilent() {
        return name.contains(SILENT_MARKER);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition that = (Transition) o;
        return id.equals(that.id);
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
