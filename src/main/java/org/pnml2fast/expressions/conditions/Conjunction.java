package org.pnml2fast.expressions.conditions;

import lombok.Getter;
import org.pnml2fast.expressions.ToFastText;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 原子约束的有序合取，FAST 文本中以 " && " 连接。
 * 顺序即加入顺序，不做排序或去重，以保证输出可复现。
 */
@Getter
public final class Conjunction implements ToFastText {

    public static final String SEPARATOR = " && ";

    private final List<AtomicCondition> conditions;

    private Conjunction(List<AtomicCondition> conditions) {
        this.conditions = List.copyOf(Objects.requireNonNull(conditions, "Conditions list cannot be null."));
    }

    public static Conjunction of(List<AtomicCondition> conditions) {
        return new Conjunction(conditions);
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    /**
     * 空合取渲染为空串。
     */
    @Override
    public String toFast() {
        return conditions.stream()
                .map(AtomicCondition::toFast)
                .collect(Collectors.joining(SEPARATOR));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return conditions.equals(((Conjunction) o).conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }

    @Override
    public String toString() {
        return "{" + conditions.stream()
                .map(AtomicCondition::toString)
                .collect(Collectors.joining(" ∧ ")) + "}";
    }
}
