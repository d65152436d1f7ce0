package org.pnml2fast.expressions.conditions;

import lombok.Getter;
import org.pnml2fast.expressions.RelationType;
import org.pnml2fast.expressions.ToFastText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表一个原子算术约束, 形如 v ~ c，其中 v 是状态变量名，c 是整数常量。
 * 守卫中的 "p1>=1" 和初始区域中的 "p1=5" 都是原子约束。
 * 此类是不可变的。
 */
@Getter
public final class AtomicCondition implements ToFastText {

    private static final Logger logger = LoggerFactory.getLogger(AtomicCondition.class);

    private final String variable;       // 状态变量 (库所名)
    private final RelationType relation; // 关系类型
    private final int bound;             // 常量边界

    /**
     * @param variable 状态变量名。
     * @param relation 关系类型。
     * @param bound    常量边界。
     * @throws NullPointerException 如果 variable 或 relation 为 null。
     */
    private AtomicCondition(String variable, RelationType relation, int bound) {
        this.variable = Objects.requireNonNull(variable, "AtomicCondition-构造函数: variable 不能为 null");
        this.relation = Objects.requireNonNull(relation, "AtomicCondition-构造函数: relation 不能为 null");
        this.bound = bound;
        logger.debug("创建了一个 AtomicCondition: {}", this);
    }

    // --- 工厂方法 ---
    public static AtomicCondition of(String variable, RelationType relation, int bound) {
        return new AtomicCondition(variable, relation, bound);
    }

    public static AtomicCondition atLeast(String variable, int bound) { return new AtomicCondition(variable, RelationType.GE, bound); }
    public static AtomicCondition equalTo(String variable, int bound) { return new AtomicCondition(variable, RelationType.EQ, bound); }

    // --- FAST 转换 ---
    @Override
    public String toFast() {
        return variable + relation.getSymbol() + bound;
    }

    // --- Object 方法 ---
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AtomicCondition that = (AtomicCondition) o;
        return relation == that.relation &&
                bound == that.bound &&
                variable.equals(that.variable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, relation, bound);
    }

    @Override
    public String toString() {
        return variable + " " + relation.getSymbol() + " " + bound;
    }
}
