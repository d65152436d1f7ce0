package org.pnml2fast.expressions.updates;

import lombok.Getter;
import org.pnml2fast.expressions.ToFastText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表一个状态变量的增量赋值 v' = v + d。
 * d 为零的赋值没有意义 (帧规则：未提及的变量保持不变)，因此不允许构造。
 * 此类是不可变的。
 */
@Getter
public final class Update implements ToFastText {

    private static final Logger logger = LoggerFactory.getLogger(Update.class);

    private final String variable;
    private final int delta;

    private Update(String variable, int delta) {
        this.variable = Objects.requireNonNull(variable, "Update variable cannot be null");
        if (delta == 0) {
            logger.warn("变量 '{}' 的零增量赋值被拒绝。", variable);
            throw new IllegalArgumentException("Update 的增量不能为 0: " + variable);
        }
        this.delta = delta;
        logger.debug("创建 Update: {}", this);
    }

    public static Update of(String variable, int delta) {
        return new Update(variable, delta);
    }

    /**
     * 正增量写作 "p'=p+2"；负增量的符号由数字自身携带，写作 "p'=p-1"。
     */
    @Override
    public String toFast() {
        String sign = delta > 0 ? "+" : "";
        return variable + "'=" + variable + sign + delta;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Update update = (Update) o;
        return delta == update.delta && variable.equals(update.variable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, delta);
    }

    @Override
    public String toString() {
        return variable + " += " + delta;
    }
}
