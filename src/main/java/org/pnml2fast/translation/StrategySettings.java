package org.pnml2fast.translation;

import lombok.AccessLevel;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * strategy 段中的调优常量。
 * 这些值只限制 FAST 引擎的探索规模，不从网推导。
 * 此类是不可变的。
 */
@Getter
public final class StrategySettings {

    public static final int DEFAULT_MAX_STATE = 2000;
    public static final int DEFAULT_MAX_ACC = 100;
    public static final int DEFAULT_DEPTH = 1;

    private static final StrategySettings DEFAULTS =
            new StrategySettings(DEFAULT_MAX_STATE, DEFAULT_MAX_ACC, DEFAULT_DEPTH, null);

    private final int maxState;
    private final int maxAcc;
    private final int depth;
    // 替换初始区域中按库所生成的约束部分，null 表示不替换
    @Getter(AccessLevel.NONE)
    private final String initialRegionOverride;

    private StrategySettings(int maxState, int maxAcc, int depth, String initialRegionOverride) {
        if (maxState <= 0 || maxAcc <= 0 || depth <= 0) {
            throw new IllegalArgumentException(String.format(
                    "调优常量必须为正: maxState=%d, maxAcc=%d, depth=%d", maxState, maxAcc, depth));
        }
        this.maxState = maxState;
        this.maxAcc = maxAcc;
        this.depth = depth;
        this.initialRegionOverride = StringUtils.isBlank(initialRegionOverride) ? null : initialRegionOverride.trim();
    }

    public static StrategySettings defaults() {
        return DEFAULTS;
    }

    public static StrategySettings of(int maxState, int maxAcc, int depth) {
        return new StrategySettings(maxState, maxAcc, depth, null);
    }

    /**
     * @param formula FAST 区域公式；空白视为不替换。
     * @return 仅初始区域不同的新设置。
     */
    public StrategySettings withInitialRegion(String formula) {
        return new StrategySettings(maxState, maxAcc, depth, formula);
    }

    public Optional<String> initialRegionOverride() {
        return Optional.ofNullable(initialRegionOverride);
    }

    @Override
    public String toString() {
        return "StrategySettings{maxState=" + maxState +
                ", maxAcc=" + maxAcc +
                ", depth=" + depth +
                ", initialRegion=" + (initialRegionOverride == null ? "<marking>" : initialRegionOverride) +
                '}';
    }
}
