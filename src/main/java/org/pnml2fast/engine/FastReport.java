package org.pnml2fast.engine;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.pnml2fast.petrinet.base.Transition;
import org.pnml2fast.petrinet.models.PetriNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * FAST 引擎诊断输出中报告的变迁。
 * FAST 对每个成功加速的变迁在诊断输出中打印一行含 "OK !" 的信息，
 * 按空格切分后的第三个记号是变迁名。
 * 此类是不可变的。
 */
@Getter
public final class FastReport {

    private static final Logger logger = LoggerFactory.getLogger(FastReport.class);

    public static final String SUCCESS_MARKER = "OK !";
    private static final int NAME_TOKEN = 2;

    // 按出现顺序排列的变迁名
    private final List<String> transitionNames;

    private FastReport(List<String> transitionNames) {
        this.transitionNames = List.copyOf(transitionNames);
    }

    /**
     * @param output FAST 的诊断输出全文。
     * @return 报告；没有匹配行时为空报告。
     */
    public static FastReport parse(String output) {
        Objects.requireNonNull(output, "Output cannot be null");
        List<String> names = new ArrayList<>();
        for (String line : output.split("\\R")) {
            if (!line.contains(SUCCESS_MARKER)) {
                continue;
            }
            String[] tokens = StringUtils.split(line, ' ');
            if (tokens.length <= NAME_TOKEN) {
                logger.warn("无法从 FAST 输出行中读取变迁名: '{}'", line);
                continue;
            }
            names.add(tokens[NAME_TOKEN]);
        }
        logger.debug("FAST 报告了 {} 个变迁: {}", names.size(), names);
        return new FastReport(names);
    }

    public boolean isEmpty() {
        return transitionNames.isEmpty();
    }

    /**
     * 将报告中的变迁名映射回网中的变迁，每个变迁单独成一个序列。
     * 网中不存在的名称被记录并跳过。
     *
     * @param net 被翻译的网。
     * @return 按报告顺序排列的单变迁序列。
     */
    public List<List<Transition>> resolve(PetriNet net) {
        List<List<Transition>> sequences = new ArrayList<>();
        for (String name : transitionNames) {
            Optional<Transition> transition = net.findTransitionByName(name);
            if (transition.isEmpty()) {
                logger.warn("FAST 报告的变迁 '{}' 不在网 '{}' 中，忽略。", name, net.getName());
                continue;
            }
            sequences.add(List.of(transition.get()));
        }
        return sequences;
    }

    @Override
    public String toString() {
        return "FastReport" + transitionNames;
    }
}
