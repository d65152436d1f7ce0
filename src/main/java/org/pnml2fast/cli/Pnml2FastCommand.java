package org.pnml2fast.cli;

import org.pnml2fast.engine.FastReport;
import org.pnml2fast.io.PnmlFormatException;
import org.pnml2fast.io.PnmlReader;
import org.pnml2fast.petrinet.base.Transition;
import org.pnml2fast.petrinet.models.PetriNet;
import org.pnml2fast.translation.FastTranslator;
import org.pnml2fast.translation.StrategySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * 命令行入口：将 PNML 文件翻译为 FAST 输入，写到标准输出或指定文件。
 * <pre>
 *   pnml2fast net.pnml                          -- 翻译并打印
 *   pnml2fast net.pnml -o net.fst               -- 写入文件
 *   pnml2fast net.pnml --silent-only            -- 只保留静默变迁 (名称含 tau)
 *   pnml2fast net.pnml --init-region "(p1 = 2)" -- 替换初始区域
 *   pnml2fast net.pnml --read-report fast.log   -- 列出 FAST 报告的变迁
 * </pre>
 */
@Command(
        name = "pnml2fast",
        mixinStandardHelpOptions = true,
        version = "pnml2fast 1.0",
        description = "Translate a PNML Place/Transition net into FAST input"
)
public class Pnml2FastCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(Pnml2FastCommand.class);

    static final int EXIT_INPUT_ERROR = 1;

    @Parameters(paramLabel = "<file.pnml>", description = "PNML P/T net to translate")
    private Path input;

    @Option(names = {"--output", "-o"}, paramLabel = "<file>", description = "Write the FAST text to this file instead of stdout")
    private Path output;

    @Option(names = "--silent-only", description = "Keep only silent transitions (name contains 'tau')")
    private boolean silentOnly;

    @Option(names = "--init-region", paramLabel = "<formula>", description = "Replace the initial marking region with this FAST formula")
    private String initRegion;

    @Option(names = "--max-state", paramLabel = "<n>", defaultValue = "" + StrategySettings.DEFAULT_MAX_STATE,
            description = "setMaxState bound (default: ${DEFAULT-VALUE})")
    private int maxState;

    @Option(names = "--max-acc", paramLabel = "<n>", defaultValue = "" + StrategySettings.DEFAULT_MAX_ACC,
            description = "setMaxAcc bound (default: ${DEFAULT-VALUE})")
    private int maxAcc;

    @Option(names = "--depth", paramLabel = "<n>", defaultValue = "" + StrategySettings.DEFAULT_DEPTH,
            description = "post* depth (default: ${DEFAULT-VALUE})")
    private int depth;

    @Option(names = "--read-report", paramLabel = "<file>",
            description = "Instead of translating, list the transitions a FAST run reported in this diagnostic output")
    private Path report;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            PetriNet net = new PnmlReader().read(input);
            if (silentOnly) {
                net = net.restrictTo(Transition::isSilent);
            }
            if (report != null) {
                return listReported(net, out);
            }

            StrategySettings settings;
            try {
                settings = StrategySettings.of(maxState, maxAcc, depth).withInitialRegion(initRegion);
            } catch (IllegalArgumentException e) {
                err.println("[ERROR] " + e.getMessage());
                err.flush();
                return CommandLine.ExitCode.USAGE;
            }

            String fast = new FastTranslator(settings).translate(net);
            if (output == null) {
                out.print(fast);
                out.flush();
            } else {
                Files.writeString(output, fast, StandardCharsets.UTF_8);
                logger.info("FAST 输出已写入 {}", output);
            }
            return CommandLine.ExitCode.OK;
        } catch (PnmlFormatException | IOException e) {
            logger.error("处理 {} 失败", input, e);
            err.println("[ERROR] " + input + ": " + e.getMessage());
            err.flush();
            return EXIT_INPUT_ERROR;
        }
    }

    private int listReported(PetriNet net, PrintWriter out) throws IOException {
        FastReport fastReport = FastReport.parse(Files.readString(report, StandardCharsets.UTF_8));
        List<List<Transition>> sequences = fastReport.resolve(net);
        for (List<Transition> sequence : sequences) {
            out.println(sequence.get(0).getName());
        }
        out.flush();
        return CommandLine.ExitCode.OK;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new Pnml2FastCommand()).execute(args));
    }
}
