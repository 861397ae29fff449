package com.largomodo.monitorlayout;

import com.largomodo.monitorlayout.core.LayoutObserver;
import com.largomodo.monitorlayout.core.MonitorLayoutManager;
import com.largomodo.monitorlayout.core.domain.MonitorRecord;
import com.largomodo.monitorlayout.core.head.Head;
import com.largomodo.monitorlayout.core.head.ReconciliationResult;
import com.largomodo.monitorlayout.core.layout.LayoutValidator;
import com.largomodo.monitorlayout.core.layout.ScalingConfig;
import com.largomodo.monitorlayout.service.DisplayLoop;
import com.largomodo.monitorlayout.service.InMemoryOutputManager;
import com.largomodo.monitorlayout.service.TopologyDispatcher;
import com.largomodo.monitorlayout.util.TopologyFileReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CLI entry point for replaying client monitor topologies through the layout engine.
 * <p>
 * Each TOPOLOGY file is one client report. Files are read up front (a bad
 * file fails the run before anything is applied), then handed to the display
 * loop in order, exactly as a transport thread would hand them over. Once all
 * of them have been applied the resulting heads are printed.
 */
@Command(
        name = "monitorlayout",
        mixinStandardHelpOptions = true,
        resourceBundle = "monitorlayout.monitorlayout",
        version = "${bundle:application.version}",
        header = "Applies remote-desktop monitor topologies and prints the resulting display layout.",
        description = {
                "Validates each client monitor topology, computes where every monitor lands in the" +
                        " compositor's coordinate space and reconciles the set of display heads with it.",
                "",
                "Topology files hold one monitor per line: x,y,width,height[,primary][,key=value...]"
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:General execution error (I/O, rejected topology, etc.)",
                "2:Invalid command line arguments"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "Project home: ${bundle:application.url}"
        }
)
public class MonitorLayoutCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MonitorLayoutCli.class);

    @Parameters(arity = "1..*", paramLabel = "TOPOLOGY",
            description = "Topology files, applied in the order given.")
    List<File> topologyFiles;

    @Option(names = "--hi-dpi", description = "Scale monitors by the client's desktop scale factor.")
    boolean hiDpi;

    @Option(names = "--debug-scale", paramLabel = "<percent>", defaultValue = "0",
            description = {
                    "Force this scale on every monitor (implies --hi-dpi).",
                    "Default: ${DEFAULT-VALUE} (off)"
            })
    int debugScale;

    @Option(names = "--fractional", description = "Keep fractional client scales (implies --hi-dpi).")
    boolean fractional;

    @Option(names = "--fractional-roundup",
            description = "Round client scales to the nearest integer (implies --hi-dpi).")
    boolean fractionalRoundup;

    @Option(names = "--dump", description = "Log a full head dump after the last topology.")
    boolean dump;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MonitorLayoutCli()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Resolve command line switches to the backend scaling configuration.
     */
    ScalingConfig scalingConfig() {
        if (debugScale < 0) {
            throw new ParameterException(spec.commandLine(),
                    "--debug-scale must not be negative: " + debugScale);
        }
        boolean enabled = hiDpi || debugScale != 0 || fractional || fractionalRoundup;
        return new ScalingConfig(enabled, debugScale, fractional, fractionalRoundup);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        ScalingConfig config = scalingConfig();

        for (File file : topologyFiles) {
            if (!file.isFile()) {
                throw new ParameterException(spec.commandLine(),
                        "Topology file does not exist: " + file.getAbsolutePath());
            }
            if (!file.canRead()) {
                throw new ParameterException(spec.commandLine(),
                        "Topology file is not readable (check permissions): " + file.getAbsolutePath());
            }
        }

        // Read everything first: a malformed file fails the run before any layout is applied
        List<List<MonitorRecord>> topologies = new ArrayList<>();
        for (File file : topologyFiles) {
            topologies.add(TopologyFileReader.read(file.toPath()));
        }

        final AtomicInteger failCount = new AtomicInteger(0);
        LayoutObserver observer = new LayoutObserver() {
            @Override
            public void onSuccess(long sequence, ReconciliationResult result) {
                if (result.scalingDegraded()) {
                    log.warn("Topology #{} ({}): scaling was turned off for this placement",
                            sequence, topologyFiles.get((int) sequence - 1).getName());
                }
            }

            @Override
            public void onFailure(long sequence, Exception e) {
                failCount.incrementAndGet();
                log.error("FAILED: topology #{} ({}) - {}",
                        sequence, topologyFiles.get((int) sequence - 1).getName(), e.getMessage());
            }
        };

        PrintWriter out = spec.commandLine().getOut();
        try (DisplayLoop loop = new DisplayLoop("compositor")) {
            InMemoryOutputManager outputs = new InMemoryOutputManager(loop, LayoutValidator.MAX_MONITORS);
            MonitorLayoutManager manager = new MonitorLayoutManager(config, outputs);
            outputs.setOutputEnabledListener(manager::outputEnabled);
            TopologyDispatcher dispatcher = new TopologyDispatcher(loop, manager, observer);

            for (List<MonitorRecord> topology : topologies) {
                dispatcher.submit(topology);
            }

            // First barrier: every topology change has run and queued its output bindings.
            // The report then runs after those bindings.
            loop.submit(() -> null).get();
            String report = loop.submit(() -> describe(manager)).get();
            out.print(report);
            out.flush();
        }

        if (failCount.get() > 0) {
            log.error("{} of {} topologies failed", failCount.get(), topologies.size());
            return 1;
        }
        log.info("Applied {} topologies", topologies.size());
        return 0;
    }

    private String describe(MonitorLayoutManager manager) {
        if (dump) {
            manager.dumpHeads();
        }
        StringBuilder sb = new StringBuilder();
        for (Head head : manager.heads()) {
            sb.append(head.getName())
                    .append(head.isPrimary() ? " primary" : "")
                    .append(" client ").append(head.getDescriptor().clientRect())
                    .append(" local ").append(head.getDescriptor().localRect())
                    .append(" scale ").append(head.getDescriptor().outputScale())
                    .append(System.lineSeparator());
        }
        sb.append("client extents ").append(manager.boundingClientExtents()).append(System.lineSeparator());
        sb.append("local extents ").append(manager.boundingLocalExtents()).append(System.lineSeparator());
        return sb.toString();
    }
}
