package de.bsommerfeld.upvision.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.upvision.app.config.AppModule;
import de.bsommerfeld.upvision.app.controller.BatchController;
import de.bsommerfeld.upvision.app.controller.BatchRequest;
import de.bsommerfeld.upvision.app.controller.InputSelection;
import de.bsommerfeld.upvision.app.report.EnvironmentReport;
import de.bsommerfeld.upvision.app.results.ResultPairing;
import de.bsommerfeld.upvision.app.selfcheck.FirstRunSelfCheck;
import de.bsommerfeld.upvision.app.view.ConsoleView;
import de.bsommerfeld.upvision.core.config.GlobalConfig;
import de.bsommerfeld.upvision.core.domain.BatchResult;
import de.bsommerfeld.upvision.core.domain.CheckpointInfo;
import de.bsommerfeld.upvision.core.util.StorageUtils;
import de.bsommerfeld.upvision.engine.checkpoint.CheckpointRegistry;
import de.bsommerfeld.upvision.engine.device.DeviceProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Command line entry point.
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>0: success, or nothing to do</li>
 * <li>1: the batch finished with failures, or the self-check failed</li>
 * <li>2: invalid arguments or the batch could not be started</li>
 * </ul>
 */
public final class AppMain {

    static {
        // logback.xml resolves its file appender against LOG_DIR
        Path logDir = StorageUtils.getLogsDir(StorageUtils.APP_NAME);
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toString());
        } catch (IOException e) {
            System.err.println("Failed to create log directory: " + logDir);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(AppMain.class);

    private AppMain() {
    }

    public static void main(String[] args) {
        System.exit(run(System.out, args));
    }

    static int run(PrintStream out, String... args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            out.println(CliOptions.USAGE);
            return 2;
        }
        if (options.help()) {
            out.println(CliOptions.USAGE);
            return 0;
        }

        Injector injector = Guice.createInjector(
                options.configFile() != null ? new AppModule(options.configFile()) : new AppModule());
        CheckpointRegistry registry = injector.getInstance(CheckpointRegistry.class);
        List<CheckpointInfo> checkpoints = registry.discover();

        if (options.envCheck()) {
            DeviceProbe probe = injector.getInstance(DeviceProbe.class);
            out.println(EnvironmentReport.describe(probe.probe(), checkpoints, registry.directory()));
            return 0;
        }
        if (options.listCheckpoints()) {
            checkpoints.forEach(c -> out.println(c.name() + "\tx" + c.scaleFactor() + "\t" + c.location()));
            return 0;
        }
        if (options.resultsDirectory() != null) {
            return printResults(out, options.resultsDirectory(), options.inputs());
        }

        BatchController controller = injector.getInstance(BatchController.class);
        injector.getInstance(ConsoleView.class);
        controller.startPolling();
        try {
            if (options.inputs().isEmpty()) {
                return runSelfCheck(out, injector, options);
            }
            return runBatch(out, injector, controller, options);
        } finally {
            controller.shutdown();
        }
    }

    private static int runSelfCheck(PrintStream out, Injector injector, CliOptions options) {
        if (options.skipSelfCheck()) {
            out.println(CliOptions.USAGE);
            return 0;
        }
        FirstRunSelfCheck selfCheck = injector.getInstance(FirstRunSelfCheck.class);
        if (!selfCheck.maybeStart()) {
            out.println(CliOptions.USAGE);
            return 0;
        }
        try {
            injector.getInstance(ApplicationLifecycle.class).awaitShutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        }
        return selfCheck.hasPassed() ? 0 : 1;
    }

    private static int runBatch(PrintStream out, Injector injector, BatchController controller,
            CliOptions options) {
        List<Path> items;
        try {
            items = InputSelection.expand(options.inputs());
        } catch (IOException e) {
            out.println("Cannot read inputs: " + e.getMessage());
            return 2;
        }
        if (items.isEmpty()) {
            out.println("No supported images among the given inputs.");
            return 2;
        }
        Path destination = options.output() != null
                ? options.output()
                : items.get(0).toAbsolutePath().getParent();

        CheckpointRegistry registry = injector.getInstance(CheckpointRegistry.class);
        DeviceProbe probe = injector.getInstance(DeviceProbe.class);
        String checkpoint = options.checkpoint() != null
                ? options.checkpoint()
                : registry.list().stream().findFirst().map(CheckpointInfo::name).orElse(null);
        if (injector.getInstance(GlobalConfig.class).isDebugMode()) {
            out.println(EnvironmentReport.describe(probe.probe(), registry.list(), registry.directory()));
        }
        out.println(EnvironmentReport.statusLine(probe.probe(), checkpoint));

        CompletableFuture<BatchResult> completion = new CompletableFuture<>();
        controller.addCompletionListener(completion::complete);
        if (!controller.start(new BatchRequest(items, destination, options.checkpoint(), options.device()))) {
            return 2;
        }
        try {
            BatchResult result = completion.get();
            return result.failed() == 0 ? 0 : 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println(controller.requestCancel());
            return 1;
        } catch (ExecutionException e) {
            LOG.error("Batch completion failed", e);
            return 1;
        }
    }

    private static int printResults(PrintStream out, Path directory, List<Path> originals) {
        List<Path> processed;
        try {
            processed = ResultPairing.listProcessed(directory);
        } catch (IOException e) {
            out.println("Cannot read " + directory + ": " + e.getMessage());
            return 2;
        }
        if (processed.isEmpty()) {
            out.println("No processed images found in " + directory);
            return 0;
        }
        for (Path file : processed) {
            Optional<Path> original = ResultPairing.findOriginal(file, originals);
            original.ifPresent(o -> out.println(file.getFileName() + "\t<- " + o));
        }
        return 0;
    }
}
