package com.planwatch.dispatch.cli;

import com.planwatch.core.config.MonitorProperties;
import com.planwatch.core.engine.MonitorEngine;
import com.planwatch.core.engine.MonitorResult;
import com.planwatch.core.engine.MonitorSupervisor;
import com.planwatch.core.engine.SessionConfig;
import com.planwatch.core.model.WorkflowOptions;
import com.planwatch.core.model.WorkflowRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: planwatch run [--target URL] ...
 * <p>
 * Dispatches one security test workflow to the engine and streams its reasoning,
 * plan and findings to the terminal until the workflow completes, the stream ends
 * or the operator presses Ctrl-C. A summary file is written in every case.
 */
@Command(name = "run", mixinStandardHelpOptions = true,
        description = "Dispatch a security test workflow and monitor it live")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    static final String DEFAULT_TARGET = "https://sweetspotgov.com";
    static final String DEFAULT_DESCRIPTION = "I want you to test against all subdomains and dir's. "
            + "Test all access, stuff like sql injection, sending JWT tokens, "
            + "catching any leaky api's stuff like this.";

    /** The command never reached the engine and no event was ever received. */
    static final int EXIT_DISPATCH_FAILED = 2;

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    @Spec
    private CommandSpec spec;

    @Option(names = {"--target", "-t"}, description = "Target host or URL (default: ${DEFAULT-VALUE})",
            defaultValue = DEFAULT_TARGET)
    private String target;

    @Option(names = {"--description", "-d"}, description = "Free-text test objective",
            defaultValue = DEFAULT_DESCRIPTION)
    private String description;

    @Option(names = {"--scope", "-s"}, description = "Path scope (default: ${DEFAULT-VALUE})",
            defaultValue = WorkflowRequest.DEFAULT_SCOPE)
    private String scope;

    @Option(names = "--backend", description = "Engine REST base URL (overrides planwatch.backend-url)")
    private String backendUrl;

    @Option(names = "--ws", description = "Engine event channel base URL (overrides planwatch.ws-url)")
    private String wsUrl;

    @Option(names = "--output-dir", description = "Directory for the summary file (overrides planwatch.output-dir)")
    private String outputDir;

    @Option(names = "--test-type", description = "Engine test profile (overrides planwatch.dispatch.test-type)")
    private String testType;

    @Option(names = "--max-initial-tests", description = "Upper bound on the engine's first batch of tests")
    private Integer maxInitialTests;

    @Option(names = "--no-recon", description = "Skip reconnaissance")
    private boolean noRecon;

    @Option(names = "--no-subdomains", description = "Do not enumerate subdomains")
    private boolean noSubdomains;

    @Option(names = "--no-auth-tests", description = "Skip authentication tests")
    private boolean noAuthTests;

    @Option(names = "--no-api-tests", description = "Skip API tests")
    private boolean noApiTests;

    private final MonitorEngine monitorEngine;
    private final MonitorProperties properties;

    public RunCommand(MonitorEngine monitorEngine, MonitorProperties properties) {
        this.monitorEngine = monitorEngine;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (target == null || target.isBlank()) {
            throw new ParameterException(spec.commandLine(), "--target must not be blank");
        }
        if (maxInitialTests != null && maxInitialTests < 0) {
            throw new ParameterException(spec.commandLine(), "--max-initial-tests must not be negative");
        }

        SessionConfig config;
        try {
            config = monitorEngine.sessionConfig(backendUrl, wsUrl, outputDir);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), "Invalid endpoint: " + e.getMessage());
        }
        WorkflowRequest request = monitorEngine.newRequest(target, description, scope, testType, workflowOptions());

        MonitorSupervisor supervisor = monitorEngine.prepare(request, config, new ConsoleRenderer(System.out));
        Thread shutdownHook = new Thread(() -> {
            supervisor.cancel();
            try {
                if (!supervisor.awaitFinished(SHUTDOWN_GRACE)) {
                    log.warn("Session {} did not finish within {}s of shutdown",
                            supervisor.session().correlationId(), SHUTDOWN_GRACE.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "planwatch-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        MonitorResult result;
        try {
            result = supervisor.run();
        } finally {
            removeHook(shutdownHook);
        }

        if (result.dispatchFailedBeforeListening()) {
            ConsoleOutput.error("Workflow was never dispatched and no events were received: "
                    + result.dispatchError().getMessage());
            return EXIT_DISPATCH_FAILED;
        }
        if (result.artifact() != null) {
            ConsoleOutput.success("Analysis saved to " + result.artifact());
        }
        return 0;
    }

    WorkflowOptions workflowOptions() {
        WorkflowOptions defaults = properties.defaultWorkflowOptions();
        return new WorkflowOptions(
                defaults.includeRecon() && !noRecon,
                defaults.includeSubdomains() && !noSubdomains,
                defaults.testAuthentication() && !noAuthTests,
                defaults.testApis() && !noApiTests,
                defaults.verboseLogging(),
                defaults.captureAiReasoning(),
                defaults.showThoughtProcess(),
                maxInitialTests != null ? maxInitialTests : defaults.maxInitialTests());
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook is running or has run
            log.debug("Shutdown in progress, leaving hook registered");
        }
    }
}
