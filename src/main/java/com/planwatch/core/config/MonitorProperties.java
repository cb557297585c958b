package com.planwatch.core.config;

import com.planwatch.core.model.WorkflowOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds {@code planwatch.*} from application.yml / environment variables.
 * CLI flags on {@code planwatch run} take precedence over these values.
 */
@Component
@ConfigurationProperties(prefix = "planwatch")
public class MonitorProperties {

    private String backendUrl = "http://localhost:8001";
    private String wsUrl = "ws://localhost:8001";
    private String outputDir = ".";
    private Channel channel = new Channel();
    private Dispatch dispatch = new Dispatch();
    private Options options = new Options();

    public String getBackendUrl() { return backendUrl; }
    public void setBackendUrl(String backendUrl) { this.backendUrl = backendUrl; }
    public String getWsUrl() { return wsUrl; }
    public void setWsUrl(String wsUrl) { this.wsUrl = wsUrl; }
    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

    // -- Channel accessors (delegate to nested) --
    public long getPollIntervalMs() { return channel.pollIntervalMs; }
    public int getChannelConnectTimeoutSeconds() { return channel.connectTimeoutSeconds; }

    // -- Dispatch accessors (delegate to nested) --
    public int getDispatchConnectTimeoutSeconds() { return dispatch.connectTimeoutSeconds; }
    public int getRequestTimeoutSeconds() { return dispatch.requestTimeoutSeconds; }
    public String getTestType() { return dispatch.testType; }

    /**
     * Default workflow options forwarded to the engine when the CLI does not override them.
     */
    public WorkflowOptions defaultWorkflowOptions() {
        return new WorkflowOptions(
                options.includeRecon,
                options.includeSubdomains,
                options.testAuthentication,
                options.testApis,
                options.verboseLogging,
                options.captureAiReasoning,
                options.showThoughtProcess,
                options.maxInitialTests);
    }

    public Channel getChannel() { return channel; }
    public void setChannel(Channel channel) { this.channel = channel; }
    public Dispatch getDispatch() { return dispatch; }
    public void setDispatch(Dispatch dispatch) { this.dispatch = dispatch; }
    public Options getOptions() { return options; }
    public void setOptions(Options options) { this.options = options; }

    public static class Channel {
        private long pollIntervalMs = 1000;
        private int connectTimeoutSeconds = 10;

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
    }

    public static class Dispatch {
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 60;
        private String testType = "comprehensive";

        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
        public String getTestType() { return testType; }
        public void setTestType(String testType) { this.testType = testType; }
    }

    public static class Options {
        private boolean includeRecon = true;
        private boolean includeSubdomains = true;
        private boolean testAuthentication = true;
        private boolean testApis = true;
        private boolean verboseLogging = true;
        private boolean captureAiReasoning = true;
        private boolean showThoughtProcess = true;
        private int maxInitialTests = 5;

        public boolean isIncludeRecon() { return includeRecon; }
        public void setIncludeRecon(boolean includeRecon) { this.includeRecon = includeRecon; }
        public boolean isIncludeSubdomains() { return includeSubdomains; }
        public void setIncludeSubdomains(boolean includeSubdomains) { this.includeSubdomains = includeSubdomains; }
        public boolean isTestAuthentication() { return testAuthentication; }
        public void setTestAuthentication(boolean testAuthentication) { this.testAuthentication = testAuthentication; }
        public boolean isTestApis() { return testApis; }
        public void setTestApis(boolean testApis) { this.testApis = testApis; }
        public boolean isVerboseLogging() { return verboseLogging; }
        public void setVerboseLogging(boolean verboseLogging) { this.verboseLogging = verboseLogging; }
        public boolean isCaptureAiReasoning() { return captureAiReasoning; }
        public void setCaptureAiReasoning(boolean captureAiReasoning) { this.captureAiReasoning = captureAiReasoning; }
        public boolean isShowThoughtProcess() { return showThoughtProcess; }
        public void setShowThoughtProcess(boolean showThoughtProcess) { this.showThoughtProcess = showThoughtProcess; }
        public int getMaxInitialTests() { return maxInitialTests; }
        public void setMaxInitialTests(int maxInitialTests) { this.maxInitialTests = maxInitialTests; }
    }
}
