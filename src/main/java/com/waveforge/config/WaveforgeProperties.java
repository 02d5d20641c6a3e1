package com.waveforge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "waveforge")
public class WaveforgeProperties {

    private Tasks tasks = new Tasks();
    private Plan plan = new Plan();
    private Executor executor = new Executor();
    private Registry registry = new Registry();
    private Dispatch dispatch = new Dispatch();
    private Docker docker = new Docker();
    private Watchdog watchdog = new Watchdog();
    private Policy policy = new Policy();
    private Git git = new Git();

    public Tasks getTasks() { return tasks; }
    public void setTasks(Tasks tasks) { this.tasks = tasks; }
    public Plan getPlan() { return plan; }
    public void setPlan(Plan plan) { this.plan = plan; }
    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }
    public Registry getRegistry() { return registry; }
    public void setRegistry(Registry registry) { this.registry = registry; }
    public Dispatch getDispatch() { return dispatch; }
    public void setDispatch(Dispatch dispatch) { this.dispatch = dispatch; }
    public Docker getDocker() { return docker; }
    public void setDocker(Docker docker) { this.docker = docker; }
    public Watchdog getWatchdog() { return watchdog; }
    public void setWatchdog(Watchdog watchdog) { this.watchdog = watchdog; }
    public Policy getPolicy() { return policy; }
    public void setPolicy(Policy policy) { this.policy = policy; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }

    public static class Tasks {
        private String file = "tasks.md";

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }
    }

    public static class Plan {
        private String file = "execution_plan.json";
        private String phaseId = "default";

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }
        public String getPhaseId() { return phaseId; }
        public void setPhaseId(String phaseId) { this.phaseId = phaseId; }
    }

    public static class Executor {
        private int pollIntervalSeconds = 5;
        private int waveTimeoutSeconds = 7200;
        private String progressFile = "memory-bank/progress.md";

        public int getPollIntervalSeconds() { return pollIntervalSeconds; }
        public void setPollIntervalSeconds(int pollIntervalSeconds) { this.pollIntervalSeconds = pollIntervalSeconds; }
        public int getWaveTimeoutSeconds() { return waveTimeoutSeconds; }
        public void setWaveTimeoutSeconds(int waveTimeoutSeconds) { this.waveTimeoutSeconds = waveTimeoutSeconds; }
        public String getProgressFile() { return progressFile; }
        public void setProgressFile(String progressFile) { this.progressFile = progressFile; }

        public Duration pollInterval() { return Duration.ofSeconds(pollIntervalSeconds); }
        public Duration waveTimeout() { return Duration.ofSeconds(waveTimeoutSeconds); }
    }

    public static class Registry {
        private String path = ".claude/process_registry.json";
        private String namespace = "waveforge";

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) { this.namespace = namespace; }
    }

    /**
     * How workers are started. {@code handshake} spawns nothing; {@code native} runs {@link #command}
     * as a local process group; {@code docker} runs {@link #image} with {@link #command} as its arguments.
     */
    public static class Dispatch {
        private String mode = "handshake";
        private String command = "";
        private String image = "";
        private String memory = "512m";
        private String cpu = "1.0";
        private String logDir = ".waveforge/logs";

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public String getMemory() { return memory; }
        public void setMemory(String memory) { this.memory = memory; }
        public String getCpu() { return cpu; }
        public void setCpu(String cpu) { this.cpu = cpu; }
        public String getLogDir() { return logDir; }
        public void setLogDir(String logDir) { this.logDir = logDir; }
    }

    /**
     * Docker daemon connection, used by container dispatch and by the watchdog for container records
     * whatever the dispatch mode. An empty host falls back to {@code DOCKER_HOST}, then the local socket.
     */
    public static class Docker {
        private String host = "";
        private int connectTimeoutSeconds = 5;
        private int responseTimeoutSeconds = 30;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public int getResponseTimeoutSeconds() { return responseTimeoutSeconds; }
        public void setResponseTimeoutSeconds(int responseTimeoutSeconds) { this.responseTimeoutSeconds = responseTimeoutSeconds; }
    }

    public static class Watchdog {
        private int intervalSeconds = 300;
        private int inspectionTimeoutSeconds = 10;
        private int killGraceSeconds = 2;
        private int overrunThresholdMinutes = 15;

        public int getIntervalSeconds() { return intervalSeconds; }
        public void setIntervalSeconds(int intervalSeconds) { this.intervalSeconds = intervalSeconds; }
        public int getInspectionTimeoutSeconds() { return inspectionTimeoutSeconds; }
        public void setInspectionTimeoutSeconds(int inspectionTimeoutSeconds) { this.inspectionTimeoutSeconds = inspectionTimeoutSeconds; }
        public int getKillGraceSeconds() { return killGraceSeconds; }
        public void setKillGraceSeconds(int killGraceSeconds) { this.killGraceSeconds = killGraceSeconds; }
        public int getOverrunThresholdMinutes() { return overrunThresholdMinutes; }
        public void setOverrunThresholdMinutes(int overrunThresholdMinutes) { this.overrunThresholdMinutes = overrunThresholdMinutes; }
    }

    public static class Policy {
        /** Validator command line; empty disables validation. */
        private String command = "";

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
    }

    public static class Git {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
