package com.waveforge.config;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import com.waveforge.backend.CommandRunner;
import com.waveforge.backend.ContainerBackend;
import com.waveforge.backend.DockerContainerBackend;
import com.waveforge.backend.OsProcessBackend;
import com.waveforge.backend.ProcessBackend;
import com.waveforge.collab.CommandPolicyValidator;
import com.waveforge.collab.CompletionMarkerStore;
import com.waveforge.collab.ContainerTaskDispatcher;
import com.waveforge.collab.GitVersionControl;
import com.waveforge.collab.HandshakeTaskDispatcher;
import com.waveforge.collab.NativeTaskDispatcher;
import com.waveforge.collab.PermissivePolicyValidator;
import com.waveforge.collab.PolicyValidator;
import com.waveforge.collab.TaskDispatcher;
import com.waveforge.collab.TaskListCompletionMarkerStore;
import com.waveforge.collab.VersionControl;
import com.waveforge.core.engine.CheckpointService;
import com.waveforge.core.engine.ProgressLog;
import com.waveforge.core.engine.WaveExecutor;
import com.waveforge.core.events.EventBus;
import com.waveforge.core.metrics.WaveforgeMetrics;
import com.waveforge.core.parser.TaskParser;
import com.waveforge.registry.ProcessRegistry;
import com.waveforge.registry.RegistryLocator;
import com.waveforge.registry.ResourceLimits;
import com.waveforge.watchdog.Watchdog;
import com.waveforge.watchdog.WatchdogFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

@Configuration
public class WaveforgeConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public CommandRunner commandRunner() {
        return new CommandRunner();
    }

    /**
     * Built on first use: commands that never touch a container never connect to the daemon.
     */
    @Bean
    @Lazy
    public DockerClient dockerClient(WaveforgeProperties properties) {
        var docker = properties.getDocker();
        String dockerHost = docker.getHost() == null || docker.getHost().isBlank()
                ? System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET)
                : docker.getHost();
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .connectionTimeout(Duration.ofSeconds(docker.getConnectTimeoutSeconds()))
                .responseTimeout(Duration.ofSeconds(docker.getResponseTimeoutSeconds()))
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    /**
     * Registered whatever {@code waveforge.dispatch.mode} says, so the watchdog can always reconcile
     * container records, including ones added with {@code register --container}.
     */
    @Bean
    @Lazy
    public ContainerBackend containerBackend(@Lazy DockerClient dockerClient) {
        return new DockerContainerBackend(dockerClient);
    }

    @Bean
    public ProcessBackend processBackend(CommandRunner commandRunner) {
        return new OsProcessBackend(commandRunner);
    }

    @Bean
    public RegistryLocator registryLocator(WaveforgeProperties properties, Clock clock) {
        return new RegistryLocator(properties.getRegistry().getPath(), clock);
    }

    /**
     * Opened lazily so commands that never touch the registry do not validate its path.
     */
    @Bean
    @Lazy
    public ProcessRegistry processRegistry(RegistryLocator locator) {
        return locator.open(null);
    }

    @Bean
    @Lazy
    public TaskDispatcher taskDispatcher(WaveforgeProperties properties, ProcessBackend processBackend,
                                         @Lazy ContainerBackend containerBackend) {
        var dispatch = properties.getDispatch();
        Path workDir = workingDirectory();
        return switch (dispatch.getMode().toLowerCase(Locale.ROOT)) {
            case "handshake" -> new HandshakeTaskDispatcher();
            case "native" -> new NativeTaskDispatcher(processBackend, dispatch.getCommand(), workDir,
                    workDir.resolve(dispatch.getLogDir()));
            case "docker" -> new ContainerTaskDispatcher(containerBackend, dispatch.getImage(),
                    dispatch.getCommand(), workDir, new ResourceLimits(dispatch.getMemory(), dispatch.getCpu()));
            default -> throw new IllegalStateException("Unknown waveforge.dispatch.mode: " + dispatch.getMode());
        };
    }

    @Bean
    public CompletionMarkerStore completionMarkerStore(WaveforgeProperties properties, TaskParser parser) {
        return new TaskListCompletionMarkerStore(Path.of(properties.getTasks().getFile()), parser);
    }

    @Bean
    public PolicyValidator policyValidator(WaveforgeProperties properties, CommandRunner commandRunner) {
        String command = properties.getPolicy().getCommand();
        if (command == null || command.isBlank()) {
            return new PermissivePolicyValidator();
        }
        return new CommandPolicyValidator(List.of(command.strip().split("\\s+")), workingDirectory(), commandRunner);
    }

    @Bean
    public VersionControl versionControl(WaveforgeProperties properties, CommandRunner commandRunner) {
        if (!properties.getGit().isEnabled()) {
            return VersionControl.disabled();
        }
        return new GitVersionControl(workingDirectory(), commandRunner);
    }

    @Bean
    public ProgressLog progressLog(WaveforgeProperties properties) {
        return new ProgressLog(Path.of(properties.getExecutor().getProgressFile()));
    }

    @Bean
    public CheckpointService checkpointService(CompletionMarkerStore markers, ProgressLog progressLog,
                                               PolicyValidator policyValidator, VersionControl versionControl,
                                               WaveforgeMetrics metrics) {
        return new CheckpointService(markers, progressLog, policyValidator, versionControl, metrics);
    }

    @Bean
    @Lazy
    public WaveExecutor waveExecutor(TaskDispatcher dispatcher, CompletionMarkerStore markers,
                                     ProcessRegistry processRegistry, CheckpointService checkpointService,
                                     EventBus eventBus, WaveforgeMetrics metrics, WaveforgeProperties properties) {
        var executor = properties.getExecutor();
        var settings = new WaveExecutor.Settings(executor.pollInterval(), executor.waveTimeout(),
                properties.getRegistry().getNamespace());
        return new WaveExecutor(dispatcher, markers, processRegistry, checkpointService, eventBus, metrics, settings);
    }

    @Bean
    public WatchdogFactory watchdogFactory(ProcessBackend processBackend,
                                           @Lazy ContainerBackend containerBackend,
                                           EventBus eventBus, WaveforgeMetrics metrics,
                                           WaveforgeProperties properties, Clock clock) {
        var watchdog = properties.getWatchdog();
        var settings = new Watchdog.Settings(
                Duration.ofSeconds(watchdog.getIntervalSeconds()),
                Duration.ofSeconds(watchdog.getInspectionTimeoutSeconds()),
                Duration.ofSeconds(watchdog.getKillGraceSeconds()),
                Duration.ofMinutes(watchdog.getOverrunThresholdMinutes()));
        return new WatchdogFactory(processBackend, containerBackend, eventBus, metrics, settings,
                clock);
    }

    private static Path workingDirectory() {
        return Path.of("").toAbsolutePath();
    }
}
