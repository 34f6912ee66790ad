package com.heystive.guard.service.sandbox;

import com.heystive.guard.config.sandbox.SandboxProperties;
import com.heystive.guard.domain.SecurityEventType;
import com.heystive.guard.domain.SkillInvocationResult;
import com.heystive.guard.exception.SandboxExecutionException;
import com.heystive.guard.exception.SandboxExecutionExceptionBuilder;
import com.heystive.guard.exception.SandboxTimeoutException;
import com.heystive.guard.exception.SecurityViolationException;
import com.heystive.guard.service.metrics.SandboxMetricsPublisher;
import com.heystive.guard.service.security.SecurityEventLog;
import com.heystive.guard.service.security.SecurityContext;
import com.heystive.guard.util.LogSanitizer;
import com.heystive.guard.util.ProcessTimeouts;
import com.heystive.guard.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs skill executables in a constrained child process.
 *
 * <p>Protocol for one invocation:
 * <ol>
 *   <li>write the payload as JSON to an owner-only temp file</li>
 *   <li>append the file's path as the last argument</li>
 *   <li>validate the argument vector with {@link CommandValidator}</li>
 *   <li>spawn it directly (no shell) in the skill's directory when one exists</li>
 *   <li>wait up to the timeout, killing the process tree when it elapses</li>
 * </ol>
 *
 * <p>Exit 0 returns stdout. A non-zero exit raises {@link SandboxExecutionException} with
 * stderr (stdout when stderr is empty). The payload file is deleted on every path.
 */
@Component
public class SkillSandboxExecutor {

    private static final Logger LOG = LogManager.getLogger(SkillSandboxExecutor.class);

    private final ProcessFactory processFactory;
    private final CommandValidator validator;
    private final SecurityEventLog events;
    private final SandboxProperties properties;
    private final SandboxMetricsPublisher metrics;

    /**
     * State of one running child and its stream drains.
     */
    private record ProcessExecution(Process process, StreamGobbler stdout, StreamGobbler stderr) {
    }

    @Autowired
    public SkillSandboxExecutor(CommandValidator validator,
                                SecurityContext securityContext,
                                SandboxProperties properties,
                                SandboxMetricsPublisher metrics) {
        this(new DefaultProcessFactory(), validator, securityContext.events(), properties, metrics);
    }

    SkillSandboxExecutor(ProcessFactory processFactory,
                         CommandValidator validator,
                         SecurityEventLog events,
                         SandboxProperties properties,
                         SandboxMetricsPublisher metrics) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.events = Objects.requireNonNull(events, "events");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metrics = metrics != null ? metrics : SandboxMetricsPublisher.NOOP;
    }

    /**
     * Executes a skill command with a JSON payload.
     *
     * @param command executable and arguments, without the payload path
     * @param payload request data serialized for the skill
     * @param timeout maximum wall time; null selects the configured default
     * @param skillName skill the command belongs to
     * @return exit code 0 with the captured stdout
     * @throws SecurityViolationException if the command is rejected; nothing is spawned
     * @throws SandboxTimeoutException if the process outlives the timeout
     * @throws SandboxExecutionException on non-zero exit or I/O failure
     */
    public SkillInvocationResult execute(List<String> command,
                                         Map<String, ?> payload,
                                         Duration timeout,
                                         String skillName) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(skillName, "skillName");
        Duration effectiveTimeout = timeout != null && !timeout.isZero() && !timeout.isNegative()
                ? timeout
                : Duration.ofSeconds(properties.getDefaultTimeoutSeconds());

        long startTime = System.nanoTime();
        Path payloadFile = null;
        try {
            payloadFile = writePayload(payload);
            List<String> argv = new ArrayList<>(command);
            argv.add(payloadFile.toString());
            checkCommand(argv, skillName);

            ProcessExecution exec = startProcess(argv, skillName);
            awaitCompletion(exec, effectiveTimeout, skillName, startTime);
            return handleResult(exec, command, skillName, startTime);
        } catch (IOException e) {
            metrics.record(skillName, SandboxMetricsPublisher.FAILED, System.nanoTime() - startTime);
            events.record(SecurityEventType.SANDBOX_FAILED, Map.of(
                    "skill", skillName, "error", String.valueOf(e.getMessage())));
            throw SandboxExecutionExceptionBuilder.create("I/O failure: " + e.getMessage())
                    .skill(skillName)
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .cause(e)
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw SandboxExecutionExceptionBuilder.create("Interrupted while waiting for skill")
                    .skill(skillName)
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .cause(e)
                    .build();
        } finally {
            deletePayload(payloadFile);
        }
    }

    private void checkCommand(List<String> argv, String skillName) {
        try {
            validator.validate(argv);
        } catch (SecurityViolationException e) {
            events.record(SecurityEventType.COMMAND_REJECTED, Map.of(
                    "skill", skillName,
                    "reason", e.getMessage(),
                    "command", LogSanitizer.truncate(String.join(" ", argv), 200)));
            metrics.record(skillName, SandboxMetricsPublisher.REJECTED, 0);
            throw e;
        }
    }

    private ProcessExecution startProcess(List<String> argv, String skillName) throws IOException {
        Path workingDir = skillDirectory(skillName);
        Process process = processFactory.start(argv, workingDir);
        StreamGobbler out = StreamGobbler.start(process.getInputStream(), "skill-" + skillName + "-out",
                properties.getMaxStdoutBytes());
        StreamGobbler err = StreamGobbler.start(process.getErrorStream(), "skill-" + skillName + "-err",
                properties.getMaxStderrBytes());
        LOG.debug("Started skill {} (cwd={})", skillName, workingDir);
        return new ProcessExecution(process, out, err);
    }

    private void awaitCompletion(ProcessExecution exec, Duration timeout, String skillName, long startTime)
            throws InterruptedException {
        boolean finished;
        try {
            finished = exec.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            exec.process().destroyForcibly();
            throw e;
        }
        if (!finished) {
            destroyProcessTree(exec.process());
            exec.stdout().join(ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            exec.stderr().join(ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            metrics.record(skillName, SandboxMetricsPublisher.TIMEOUT, System.nanoTime() - startTime);
            events.record(SecurityEventType.SANDBOX_TIMEOUT, Map.of(
                    "skill", skillName,
                    "timeout_ms", String.valueOf(timeout.toMillis())));
            throw new SandboxTimeoutException(skillName, timeout);
        }
        exec.stdout().join(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        exec.stderr().join(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
    }

    private SkillInvocationResult handleResult(ProcessExecution exec, List<String> command,
                                               String skillName, long startTime) {
        int exitCode = exec.process().exitValue();
        long durationMs = TimeUtils.elapsedMillis(startTime);
        String stdout = exec.stdout().content();

        if (exitCode != 0) {
            String stderr = exec.stderr().content();
            String errorOutput = stderr.isEmpty() ? stdout : stderr;
            metrics.record(skillName, SandboxMetricsPublisher.FAILED, System.nanoTime() - startTime);
            events.record(SecurityEventType.SANDBOX_FAILED, Map.of(
                    "skill", skillName,
                    "exit_code", String.valueOf(exitCode)));
            throw SandboxExecutionExceptionBuilder.create("Non-zero exit: " + exitCode)
                    .skill(skillName)
                    .exitCode(exitCode)
                    .durationMs(durationMs)
                    .metadata("executable", command.get(0))
                    .errorOutput(LogSanitizer.truncate(errorOutput, properties.getErrorSnippetMaxChars()))
                    .build();
        }

        metrics.record(skillName, SandboxMetricsPublisher.COMPLETED, System.nanoTime() - startTime);
        events.record(SecurityEventType.SANDBOX_COMPLETED, Map.of(
                "skill", skillName,
                "duration_ms", String.valueOf(durationMs)));
        LOG.debug("Skill {} finished in {}ms, stdout size={}", skillName, durationMs, stdout.length());
        return new SkillInvocationResult(skillName, command, exitCode, stdout, durationMs);
    }

    private Path skillDirectory(String skillName) {
        Path dir = Path.of(properties.getSkillsDir()).resolve(skillName).normalize();
        return Files.isDirectory(dir) ? dir.toAbsolutePath() : null;
    }

    private static Path writePayload(Map<String, ?> payload) throws IOException {
        Path file;
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            file = Files.createTempFile("heystive_payload_", ".json",
                    PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
        } else {
            file = Files.createTempFile("heystive_payload_", ".json");
            file.toFile().setReadable(false, false);
            file.toFile().setReadable(true, true);
        }
        JSONObject json = payload == null ? new JSONObject() : new JSONObject(payload);
        Files.writeString(file, json.toString(), StandardCharsets.UTF_8);
        return file;
    }

    private static void deletePayload(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Failed to delete payload file {}: {}", file, e.toString());
        }
    }

    private static void destroyProcessTree(Process process) {
        try {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
        } catch (UnsupportedOperationException e) {
            LOG.debug("Process does not expose descendants: {}", e.toString());
        }
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        }
    }
}
