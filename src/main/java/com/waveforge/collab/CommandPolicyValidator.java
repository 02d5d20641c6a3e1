package com.waveforge.collab;

import com.waveforge.backend.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs an external validator with the changed files as trailing arguments.
 *
 * <p>The validator reports one violation per stdout line in the form
 * {@code file:line:rule:message}; other lines are ignored. A non-zero exit without any
 * parsable violation is itself reported as a violation, so a broken validator blocks the commit.
 */
public class CommandPolicyValidator implements PolicyValidator {

    private static final Logger log = LoggerFactory.getLogger(CommandPolicyValidator.class);

    static final Pattern VIOLATION_LINE = Pattern.compile("^(.+?):(\\d+):([^:]+):\\s*(.*)$");

    private static final Duration TIMEOUT = Duration.ofMinutes(5);

    private final List<String> command;
    private final Path workDir;
    private final CommandRunner runner;

    public CommandPolicyValidator(List<String> command, Path workDir, CommandRunner runner) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Policy command must not be empty");
        }
        this.command = List.copyOf(command);
        this.workDir = workDir;
        this.runner = runner;
    }

    @Override
    public List<PolicyViolation> validate(List<String> files) {
        if (files.isEmpty()) {
            log.info("No changed files to validate");
            return List.of();
        }
        var argv = new ArrayList<>(command);
        argv.addAll(files);
        log.info("Validating {} file(s) with {}", files.size(), command.get(0));

        var result = runner.run(workDir, TIMEOUT, argv);
        List<PolicyViolation> violations = parse(result.stdout());
        if (violations.isEmpty() && !result.succeeded()) {
            String detail = result.stderr().isBlank() ? "exit code " + result.exitCode() : result.stderr().strip();
            return List.of(new PolicyViolation(command.get(0), 0, "validator-error", detail));
        }
        return violations;
    }

    static List<PolicyViolation> parse(String output) {
        var violations = new ArrayList<PolicyViolation>();
        for (String line : output.split("\n")) {
            Matcher m = VIOLATION_LINE.matcher(line.strip());
            if (m.matches()) {
                violations.add(new PolicyViolation(m.group(1), Integer.parseInt(m.group(2)),
                        m.group(3).strip(), m.group(4).strip()));
            }
        }
        return violations;
    }
}
