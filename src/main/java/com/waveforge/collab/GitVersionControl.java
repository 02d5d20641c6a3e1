package com.waveforge.collab;

import com.waveforge.backend.BackendException;
import com.waveforge.backend.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Shells out to the {@code git} CLI via {@link ProcessBuilder} rather than depending on JGit.
 */
public class GitVersionControl implements VersionControl {

    private static final Logger log = LoggerFactory.getLogger(GitVersionControl.class);

    private static final Duration TIMEOUT = Duration.ofMinutes(2);

    private final Path repoDir;
    private final CommandRunner runner;

    public GitVersionControl(Path repoDir, CommandRunner runner) {
        this.repoDir = repoDir;
        this.runner = runner;
    }

    @Override
    public List<String> changedFiles() {
        var files = new LinkedHashSet<String>();
        var diff = git("diff", "--name-only", "HEAD");
        if (diff.succeeded()) {
            addLines(files, diff.stdout());
        } else {
            log.warn("git diff failed in {} (exit {}): {}", repoDir, diff.exitCode(), diff.stderr().strip());
        }
        var untracked = git("ls-files", "--others", "--exclude-standard");
        if (untracked.succeeded()) {
            addLines(files, untracked.stdout());
        }
        log.debug("{} changed file(s) in {}", files.size(), repoDir);
        return List.copyOf(files);
    }

    @Override
    public boolean commit(String message) {
        var add = git("add", "-A");
        if (!add.succeeded()) {
            throw new VersionControlException(
                    "git add failed (exit code %d): %s".formatted(add.exitCode(), add.stderr().strip()));
        }
        var commit = git("commit", "-m", message);
        if (commit.succeeded()) {
            log.info("Committed '{}'", message.lines().findFirst().orElse(message));
            return true;
        }
        if (commit.stdout().contains("nothing to commit") || commit.stderr().contains("nothing to commit")) {
            log.info("Nothing to commit for '{}'", message.lines().findFirst().orElse(message));
            return false;
        }
        throw new VersionControlException(
                "git commit failed (exit code %d): %s".formatted(commit.exitCode(), commit.stderr().strip()));
    }

    private CommandRunner.Result git(String... args) {
        var argv = new ArrayList<String>(args.length + 1);
        argv.add("git");
        argv.addAll(List.of(args));
        try {
            return runner.run(repoDir, TIMEOUT, argv);
        } catch (BackendException e) {
            throw new VersionControlException(e.getMessage(), e);
        }
    }

    private static void addLines(LinkedHashSet<String> target, String output) {
        output.lines().map(String::strip).filter(l -> !l.isEmpty()).forEach(target::add);
    }
}
