package com.wptsync.orchestrator.vcs;

import com.wptsync.orchestrator.command.CommandResult;
import com.wptsync.orchestrator.command.CommandRunner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * {@link GitWorkTree} backed by the {@code git} command line.
 *
 * The CLI is used rather than a Java git library because the sync depends on
 * worktrees and on {@code git am --directory}, neither of which a library
 * implementation offers.
 */
public class CliGitWorkTree implements GitWorkTree {

    private final Path          path;
    private final CommandRunner runner;

    public CliGitWorkTree(Path path, CommandRunner runner) {
        this.path   = path;
        this.runner = runner;
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public void fetch(String remote, String refspec, boolean tags) {
        List<String> args = new ArrayList<>(List.of("fetch", tags ? "--tags" : "--no-tags", remote));
        if (refspec != null) {
            args.add(refspec);
        }
        git(args.toArray(String[]::new));
    }

    @Override
    public void merge(String ref) {
        git("merge", "--no-edit", ref);
    }

    @Override
    public void resetHard(String ref) {
        git("reset", "--hard", ref);
    }

    @Override
    public void resetTo(String ref) {
        git("reset", ref);
    }

    @Override
    public void abortApply() {
        Path rebaseApply = path.resolve(git("rev-parse", "--git-path", "rebase-apply").strip());
        if (Files.isDirectory(rebaseApply)) {
            git("am", "--abort");
        }
    }

    @Override
    public String renderPatch(String commitId) {
        return git("show", "--pretty=email", commitId) + "\n";
    }

    @Override
    public CommandResult applyPatch(String patch, String directoryPrefix) {
        return runner.run(path, List.of("git", "am", "--directory=" + directoryPrefix, "-"), patch);
    }

    @Override
    public void add(String pathspec) {
        git("add", "--", pathspec);
    }

    @Override
    public boolean isDirty() {
        return !git("status", "--porcelain").isBlank();
    }

    @Override
    public void commit(String message) {
        git("commit", "-m", message);
    }

    @Override
    public void commitAllowEmpty(String message) {
        git("commit", "--allow-empty", "-m", message);
    }

    @Override
    public CommandResult push(String remote) {
        CommandResult result = runner.run(path, List.of("git", "push", remote));
        if (!result.success()) {
            throw new VcsException("push " + remote, result);
        }
        return result;
    }

    @Override
    public void checkout(String branch) {
        git("checkout", branch);
    }

    @Override
    public String currentTip() {
        return git("rev-parse", "HEAD").strip();
    }

    @Override
    public String activeBranch() {
        return git("rev-parse", "--abbrev-ref", "HEAD").strip();
    }

    @Override
    public List<String> commitsBetween(String baseRef, String headRef) {
        return git("rev-list", "--reverse", baseRef + ".." + headRef).lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
    }

    @Override
    public Optional<String> branchTip(String branch) {
        CommandResult result = runner.run(path,
                List.of("git", "rev-parse", "--verify", "--quiet", "refs/heads/" + branch));
        return result.success() ? Optional.of(result.stdout().strip()) : Optional.empty();
    }

    @Override
    public void addWorktree(Path worktreePath, String branch, String startRef) {
        // Drop registrations of worktrees whose directories are gone so an
        // existing branch can be checked out again.
        git("worktree", "prune");
        if (branchTip(branch).isPresent()) {
            git("worktree", "add", worktreePath.toString(), branch);
        } else {
            git("worktree", "add", "-b", branch, worktreePath.toString(), startRef);
        }
    }

    @Override
    public void removeWorktree(Path worktreePath) {
        git("worktree", "remove", "--force", worktreePath.toString());
    }

    private String git(String... args) {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add("git");
        command.addAll(Arrays.asList(args));
        CommandResult result = runner.run(path, command);
        if (!result.success()) {
            throw new VcsException(String.join(" ", args), result);
        }
        return result.stdout();
    }
}
