package com.ciflow.definition;

import com.ciflow.core.RunContext;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.List;

/**
 * A trigger predicate: which event kinds, branches and changed paths start the pipeline.
 *
 * <p><b>Matching:</b></p>
 * <ul>
 *   <li>{@code event} must equal the run's trigger kind</li>
 *   <li>{@code branches}, when present, must contain a glob matching the run's branch</li>
 *   <li>{@code paths}, when present, must match at least one changed path</li>
 *   <li>{@code pathsIgnore}, when present, must not match every changed path</li>
 * </ul>
 * Path filters are ignored when the run carries no changed paths.
 */
public final class Trigger {
    private final String event;
    private final List<String> branches;
    private final List<String> paths;
    private final List<String> pathsIgnore;

    public Trigger(String event, List<String> branches, List<String> paths, List<String> pathsIgnore) {
        this.event = event;
        this.branches = List.copyOf(branches);
        this.paths = List.copyOf(paths);
        this.pathsIgnore = List.copyOf(pathsIgnore);
    }

    public static Trigger on(String event) {
        return new Trigger(event, List.of(), List.of(), List.of());
    }

    public boolean matches(RunContext context) {
        if (!event.equals(context.getTrigger())) {
            return false;
        }
        if (!branches.isEmpty()) {
            String branch = context.getBranch();
            if (branch == null || branches.stream().noneMatch(glob -> globMatches(glob, branch))) {
                return false;
            }
        }

        List<String> changed = context.getChangedPaths();
        if (changed.isEmpty()) {
            return true;
        }
        if (!paths.isEmpty()
                && changed.stream().noneMatch(path -> paths.stream().anyMatch(glob -> globMatches(glob, path)))) {
            return false;
        }
        if (!pathsIgnore.isEmpty()
                && changed.stream().allMatch(path -> pathsIgnore.stream().anyMatch(glob -> globMatches(glob, path)))) {
            return false;
        }
        return true;
    }

    static boolean globMatches(String glob, String value) {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        try {
            return matcher.matches(Paths.get(value));
        } catch (InvalidPathException e) {
            return false;
        }
    }

    public String getEvent() {
        return event;
    }

    public List<String> getBranches() {
        return branches;
    }

    public List<String> getPaths() {
        return paths;
    }

    public List<String> getPathsIgnore() {
        return pathsIgnore;
    }

    @Override
    public String toString() {
        return "Trigger{" + event + ", branches=" + branches + '}';
    }
}
