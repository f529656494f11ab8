package com.planmarshall.core.task;

import com.planmarshall.core.model.ExecutionStrategy;
import com.planmarshall.core.model.Task;
import com.planmarshall.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the next wave of runnable tasks: pending tasks whose dependencies are all done, in task
 * number order, capped by the execution strategy.
 *
 * <p>Under PARALLEL two tasks with overlapping targets never share a wave; the higher-numbered one waits.
 */
@Service
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    /**
     * @param tasks       all tasks of the plan
     * @param strategy    SEQUENTIAL caps the wave at 1, PARALLEL at {@code maxParallel}
     * @param maxParallel maximum concurrent tasks
     * @return task numbers to dispatch; empty when nothing is runnable
     */
    public List<Integer> computeNextWave(List<Task> tasks, ExecutionStrategy strategy, int maxParallel) {
        int limit = strategy == ExecutionStrategy.SEQUENTIAL ? 1 : Math.max(1, maxParallel);

        Map<Integer, TaskStatus> status = new HashMap<>();
        tasks.forEach(t -> status.put(t.number(), t.status()));

        var wave = new ArrayList<Integer>();
        var claimedTargets = new HashSet<Path>();
        var deferred = new ArrayList<String>();

        for (var task : tasks.stream().sorted((a, b) -> Integer.compare(a.number(), b.number())).toList()) {
            if (wave.size() >= limit) break;
            if (!isRunnable(task)) continue;
            if (!task.dependsOn().stream().allMatch(dep -> status.get(dep) == TaskStatus.DONE)) {
                log.debug("  {} - deps unsatisfied: {}", task.displayId(), task.dependsOn());
                continue;
            }
            if (strategy == ExecutionStrategy.PARALLEL && hasFileOverlap(task, claimedTargets)) {
                deferred.add(task.displayId());
                continue;
            }
            wave.add(task.number());
            task.fileTargets().forEach(t -> claimedTargets.add(normalize(t)));
        }

        if (!deferred.isEmpty()) {
            log.info("Deferred {} to a later wave: targets overlap tasks already scheduled", deferred);
        }
        log.debug("Next wave: {} (strategy={}, limit={})", wave, strategy, limit);
        return wave;
    }

    /** In-progress tasks left behind by an interrupted run are dispatched again. */
    private boolean isRunnable(Task task) {
        return task.status() == TaskStatus.PENDING || task.status() == TaskStatus.IN_PROGRESS;
    }

    /**
     * A target conflicts with a claimed one when, after normalization, either path contains the other:
     * a module directory claims every file below it.
     */
    private boolean hasFileOverlap(Task task, Set<Path> claimed) {
        return task.fileTargets().stream()
                .map(TaskScheduler::normalize)
                .anyMatch(target -> claimed.stream().anyMatch(c -> {
                    boolean conflict = target.startsWith(c) || c.startsWith(target);
                    if (conflict) {
                        log.debug("{} target {} conflicts with {} already in the wave", task.displayId(), target, c);
                    }
                    return conflict;
                }));
    }

    static Path normalize(String target) {
        try {
            return Path.of(target).normalize();
        } catch (InvalidPathException e) {
            // Not a valid path on this file system, e.g. a build target; compare a sanitized form
            return Path.of(target.replaceAll("[^A-Za-z0-9._-]", "_"));
        }
    }
}
