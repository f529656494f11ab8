package com.planmarshall.core.task;

import com.planmarshall.core.error.DependencyCycleException;
import com.planmarshall.core.error.ValidationException;
import com.planmarshall.core.model.Deliverable;
import com.planmarshall.core.model.Task;
import com.planmarshall.core.model.TaskOrigin;
import com.planmarshall.core.model.TaskStatus;
import com.planmarshall.core.model.TaskStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Expands deliverables into an ordered, dependency-respecting task list.
 * <p>
 * Deliverables are visited in topological order with ties broken by deliverable number. Each
 * deliverable yields one task per required profile, in profile order; its affected files become the
 * task's steps.
 */
@Service
public class TaskPlanner {

    private static final Logger log = LoggerFactory.getLogger(TaskPlanner.class);

    public List<Task> deriveTasks(List<Deliverable> deliverables) {
        return deriveTasks(deliverables, d -> null);
    }

    /**
     * @param deliverables     validated deliverables
     * @param executorResolver executor reference per deliverable, {@code null} to select by profile at run time
     * @return tasks numbered from 1 in creation order
     * @throws ValidationException      if a deliverable is malformed or references an unknown deliverable
     * @throws DependencyCycleException if deliverables depend on each other cyclically
     */
    public List<Task> deriveTasks(List<Deliverable> deliverables, Function<Deliverable, String> executorResolver) {
        validate(deliverables);
        List<Deliverable> ordered = topologicalOrder(deliverables);

        var tasks = new ArrayList<Task>();
        var tasksByDeliverable = new HashMap<Integer, List<Integer>>();
        int next = 1;
        for (var deliverable : ordered) {
            var prerequisites = new TreeSet<Integer>();
            for (int dep : deliverable.dependsOn()) {
                prerequisites.addAll(tasksByDeliverable.getOrDefault(dep, List.of()));
            }
            String executor = executorResolver.apply(deliverable);
            var steps = new ArrayList<TaskStep>();
            for (int i = 0; i < deliverable.affectedFiles().size(); i++) {
                steps.add(TaskStep.pending(i + 1, deliverable.affectedFiles().get(i)));
            }

            var created = new ArrayList<Integer>();
            Integer previous = null;
            for (String profile : deliverable.profiles()) {
                var dependsOn = new TreeSet<>(prerequisites);
                if (previous != null) dependsOn.add(previous);
                String title = deliverable.profiles().size() == 1
                        ? deliverable.title()
                        : deliverable.title() + " [" + profile + "]";
                tasks.add(new Task(next, title, deliverable.number(), TaskStatus.PENDING, profile,
                        deliverable.domain(), deliverable.changeType(), executor, steps, deliverable.skills(),
                        TaskOrigin.PLAN, List.of(), List.copyOf(dependsOn), null));
                created.add(next);
                previous = next;
                next++;
            }
            tasksByDeliverable.put(deliverable.number(), created);
            log.debug("Deliverable {} expanded into tasks {}", deliverable.number(), created);
        }
        log.info("Derived {} task(s) from {} deliverable(s)", tasks.size(), deliverables.size());
        return List.copyOf(tasks);
    }

    /**
     * Structural checks applied at outline time, before any task exists.
     */
    public void validate(List<Deliverable> deliverables) {
        if (deliverables == null || deliverables.isEmpty()) {
            throw new ValidationException("Outline produced no deliverables");
        }
        var numbers = new HashSet<Integer>();
        for (var d : deliverables) {
            if (d.number() < 1 || !numbers.add(d.number())) {
                throw new ValidationException("Deliverable number " + d.number() + " is invalid or duplicated");
            }
        }
        for (var d : deliverables) {
            String label = "Deliverable " + d.number();
            if (isBlank(d.title())) throw new ValidationException(label + " has no title");
            if (isBlank(d.domain())) throw new ValidationException(label + " has no domain");
            if (d.changeType() == null) throw new ValidationException(label + " has no change type");
            if (d.affectedFiles().isEmpty() || d.affectedFiles().stream().anyMatch(TaskPlanner::isBlank)) {
                throw new ValidationException(label + " must list at least one affected file");
            }
            if (d.profiles().isEmpty() || d.profiles().stream().anyMatch(TaskPlanner::isBlank)) {
                throw new ValidationException(label + " must require at least one profile");
            }
            if (new HashSet<>(d.profiles()).size() != d.profiles().size()) {
                throw new ValidationException(label + " lists a profile twice");
            }
            for (int dep : d.dependsOn()) {
                if (!numbers.contains(dep)) {
                    throw new ValidationException(label + " depends on unknown deliverable " + dep);
                }
            }
        }
    }

    /**
     * Kahn's algorithm over deliverable dependencies, lowest ready number first.
     */
    public List<Deliverable> topologicalOrder(List<Deliverable> deliverables) {
        Map<Integer, Deliverable> byNumber = new HashMap<>();
        Map<Integer, Integer> pending = new HashMap<>();
        Map<Integer, List<Integer>> dependents = new HashMap<>();
        for (var d : deliverables) {
            byNumber.put(d.number(), d);
            var deps = new HashSet<>(d.dependsOn());
            pending.put(d.number(), deps.size());
            for (int dep : deps) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(d.number());
            }
        }

        var ready = new PriorityQueue<Integer>();
        pending.forEach((number, count) -> {
            if (count == 0) ready.add(number);
        });
        var ordered = new ArrayList<Deliverable>();
        while (!ready.isEmpty()) {
            int number = ready.poll();
            ordered.add(byNumber.get(number));
            for (int dependent : dependents.getOrDefault(number, List.of())) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (ordered.size() != deliverables.size()) {
            throw new DependencyCycleException(cycleMembers(byNumber, pending));
        }
        return ordered;
    }

    /**
     * Narrows the unordered remainder to deliverables that are both depended on and depending within
     * it, which drops those merely downstream of a cycle.
     */
    private List<Integer> cycleMembers(Map<Integer, Deliverable> byNumber, Map<Integer, Integer> pending) {
        Set<Integer> remaining = new TreeSet<>();
        pending.forEach((number, count) -> {
            if (count > 0) remaining.add(number);
        });
        boolean changed = true;
        while (changed) {
            changed = false;
            for (var it = remaining.iterator(); it.hasNext(); ) {
                int candidate = it.next();
                boolean dependedOn = remaining.stream()
                        .anyMatch(other -> byNumber.get(other).dependsOn().contains(candidate));
                if (!dependedOn) {
                    it.remove();
                    changed = true;
                }
            }
        }
        return List.copyOf(remaining);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
