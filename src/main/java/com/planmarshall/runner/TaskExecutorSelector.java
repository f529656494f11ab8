package com.planmarshall.runner;

import com.planmarshall.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the executor for a task: the one named by {@code Task.executor()}, else the first executor
 * (by id) declaring the task's profile, else the first accepting any profile.
 */
@Component
public class TaskExecutorSelector {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutorSelector.class);

    private final List<TaskExecutor> executors;

    public TaskExecutorSelector(List<TaskExecutor> executors) {
        this.executors = executors.stream().sorted(Comparator.comparing(TaskExecutor::id)).toList();
    }

    public Optional<TaskExecutor> select(Task task) {
        if (task.executor() != null) {
            var named = executors.stream().filter(e -> e.id().equals(task.executor())).findFirst();
            if (named.isPresent()) {
                return named;
            }
            log.warn("{} names unknown executor '{}'; selecting by profile {}",
                    task.displayId(), task.executor(), task.profile());
        }
        var byProfile = executors.stream().filter(e -> e.profiles().contains(task.profile())).findFirst();
        if (byProfile.isPresent()) {
            return byProfile;
        }
        return executors.stream().filter(e -> e.profiles().isEmpty()).findFirst();
    }
}
