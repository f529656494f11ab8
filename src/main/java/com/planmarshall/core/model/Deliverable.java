package com.planmarshall.core.model;

import java.util.List;

/**
 * A planned unit of change produced during 3-outline and expanded into tasks during 4-plan.
 *
 * @param number        plan-scoped number, starting at 1
 * @param title         short title
 * @param description   what the deliverable changes
 * @param changeType    kind of change
 * @param domain        domain whose extensions handle this deliverable
 * @param module        target module
 * @param affectedFiles files or targets the deliverable touches; each becomes a task step
 * @param profiles      capability profiles required, e.g. "implementation", "testing"; one task per profile
 * @param skills        skills the executing tasks need, in {@code bundle:skill} form
 * @param dependsOn     numbers of deliverables that must be completed first
 */
public record Deliverable(
    int number,
    String title,
    String description,
    ChangeType changeType,
    String domain,
    String module,
    List<String> affectedFiles,
    List<String> profiles,
    List<String> skills,
    List<Integer> dependsOn
) {

    public Deliverable {
        affectedFiles = affectedFiles == null ? List.of() : List.copyOf(affectedFiles);
        profiles = profiles == null ? List.of() : List.copyOf(profiles);
        skills = skills == null ? List.of() : List.copyOf(skills);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public Deliverable withNumbering(int newNumber, List<Integer> newDependsOn) {
        return new Deliverable(newNumber, title, description, changeType, domain, module,
                affectedFiles, profiles, skills, newDependsOn);
    }
}
