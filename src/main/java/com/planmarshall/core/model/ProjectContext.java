package com.planmarshall.core.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Architecture metadata of the target project supplied at intake: its modules and the domains they belong to.
 */
public record ProjectContext(
    String rootPath,
    List<ModuleInfo> modules,
    List<String> domains
) {

    public ProjectContext {
        modules = modules == null ? List.of() : List.copyOf(modules);
        domains = domains == null ? List.of() : List.copyOf(domains);
    }

    public static ProjectContext empty() {
        return new ProjectContext(".", List.of(), List.of());
    }

    public Optional<ModuleInfo> module(String name) {
        if (name == null) return Optional.empty();
        return modules.stream().filter(m -> Objects.equals(m.name(), name)).findFirst();
    }

    /** Domains declared explicitly plus every module's domain, in declaration order without duplicates. */
    public List<String> allDomains() {
        var all = new LinkedHashSet<>(domains);
        for (var m : modules) {
            if (m.domain() != null && !m.domain().isBlank()) all.add(m.domain());
        }
        return List.copyOf(all);
    }
}
