package com.planmarshall.runner;

import com.planmarshall.core.model.ProjectContext;

import java.util.List;

/**
 * Scope of one 6-verify run.
 *
 * @param planId         plan being verified
 * @param iteration      verify run number, starting at 1
 * @param domains        plan domains
 * @param touchedModules modules touched by the plan's tasks, sorted
 * @param touchedFiles   files touched by the plan's tasks, sorted
 * @param context        project context
 */
public record VerificationRequest(
    String planId,
    int iteration,
    List<String> domains,
    List<String> touchedModules,
    List<String> touchedFiles,
    ProjectContext context
) {}
