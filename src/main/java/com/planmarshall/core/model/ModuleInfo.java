package com.planmarshall.core.model;

/**
 * A module of the target project as described by the intake architecture metadata.
 */
public record ModuleInfo(String name, String domain, String path) {}
