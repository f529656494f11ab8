package com.planmarshall.extension;

/**
 * Marker for domain capability handlers resolved through the {@link ExtensionRegistry}.
 */
public interface Extension {
}
