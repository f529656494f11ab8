package com.planmarshall.core.error;

import com.planmarshall.extension.Capability;

/**
 * Thrown by {@code ExtensionRegistry.resolve} when no handler is registered for a domain and capability.
 */
public class ExtensionNotFoundException extends PlanMarshallException {

    private final String domain;
    private final Capability capability;

    public ExtensionNotFoundException(String domain, Capability capability) {
        super("No " + capability + " extension registered for domain '" + domain + "'");
        this.domain = domain;
        this.capability = capability;
    }

    public String getDomain() {
        return domain;
    }

    public Capability getCapability() {
        return capability;
    }
}
