package com.planmarshall.extension;

/**
 * Capabilities a domain may provide, each bound to its handler interface.
 */
public enum Capability {
    OUTLINE(Outliner.class),
    TRIAGE(Triager.class),
    CHANGE_TYPE_AGENT(ChangeTypeAgent.class);

    private final Class<? extends Extension> type;

    Capability(Class<? extends Extension> type) {
        this.type = type;
    }

    public Class<? extends Extension> type() {
        return type;
    }

    public boolean accepts(Extension handler) {
        return type.isInstance(handler);
    }
}
