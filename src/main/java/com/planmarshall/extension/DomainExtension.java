package com.planmarshall.extension;

import java.util.EnumMap;
import java.util.Map;

/**
 * What one domain bundle contributes to the registry. Each handler is optional.
 * Host applications register domains by declaring beans of this type.
 *
 * @param domain          domain key, e.g. "java"
 * @param outliner        outline handler or {@code null}
 * @param triager         triage handler or {@code null}
 * @param changeTypeAgent change-type agent or {@code null}
 */
public record DomainExtension(String domain, Outliner outliner, Triager triager, ChangeTypeAgent changeTypeAgent) {

    public static DomainExtension of(String domain) {
        return new DomainExtension(domain, null, null, null);
    }

    public DomainExtension withOutliner(Outliner handler) {
        return new DomainExtension(domain, handler, triager, changeTypeAgent);
    }

    public DomainExtension withTriager(Triager handler) {
        return new DomainExtension(domain, outliner, handler, changeTypeAgent);
    }

    public DomainExtension withChangeTypeAgent(ChangeTypeAgent handler) {
        return new DomainExtension(domain, outliner, triager, handler);
    }

    Map<Capability, Extension> handlers() {
        var handlers = new EnumMap<Capability, Extension>(Capability.class);
        if (outliner != null) handlers.put(Capability.OUTLINE, outliner);
        if (triager != null) handlers.put(Capability.TRIAGE, triager);
        if (changeTypeAgent != null) handlers.put(Capability.CHANGE_TYPE_AGENT, changeTypeAgent);
        return handlers;
    }
}
