package com.planmarshall.extension;

import com.planmarshall.core.error.ExtensionNotFoundException;
import com.planmarshall.core.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps {@code (domain, capability)} to a handler.
 * <p>
 * Built once from the {@link DomainExtension} beans and never modified afterwards, so one instance is
 * shared by every plan without locking. Lookups have no side effects apart from logging.
 */
@Component
public class ExtensionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExtensionRegistry.class);

    private final Map<String, Map<Capability, Extension>> handlers;

    public ExtensionRegistry(List<DomainExtension> extensions) {
        var byDomain = new TreeMap<String, Map<Capability, Extension>>();
        for (var extension : extensions) {
            if (extension.domain() == null || extension.domain().isBlank()) {
                throw new ValidationException("Domain extension without a domain key");
            }
            var target = byDomain.computeIfAbsent(extension.domain(), k -> new EnumMap<>(Capability.class));
            for (var entry : extension.handlers().entrySet()) {
                if (target.putIfAbsent(entry.getKey(), entry.getValue()) != null) {
                    throw new ValidationException("Domain '" + extension.domain() + "' registers "
                            + entry.getKey() + " twice");
                }
            }
        }
        var frozen = new TreeMap<String, Map<Capability, Extension>>();
        byDomain.forEach((domain, caps) -> frozen.put(domain, Collections.unmodifiableMap(new EnumMap<>(caps))));
        this.handlers = Collections.unmodifiableMap(frozen);
        log.info("Extension registry initialised with domains {}", describe());
    }

    public static ExtensionRegistry empty() {
        return new ExtensionRegistry(List.of());
    }

    /**
     * @throws ExtensionNotFoundException if the domain lacks the capability
     */
    public Extension resolve(String domain, Capability capability) {
        Extension handler = handlers.getOrDefault(domain, Map.of()).get(capability);
        if (handler == null) {
            throw new ExtensionNotFoundException(domain, capability);
        }
        return handler;
    }

    /**
     * Like {@link #resolve} but reports a missing handler as empty, logging that the caller falls back.
     */
    public Optional<Extension> find(String domain, Capability capability) {
        try {
            return Optional.of(resolve(domain, capability));
        } catch (ExtensionNotFoundException e) {
            log.info("{}; using generic handling", e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<Outliner> findOutliner(String domain) {
        return find(domain, Capability.OUTLINE).map(Outliner.class::cast);
    }

    public Optional<Triager> findTriager(String domain) {
        return find(domain, Capability.TRIAGE).map(Triager.class::cast);
    }

    public Optional<ChangeTypeAgent> findChangeTypeAgent(String domain) {
        return find(domain, Capability.CHANGE_TYPE_AGENT).map(ChangeTypeAgent.class::cast);
    }

    /** Registered domains, sorted. */
    public Set<String> domains() {
        return handlers.keySet();
    }

    public Set<Capability> capabilities(String domain) {
        return handlers.getOrDefault(domain, Map.of()).keySet();
    }

    private String describe() {
        var sb = new StringBuilder("{");
        handlers.forEach((domain, caps) -> {
            if (sb.length() > 1) sb.append(", ");
            sb.append(domain).append('=').append(caps.keySet());
        });
        return sb.append('}').toString();
    }
}
