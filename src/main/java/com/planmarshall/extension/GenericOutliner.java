package com.planmarshall.extension;

import com.planmarshall.core.model.ChangeType;
import com.planmarshall.core.model.Deliverable;
import com.planmarshall.core.model.ModuleInfo;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Fallback outline for domains without an {@link Outliner}: one implementation deliverable covering
 * the domain's first module, or the project root when the domain has no module.
 */
@Component
public class GenericOutliner implements Outliner {

    public static final String DEFAULT_PROFILE = "implementation";

    @Override
    public List<Deliverable> outline(OutlineRequest request) {
        var module = request.context().modules().stream()
                .filter(m -> Objects.equals(m.domain(), request.domain()))
                .findFirst();
        String target = module.map(ModuleInfo::path)
                .filter(p -> p != null && !p.isBlank())
                .orElse(request.context().rootPath() == null ? "." : request.context().rootPath());
        ChangeType changeType = request.changeType() != null ? request.changeType() : ChangeType.FEATURE;

        return List.of(new Deliverable(1,
                request.request().title() + " (" + request.domain() + ")",
                request.request().description(),
                changeType,
                request.domain(),
                module.map(ModuleInfo::name).orElse(null),
                List.of(target),
                List.of(DEFAULT_PROFILE),
                List.of(),
                List.of()));
    }
}
