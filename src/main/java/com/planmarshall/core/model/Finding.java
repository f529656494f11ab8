package com.planmarshall.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A defect or observation reported by a verification step or discovered during task execution.
 *
 * @param id          stable identifier; derived from the content when the producer leaves it blank
 * @param source      producing step, e.g. "quality", "build", "execute"
 * @param rule        rule or category, e.g. "java/unused-import"
 * @param file        file path, may be {@code null}
 * @param line        line number, may be {@code null}
 * @param severity    severity
 * @param message     free-text description
 * @param autoFixable whether the producer believes the finding can be fixed mechanically
 * @param domain      domain whose triage handler applies, may be {@code null}
 * @param module      module the finding belongs to, may be {@code null}
 */
public record Finding(
    String id,
    String source,
    String rule,
    String file,
    Integer line,
    Severity severity,
    String message,
    boolean autoFixable,
    String domain,
    String module
) {

    public Finding {
        severity = severity == null ? Severity.INFO : severity;
        if (id == null || id.isBlank()) {
            id = contentId(source, rule, file, line, message);
        }
    }

    public Finding withId(String newId) {
        return new Finding(newId, source, rule, file, line, severity, message, autoFixable, domain, module);
    }

    public Finding withDomain(String resolvedDomain) {
        return new Finding(id, source, rule, file, line, severity, message, autoFixable, resolvedDomain, module);
    }

    static String contentId(String source, String rule, String file, Integer line, String message) {
        String key = String.join("|",
                Objects.toString(source, ""), Objects.toString(rule, ""),
                Objects.toString(file, ""), Objects.toString(line, ""), Objects.toString(message, ""));
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            return "F-" + HexFormat.of().formatHex(digest).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
