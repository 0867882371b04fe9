package com.jeeves.protocol;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves prompt text by key, rendered against a context of envelope values
 * ({@code raw_input}, {@code user_id}, {@code session_id} and every output by key).
 */
@FunctionalInterface
public interface PromptRegistry {

    /**
     * @return rendered prompt, or empty when no prompt is registered under the key
     */
    Optional<String> get(String key, Map<String, Object> context);

    /**
     * Registry over fixed templates; {@code {name}} placeholders are replaced by the string value
     * of the matching context entry and unknown placeholders are left as they are.
     */
    static PromptRegistry fromTemplates(Map<String, String> templates) {
        Map<String, String> copy = Map.copyOf(templates);
        return (key, context) -> {
            String template = copy.get(key);
            if (template == null) return Optional.empty();
            String rendered = template;
            for (Map.Entry<String, Object> e : context.entrySet()) {
                rendered = rendered.replace("{" + e.getKey() + "}", String.valueOf(e.getValue()));
            }
            return Optional.of(rendered);
        };
    }
}
