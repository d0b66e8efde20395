package org.learningjava.macrohub.domain.model.keycommands;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One step of a macro: the command name plus its parameters in document order
 * (usually just {@code Category}).
 */
public record SubCommand(
        String name,
        Map<String, String> parameters
) {

    public SubCommand {
        Objects.requireNonNull(name, "name");
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public SubCommand(String name) {
        this(name, Map.of());
    }

    public String parameter(String key) {
        return parameters.get(key);
    }
}
