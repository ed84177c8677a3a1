package com.enterprise.querybook.sql.core;

import com.enterprise.querybook.sql.validation.SqlIdentifiers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps {@code {:name:}} source slots in projection or condition text to the
 * table alias used by a particular query, so one definition can be reused
 * under different aliases.
 *
 * <pre>{@code
 * SourceAliases aliases = SourceAliases.of("thing", "whatever");
 * aliases.apply("{:thing:}.thing_id = $?");   // "whatever.thing_id = $?"
 * }</pre>
 */
public final class SourceAliases {

    private static final SourceAliases NONE = new SourceAliases(Map.of());

    private final Map<String, String> aliases;

    private SourceAliases(Map<String, String> aliases) {
        this.aliases = aliases;
    }

    public static SourceAliases none() {
        return NONE;
    }

    public static SourceAliases of(String slot, String alias) {
        return none().with(slot, alias);
    }

    public SourceAliases with(String slot, String alias) {
        SqlIdentifiers.requireValid(slot, "source slot");
        SqlIdentifiers.requireValid(alias, "source alias");
        Map<String, String> copy = new LinkedHashMap<>(aliases);
        copy.put(slot, alias);
        return new SourceAliases(Collections.unmodifiableMap(copy));
    }

    /** Replaces every known {@code {:slot:}} in {@code text}; unknown slots are left untouched. */
    public String apply(String text) {
        String result = text;
        for (Map.Entry<String, String> entry : aliases.entrySet()) {
            result = result.replace("{:" + entry.getKey() + ":}", entry.getValue());
        }
        return result;
    }

    public Map<String, String> asMap() {
        return aliases;
    }
}
