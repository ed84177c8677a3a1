package com.enterprise.querybook.sql.query;

import com.enterprise.querybook.sql.condition.Condition;
import com.enterprise.querybook.sql.core.Dialects;
import com.enterprise.querybook.sql.core.SqlDialect;
import com.enterprise.querybook.sql.param.ParameterBinder;
import com.enterprise.querybook.sql.validation.SqlIdentifiers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A SQL template with {@code {:name:}} variable slots and the ordered
 * parameters its placeholders bind to.
 *
 * <p>Variables are plain text substitutions (source, projection, structure,
 * a rendered condition...). Parameters are either written literally in the
 * template ({@link #addParameter(Object)} with {@code $1}, {@code $2}, ...) or
 * contributed by a condition through {@link #setCondition(String, Condition)},
 * which numbers the condition's placeholders after the parameters already
 * present:
 * <pre>{@code
 * Query query = new Query("select {:projection:} from {:source:} where {:condition:}")
 *     .setVariable("projection", CONTACT_PROJECTION.render())
 *     .setVariable("source", "pommr.contact")
 *     .setCondition("condition", where("company_id = $?", companyId));
 *
 * SqlResult result = query.render();
 * // select contact_id as contact_id, ... from pommr.contact where company_id = $1
 * }</pre>
 *
 * <p>When a variable renders to blank text and the template puts it right
 * after a {@code where} keyword, the keyword is dropped, so an empty condition
 * never leaves a dangling {@code where}.
 *
 * <p>{@link #render()} never mutates the query; rendering twice yields equal
 * results. Setting a variable twice keeps the last value.
 */
public class Query {

    private static final Pattern SLOT = Pattern.compile("\\{:([A-Za-z_][A-Za-z0-9_]*):\\}");

    private final String template;
    private final SqlDialect dialect;
    private final Map<String, String> variables = new LinkedHashMap<>();
    private final List<Object> parameters = new ArrayList<>();
    private boolean strictVariables;

    public Query(String template) {
        this(template, Dialects.POSTGRES);
    }

    public Query(String template, SqlDialect dialect) {
        this.template = Objects.requireNonNull(template, "template");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    // ==================== Variables ====================

    /** Sets the text substituted for every {@code {:name:}} slot. Overwrites. */
    public Query setVariable(String name, String value) {
        SqlIdentifiers.requireValid(name, "variable");
        Objects.requireNonNull(value, "value of variable " + name);
        variables.put(name, value);
        return this;
    }

    /**
     * Expands {@code condition} so its placeholders continue after the
     * parameters already bound, stores the text under {@code name} and
     * appends the condition's values.
     *
     * <p>The text is inserted without outer parentheses, which suits a slot
     * standing alone after {@code where}. When the slot sits next to other
     * operators ({@code kind = $1 and {:condition:}}), pass
     * {@link com.enterprise.querybook.sql.condition.Conditions#group(Condition)}
     * so a top-level {@code or} keeps its meaning.
     */
    public Query setCondition(String name, Condition condition) {
        ParameterBinder binder = new ParameterBinder(dialect, parameters.size());
        SqlResult expanded = condition.expand(binder);
        setVariable(name, expanded.sql());
        parameters.addAll(expanded.parameters());
        return this;
    }

    /**
     * Embeds an already-rendered fragment numbered from 1: its placeholders
     * are shifted past the parameters already bound.
     */
    public Query setFragment(String name, SqlResult fragment) {
        SqlResult shifted = fragment.shift(parameters.size());
        setVariable(name, shifted.sql());
        parameters.addAll(shifted.parameters());
        return this;
    }

    // ==================== Parameters ====================

    /** Appends one parameter whose placeholder is written in the template. */
    public Query addParameter(Object value) {
        parameters.add(value);
        return this;
    }

    /**
     * Appends a batch of parameters. Nothing is renumbered: the placeholders
     * for these values must already be written in the template at positions
     * following the existing parameters. To embed an expanded condition
     * numbered from 1, use {@link #setFragment(String, SqlResult)} (or
     * {@link #setCondition(String, Condition)}) instead of pairing
     * {@code setVariable} with this method.
     */
    public Query setParameters(List<?> values) {
        parameters.addAll(values);
        return this;
    }

    /** When on, rendering fails on variables the template never references. */
    public Query strictVariables(boolean strict) {
        this.strictVariables = strict;
        return this;
    }

    // ==================== Render ====================

    /**
     * Substitutes every slot and returns the final text with the parameters.
     *
     * @throws TemplateException if a slot has no value, or (strict mode) a
     *                           variable is never referenced
     */
    public SqlResult render() {
        Set<String> referenced = slotNames(template);
        for (String name : referenced) {
            if (!variables.containsKey(name)) {
                throw TemplateException.unresolvedVariable(name, template);
            }
        }
        if (strictVariables) {
            for (String name : variables.keySet()) {
                if (!referenced.contains(name)) {
                    throw TemplateException.unusedVariable(name);
                }
            }
        }

        String text = template;
        for (Map.Entry<String, String> variable : variables.entrySet()) {
            if (variable.getValue().isBlank()) {
                text = dropWhereKeyword(text, variable.getKey());
            }
        }

        Matcher m = SLOT.matcher(text);
        StringBuilder sql = new StringBuilder(text.length() + 64);
        while (m.find()) {
            m.appendReplacement(sql, Matcher.quoteReplacement(variables.get(m.group(1))));
        }
        m.appendTail(sql);
        return new SqlResult(sql.toString(), parameters, dialect);
    }

    private static String dropWhereKeyword(String text, String name) {
        return text.replaceAll("(?i)\\s*\\bwhere\\s*" + Pattern.quote("{:" + name + ":}"), "");
    }

    private static Set<String> slotNames(String text) {
        Set<String> names = new LinkedHashSet<>();
        Matcher m = SLOT.matcher(text);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    // ==================== Introspection ====================

    public String template() {
        return template;
    }

    public SqlDialect dialect() {
        return dialect;
    }

    public Map<String, String> getVariables() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public List<Object> getParameters() {
        return Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    /** The rendered SQL text. Throws like {@link #render()}. */
    @Override
    public String toString() {
        return render().sql();
    }
}
