package com.enterprise.querybook.sql.core;

import com.enterprise.querybook.sql.validation.SqlIdentifiers;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The named output columns a query selects to hydrate one entity type.
 *
 * <p>The default projection of a {@link Structure} selects every field as
 * itself, in structure order. Individual entries can then be redefined
 * (computed, renamed source, nested row) without changing their position:
 * <pre>{@code
 * Projection projection = Projection.defaultFor(COMPANY_SHORT, "company")
 *     .withDefinition("contacts_nb", "count(contact.company_id)");
 *
 * projection.render();
 * // company.company_id as company_id, company.name as name,
 * // count(contact.company_id) as contacts_nb
 * }</pre>
 *
 * <p>Under {@link Policy#STRICT} (the default for structure-derived
 * projections) redefining an undeclared alias fails with
 * {@link UnknownProjectionAliasException}; under {@link Policy#OPEN} it
 * appends a new entry. Instances are immutable, every modifier returns a copy.
 */
public final class Projection {

    public enum Policy { STRICT, OPEN }

    private final List<ProjectionField> fields;
    private final String sourceAlias;
    private final Policy policy;

    private Projection(List<ProjectionField> fields, String sourceAlias, Policy policy) {
        this.fields = List.copyOf(fields);
        this.sourceAlias = sourceAlias;
        this.policy = policy;
    }

    public static Projection defaultFor(Structure structure) {
        return defaultFor(structure, null);
    }

    /**
     * Self-projection of {@code structure}; when {@code sourceAlias} is given
     * each expression is qualified with it ({@code alias.column}).
     */
    public static Projection defaultFor(Structure structure, String sourceAlias) {
        if (sourceAlias != null) {
            SqlIdentifiers.requireValid(sourceAlias, "source alias");
        }
        List<ProjectionField> fields = new ArrayList<>();
        for (String name : structure.columnNames()) {
            String expression = sourceAlias == null ? name : sourceAlias + "." + name;
            fields.add(new ProjectionField(name, expression));
        }
        return new Projection(fields, sourceAlias, Policy.STRICT);
    }

    /** Empty projection that accepts any alias. */
    public static Projection open() {
        return new Projection(List.of(), null, Policy.OPEN);
    }

    /**
     * Replaces the expression bound to {@code alias}, keeping its position,
     * or appends a new entry when the policy is {@link Policy#OPEN}.
     *
     * @throws UnknownProjectionAliasException if the alias is unknown under {@link Policy#STRICT}
     */
    public Projection withDefinition(String alias, String expression) {
        SqlIdentifiers.requireValid(alias, "projection alias");
        Objects.requireNonNull(expression, "expression");
        List<ProjectionField> copy = new ArrayList<>(fields);
        for (int i = 0; i < copy.size(); i++) {
            if (copy.get(i).alias().equals(alias)) {
                copy.set(i, new ProjectionField(alias, expression));
                return new Projection(copy, sourceAlias, policy);
            }
        }
        if (policy == Policy.STRICT) {
            throw new UnknownProjectionAliasException(alias, aliases());
        }
        copy.add(new ProjectionField(alias, expression));
        return new Projection(copy, sourceAlias, policy);
    }

    /**
     * Gives the entry {@code alias} a new output name, keeping its expression
     * and position.
     *
     * @throws UnknownProjectionAliasException if {@code alias} is not declared
     * @throws IllegalArgumentException        if {@code newAlias} is already taken
     */
    public Projection renamed(String alias, String newAlias) {
        SqlIdentifiers.requireValid(newAlias, "projection alias");
        if (!alias.equals(newAlias) && aliases().contains(newAlias)) {
            throw new IllegalArgumentException("Projection alias '" + newAlias + "' is already used");
        }
        List<ProjectionField> copy = new ArrayList<>(fields);
        for (int i = 0; i < copy.size(); i++) {
            if (copy.get(i).alias().equals(alias)) {
                copy.set(i, new ProjectionField(newAlias, copy.get(i).expression()));
                return new Projection(copy, sourceAlias, policy);
            }
        }
        throw new UnknownProjectionAliasException(alias, aliases());
    }

    public Projection withPolicy(Policy newPolicy) {
        return new Projection(fields, sourceAlias, Objects.requireNonNull(newPolicy));
    }

    /** {@code expr as alias, expr as alias, ...} in entry order. */
    public String render() {
        return fields.stream()
                .map(ProjectionField::render)
                .collect(Collectors.joining(", "));
    }

    /** Renders and resolves {@code {:slot:}} source aliases in the expressions. */
    public String render(SourceAliases aliases) {
        return aliases.apply(render());
    }

    public List<ProjectionField> fields() {
        return fields;
    }

    public List<String> aliases() {
        return fields.stream().map(ProjectionField::alias).toList();
    }

    public String sourceAlias() {
        return sourceAlias;
    }

    public Policy policy() {
        return policy;
    }

    @Override
    public String toString() {
        return render();
    }
}
