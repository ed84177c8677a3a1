package com.enterprise.querybook.sql.core;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered column shape of an entity or table. Single source of truth for
 * column names and declared SQL types; field order drives generated column
 * lists and the default {@link Projection}.
 *
 * <p>Example:
 * <pre>{@code
 * public static final Structure CONTACT = Structure.builder()
 *     .field("contact_id", "uuid")
 *     .field("name", "text")
 *     .field("company_id", "uuid")
 *     .build();
 *
 * CONTACT.columnList();   // "contact_id, name, company_id"
 * }</pre>
 *
 * <p>Immutable and safe to share between threads.
 */
public final class Structure {

    private final List<StructureField> fields;

    /**
     * @throws IllegalArgumentException if a field name repeats
     */
    public Structure(List<StructureField> fields) {
        Set<String> seen = new HashSet<>();
        for (StructureField field : fields) {
            if (!seen.add(field.name())) {
                throw new IllegalArgumentException(
                        "Duplicate field '" + field.name() + "' in structure");
            }
        }
        this.fields = List.copyOf(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<StructureField> fields() {
        return fields;
    }

    public Optional<StructureField> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public boolean contains(String name) {
        return field(name).isPresent();
    }

    public List<String> columnNames() {
        return fields.stream().map(StructureField::name).toList();
    }

    /** Comma-separated column names in declaration order, for INSERT column lists. */
    public String columnList() {
        return String.join(", ", columnNames());
    }

    public int size() {
        return fields.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Structure other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.stream()
                .map(f -> f.name() + " " + f.sqlType())
                .collect(Collectors.joining(", ", "(", ")"));
    }

    public static final class Builder {

        private final List<StructureField> fields = new ArrayList<>();

        private Builder() {}

        public Builder field(String name, String sqlType) {
            fields.add(new StructureField(name, sqlType));
            return this;
        }

        /** Composite column whose value is itself a row of {@code structure}. */
        public Builder nested(String name, String typeName, Structure structure) {
            fields.add(new StructureField(name, FieldType.nested(typeName, structure)));
            return this;
        }

        public Structure build() {
            return new Structure(fields);
        }
    }
}
