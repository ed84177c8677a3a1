package com.enterprise.querybook.sql.core;

import java.util.Objects;

/**
 * Declared type of a {@link StructureField}: either a scalar SQL type or a
 * composite row type whose own shape is a {@link Structure}.
 */
public interface FieldType {

    /** SQL type name as declared in the database, e.g. {@code uuid} or {@code pommr.company}. */
    String sqlType();

    static FieldType scalar(String sqlType) {
        return new Scalar(sqlType);
    }

    static FieldType nested(String typeName, Structure structure) {
        return new Nested(typeName, structure);
    }

    record Scalar(String sqlType) implements FieldType {
        public Scalar {
            Objects.requireNonNull(sqlType, "sqlType");
        }
    }

    record Nested(String sqlType, Structure structure) implements FieldType {
        public Nested {
            Objects.requireNonNull(sqlType, "sqlType");
            Objects.requireNonNull(structure, "structure");
        }
    }
}
