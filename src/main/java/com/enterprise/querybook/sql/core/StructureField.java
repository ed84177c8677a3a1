package com.enterprise.querybook.sql.core;

import com.enterprise.querybook.sql.validation.SqlIdentifiers;

import java.util.Objects;

public record StructureField(String name, FieldType type) {

    public StructureField {
        SqlIdentifiers.requireValid(name, "field");
        Objects.requireNonNull(type, "type");
    }

    public StructureField(String name, String sqlType) {
        this(name, FieldType.scalar(sqlType));
    }

    public String sqlType() {
        return type.sqlType();
    }

    public boolean isNested() {
        return type instanceof FieldType.Nested;
    }
}
