package com.enterprise.querybook.example.pommr;

import com.enterprise.querybook.sql.book.SqlEntity;
import com.enterprise.querybook.sql.core.Structure;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;

import static com.enterprise.querybook.sql.book.ResultColumns.required;

public final class CompanyEntity implements SqlEntity<Company> {

    public static final CompanyEntity INSTANCE = new CompanyEntity();

    public static final Structure STRUCTURE = Structure.builder()
            .field("company_id", "uuid")
            .field("name", "text")
            .field("default_address_id", "uuid")
            .build();

    private CompanyEntity() {}

    @Override
    public Structure structure() {
        return STRUCTURE;
    }

    @Override
    public Company hydrate(ResultSet row) throws SQLException {
        return new Company(
                required(row, "company_id", UUID.class),
                required(row, "name", String.class),
                required(row, "default_address_id", UUID.class));
    }
}
