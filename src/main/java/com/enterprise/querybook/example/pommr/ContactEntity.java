package com.enterprise.querybook.example.pommr;

import com.enterprise.querybook.sql.book.SqlEntity;
import com.enterprise.querybook.sql.core.Structure;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;

import static com.enterprise.querybook.sql.book.ResultColumns.optional;
import static com.enterprise.querybook.sql.book.ResultColumns.required;

public final class ContactEntity implements SqlEntity<Contact> {

    public static final ContactEntity INSTANCE = new ContactEntity();

    public static final Structure STRUCTURE = Structure.builder()
            .field("contact_id", "uuid")
            .field("name", "text")
            .field("email", "text")
            .field("phone_number", "text")
            .field("company_id", "uuid")
            .build();

    private ContactEntity() {}

    @Override
    public Structure structure() {
        return STRUCTURE;
    }

    @Override
    public Contact hydrate(ResultSet row) throws SQLException {
        return new Contact(
                required(row, "contact_id", UUID.class),
                required(row, "name", String.class),
                optional(row, "email", String.class),
                optional(row, "phone_number", String.class),
                required(row, "company_id", UUID.class));
    }
}
