package com.enterprise.querybook.example.pommr;

import com.enterprise.querybook.sql.book.HydrationException;
import com.enterprise.querybook.sql.book.SqlEntity;
import com.enterprise.querybook.sql.core.Projection;
import com.enterprise.querybook.sql.core.Structure;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;

import static com.enterprise.querybook.sql.book.ResultColumns.required;

/**
 * Aggregate view over {@code company} joined with {@code contact}. Columns are
 * qualified with the {@code company} alias; {@code contacts_nb} is computed.
 */
public final class CompanyShortEntity implements SqlEntity<CompanyShort> {

    public static final CompanyShortEntity INSTANCE = new CompanyShortEntity();

    public static final Structure STRUCTURE = Structure.builder()
            .field("company_id", "uuid")
            .field("name", "text")
            .field("contacts_nb", "integer")
            .build();

    private static final Projection PROJECTION = Projection.defaultFor(STRUCTURE, "company")
            .withDefinition("contacts_nb", "count(contact.company_id)");

    private CompanyShortEntity() {}

    @Override
    public Structure structure() {
        return STRUCTURE;
    }

    @Override
    public Projection projection() {
        return PROJECTION;
    }

    @Override
    public CompanyShort hydrate(ResultSet row) throws SQLException {
        long contactsNb = required(row, "contacts_nb", Long.class);
        if (contactsNb < 0) {
            throw HydrationException.invalidData("contacts_nb", contactsNb);
        }
        return new CompanyShort(
                required(row, "company_id", UUID.class),
                required(row, "name", String.class),
                contactsNb);
    }
}
