package com.enterprise.querybook.example.pommr;

import com.enterprise.querybook.sql.book.ReadQueryBook;
import com.enterprise.querybook.sql.book.SqlEntity;
import com.enterprise.querybook.sql.query.Query;

import java.util.UUID;

import static com.enterprise.querybook.sql.condition.Conditions.where;

/**
 * Companies with their contact count. Reads from a join, so the select
 * definition is replaced and the contact table comes in through its own
 * {@code contact_source} variable.
 */
public class CompanyShortQueryBook implements ReadQueryBook<CompanyShort> {

    static final String SELECT_DEFINITION =
            "select {:projection:}\n"
            + "  from {:source:} as company\n"
            + "    left join {:contact_source:} as contact\n"
            + "      on company.company_id = contact.company_id\n"
            + "  where {:condition:}\n"
            + "  group by company.company_id, company.name";

    @Override
    public String sqlSource() {
        return CompanyQueryBook.SOURCE;
    }

    @Override
    public SqlEntity<CompanyShort> entity() {
        return CompanyShortEntity.INSTANCE;
    }

    @Override
    public String selectDefinition() {
        return SELECT_DEFINITION;
    }

    @Override
    public Query newQuery(String definition) {
        return ReadQueryBook.super.newQuery(definition)
                .setVariable("contact_source", ContactQueryBook.SOURCE);
    }

    public Query selectById(UUID companyId) {
        return select(where("company.company_id = $?", companyId));
    }
}
