package com.enterprise.querybook.example.pommr;

import com.enterprise.querybook.sql.book.DeleteQueryBook;
import com.enterprise.querybook.sql.book.InsertQueryBook;
import com.enterprise.querybook.sql.book.ReadQueryBook;
import com.enterprise.querybook.sql.book.SqlEntity;
import com.enterprise.querybook.sql.book.UpdateQueryBook;
import com.enterprise.querybook.sql.query.Query;

import java.util.UUID;

import static com.enterprise.querybook.sql.condition.Conditions.where;

public class ContactQueryBook implements ReadQueryBook<Contact>, InsertQueryBook<Contact>,
        UpdateQueryBook<Contact>, DeleteQueryBook<Contact> {

    public static final String SOURCE = "pommr.contact";

    @Override
    public String sqlSource() {
        return SOURCE;
    }

    @Override
    public SqlEntity<Contact> entity() {
        return ContactEntity.INSTANCE;
    }

    public Query selectByCompany(UUID companyId) {
        return select(where("company_id = $?", companyId));
    }

    public Query deleteById(UUID contactId) {
        return delete(where("contact_id = $?", contactId));
    }
}
