package com.enterprise.querybook.example.pommr;

import com.enterprise.querybook.sql.book.InsertQueryBook;
import com.enterprise.querybook.sql.book.ReadQueryBook;
import com.enterprise.querybook.sql.book.SqlEntity;
import com.enterprise.querybook.sql.book.UpdateQueryBook;
import com.enterprise.querybook.sql.query.Query;

import java.util.UUID;

import static com.enterprise.querybook.sql.condition.Conditions.where;

public class CompanyQueryBook implements ReadQueryBook<Company>, InsertQueryBook<Company>,
        UpdateQueryBook<Company> {

    public static final String SOURCE = "pommr.company";

    @Override
    public String sqlSource() {
        return SOURCE;
    }

    @Override
    public SqlEntity<Company> entity() {
        return CompanyEntity.INSTANCE;
    }

    public Query selectById(UUID companyId) {
        return select(where("company_id = $?", companyId));
    }
}
