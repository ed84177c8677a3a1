package com.enterprise.querybook.spring;

import com.enterprise.querybook.sql.book.ReadQueryBook;
import com.enterprise.querybook.sql.condition.Condition;
import com.enterprise.querybook.sql.condition.Conditions;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fetches entities of one {@link ReadQueryBook} by condition.
 *
 * <pre>{@code
 * EntityProvider<Contact> contacts = new EntityProvider<>(executor, new ContactQueryBook());
 * List<Contact> ofCompany = contacts.fetch(where("company_id = $?", companyId));
 * }</pre>
 *
 * @param <T> entity type
 */
public class EntityProvider<T> {

    private final QueryExecutor executor;
    private final ReadQueryBook<T> book;

    public EntityProvider(QueryExecutor executor, ReadQueryBook<T> book) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.book = Objects.requireNonNull(book, "book");
    }

    public List<T> fetch(Condition condition) {
        return executor.fetch(book.select(condition), book.entity());
    }

    public List<T> fetchAll() {
        return fetch(Conditions.none());
    }

    public Optional<T> fetchOne(Condition condition) {
        return executor.fetchOne(book.select(condition), book.entity());
    }

    public ReadQueryBook<T> book() {
        return book;
    }
}
