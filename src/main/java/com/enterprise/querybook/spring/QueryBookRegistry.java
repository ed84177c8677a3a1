package com.enterprise.querybook.spring;

import com.enterprise.querybook.sql.book.QueryBook;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named catalog of {@link QueryBook} instances, for code that picks its
 * source by logical name:
 * <pre>{@code
 * @Bean
 * public QueryBookRegistry queryBookRegistry() {
 *     QueryBookRegistry registry = new QueryBookRegistry();
 *     registry.register("contact", new ContactQueryBook());
 *     registry.register("company", new CompanyQueryBook());
 *     return registry;
 * }
 * }</pre>
 */
public class QueryBookRegistry {

    private final Map<String, QueryBook<?>> books = new LinkedHashMap<>();

    public QueryBookRegistry register(String name, QueryBook<?> book) {
        books.put(name, book);
        return this;
    }

    /**
     * @throws IllegalArgumentException if no book is registered under {@code name}
     */
    public QueryBook<?> get(String name) {
        QueryBook<?> book = books.get(name);
        if (book == null) {
            throw new IllegalArgumentException("No query book registered as '" + name
                    + "'. Registered books are [" + String.join(", ", books.keySet()) + "]");
        }
        return book;
    }

    /** Typed lookup; fails when the registered book is not an instance of {@code type}. */
    public <B> B get(String name, Class<B> type) {
        QueryBook<?> book = get(name);
        if (!type.isInstance(book)) {
            throw new IllegalArgumentException("Query book '" + name + "' is a "
                    + book.getClass().getSimpleName() + ", not a " + type.getSimpleName());
        }
        return type.cast(book);
    }

    public Map<String, QueryBook<?>> all() {
        return Collections.unmodifiableMap(books);
    }
}
