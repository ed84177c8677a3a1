package com.enterprise.querybook.spring;

import com.enterprise.querybook.example.pommr.CompanyQueryBook;
import com.enterprise.querybook.example.pommr.ContactQueryBook;
import com.enterprise.querybook.sql.book.DeleteQueryBook;
import com.enterprise.querybook.sql.book.ReadQueryBook;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class QueryBookRegistryTest {

    private final QueryBookRegistry registry = new QueryBookRegistry()
            .register("contact", new ContactQueryBook())
            .register("company", new CompanyQueryBook());

    @Test
    void looksUpByName() {
        assertThat(registry.get("company").sqlSource()).isEqualTo("pommr.company");
        assertThat(registry.all()).containsOnlyKeys("contact", "company");
    }

    @Test
    void unknownNameListsRegisteredBooks() {
        assertThatThrownBy(() -> registry.get("address"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'address'")
                .hasMessageContaining("[contact, company]");
    }

    @Test
    void typedLookupChecksCapabilities() {
        ReadQueryBook<?> read = registry.get("company", ReadQueryBook.class);
        assertThat(read.selectAll().toString()).startsWith("select ");

        assertThat(registry.get("contact", DeleteQueryBook.class)).isInstanceOf(ContactQueryBook.class);
        assertThatThrownBy(() -> registry.get("company", DeleteQueryBook.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a DeleteQueryBook");
    }
}
