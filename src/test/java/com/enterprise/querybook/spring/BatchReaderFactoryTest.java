package com.enterprise.querybook.spring;

import com.enterprise.querybook.example.pommr.Contact;
import com.enterprise.querybook.example.pommr.ContactQueryBook;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.database.JdbcCursorItemReader;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.util.ArrayList;
import java.util.List;

import static com.enterprise.querybook.spring.PommrDatabase.*;
import static com.enterprise.querybook.sql.condition.Conditions.*;
import static org.assertj.core.api.Assertions.*;

class BatchReaderFactoryTest {

    private EmbeddedDatabase db;
    private BatchReaderFactory factory;
    private final ContactQueryBook contacts = new ContactQueryBook();

    @BeforeEach
    void setUp() {
        db = PommrDatabase.create();
        factory = new BatchReaderFactory(db);
        factory.setFetchSize(10);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    void streamsHydratedRows() throws Exception {
        assertThat(readAll(factory.cursorReader("allContacts", contacts.selectAll(), contacts.entity())))
                .extracting(Contact::contactId)
                .containsExactlyInAnyOrder(CONTACT_1_ID, CONTACT_2_ID);
    }

    @Test
    void bindsConditionParameters() throws Exception {
        JdbcCursorItemReader<Contact> reader = factory.cursorReader("companyContacts",
                contacts.select(where("company_id = $?", COMPANY_2_ID).and(where("email like $?", "%@second.com"))),
                contacts.entity());

        assertThat(reader.getSql()).endsWith("where company_id = ? and email like ?");
        assertThat(readAll(reader))
                .extracting(Contact::name)
                .containsExactly("Caroline Pagan");
    }

    @Test
    void rejectsUnverifiableQuery() {
        assertThatThrownBy(() -> factory.cursorReader("broken",
                contacts.selectAll().addParameter("dangling"), contacts.entity()))
                .isInstanceOf(IllegalStateException.class);
    }

    private static <T> List<T> readAll(JdbcCursorItemReader<T> reader) throws Exception {
        reader.afterPropertiesSet();
        reader.open(new ExecutionContext());
        try {
            List<T> items = new ArrayList<>();
            T item;
            while ((item = reader.read()) != null) {
                items.add(item);
            }
            return items;
        } finally {
            reader.close();
        }
    }
}
