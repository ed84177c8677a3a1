package com.enterprise.querybook.sql;

import com.enterprise.querybook.example.pommr.CompanyQueryBook;
import com.enterprise.querybook.example.pommr.CompanyShortQueryBook;
import com.enterprise.querybook.example.pommr.ContactQueryBook;
import com.enterprise.querybook.sql.query.Query;
import com.enterprise.querybook.sql.query.SqlResult;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static com.enterprise.querybook.sql.condition.Conditions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Statements built by the read/insert/update/delete query books.
 */
public class QueryBookTests {

    private static final UUID COMPANY_1_ID = UUID.fromString("a7b5f2c8-8816-4c40-86bf-64e066a8db7a");
    private static final UUID CONTACT_1_ID = UUID.fromString("529fb920-6df7-4637-8f7f-0878ee140a0f");

    private static final String CONTACT_PROJECTION = "contact_id as contact_id, name as name, "
            + "email as email, phone_number as phone_number, company_id as company_id";

    private final ContactQueryBook contacts = new ContactQueryBook();
    private final CompanyQueryBook companies = new CompanyQueryBook();

    // ==================== Select ====================

    @Test
    void testSelectByCompany() {
        SqlResult r = contacts.selectByCompany(COMPANY_1_ID).render();
        assertThat(r.sql()).isEqualTo(
                "select " + CONTACT_PROJECTION + " from pommr.contact where company_id = $1");
        assertThat(r.parameters()).containsExactly(COMPANY_1_ID);
    }

    @Test
    void testSelectAllHasNoWhere() {
        SqlResult r = companies.selectAll().render();
        assertThat(r.sql()).isEqualTo("select company_id as company_id, name as name, "
                + "default_address_id as default_address_id from pommr.company");
        assertThat(r.parameters()).isEmpty();
    }

    @Test
    void testSelectWithComposedCondition() {
        SqlResult r = contacts.select(
                where("company_id = $?", COMPANY_1_ID)
                        .and(where("email is not null").or(whereIfPresent("phone_number = $?", "+33661234567"))))
                .render();
        assertThat(r.sql()).endsWith(
                "where company_id = $1 and (email is not null or phone_number = $2)");
        assertThat(r.parameters()).containsExactly(COMPANY_1_ID, "+33661234567");
    }

    @Test
    void testCustomSelectDefinition() {
        Query query = new CompanyShortQueryBook().selectById(COMPANY_1_ID);
        assertThat(query.getParameters()).containsExactly(COMPANY_1_ID);
        assertThat(query.toString()).isEqualTo(
                "select company.company_id as company_id, company.name as name, "
                        + "count(contact.company_id) as contacts_nb\n"
                        + "  from pommr.company as company\n"
                        + "    left join pommr.contact as contact\n"
                        + "      on company.company_id = contact.company_id\n"
                        + "  where company.company_id = $1\n"
                        + "  group by company.company_id, company.name");
    }

    @Test
    void testCustomSelectDefinitionWithoutCondition() {
        String sql = new CompanyShortQueryBook().selectAll().toString();
        assertThat(sql).doesNotContain("where");
        assertThat(sql).endsWith("on company.company_id = contact.company_id\n"
                + "  group by company.company_id, company.name");
    }

    // ==================== Insert ====================

    @Test
    void testInsertFollowsStructureOrder() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("company_id", COMPANY_1_ID);
        values.put("name", "Jane Doe");
        SqlResult r = contacts.insert(values).render();
        assertThat(r.sql()).isEqualTo("insert into pommr.contact (name, company_id) values ($1, $2) "
                + "returning " + CONTACT_PROJECTION);
        assertThat(r.parameters()).containsExactly("Jane Doe", COMPANY_1_ID);
        r.verify();
    }

    @Test
    void testInsertRejectsUnknownColumn() {
        assertThatThrownBy(() -> contacts.insert(Map.of("age", 42)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("age")
                .hasMessageContaining("pommr.contact");
    }

    @Test
    void testInsertRejectsEmptyValues() {
        assertThatThrownBy(() -> contacts.insert(Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ==================== Update ====================

    @Test
    void testUpdateBindsAssignmentsBeforeCondition() {
        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put("email", "jane@first.fr");
        updates.put("phone_number", null);
        SqlResult r = contacts.update(updates, where("contact_id = $?", CONTACT_1_ID)).render();
        assertThat(r.sql()).isEqualTo("update pommr.contact set email = $1, phone_number = $2 "
                + "where contact_id = $3 returning " + CONTACT_PROJECTION);
        assertThat(r.parameters()).containsExactly("jane@first.fr", null, CONTACT_1_ID);
    }

    @Test
    void testUpdateRejectsUnknownColumn() {
        assertThatThrownBy(() -> contacts.update(Map.of("nope", 1), none()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope");
    }

    // ==================== Delete ====================

    @Test
    void testDeleteById() {
        SqlResult r = contacts.deleteById(CONTACT_1_ID).render();
        assertThat(r.sql()).isEqualTo(
                "delete from pommr.contact where contact_id = $1 returning " + CONTACT_PROJECTION);
        assertThat(r.parameters()).containsExactly(CONTACT_1_ID);
    }

    @Test
    void testBooksBuildFreshQueries() {
        Query first = contacts.deleteById(CONTACT_1_ID);
        Query second = contacts.deleteById(CONTACT_1_ID);
        assertThat(first).isNotSameAs(second);
        assertThat(first.render()).isEqualTo(second.render());
    }
}
