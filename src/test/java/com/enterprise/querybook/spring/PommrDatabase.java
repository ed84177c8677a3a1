package com.enterprise.querybook.spring;

import com.enterprise.querybook.example.pommr.ContactQueryBook;

import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.util.UUID;

/**
 * In-memory H2 copy of the pommr schema with two companies and one contact each.
 */
final class PommrDatabase {

    static final UUID COMPANY_1_ID = UUID.fromString("a7b5f2c8-8816-4c40-86bf-64e066a8db7a");
    static final UUID COMPANY_2_ID = UUID.fromString("dcce1188-66ad-48a1-bb41-756a48514ac4");
    static final UUID CONTACT_1_ID = UUID.fromString("529fb920-6df7-4637-8f7f-0878ee140a0f");
    static final UUID CONTACT_2_ID = UUID.fromString("99c4996c-b5a7-42bf-af8a-2df326722566");

    private PommrDatabase() {}

    static EmbeddedDatabase create() {
        return new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .setScriptEncoding("UTF-8")
                .addScript("db/schema.sql")
                .addScript("db/data.sql")
                .build();
    }

    /** H2 has no {@code returning} clause: write statements without it. */
    static class H2ContactQueryBook extends ContactQueryBook {

        @Override
        public String insertDefinition() {
            return "insert into {:source:} ({:structure:}) values ({:values:})";
        }

        @Override
        public String updateDefinition() {
            return "update {:source:} set {:updates:} where {:condition:}";
        }

        @Override
        public String deleteDefinition() {
            return "delete from {:source:} where {:condition:}";
        }
    }
}
