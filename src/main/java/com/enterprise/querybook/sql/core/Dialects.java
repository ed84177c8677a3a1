package com.enterprise.querybook.sql.core;

public final class Dialects {

    private Dialects() {}

    public static final SqlDialect POSTGRES = new SqlDialect() {
        @Override public String placeholder(int position) {
            return "$" + position;
        }
        @Override public boolean numberedPlaceholders() {
            return true;
        }
        @Override public String toString() {
            return "POSTGRES";
        }
    };

    // Plain JDBC drivers bind by occurrence order
    public static final SqlDialect JDBC = new SqlDialect() {
        @Override public String placeholder(int position) {
            return "?";
        }
        @Override public boolean numberedPlaceholders() {
            return false;
        }
        @Override public String toString() {
            return "JDBC";
        }
    };

}
