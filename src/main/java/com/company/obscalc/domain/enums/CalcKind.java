package com.company.obscalc.domain.enums;

/**
 * The derived results maintained by this service. Each kind has its own table
 * with an identical layout.
 */
public enum CalcKind {
    OBSCALC("obscalc"),
    TELLURIC("telluric_resolution");

    private final String tableName;

    CalcKind(String tableName) {
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
