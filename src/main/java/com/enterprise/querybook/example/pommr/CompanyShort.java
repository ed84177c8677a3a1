package com.enterprise.querybook.example.pommr;

import java.util.UUID;

/** Company summary with its number of contacts. */
public record CompanyShort(
    UUID companyId,
    String name,
    long contactsNb
) {}
