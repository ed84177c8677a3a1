package com.enterprise.querybook.example.pommr;

import java.util.UUID;

/** A person working for a {@link Company}. Email and phone number are optional. */
public record Contact(
    UUID contactId,
    String name,
    String email,
    String phoneNumber,
    UUID companyId
) {}
