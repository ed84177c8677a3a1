package com.enterprise.querybook.example.pommr;

import java.util.UUID;

public record Company(
    UUID companyId,
    String name,
    UUID defaultAddressId
) {}
