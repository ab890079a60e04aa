package io.leadzpay.domain.lead;

/**
 * Customer contact details captured by the provider.
 */
public record CustomerContact(
    String name,
    String email,
    String phone,
    String state     // optional, two-letter code
) {}
