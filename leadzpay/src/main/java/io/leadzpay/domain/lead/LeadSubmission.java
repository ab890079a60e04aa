package io.leadzpay.domain.lead;

/**
 * Provider input for a new lead.
 */
public record LeadSubmission(
    CustomerContact customer,
    String carModel,
    QuoteType quoteType,
    SelectedQuote selectedQuote   // optional
) {}
