package io.leadzpay.service.lead;

import io.leadzpay.domain.lead.Lead;

/**
 * Outcome of a lead submission. A reached cap is an expected outcome, not an error.
 *
 * @param lead      the stored lead; null when the cap was reached
 * @param capStatus cap usage after the submission (or at refusal)
 */
public record LeadSubmissionResult(
    boolean accepted,
    Lead lead,
    LeadCapStatus capStatus
) {
    public static LeadSubmissionResult accepted(Lead lead, LeadCapStatus capStatus) {
        return new LeadSubmissionResult(true, lead, capStatus);
    }

    public static LeadSubmissionResult capReached(LeadCapStatus capStatus) {
        return new LeadSubmissionResult(false, null, capStatus);
    }
}
