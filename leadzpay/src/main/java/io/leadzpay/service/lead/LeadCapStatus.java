package io.leadzpay.service.lead;

import io.leadzpay.domain.connection.LeadCaps;

import java.util.ArrayList;
import java.util.List;

/**
 * Cap usage for one connection at one moment.
 *
 * Remaining values are null for unlimited windows. canSubmit is false only when a cap is
 * reached and the terms ask to pause on cap.
 */
public record LeadCapStatus(
    Integer weeklyLimit,
    int weeklyUsed,
    Integer weeklyRemaining,
    boolean weeklyCapReached,

    Integer monthlyLimit,
    int monthlyUsed,
    Integer monthlyRemaining,
    boolean monthlyCapReached,

    boolean pauseWhenCapReached,
    boolean canSubmit,
    String message,     // null while under both caps
    String summary      // "3/5 weekly • 10/20 monthly" or "Unlimited"
) {
    public static final String UNLIMITED = "Unlimited";

    public static LeadCapStatus evaluate(LeadCaps caps, int weeklyUsed, int monthlyUsed) {
        if (caps == null) {
            return new LeadCapStatus(null, weeklyUsed, null, false, null, monthlyUsed, null, false,
                false, true, null, UNLIMITED);
        }

        Integer weeklyLimit = caps.weeklyLimit();
        Integer monthlyLimit = caps.monthlyLimit();

        boolean weeklyReached = weeklyLimit != null && weeklyUsed >= weeklyLimit;
        boolean monthlyReached = monthlyLimit != null && monthlyUsed >= monthlyLimit;

        Integer weeklyRemaining = weeklyLimit != null ? Math.max(0, weeklyLimit - weeklyUsed) : null;
        Integer monthlyRemaining = monthlyLimit != null ? Math.max(0, monthlyLimit - monthlyUsed) : null;

        String message = null;
        if (weeklyReached && monthlyReached) {
            message = "Both weekly and monthly lead caps have been reached";
        } else if (weeklyReached) {
            message = "Weekly lead cap reached (" + weeklyLimit + " leads). Resets Monday.";
        } else if (monthlyReached) {
            message = "Monthly lead cap reached (" + monthlyLimit + " leads). Resets next month.";
        }

        boolean canSubmit = !(caps.pauseWhenCapReached() && (weeklyReached || monthlyReached));

        return new LeadCapStatus(
            weeklyLimit, weeklyUsed, weeklyRemaining, weeklyReached,
            monthlyLimit, monthlyUsed, monthlyRemaining, monthlyReached,
            caps.pauseWhenCapReached(), canSubmit, message,
            summarize(weeklyLimit, weeklyUsed, monthlyLimit, monthlyUsed));
    }

    /**
     * Which window blocked a submission: weekly, monthly or both. Null when none did.
     */
    public String reachedWindow() {
        if (weeklyCapReached && monthlyCapReached) return "both";
        if (weeklyCapReached) return "weekly";
        if (monthlyCapReached) return "monthly";
        return null;
    }

    private static String summarize(Integer weeklyLimit, int weeklyUsed, Integer monthlyLimit, int monthlyUsed) {
        List<String> parts = new ArrayList<>();
        if (weeklyLimit != null) {
            parts.add(weeklyUsed + "/" + weeklyLimit + " weekly");
        }
        if (monthlyLimit != null) {
            parts.add(monthlyUsed + "/" + monthlyLimit + " monthly");
        }
        return parts.isEmpty() ? UNLIMITED : String.join(" • ", parts);
    }
}
