package com.taxledger.costbasis.ordering;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Comparator;

/**
 * Canonical processing position of an event: date first, then the same-day group, the broker transaction id,
 * kind-specific fields and finally the event id. Missing text fields are normalized to "" and a missing amount to 0.
 */
public record EventSortKey(
        LocalDate date,
        int group,
        String transactionId,
        String primary,
        String secondary,
        String tertiary,
        BigDecimal amount,
        String eventId
) implements Comparable<EventSortKey> {

    private static final Comparator<EventSortKey> ORDER = Comparator
            .comparing(EventSortKey::date)
            .thenComparingInt(EventSortKey::group)
            .thenComparing(EventSortKey::transactionId, EventSortKey::compareTransactionIds)
            .thenComparing(EventSortKey::primary)
            .thenComparing(EventSortKey::secondary)
            .thenComparing(EventSortKey::tertiary)
            .thenComparing(EventSortKey::amount)
            .thenComparing(EventSortKey::eventId);

    public EventSortKey {
        transactionId = transactionId != null ? transactionId : "";
        primary = primary != null ? primary : "";
        secondary = secondary != null ? secondary : "";
        tertiary = tertiary != null ? tertiary : "";
        amount = amount != null ? amount : BigDecimal.ZERO;
    }

    @Override
    public int compareTo(EventSortKey other) {
        return ORDER.compare(this, other);
    }

    /**
     * Broker ids are sequential numbers of varying length, so two all-digit ids compare numerically
     * ("999" before "1000"). Anything else compares as text.
     */
    static int compareTransactionIds(String left, String right) {
        if (isDigits(left) && isDigits(right)) {
            int byValue = new BigInteger(left).compareTo(new BigInteger(right));
            return byValue != 0 ? byValue : left.compareTo(right);
        }
        return left.compareTo(right);
    }

    private static boolean isDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) < '0' || value.charAt(i) > '9') {
                return false;
            }
        }
        return true;
    }
}
