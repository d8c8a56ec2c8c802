package com.taxledger.costbasis.engine;

import com.taxledger.domain.OptionRight;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Premiums of exercised or assigned options, waiting for the stock trade that the exercise or assignment produced.
 * Keyed by the option lifecycle event id. One instance per run.
 */
public class PendingOptionAdjustments {

    /** {@code totalPremiumEur} is always positive: premium paid (exercise) or received (assignment). */
    public record Adjustment(UUID optionEventId, UUID optionAssetId, OptionRight right, BigDecimal totalPremiumEur) {
    }

    private final Map<UUID, Adjustment> byOptionEvent = new HashMap<>();

    public void store(Adjustment adjustment) {
        byOptionEvent.put(adjustment.optionEventId(), adjustment);
    }

    public Optional<Adjustment> find(UUID optionEventId) {
        return Optional.ofNullable(byOptionEvent.get(optionEventId));
    }

    public void remove(UUID optionEventId) {
        byOptionEvent.remove(optionEventId);
    }

    public int size() {
        return byOptionEvent.size();
    }
}
