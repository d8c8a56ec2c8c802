package com.taxledger.costbasis.ledger;

import java.util.List;

/**
 * Outcome of consuming lots. Insufficient quantity is reported as a value: {@link Fatal} during live-year processing,
 * {@link ReplayInsufficient} while reconstructing history (which sends SOY seeding to its fallback path).
 */
public sealed interface LotConsumption<T> {

    static <T> LotConsumption<T> consumed(List<T> items) {
        return new Consumed<>(List.copyOf(items));
    }

    static <T> LotConsumption<T> insufficient(boolean replay, String reason) {
        return replay ? new ReplayInsufficient<>(reason) : new Fatal<>(reason);
    }

    default boolean isConsumed() {
        return this instanceof Consumed;
    }

    /** Items produced by a successful consumption; empty for failures. */
    List<T> items();

    /** Failure reason; null on success. */
    String reason();

    record Consumed<T>(List<T> items) implements LotConsumption<T> {
        @Override
        public String reason() {
            return null;
        }
    }

    record Fatal<T>(String reason) implements LotConsumption<T> {
        @Override
        public List<T> items() {
            return List.of();
        }
    }

    record ReplayInsufficient<T>(String reason) implements LotConsumption<T> {
        @Override
        public List<T> items() {
            return List.of();
        }
    }
}
