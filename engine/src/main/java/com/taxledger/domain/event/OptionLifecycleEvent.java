package com.taxledger.domain.event;

import java.math.BigDecimal;

/**
 * Exercise, assignment or worthless expiration of an option position.
 */
public sealed interface OptionLifecycleEvent extends FinancialEvent
        permits OptionExerciseEvent, OptionAssignmentEvent, OptionExpirationEvent {

    /** Number of contracts affected (positive). */
    BigDecimal quantityContracts();
}
