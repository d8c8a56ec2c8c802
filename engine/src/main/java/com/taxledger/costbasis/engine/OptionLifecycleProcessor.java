package com.taxledger.costbasis.engine;

import com.taxledger.common.NumericContext;
import com.taxledger.domain.Asset;
import com.taxledger.domain.AssetCategory;
import com.taxledger.domain.RealizationType;
import com.taxledger.domain.RealizedGainLoss;
import com.taxledger.domain.event.OptionAssignmentEvent;
import com.taxledger.domain.event.OptionExerciseEvent;
import com.taxledger.domain.event.OptionExpirationEvent;
import com.taxledger.domain.event.OptionLifecycleEvent;
import com.taxledger.costbasis.ledger.ConsumedLotDetail;
import com.taxledger.costbasis.ledger.FifoLedger;
import com.taxledger.costbasis.ledger.LotConsumption;
import com.taxledger.costbasis.ledger.RealizationRecordFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Exercise, assignment and worthless expiration of option contracts.
 * <p>
 * Exercise and assignment close option lots without a realization of their own: the premium is parked in
 * {@link PendingOptionAdjustments} and moves into the cost or proceeds of the resulting stock trade.
 * Worthless expiration realizes the full premium as a Termingeschäft loss (long) or gain (short).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OptionLifecycleProcessor {

    private final NumericContext numeric;

    public void exercise(OptionExerciseEvent event, FifoLedger ledger, Asset option, PendingOptionAdjustments pending) {
        if (!isUsableOption(event, option)) {
            return;
        }
        LotConsumption<ConsumedLotDetail> consumed = ledger.consumeLongOptionLots(contracts(event));
        storePremium(event, option, consumed, pending);
    }

    public void assign(OptionAssignmentEvent event, FifoLedger ledger, Asset option, PendingOptionAdjustments pending) {
        if (!isUsableOption(event, option)) {
            return;
        }
        LotConsumption<ConsumedLotDetail> consumed = ledger.consumeShortOptionLots(contracts(event));
        storePremium(event, option, consumed, pending);
    }

    /**
     * Long lots are tried first, then short lots. When neither side holds enough contracts nothing is realized.
     */
    public List<RealizedGainLoss> expire(OptionExpirationEvent event, FifoLedger ledger) {
        if (ledger.getCategory() != AssetCategory.OPTION) {
            log.error("Expiration {} refers to {} asset {}; skipped", event.eventId(), ledger.getCategory(), ledger.getAssetId());
            return List.of();
        }
        BigDecimal contracts = contracts(event);
        BigDecimal availableLong = ledger.longQuantity();
        BigDecimal availableShort = ledger.shortQuantity();
        boolean longSide;
        LotConsumption<ConsumedLotDetail> consumed;
        if (availableLong.compareTo(contracts) >= 0) {
            longSide = true;
            consumed = ledger.consumeLongOptionLots(contracts);
        } else if (availableShort.compareTo(contracts) >= 0) {
            longSide = false;
            consumed = ledger.consumeShortOptionLots(contracts);
        } else {
            log.error("Expiration {} of option {}: cannot tell long from short (long {}, short {}, expiring {}); no record created",
                    event.eventId(), ledger.getAssetId(), availableLong, availableShort, contracts);
            return List.of();
        }
        if (!consumed.isConsumed()) {
            log.error("Expiration {}: {}", event.eventId(), consumed.reason());
            return List.of();
        }

        RealizationRecordFactory factory = ledger.getRecordFactory();
        List<RealizedGainLoss> records = new ArrayList<>();
        for (ConsumedLotDetail detail : consumed.items()) {
            BigDecimal unitCost = longSide ? detail.valuePerUnitEur() : BigDecimal.ZERO;
            BigDecimal unitValue = longSide ? BigDecimal.ZERO : detail.valuePerUnitEur();
            records.add(factory.create(event.eventId(), detail.lotDate(), event.eventDate(),
                    longSide ? RealizationType.OPTION_EXPIRED_LONG : RealizationType.OPTION_EXPIRED_SHORT,
                    detail.quantity(), unitCost, unitValue,
                    numeric.multiply(detail.quantity(), unitCost), numeric.multiply(detail.quantity(), unitValue),
                    !longSide));
        }
        log.info("Expiration {} of option {} realized {} {} slice(s)", event.eventId(), ledger.getAssetId(),
                records.size(), longSide ? "long" : "short");
        return records;
    }

    private boolean isUsableOption(OptionLifecycleEvent event, Asset option) {
        if (option.category() != AssetCategory.OPTION) {
            log.error("{} {} refers to {} asset {}; skipped", event.type(), event.eventId(), option.category(), option.displayName());
            return false;
        }
        if (option.underlyingAssetId() == null) {
            String message = "Option " + option.displayName() + " has no underlying; cannot process " + event.type() + " " + event.eventId();
            log.error(message);
            throw new CalculationException(CalculationException.INVALID_OPTION_LINK, message);
        }
        if (option.optionRight() == null) {
            log.error("Option {} has no call/put right; {} {} skipped", option.displayName(), event.type(), event.eventId());
            return false;
        }
        return true;
    }

    private void storePremium(OptionLifecycleEvent event, Asset option, LotConsumption<ConsumedLotDetail> consumed,
                              PendingOptionAdjustments pending) {
        if (!consumed.isConsumed()) {
            String message = event.type() + " " + event.eventId() + ": " + consumed.reason();
            log.error(message);
            throw new CalculationException(CalculationException.INSUFFICIENT_LOTS, message);
        }
        BigDecimal premium = BigDecimal.ZERO;
        for (ConsumedLotDetail detail : consumed.items()) {
            premium = numeric.add(premium, numeric.multiply(detail.quantity(), detail.valuePerUnitEur()));
        }
        pending.store(new PendingOptionAdjustments.Adjustment(event.eventId(), option.id(), option.optionRight(), premium));
        log.info("{} {} of {} {}: premium {} EUR pending for the linked stock trade",
                event.type(), event.eventId(), option.optionRight(), option.displayName(), premium);
    }

    private static BigDecimal contracts(OptionLifecycleEvent event) {
        BigDecimal contracts = event.quantityContracts();
        return contracts != null ? contracts.abs() : BigDecimal.ZERO;
    }
}
