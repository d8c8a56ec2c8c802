package com.taxledger.costbasis.engine;

import com.taxledger.asset.AssetLookup;
import com.taxledger.common.NumericContext;
import com.taxledger.domain.Asset;
import com.taxledger.domain.AssetCategory;
import com.taxledger.domain.FinancialEventType;
import com.taxledger.domain.OptionRight;
import com.taxledger.domain.RealizedGainLoss;
import com.taxledger.domain.event.TradeEvent;
import com.taxledger.costbasis.ledger.FifoLedger;
import com.taxledger.costbasis.ledger.LotConsumption;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Routes buys, sells, short-opens and covers into the asset's ledger. Stock trades produced by an option exercise or
 * assignment first absorb the option premium.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TradeProcessor {

    private final NumericContext numeric;

    /**
     * Returns the trade with the linked option premium folded into its net amount, or the trade unchanged when it is
     * not a stock trade linked to an option event.
     *
     * @throws CalculationException when the link cannot be resolved or points at a different underlying
     */
    public TradeEvent applyOptionPremium(TradeEvent trade, Asset asset, AssetLookup assets,
                                         PendingOptionAdjustments pending) {
        if (asset.category() != AssetCategory.STOCK || trade.relatedOptionEventId() == null) {
            return trade;
        }
        PendingOptionAdjustments.Adjustment adjustment = pending.find(trade.relatedOptionEventId())
                .orElseThrow(() -> fatal(CalculationException.MISSING_OPTION_ADJUSTMENT,
                        "Stock trade " + trade.eventId() + " (" + asset.displayName() + ") is linked to option event "
                                + trade.relatedOptionEventId() + " but no premium adjustment was recorded"));
        Asset option = assets.findAsset(adjustment.optionAssetId())
                .filter(a -> a.category() == AssetCategory.OPTION)
                .orElseThrow(() -> fatal(CalculationException.INVALID_OPTION_LINK,
                        "Premium adjustment for option event " + adjustment.optionEventId()
                                + " references asset " + adjustment.optionAssetId() + ", which is not an option"));
        if (!asset.id().equals(option.underlyingAssetId())) {
            throw fatal(CalculationException.INVALID_OPTION_LINK, "Stock trade " + trade.eventId() + " on "
                    + asset.displayName() + " is linked to option " + option.displayName()
                    + " whose underlying is " + option.underlyingAssetId());
        }
        if (trade.netAmountEur() == null) {
            throw fatal(CalculationException.MISSING_OPTION_ADJUSTMENT,
                    "Stock trade " + trade.eventId() + " needs a premium adjustment but has no net EUR amount");
        }

        BigDecimal premium = adjustment.totalPremiumEur();
        BigDecimal signed = adjustment.right() == OptionRight.CALL ? premium : premium.negate();
        BigDecimal adjusted = numeric.add(trade.netAmountEur().abs(), signed);
        if (adjusted.signum() < 0) {
            log.warn("Premium adjustment {} turns net amount of trade {} negative ({}); using 0",
                    signed, trade.eventId(), adjusted);
            adjusted = BigDecimal.ZERO;
        }
        log.info("Trade {} ({} {}): net {} EUR adjusted by {} EUR from {} {} premium to {} EUR",
                trade.eventId(), trade.type(), asset.displayName(), trade.netAmountEur(), signed,
                option.displayName(), adjustment.right(), adjusted);
        pending.remove(adjustment.optionEventId());
        return trade.withNetAmountEur(adjusted);
    }

    /**
     * @throws CalculationException when a closing trade finds too few lots
     */
    public List<RealizedGainLoss> process(TradeEvent trade, FifoLedger ledger) {
        FinancialEventType type = trade.type();
        LotConsumption<RealizedGainLoss> consumption = switch (type) {
            case TRADE_BUY_LONG -> {
                ledger.addLongLot(trade);
                yield LotConsumption.consumed(List.of());
            }
            case TRADE_SELL_SHORT_OPEN -> {
                ledger.addShortLot(trade);
                yield LotConsumption.consumed(List.of());
            }
            case TRADE_SELL_LONG -> ledger.consumeLongLotsForSale(trade, false);
            case TRADE_BUY_SHORT_COVER -> ledger.consumeShortLotsForCover(trade, false);
            default -> throw new IllegalArgumentException("Not a trade type: " + type);
        };
        if (!consumption.isConsumed()) {
            throw fatal(CalculationException.INSUFFICIENT_LOTS, consumption.reason());
        }
        return consumption.items();
    }

    private static CalculationException fatal(String code, String message) {
        log.error(message);
        return new CalculationException(code, message);
    }
}
