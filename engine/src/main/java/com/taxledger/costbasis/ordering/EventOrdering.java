package com.taxledger.costbasis.ordering;

import com.taxledger.asset.AssetLookup;
import com.taxledger.domain.Asset;
import com.taxledger.domain.event.CashFlowEvent;
import com.taxledger.domain.event.CashMergerEvent;
import com.taxledger.domain.event.CorporateActionEvent;
import com.taxledger.domain.event.CurrencyConversionEvent;
import com.taxledger.domain.event.ExpireDividendRightsEvent;
import com.taxledger.domain.event.FeeEvent;
import com.taxledger.domain.event.FinancialEvent;
import com.taxledger.domain.event.FinancialEventVisitor;
import com.taxledger.domain.event.OptionAssignmentEvent;
import com.taxledger.domain.event.OptionExerciseEvent;
import com.taxledger.domain.event.OptionExpirationEvent;
import com.taxledger.domain.event.OptionLifecycleEvent;
import com.taxledger.domain.event.SplitEvent;
import com.taxledger.domain.event.StockDividendEvent;
import com.taxledger.domain.event.StockMergerEvent;
import com.taxledger.domain.event.TradeEvent;
import com.taxledger.domain.event.WithholdingTaxEvent;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic same-day ordering so that FIFO results do not depend on input row order.
 * Group precedence on one date: corporate actions, option lifecycle, trades and FX, cash-like events.
 */
public final class EventOrdering {

    public static final int GROUP_CORPORATE_ACTION = 0;
    public static final int GROUP_OPTION_LIFECYCLE = 1;
    public static final int GROUP_TRADE = 2;
    public static final int GROUP_CASH = 3;

    private EventOrdering() {
    }

    /**
     * @throws EventOrderingException when the event has no date or its asset is null
     */
    public static EventSortKey sortKey(FinancialEvent event, Asset asset) {
        if (event.eventDate() == null) {
            throw new EventOrderingException("Event " + event.eventId() + " (" + event.type() + ") has no valid date");
        }
        if (asset == null) {
            throw new EventOrderingException("Event " + event.eventId() + " on " + event.eventDate()
                    + " references unknown asset " + event.assetId());
        }
        return event.accept(new KeyBuilder(asset));
    }

    public static EventSortKey sortKey(FinancialEvent event, AssetLookup assets) {
        return sortKey(event, assets.findAsset(event.assetId()).orElse(null));
    }

    /**
     * Returns a new list in canonical order. Every key is computed up front so a bad event fails the whole sort.
     */
    public static List<FinancialEvent> sort(List<? extends FinancialEvent> events, AssetLookup assets) {
        Map<FinancialEvent, EventSortKey> keys = new IdentityHashMap<>();
        for (FinancialEvent event : events) {
            keys.put(event, sortKey(event, assets));
        }
        List<FinancialEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparing(keys::get));
        return sorted;
    }

    private static final class KeyBuilder implements FinancialEventVisitor<EventSortKey> {

        private final Asset asset;

        private KeyBuilder(Asset asset) {
            this.asset = asset;
        }

        private EventSortKey corporateAction(CorporateActionEvent event) {
            return new EventSortKey(event.eventDate(), GROUP_CORPORATE_ACTION, event.transactionId(),
                    asset.symbol(), event.corporateActionId(), event.description(), null, event.eventId().toString());
        }

        private EventSortKey optionLifecycle(OptionLifecycleEvent event) {
            return new EventSortKey(event.eventDate(), GROUP_OPTION_LIFECYCLE, event.transactionId(),
                    asset.category().name(), null, null, null, event.eventId().toString());
        }

        private EventSortKey tradeLike(FinancialEvent event) {
            return new EventSortKey(event.eventDate(), GROUP_TRADE, event.transactionId(),
                    asset.category().name(), null, null, null, event.eventId().toString());
        }

        private EventSortKey cashLike(FinancialEvent event, BigDecimal amount) {
            return new EventSortKey(event.eventDate(), GROUP_CASH, event.transactionId(),
                    asset.category().name(), null, null, amount, event.eventId().toString());
        }

        @Override
        public EventSortKey visitTrade(TradeEvent event) {
            return tradeLike(event);
        }

        @Override
        public EventSortKey visitCurrencyConversion(CurrencyConversionEvent event) {
            return tradeLike(event);
        }

        @Override
        public EventSortKey visitCashFlow(CashFlowEvent event) {
            BigDecimal amount = event.grossAmountForeign() != null ? event.grossAmountForeign() : event.grossAmountEur();
            return cashLike(event, amount);
        }

        @Override
        public EventSortKey visitWithholdingTax(WithholdingTaxEvent event) {
            return cashLike(event, event.grossAmountEur());
        }

        @Override
        public EventSortKey visitFee(FeeEvent event) {
            return cashLike(event, event.grossAmountEur());
        }

        @Override
        public EventSortKey visitSplit(SplitEvent event) {
            return corporateAction(event);
        }

        @Override
        public EventSortKey visitCashMerger(CashMergerEvent event) {
            return corporateAction(event);
        }

        @Override
        public EventSortKey visitStockMerger(StockMergerEvent event) {
            return corporateAction(event);
        }

        @Override
        public EventSortKey visitStockDividend(StockDividendEvent event) {
            return corporateAction(event);
        }

        @Override
        public EventSortKey visitExpireDividendRights(ExpireDividendRightsEvent event) {
            return corporateAction(event);
        }

        @Override
        public EventSortKey visitOptionExercise(OptionExerciseEvent event) {
            return optionLifecycle(event);
        }

        @Override
        public EventSortKey visitOptionAssignment(OptionAssignmentEvent event) {
            return optionLifecycle(event);
        }

        @Override
        public EventSortKey visitOptionExpiration(OptionExpirationEvent event) {
            return optionLifecycle(event);
        }
    }
}
