package com.taxledger.support;

import com.taxledger.domain.Asset;
import com.taxledger.domain.AssetCategory;
import com.taxledger.domain.FinancialEventType;
import com.taxledger.domain.FundType;
import com.taxledger.domain.OptionRight;
import com.taxledger.domain.event.CashFlowEvent;
import com.taxledger.domain.event.CashMergerEvent;
import com.taxledger.domain.event.OptionAssignmentEvent;
import com.taxledger.domain.event.OptionExerciseEvent;
import com.taxledger.domain.event.OptionExpirationEvent;
import com.taxledger.domain.event.SplitEvent;
import com.taxledger.domain.event.StockDividendEvent;
import com.taxledger.domain.event.TradeEvent;
import com.taxledger.domain.event.WithholdingTaxEvent;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Builders for assets and events in tests. Quantities and amounts are given as strings; trade quantities are passed
 * unsigned and signed here by trade direction.
 */
public final class TestEvents {

    private TestEvents() {
    }

    public static Asset stock(String symbol) {
        return Asset.builder().id(UUID.randomUUID()).category(AssetCategory.STOCK).symbol(symbol).currency("EUR").build();
    }

    public static Asset asset(AssetCategory category, String symbol) {
        return Asset.builder().id(UUID.randomUUID()).category(category).symbol(symbol).currency("EUR").build();
    }

    public static Asset fund(String symbol, FundType fundType) {
        return Asset.builder().id(UUID.randomUUID()).category(AssetCategory.INVESTMENT_FUND).symbol(symbol)
                .fundType(fundType).currency("EUR").build();
    }

    public static Asset option(String symbol, OptionRight right, Asset underlying) {
        return Asset.builder().id(UUID.randomUUID()).category(AssetCategory.OPTION).symbol(symbol)
                .optionRight(right).underlyingAssetId(underlying.id()).multiplier(new BigDecimal("100"))
                .currency("EUR").build();
    }

    public static LocalDate date(String iso) {
        return LocalDate.parse(iso);
    }

    public static TradeEvent buy(Asset asset, String date, String txId, String quantity, String netEur) {
        return trade(asset, FinancialEventType.TRADE_BUY_LONG, date, txId, new BigDecimal(quantity), netEur);
    }

    public static TradeEvent sell(Asset asset, String date, String txId, String quantity, String netEur) {
        return trade(asset, FinancialEventType.TRADE_SELL_LONG, date, txId, new BigDecimal(quantity).negate(), netEur);
    }

    public static TradeEvent shortOpen(Asset asset, String date, String txId, String quantity, String netEur) {
        return trade(asset, FinancialEventType.TRADE_SELL_SHORT_OPEN, date, txId, new BigDecimal(quantity).negate(), netEur);
    }

    public static TradeEvent cover(Asset asset, String date, String txId, String quantity, String netEur) {
        return trade(asset, FinancialEventType.TRADE_BUY_SHORT_COVER, date, txId, new BigDecimal(quantity), netEur);
    }

    private static TradeEvent trade(Asset asset, FinancialEventType type, String date, String txId,
                                    BigDecimal signedQuantity, String netEur) {
        return TradeEvent.builder()
                .eventId(UUID.randomUUID())
                .assetId(asset.id())
                .eventDate(date(date))
                .type(type)
                .transactionId(txId)
                .quantity(signedQuantity)
                .netAmountEur(new BigDecimal(netEur))
                .grossAmountEur(new BigDecimal(netEur))
                .build();
    }

    public static SplitEvent split(Asset asset, String date, String ratio) {
        return SplitEvent.builder()
                .eventId(UUID.randomUUID())
                .assetId(asset.id())
                .eventDate(date(date))
                .corporateActionId("CA-SPLIT-" + date)
                .newSharesPerOldShare(new BigDecimal(ratio))
                .build();
    }

    public static StockDividendEvent stockDividend(Asset asset, String date, String newShares, String fmvPerShare) {
        BigDecimal shares = new BigDecimal(newShares);
        BigDecimal fmv = new BigDecimal(fmvPerShare);
        return StockDividendEvent.builder()
                .eventId(UUID.randomUUID())
                .assetId(asset.id())
                .eventDate(date(date))
                .corporateActionId("CA-SD-" + date)
                .quantityNewShares(shares)
                .fmvPerNewShareEur(fmv)
                .grossAmountEur(shares.multiply(fmv))
                .build();
    }

    public static CashMergerEvent cashMerger(Asset asset, String date, String cashPerShare) {
        return CashMergerEvent.builder()
                .eventId(UUID.randomUUID())
                .assetId(asset.id())
                .eventDate(date(date))
                .corporateActionId("CA-MERGER-" + date)
                .cashPerShareEur(new BigDecimal(cashPerShare))
                .build();
    }

    public static CashFlowEvent cashFlow(Asset asset, FinancialEventType type, String date, String amountEur) {
        return CashFlowEvent.builder()
                .eventId(UUID.randomUUID())
                .assetId(asset.id())
                .eventDate(date(date))
                .type(type)
                .currency("EUR")
                .grossAmountForeign(new BigDecimal(amountEur))
                .grossAmountEur(new BigDecimal(amountEur))
                .build();
    }

    public static WithholdingTaxEvent withholdingTax(Asset asset, String date, String amountEur) {
        return WithholdingTaxEvent.builder()
                .eventId(UUID.randomUUID())
                .assetId(asset.id())
                .eventDate(date(date))
                .grossAmountEur(new BigDecimal(amountEur))
                .sourceCountry("US")
                .build();
    }

    public static OptionExerciseEvent exercise(Asset option, String date, String contracts) {
        return OptionExerciseEvent.builder()
                .eventId(UUID.randomUUID())
                .assetId(option.id())
                .eventDate(date(date))
                .quantityContracts(new BigDecimal(contracts))
                .build();
    }

    public static OptionAssignmentEvent assignment(Asset option, String date, String contracts) {
        return OptionAssignmentEvent.builder()
                .eventId(UUID.randomUUID())
                .assetId(option.id())
                .eventDate(date(date))
                .quantityContracts(new BigDecimal(contracts))
                .build();
    }

    public static OptionExpirationEvent expiration(Asset option, String date, String contracts) {
        return OptionExpirationEvent.builder()
                .eventId(UUID.randomUUID())
                .assetId(option.id())
                .eventDate(date(date))
                .quantityContracts(new BigDecimal(contracts))
                .build();
    }
}
