package com.taxledger.costbasis.engine;

import com.taxledger.asset.InMemoryAssetLookup;
import com.taxledger.common.NumericContext;
import com.taxledger.domain.Asset;
import com.taxledger.domain.AssetCategory;
import com.taxledger.domain.FinancialEventType;
import com.taxledger.domain.FundType;
import com.taxledger.domain.OptionRight;
import com.taxledger.domain.RealizationType;
import com.taxledger.domain.RealizedGainLoss;
import com.taxledger.domain.TaxReportingCategory;
import com.taxledger.domain.VorabpauschaleItem;
import com.taxledger.domain.event.FinancialEvent;
import com.taxledger.domain.event.OptionAssignmentEvent;
import com.taxledger.domain.event.OptionExerciseEvent;
import com.taxledger.domain.event.TradeEvent;
import com.taxledger.pricing.ConversionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static com.taxledger.support.TestEvents.asset;
import static com.taxledger.support.TestEvents.assignment;
import static com.taxledger.support.TestEvents.buy;
import static com.taxledger.support.TestEvents.cashFlow;
import static com.taxledger.support.TestEvents.cashMerger;
import static com.taxledger.support.TestEvents.date;
import static com.taxledger.support.TestEvents.exercise;
import static com.taxledger.support.TestEvents.expiration;
import static com.taxledger.support.TestEvents.fund;
import static com.taxledger.support.TestEvents.option;
import static com.taxledger.support.TestEvents.sell;
import static com.taxledger.support.TestEvents.shortOpen;
import static com.taxledger.support.TestEvents.split;
import static com.taxledger.support.TestEvents.stock;
import static com.taxledger.support.TestEvents.withholdingTax;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalculationEngineTest {

    private final NumericContext numeric = NumericContext.defaults();

    private CalculationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new CalculationEngine(numeric,
                (amount, currency, date) -> ConversionResult.unknown(),
                new TradeProcessor(numeric),
                new CorporateActionProcessor(),
                new OptionLifecycleProcessor(numeric));
    }

    private static Asset positions(Asset asset, String soy, String eoy) {
        return asset.toBuilder()
                .soyQuantity(soy == null ? null : new BigDecimal(soy))
                .eoyQuantity(eoy == null ? null : new BigDecimal(eoy))
                .build();
    }

    private static BigDecimal cents(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private static TradeEvent linkedTo(TradeEvent trade, UUID optionEventId) {
        return trade.toBuilder().relatedOptionEventId(optionEventId).build();
    }

    private static TradeEvent processedTrade(CalculationResult result, UUID eventId) {
        return result.getProcessedEvents().stream()
                .filter(e -> e.eventId().equals(eventId))
                .map(TradeEvent.class::cast)
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("trades")
    class Trades {

        @Test
        @DisplayName("two buys and a partial sale realize two FIFO slices and reconcile")
        void twoLotScenario() {
            Asset aapl = positions(stock("AAPL"), "0", "5");
            List<FinancialEvent> events = List.of(
                    buy(aapl, "2023-01-10", "T1", "10", "1001"),
                    buy(aapl, "2023-02-10", "T2", "10", "1101"),
                    sell(aapl, "2023-03-10", "T3", "15", "1799"));

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(aapl), events);

            assertThat(result.getTaxYear().year()).isEqualTo(2023);
            assertThat(result.getRealizedGainLosses()).hasSize(2);
            assertThat(cents(result.getRealizedGainLosses().get(0).grossGainLossEur())).isEqualByComparingTo("198.33");
            assertThat(cents(result.getRealizedGainLosses().get(1).grossGainLossEur())).isEqualByComparingTo("49.17");
            assertThat(result.getProcessedEvents()).hasSize(3);
            assertThat(result.getEoyMismatches()).isEmpty();
        }

        @Test
        @DisplayName("same-day buy and sell with numeric ids of different length replay in broker order")
        void numericTransactionIdsKeepIntraDayOrder() {
            Asset aapl = positions(stock("AAPL"), "0", "0");
            List<FinancialEvent> events = List.of(
                    sell(aapl, "2023-03-01", "1000", "10", "1100"),
                    buy(aapl, "2023-03-01", "999", "10", "1000"));

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(aapl), events);

            assertThat(result.getRealizedGainLosses()).singleElement()
                    .satisfies(r -> assertThat(r.grossGainLossEur()).isEqualByComparingTo("100"));
            assertThat(result.getEoyMismatches()).isEmpty();
        }

        @Test
        @DisplayName("SOY fallback lot is consumed by the first sale")
        void soyFallbackScenario() {
            Asset aapl = positions(stock("AAPL"), "20", "0").toBuilder()
                    .soyCostBasisAmount(new BigDecimal("2000")).soyCostBasisCurrency("EUR").build();

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(aapl),
                    List.of(sell(aapl, "2023-05-05", "T1", "20", "2399")));

            assertThat(result.getRealizedGainLosses()).singleElement().satisfies(r -> {
                assertThat(r.grossGainLossEur()).isEqualByComparingTo("399");
                assertThat(r.acquisitionDate()).isEqualTo(date("2022-12-31"));
            });
            assertThat(result.getEoyMismatchCount()).isZero();
        }

        @Test
        @DisplayName("pre-year history seeds lots with their true acquisition dates")
        void historicalLots() {
            Asset aapl = positions(stock("AAPL"), "10", "0");
            List<FinancialEvent> events = List.of(
                    buy(aapl, "2022-05-01", "T0", "10", "1000"),
                    cashFlow(aapl, FinancialEventType.DIVIDEND_CASH, "2022-08-01", "12"),
                    sell(aapl, "2023-03-01", "T1", "10", "1300"));

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(aapl), events);

            RealizedGainLoss record = result.getRealizedGainLosses().get(0);
            assertThat(record.acquisitionDate()).isEqualTo(date("2022-05-01"));
            assertThat(record.grossGainLossEur()).isEqualByComparingTo("300");
            assertThat(result.getProcessedEvents()).hasSize(1);
        }

        @Test
        @DisplayName("events after the tax year are counted and dropped")
        void futureEventsDropped() {
            Asset aapl = positions(stock("AAPL"), "0", "10");
            List<FinancialEvent> events = List.of(
                    buy(aapl, "2023-01-10", "T1", "10", "1000"),
                    sell(aapl, "2024-01-02", "T2", "10", "1500"));

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(aapl), events);

            assertThat(result.getDroppedFutureEvents()).isEqualTo(1);
            assertThat(result.getProcessedEvents()).hasSize(1);
            assertThat(result.getRealizedGainLosses()).isEmpty();
            assertThat(result.getEoyMismatches()).isEmpty();
        }

        @Test
        @DisplayName("records do not depend on input row order")
        void inputOrderIndependent() {
            Asset aapl = positions(stock("AAPL"), "0", "3");
            List<FinancialEvent> events = new ArrayList<>(List.of(
                    buy(aapl, "2023-01-10", "T2", "5", "600"),
                    buy(aapl, "2023-01-10", "T1", "5", "500"),
                    sell(aapl, "2023-02-01", "T3", "7", "910")));
            InMemoryAssetLookup assets = InMemoryAssetLookup.of(aapl);

            List<RealizedGainLoss> first = engine.run(2023, assets, events).getRealizedGainLosses();
            Collections.reverse(events);
            List<RealizedGainLoss> second = engine.run(2023, assets, events).getRealizedGainLosses();

            assertThat(second).isEqualTo(first);
            assertThat(first.get(0).totalCostBasisEur()).isEqualByComparingTo("500");
            assertThat(first.get(1).totalCostBasisEur()).isEqualByComparingTo("240");
        }
    }

    @Nested
    @DisplayName("corporate actions and cash flows")
    class CorporateActionsAndCash {

        @Test
        @DisplayName("split during the year doubles lots before the sale")
        void liveSplit() {
            Asset aapl = positions(stock("AAPL"), "0", "0");
            List<FinancialEvent> events = List.of(
                    buy(aapl, "2023-01-10", "T1", "10", "1000"),
                    split(aapl, "2023-03-01", "2"),
                    sell(aapl, "2023-04-01", "T2", "20", "1200"));

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(aapl), events);

            assertThat(result.getRealizedGainLosses()).singleElement().satisfies(r -> {
                assertThat(r.quantityRealized()).isEqualByComparingTo("20");
                assertThat(r.grossGainLossEur()).isEqualByComparingTo("200");
            });
        }

        @Test
        @DisplayName("cash merger realizes all lots and closes the position")
        void cashMergerCloses() {
            Asset target = positions(stock("TGT"), "0", "0");
            List<FinancialEvent> events = List.of(
                    buy(target, "2023-01-10", "T1", "10", "1001"),
                    cashMerger(target, "2023-07-01", "150"));

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(target), events);

            assertThat(result.getRealizedGainLosses()).singleElement().satisfies(r -> {
                assertThat(r.realizationType()).isEqualTo(RealizationType.CASH_MERGER_PROCEEDS);
                assertThat(r.grossGainLossEur()).isEqualByComparingTo("499");
            });
            assertThat(result.getEoyMismatches()).isEmpty();
        }

        @Test
        @DisplayName("capital repayment beyond cost basis is reported as excess")
        void capitalRepaymentExcess() {
            Asset aapl = positions(stock("AAPL"), "0", "0");
            List<FinancialEvent> events = List.of(
                    buy(aapl, "2023-01-10", "T1", "10", "1000"),
                    cashFlow(aapl, FinancialEventType.CAPITAL_REPAYMENT, "2023-04-01", "1200"),
                    sell(aapl, "2023-06-01", "T2", "10", "500"));

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(aapl), events);

            assertThat(result.getCapitalRepaymentExcesses()).singleElement().satisfies(excess -> {
                assertThat(excess.amountEur()).isEqualByComparingTo("200");
                assertThat(excess.assetId()).isEqualTo(aapl.id());
                assertThat(excess.eventDate()).isEqualTo(date("2023-04-01"));
            });
            assertThat(result.getRealizedGainLosses().get(0).totalCostBasisEur()).isEqualByComparingTo("0");
            assertThat(result.getRealizedGainLosses().get(0).grossGainLossEur()).isEqualByComparingTo("500");
        }

        @Test
        @DisplayName("capital repayment on an asset without ledger is excess in full")
        void capitalRepaymentWithoutLedger() {
            Asset cash = asset(AssetCategory.CASH_BALANCE, "EUR-CASH");

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(cash),
                    List.of(cashFlow(cash, FinancialEventType.CAPITAL_REPAYMENT, "2023-04-01", "80")));

            assertThat(result.getCapitalRepaymentExcesses()).singleElement()
                    .satisfies(excess -> assertThat(excess.amountEur()).isEqualByComparingTo("80"));
        }

        @Test
        @DisplayName("income events pass through as processed without realizations")
        void incomePassThrough() {
            Asset aapl = positions(stock("AAPL"), "0", "0");
            List<FinancialEvent> events = List.of(
                    cashFlow(aapl, FinancialEventType.DIVIDEND_CASH, "2023-05-02", "100"),
                    withholdingTax(aapl, "2023-05-02", "-15"));

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(aapl), events);

            assertThat(result.getProcessedEvents()).extracting(FinancialEvent::type)
                    .containsExactlyInAnyOrder(FinancialEventType.DIVIDEND_CASH, FinancialEventType.WITHHOLDING_TAX);
            assertThat(result.getRealizedGainLosses()).isEmpty();
        }

        @Test
        @DisplayName("Vorabpauschale items of other years are ignored")
        void vorabpauschaleFilteredByYear() {
            Asset etf = positions(fund("VWRL", FundType.AKTIENFONDS), "0", "0");
            VorabpauschaleItem current = VorabpauschaleItem.of(etf.id(), 2023, FundType.AKTIENFONDS, new BigDecimal("100"), numeric);
            VorabpauschaleItem stale = VorabpauschaleItem.of(etf.id(), 2022, FundType.AKTIENFONDS, new BigDecimal("80"), numeric);

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(etf), List.of(), List.of(current, stale));

            assertThat(result.getVorabpauschaleItems()).containsExactly(current);
        }
    }

    @Nested
    @DisplayName("options")
    class Options {

        @Test
        @DisplayName("exercised call premium is added to the stock purchase cost")
        void callExerciseAdjustsCost() {
            Asset aapl = positions(stock("AAPL"), "0", "0");
            Asset call = positions(option("AAPL C150", OptionRight.CALL, aapl), "0", "0");
            OptionExerciseEvent exercise = exercise(call, "2023-03-01", "1");
            TradeEvent stockBuy = linkedTo(buy(aapl, "2023-03-01", "X1", "100", "15000"), exercise.eventId());
            List<FinancialEvent> events = List.of(
                    stockBuy,
                    buy(call, "2023-02-01", "O1", "1", "300"),
                    exercise,
                    sell(aapl, "2023-06-01", "X2", "100", "16000"));

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(aapl, call), events);

            assertThat(processedTrade(result, stockBuy.eventId()).netAmountEur()).isEqualByComparingTo("15300");
            assertThat(result.getRealizedGainLosses()).singleElement().satisfies(r -> {
                assertThat(r.totalCostBasisEur()).isEqualByComparingTo("15300");
                assertThat(r.grossGainLossEur()).isEqualByComparingTo("700");
            });
            assertThat(result.getEoyMismatches()).isEmpty();
        }

        @Test
        @DisplayName("assigned short put premium reduces the stock purchase cost")
        void putAssignmentAdjustsCost() {
            Asset aapl = positions(stock("AAPL"), "0", "100");
            Asset put = positions(option("AAPL P100", OptionRight.PUT, aapl), "0", "0");
            OptionAssignmentEvent assignment = assignment(put, "2023-03-15", "1");
            TradeEvent stockBuy = linkedTo(buy(aapl, "2023-03-15", "X1", "100", "10000"), assignment.eventId());

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(aapl, put), List.of(
                    shortOpen(put, "2023-02-01", "P1", "1", "200"),
                    assignment,
                    stockBuy));

            assertThat(processedTrade(result, stockBuy.eventId()).netAmountEur()).isEqualByComparingTo("9800");
            assertThat(result.getRealizedGainLosses()).isEmpty();
            assertThat(result.getEoyMismatches()).isEmpty();
        }

        @Test
        @DisplayName("long option expiring worthless realizes the premium as a loss")
        void longExpiration() {
            Asset aapl = positions(stock("AAPL"), "0", "0");
            Asset call = positions(option("AAPL C200", OptionRight.CALL, aapl), "0", "0");

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(aapl, call), List.of(
                    buy(call, "2023-01-15", "O1", "2", "400"),
                    expiration(call, "2023-06-16", "2")));

            assertThat(result.getRealizedGainLosses()).singleElement().satisfies(r -> {
                assertThat(r.realizationType()).isEqualTo(RealizationType.OPTION_EXPIRED_LONG);
                assertThat(r.grossGainLossEur()).isEqualByComparingTo("-400");
                assertThat(r.taxReportingCategory()).isEqualTo(TaxReportingCategory.ANLAGE_KAP_TERMIN_VERLUST);
            });
        }

        @Test
        @DisplayName("short option expiring worthless is Stillhalter income")
        void shortExpiration() {
            Asset aapl = positions(stock("AAPL"), "0", "0");
            Asset put = positions(option("AAPL P80", OptionRight.PUT, aapl), "0", "0");

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(aapl, put), List.of(
                    shortOpen(put, "2023-01-15", "P1", "1", "150"),
                    expiration(put, "2023-06-16", "1")));

            assertThat(result.getRealizedGainLosses()).singleElement().satisfies(r -> {
                assertThat(r.realizationType()).isEqualTo(RealizationType.OPTION_EXPIRED_SHORT);
                assertThat(r.grossGainLossEur()).isEqualByComparingTo("150");
                assertThat(r.stillhalterIncome()).isTrue();
            });
        }

        @Test
        @DisplayName("expiration without matching lots realizes nothing")
        void expirationWithoutLots() {
            Asset aapl = positions(stock("AAPL"), "0", "0");
            Asset call = positions(option("AAPL C300", OptionRight.CALL, aapl), "0", "0");

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(aapl, call),
                    List.of(expiration(call, "2023-06-16", "1")));

            assertThat(result.getRealizedGainLosses()).isEmpty();
            assertThat(result.getProcessedEvents()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("end-of-year reconciliation")
    class Reconciliation {

        @Test
        @DisplayName("differing reported quantity is a mismatch")
        void quantityMismatch() {
            Asset aapl = positions(stock("AAPL"), "0", "7");

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(aapl),
                    List.of(buy(aapl, "2023-01-10", "T1", "10", "1000")));

            assertThat(result.getEoyMismatches()).singleElement().satisfies(m -> {
                assertThat(m.calculatedQuantity()).isEqualByComparingTo("10");
                assertThat(m.reportedQuantity()).isEqualByComparingTo("7");
                assertThat(m.difference()).isEqualByComparingTo("3");
            });
        }

        @Test
        @DisplayName("open position without reported EOY is a mismatch; flat position is not")
        void missingReportedQuantity() {
            Asset open = positions(stock("OPEN"), "0", null);
            Asset flat = positions(stock("FLAT"), "0", null);

            CalculationResult result = engine.run(2023, InMemoryAssetLookup.of(open, flat),
                    List.of(buy(open, "2023-01-10", "T1", "10", "1000")));

            assertThat(result.getEoyMismatches()).singleElement().satisfies(m -> {
                assertThat(m.assetId()).isEqualTo(open.id());
                assertThat(m.reportedQuantity()).isNull();
            });
        }
    }

    @Nested
    @DisplayName("fatal conditions")
    class Fatal {

        @Test
        @DisplayName("tax year outside the supported range")
        void invalidTaxYear() {
            assertThatThrownBy(() -> engine.run(0, InMemoryAssetLookup.of(), List.of()))
                    .isInstanceOfSatisfying(CalculationException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(CalculationException.INVALID_TAX_YEAR));
        }

        @Test
        @DisplayName("event on an unknown asset")
        void unknownAsset() {
            Asset known = stock("AAPL");
            Asset unknown = stock("GHOST");

            assertThatThrownBy(() -> engine.run(2023, InMemoryAssetLookup.of(known),
                    List.of(buy(unknown, "2023-01-10", "T1", "1", "100"))))
                    .isInstanceOfSatisfying(CalculationException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(CalculationException.UNKNOWN_ASSET));
        }

        @Test
        @DisplayName("sale without enough lots")
        void insufficientLots() {
            Asset aapl = positions(stock("AAPL"), "0", "0");

            assertThatThrownBy(() -> engine.run(2023, InMemoryAssetLookup.of(aapl), List.of(
                    buy(aapl, "2023-01-10", "T1", "5", "500"),
                    sell(aapl, "2023-02-10", "T2", "10", "1200"))))
                    .isInstanceOfSatisfying(CalculationException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(CalculationException.INSUFFICIENT_LOTS));
        }

        @Test
        @DisplayName("malformed historical trade fails seeding")
        void seedFailure() {
            Asset aapl = positions(stock("AAPL"), "10", "10");

            assertThatThrownBy(() -> engine.run(2023, InMemoryAssetLookup.of(aapl),
                    List.of(buy(aapl, "2022-01-10", "", "10", "1000"))))
                    .isInstanceOfSatisfying(CalculationException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(CalculationException.SEED_FAILED));
        }

        @Test
        @DisplayName("malformed current-year trade aborts the run")
        void invalidEvent() {
            Asset aapl = positions(stock("AAPL"), "0", "10");

            assertThatThrownBy(() -> engine.run(2023, InMemoryAssetLookup.of(aapl),
                    List.of(buy(aapl, "2023-01-10", null, "10", "1000"))))
                    .isInstanceOfSatisfying(CalculationException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(CalculationException.INVALID_EVENT));
        }

        @Test
        @DisplayName("stock trade linked to an option event that left no premium")
        void missingAdjustment() {
            Asset aapl = positions(stock("AAPL"), "0", "100");

            assertThatThrownBy(() -> engine.run(2023, InMemoryAssetLookup.of(aapl),
                    List.of(linkedTo(buy(aapl, "2023-03-01", "X1", "100", "15000"), UUID.randomUUID()))))
                    .isInstanceOfSatisfying(CalculationException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(CalculationException.MISSING_OPTION_ADJUSTMENT));
        }

        @Test
        @DisplayName("stock trade linked to an option on a different underlying")
        void underlyingMismatch() {
            Asset aapl = positions(stock("AAPL"), "0", "0");
            Asset msft = positions(stock("MSFT"), "0", "100");
            Asset call = positions(option("AAPL C150", OptionRight.CALL, aapl), "0", "0");
            OptionExerciseEvent exercise = exercise(call, "2023-03-01", "1");

            assertThatThrownBy(() -> engine.run(2023, InMemoryAssetLookup.of(aapl, msft, call), List.of(
                    buy(call, "2023-02-01", "O1", "1", "300"),
                    exercise,
                    linkedTo(buy(msft, "2023-03-01", "X1", "100", "30000"), exercise.eventId()))))
                    .isInstanceOfSatisfying(CalculationException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(CalculationException.INVALID_OPTION_LINK));
        }
    }
}
