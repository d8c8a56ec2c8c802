package com.taxledger.costbasis.ledger;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * Open short lot: quantity sold short (positive) and the proceeds received when opening.
 */
@Slf4j
public final class ShortFifoLot {

    static final Comparator<ShortFifoLot> FIFO_ORDER = Comparator
            .comparing(ShortFifoLot::getOpeningDate)
            .thenComparing(ShortFifoLot::getSourceTransactionId);

    private static final BigDecimal CONSISTENCY_TOLERANCE = new BigDecimal("0.1");

    private final LocalDate openingDate;
    private final String sourceTransactionId;
    private BigDecimal quantityShorted;
    private BigDecimal unitProceedsEur;
    private BigDecimal totalProceedsEur;

    public ShortFifoLot(LocalDate openingDate, BigDecimal quantityShorted, BigDecimal unitProceedsEur,
                        BigDecimal totalProceedsEur, String sourceTransactionId) {
        this.openingDate = Objects.requireNonNull(openingDate, "openingDate must not be null");
        LotChecks.requirePositive(quantityShorted, "short lot quantity");
        LotChecks.requireNonNegative(unitProceedsEur, "short lot unit proceeds");
        LotChecks.requireNonNegative(totalProceedsEur, "short lot total proceeds");
        this.sourceTransactionId = LotChecks.requireSourceId(sourceTransactionId);
        this.quantityShorted = quantityShorted;
        this.unitProceedsEur = unitProceedsEur;
        this.totalProceedsEur = totalProceedsEur;
        BigDecimal expected = quantityShorted.multiply(unitProceedsEur, MathContext.DECIMAL128);
        if (expected.signum() != 0 && totalProceedsEur.subtract(expected).abs().compareTo(CONSISTENCY_TOLERANCE) > 0) {
            log.warn("Short lot {}: total proceeds {} differ from quantity {} x unit {} = {}; keeping the given total",
                    sourceTransactionId, totalProceedsEur, quantityShorted, unitProceedsEur, expected);
        }
    }

    public LocalDate getOpeningDate() {
        return openingDate;
    }

    public String getSourceTransactionId() {
        return sourceTransactionId;
    }

    public BigDecimal getQuantityShorted() {
        return quantityShorted;
    }

    public BigDecimal getUnitProceedsEur() {
        return unitProceedsEur;
    }

    public BigDecimal getTotalProceedsEur() {
        return totalProceedsEur;
    }

    void shrinkTo(BigDecimal remainingQuantity, MathContext mc) {
        this.quantityShorted = remainingQuantity;
        this.totalProceedsEur = remainingQuantity.multiply(unitProceedsEur, mc);
    }

    void rescale(BigDecimal newQuantity, BigDecimal newUnitProceedsEur) {
        this.quantityShorted = newQuantity;
        this.unitProceedsEur = newUnitProceedsEur;
    }

    ShortFifoLot copyWithQuantity(BigDecimal newQuantity, MathContext mc) {
        return new ShortFifoLot(openingDate, newQuantity, unitProceedsEur,
                newQuantity.multiply(unitProceedsEur, mc), sourceTransactionId);
    }

    @Override
    public String toString() {
        return "ShortFifoLot{" + openingDate + ", qty=" + quantityShorted + ", unit=" + unitProceedsEur
                + ", total=" + totalProceedsEur + ", src=" + sourceTransactionId + "}";
    }
}
