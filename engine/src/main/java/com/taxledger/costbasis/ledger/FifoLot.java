package com.taxledger.costbasis.ledger;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * Open long lot. Quantity and totals shrink on partial consumption; the unit cost only changes through
 * splits and capital repayments.
 */
@Slf4j
public final class FifoLot {

    static final Comparator<FifoLot> FIFO_ORDER = Comparator
            .comparing(FifoLot::getAcquisitionDate)
            .thenComparing(FifoLot::getSourceTransactionId);

    private static final BigDecimal CONSISTENCY_TOLERANCE = new BigDecimal("0.1");

    private final LocalDate acquisitionDate;
    private final String sourceTransactionId;
    private BigDecimal quantity;
    private BigDecimal unitCostBasisEur;
    private BigDecimal totalCostBasisEur;

    public FifoLot(LocalDate acquisitionDate, BigDecimal quantity, BigDecimal unitCostBasisEur,
                   BigDecimal totalCostBasisEur, String sourceTransactionId) {
        this.acquisitionDate = Objects.requireNonNull(acquisitionDate, "acquisitionDate must not be null");
        LotChecks.requirePositive(quantity, "lot quantity");
        LotChecks.requireNonNegative(unitCostBasisEur, "lot unit cost basis");
        LotChecks.requireNonNegative(totalCostBasisEur, "lot total cost basis");
        this.sourceTransactionId = LotChecks.requireSourceId(sourceTransactionId);
        this.quantity = quantity;
        this.unitCostBasisEur = unitCostBasisEur;
        this.totalCostBasisEur = totalCostBasisEur;
        BigDecimal expected = quantity.multiply(unitCostBasisEur, MathContext.DECIMAL128);
        if (expected.signum() != 0 && totalCostBasisEur.subtract(expected).abs().compareTo(CONSISTENCY_TOLERANCE) > 0) {
            log.warn("Lot {}: total cost basis {} differs from quantity {} x unit {} = {}; keeping the given total",
                    sourceTransactionId, totalCostBasisEur, quantity, unitCostBasisEur, expected);
        }
    }

    public LocalDate getAcquisitionDate() {
        return acquisitionDate;
    }

    public String getSourceTransactionId() {
        return sourceTransactionId;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getUnitCostBasisEur() {
        return unitCostBasisEur;
    }

    public BigDecimal getTotalCostBasisEur() {
        return totalCostBasisEur;
    }

    void shrinkTo(BigDecimal remainingQuantity, MathContext mc) {
        this.quantity = remainingQuantity;
        this.totalCostBasisEur = remainingQuantity.multiply(unitCostBasisEur, mc);
    }

    void rescale(BigDecimal newQuantity, BigDecimal newUnitCostBasisEur) {
        this.quantity = newQuantity;
        this.unitCostBasisEur = newUnitCostBasisEur;
    }

    void reduceTotalCostBasis(BigDecimal newTotalCostBasisEur, BigDecimal newUnitCostBasisEur) {
        this.totalCostBasisEur = newTotalCostBasisEur;
        this.unitCostBasisEur = newUnitCostBasisEur;
    }

    FifoLot copyWithQuantity(BigDecimal newQuantity, MathContext mc) {
        return new FifoLot(acquisitionDate, newQuantity, unitCostBasisEur,
                newQuantity.multiply(unitCostBasisEur, mc), sourceTransactionId);
    }

    @Override
    public String toString() {
        return "FifoLot{" + acquisitionDate + ", qty=" + quantity + ", unit=" + unitCostBasisEur
                + ", total=" + totalCostBasisEur + ", src=" + sourceTransactionId + "}";
    }
}
