package com.taxledger.costbasis.engine;

import com.taxledger.asset.AssetLookup;
import com.taxledger.common.NumericContext;
import com.taxledger.domain.Asset;
import com.taxledger.costbasis.ledger.FifoLedger;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Compares ledger positions with broker-reported end-of-year quantities. Read-only: reconciling the same ledgers twice
 * yields the same mismatches.
 */
@Slf4j
public class EoyReconciler {

    private final NumericContext numeric;

    public EoyReconciler(NumericContext numeric) {
        this.numeric = numeric;
    }

    public List<EoyMismatch> reconcile(Map<UUID, FifoLedger> ledgers, AssetLookup assets) {
        BigDecimal tolerance = numeric.reconciliationTolerance();
        List<EoyMismatch> mismatches = new ArrayList<>();
        for (Asset asset : assets.allAssets()) {
            if (!asset.category().isLedgerBearing()) {
                continue;
            }
            FifoLedger ledger = ledgers.get(asset.id());
            BigDecimal calculated = ledger != null ? ledger.currentPositionQuantity() : BigDecimal.ZERO;
            BigDecimal reported = asset.eoyQuantity();
            if (reported != null) {
                if (calculated.subtract(reported).abs().compareTo(tolerance) > 0) {
                    log.error("EOY mismatch for {}: calculated {}, reported {}, difference {}",
                            asset.displayName(), calculated, reported, calculated.subtract(reported));
                    mismatches.add(new EoyMismatch(asset.id(), asset.displayName(), calculated, reported));
                }
            } else if (calculated.abs().compareTo(tolerance) > 0) {
                log.error("EOY mismatch for {}: calculated {}, but no EOY position was reported", asset.displayName(), calculated);
                mismatches.add(new EoyMismatch(asset.id(), asset.displayName(), calculated, null));
            }
        }
        if (mismatches.isEmpty()) {
            log.info("EOY reconciliation passed for {} ledgers", ledgers.size());
        } else {
            log.error("EOY reconciliation found {} mismatches; results need manual review", mismatches.size());
        }
        return mismatches;
    }
}
