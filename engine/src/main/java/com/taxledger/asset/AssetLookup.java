package com.taxledger.asset;

import com.taxledger.domain.Asset;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolved instrument identities for one calculation run. Must return the same asset for an id for the whole run.
 */
public interface AssetLookup {

    Optional<Asset> findAsset(UUID assetId);

    /** Every asset known to the run, including those without events (needed for EOY reconciliation). */
    Collection<Asset> allAssets();
}
