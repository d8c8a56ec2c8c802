package com.taxledger.asset;

import com.taxledger.domain.Asset;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable id to asset map, insertion ordered so that ledgers are built in a stable order.
 */
public final class InMemoryAssetLookup implements AssetLookup {

    private final Map<UUID, Asset> assets;

    private InMemoryAssetLookup(Map<UUID, Asset> assets) {
        this.assets = Collections.unmodifiableMap(assets);
    }

    public static InMemoryAssetLookup of(Collection<Asset> assets) {
        Map<UUID, Asset> byId = new LinkedHashMap<>();
        for (Asset asset : assets) {
            Asset previous = byId.putIfAbsent(asset.id(), asset);
            if (previous != null && !previous.equals(asset)) {
                throw new IllegalArgumentException("Conflicting assets for id " + asset.id());
            }
        }
        return new InMemoryAssetLookup(byId);
    }

    public static InMemoryAssetLookup of(Asset... assets) {
        return of(List.of(assets));
    }

    @Override
    public Optional<Asset> findAsset(UUID assetId) {
        return assetId == null ? Optional.empty() : Optional.ofNullable(assets.get(assetId));
    }

    @Override
    public Collection<Asset> allAssets() {
        return assets.values();
    }
}
