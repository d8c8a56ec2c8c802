package com.taxledger.asset;

import com.taxledger.domain.Asset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static com.taxledger.support.TestEvents.stock;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryAssetLookupTest {

    @Test
    @DisplayName("finds assets by id and keeps insertion order")
    void lookup() {
        Asset first = stock("B");
        Asset second = stock("A");
        InMemoryAssetLookup lookup = InMemoryAssetLookup.of(first, second);

        assertThat(lookup.findAsset(second.id())).contains(second);
        assertThat(lookup.findAsset(UUID.randomUUID())).isEmpty();
        assertThat(lookup.findAsset(null)).isEmpty();
        assertThat(lookup.allAssets()).containsExactly(first, second);
    }

    @Test
    @DisplayName("two different assets under one id are rejected")
    void conflictingIds() {
        Asset original = stock("AAPL");
        Asset conflicting = original.toBuilder().symbol("AAPL.DE").build();

        assertThatThrownBy(() -> InMemoryAssetLookup.of(original, conflicting))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(original.id().toString());
    }
}
