package com.boqregistry.classification.override;

import com.boqregistry.classification.ClassificationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OverrideStoreTest {

    @Test
    @DisplayName("lookup matches on normalized code and last record wins")
    void recordAndLookup() {
        OverrideStore store = new OverrideStore();

        store.record(" 231 112 ", "BETON_MONOLIT");
        store.record("231 112", "BEDNENI");

        assertThat(store.lookup("231  112")).contains("BEDNENI");
        assertThat(store.lookup("231113")).isEmpty();
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("blank codes never match")
    void blankCodeNeverMatches() {
        OverrideStore store = OverrideStore.of(Map.of("231112", "BETON_MONOLIT"));

        assertThat(store.lookup(null)).isEmpty();
        assertThat(store.lookup("   ")).isEmpty();
    }

    @Test
    @DisplayName("blank code or category cannot be recorded")
    void rejectsBlankEntries() {
        OverrideStore store = new OverrideStore();

        assertThatThrownBy(() -> store.record(" ", "BETON_MONOLIT"))
                .isInstanceOf(ClassificationException.class)
                .satisfies(e -> assertThat(((ClassificationException) e).getErrorCode())
                        .isEqualTo(ClassificationException.INVALID_OVERRIDE));
        assertThatThrownBy(() -> store.record("231112", null))
                .isInstanceOf(ClassificationException.class);
        assertThat(store.count()).isZero();
    }

    @Test
    @DisplayName("snapshot is detached from later changes")
    void snapshotIsDetached() {
        OverrideStore store = OverrideStore.of(Map.of("231112", "BETON_MONOLIT"));

        OverrideStore snapshot = store.snapshot();
        store.record("231112", "IZOLACE");
        store.record("465", "DOPRAVA");

        assertThat(snapshot.lookup("231112")).contains("BETON_MONOLIT");
        assertThat(snapshot.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("clear removes every entry")
    void clear() {
        OverrideStore store = OverrideStore.of(Map.of("1001", "A", "1002", "B"));

        store.clear();

        assertThat(store.count()).isZero();
        assertThat(store.lookup("1001")).isEmpty();
    }

    @Test
    @DisplayName("concurrent records and lookups do not lose entries")
    void concurrentAccess() throws Exception {
        OverrideStore store = new OverrideStore();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                int offset = t * 250;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 250; i++) {
                        store.record(String.valueOf(100_000 + offset + i), "CAT");
                        store.lookup(String.valueOf(100_000 + i));
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.count()).isEqualTo(1000);
    }
}
