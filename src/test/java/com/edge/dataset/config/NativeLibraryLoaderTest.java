package com.edge.dataset.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NativeLibraryLoaderTest {

    @Test
    void loadResultIsStableAcrossCalls() {
        boolean first = NativeLibraryLoader.loadOpenCv();

        assertThat(NativeLibraryLoader.loadOpenCv()).isEqualTo(first);
    }
}
