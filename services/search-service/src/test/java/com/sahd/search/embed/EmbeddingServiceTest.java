package com.sahd.search.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.sahd.search.resilience.SearchResilienceProperties;
import com.sahd.search.resilience.SearchResilienceRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EmbeddingServiceTest {

    @Mock
    private EmbeddingGateway embeddingGateway;

    @Test
    void disabledModeRefusesToEmbed() {
        EmbeddingService service = service(EmbeddingMode.DISABLED, false);

        assertThatThrownBy(() -> service.embed("صلاه", null))
            .isInstanceOfSatisfying(EmbeddingUnavailableException.class,
                e -> assertThat(e.getReason()).isEqualTo("embed_disabled"));
        verifyNoInteractions(embeddingGateway);
    }

    @Test
    void emptyTextIsRejected() {
        EmbeddingService service = service(EmbeddingMode.TOY, false);

        assertThatThrownBy(() -> service.embed("  ", null))
            .isInstanceOfSatisfying(EmbeddingUnavailableException.class,
                e -> assertThat(e.getReason()).isEqualTo("embed_empty_text"));
    }

    @Test
    void toyModeIsDeterministicUnitLength() {
        EmbeddingService service = service(EmbeddingMode.TOY, false);

        List<Double> first = service.embed("صلاه", null);
        List<Double> second = service.embed("صلاه", null);

        assertThat(first).hasSize(768).isEqualTo(second);
        double norm = Math.sqrt(first.stream().mapToDouble(v -> v * v).sum());
        assertThat(norm).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void httpModeUsesCacheOnRepeat() {
        EmbeddingService service = service(EmbeddingMode.HTTP, true);
        when(embeddingGateway.embedAll(anyList(), any())).thenReturn(List.of(List.of(0.6, 0.8)));

        service.embed("صلاه", 500);
        List<Double> cached = service.embed("صلاه", 500);

        assertThat(cached).containsExactly(0.6, 0.8);
        verify(embeddingGateway, times(1)).embedAll(anyList(), any());
    }

    @Test
    void repeatedFailuresOpenTheCircuit() {
        EmbeddingService service = service(EmbeddingMode.HTTP, false);
        when(embeddingGateway.embedAll(anyList(), any())).thenThrow(new EmbeddingUnavailableException("embed_timeout"));

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> service.embed("صلاه", null)).isInstanceOf(EmbeddingUnavailableException.class);
        }

        assertThatThrownBy(() -> service.embed("صلاه", null))
            .isInstanceOfSatisfying(EmbeddingUnavailableException.class,
                e -> assertThat(e.getReason()).isEqualTo("embed_circuit_open"));
        verify(embeddingGateway, times(3)).embedAll(anyList(), any());
    }

    @Test
    void batchEmbeddingIsChunked() {
        EmbeddingService service = service(EmbeddingMode.HTTP, false, 2);
        when(embeddingGateway.embedAll(anyList(), any()))
            .thenReturn(List.of(List.of(1.0), List.of(2.0)))
            .thenReturn(List.of(List.of(3.0)));

        List<List<Double>> vectors = service.embedAll(List.of("ا", "ب", "ت"), null);

        assertThat(vectors).containsExactly(List.of(1.0), List.of(2.0), List.of(3.0));
        verify(embeddingGateway, times(2)).embedAll(anyList(), any());
    }

    private EmbeddingService service(EmbeddingMode mode, boolean cacheEnabled) {
        return service(mode, cacheEnabled, 32);
    }

    private EmbeddingService service(EmbeddingMode mode, boolean cacheEnabled, int batchSize) {
        EmbeddingProperties props = new EmbeddingProperties();
        props.setMode(mode);
        props.setModel("arabert-base");
        props.setBatchSize(batchSize);
        EmbeddingProperties.Cache cache = new EmbeddingProperties.Cache();
        cache.setEnabled(cacheEnabled);
        props.setCache(cache);
        return new EmbeddingService(
            props,
            embeddingGateway,
            new ToyEmbedder(props),
            new EmbeddingCacheService(props),
            new SearchResilienceRegistry(new SearchResilienceProperties())
        );
    }
}
