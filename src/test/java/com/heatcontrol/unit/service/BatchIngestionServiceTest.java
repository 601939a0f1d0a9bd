package com.heatcontrol.unit.service;

import com.heatcontrol.domain.model.POJOS.Sample;
import com.heatcontrol.domain.model.POJOS.SeriesKey;
import com.heatcontrol.domain.model.exception.InvalidArgumentException;
import com.heatcontrol.domain.service.BatchIngestionService;
import com.heatcontrol.infrastructure.telemetry.ITelemetryStore;
import com.heatcontrol.infrastructure.telemetry.InMemoryTelemetryStore;
import com.heatcontrol.infrastructure.telemetry.TelemetryStoreAdapter;
import com.heatcontrol.infrastructure.telemetry.TimeBound;
import com.heatcontrol.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("BatchIngestionService - Tests Unitarios")
class BatchIngestionServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-15T12:00:00Z");

    private final SeriesKey room = SeriesKey.room(1, 1);
    private MutableClock clock;
    private TelemetryStoreAdapter adapter;
    private BatchIngestionService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        adapter = new TelemetryStoreAdapter(new InMemoryTelemetryStore(), clock, 24);
        service = new BatchIngestionService(adapter, clock, 100);
    }

    @Test
    @DisplayName("Los valores se guardan con sus timestamps, con Z normalizado")
    void shouldUseProvidedTimestamps() {
        int count = service.ingestBatch(room,
                List.of(19.5, 19.8),
                List.of("2024-01-15T10:30:00Z", "2024-01-15T11:35:00+01:00"));

        assertThat(count).isEqualTo(2);
        List<Sample> stored = adapter.range(room, TimeBound.parse("-1d"), TimeBound.now());
        assertThat(stored).extracting(Sample::getTimestamp).containsExactly(
                Instant.parse("2024-01-15T10:30:00Z"),
                Instant.parse("2024-01-15T10:35:00Z"));
        assertThat(stored).extracting(Sample::getValue).containsExactly(19.5, 19.8);
    }

    @Test
    @DisplayName("Sin timestamps cada valor queda con la hora actual, en orden")
    void shouldStampWithNowWhenTimestampsMissing() {
        int count = service.ingestBatch(room, List.of(20.0, 20.1, 20.2), null);

        assertThat(count).isEqualTo(3);
        // el fin del rango es exclusivo: se consulta un segundo después de "ahora"
        List<Sample> stored = adapter.range(room, TimeBound.parse("-1h"), TimeBound.at(NOW.plusSeconds(1)));
        assertThat(stored).hasSize(3);
        assertThat(stored).allSatisfy(sample -> assertThat(sample.getTimestamp()).isAfterOrEqualTo(NOW));
        assertThat(stored).extracting(Sample::getValue).containsExactly(20.0, 20.1, 20.2);
    }

    @Test
    @DisplayName("Con reloj real los instantes asignados no son anteriores al inicio del lote")
    void shouldUseIndependentNowPerValue() {
        Clock systemClock = Clock.systemUTC();
        TelemetryStoreAdapter realAdapter = new TelemetryStoreAdapter(new InMemoryTelemetryStore(), systemClock, 24);
        BatchIngestionService realService = new BatchIngestionService(realAdapter, systemClock, 100);
        Instant before = systemClock.instant();

        realService.ingestBatch(room, List.of(1.0, 2.0, 3.0, 4.0), List.of());

        List<Sample> stored = realAdapter.range(room, TimeBound.at(before), TimeBound.at(systemClock.instant().plusSeconds(1)));
        assertThat(stored).hasSize(4);
        assertThat(stored).allSatisfy(sample -> assertThat(sample.getTimestamp()).isAfterOrEqualTo(before));
    }

    @Test
    @DisplayName("Timestamps inválidos o vacíos caen a la hora actual")
    void shouldFallBackToNowForInvalidTimestamps() {
        service.ingestBatch(room,
                List.of(18.0, 18.5, 19.0),
                Arrays.asList("no-es-fecha", null, "2024-01-15T11:00:00Z"));

        List<Sample> stored = adapter.range(room, TimeBound.parse("-1d"), TimeBound.at(NOW.plusSeconds(1)));
        assertThat(stored).extracting(Sample::getTimestamp).containsExactly(
                Instant.parse("2024-01-15T11:00:00Z"), NOW, NOW);
        assertThat(stored).extracting(Sample::getValue).containsExactly(19.0, 18.0, 18.5);
    }

    @Test
    @DisplayName("Timestamps de solo fecha o con espacio conservan su instante")
    void shouldKeepDateOnlyAndSpaceSeparatedTimestamps() {
        service.ingestBatch(room,
                List.of(1.0, 2.0),
                List.of("2024-01-10", "2024-01-10 08:00:00"));

        List<Sample> stored = adapter.range(room, TimeBound.parse("-30d"), TimeBound.now());
        assertThat(stored).extracting(Sample::getTimestamp).containsExactly(
                Instant.parse("2024-01-10T00:00:00Z"),
                Instant.parse("2024-01-10T08:00:00Z"));
        assertThat(stored).extracting(Sample::getValue).containsExactly(1.0, 2.0);
    }

    @Test
    @DisplayName("Más de 100 valores se rechaza sin escribir nada")
    void shouldRejectOversizedBatchWithoutWriting() {
        ITelemetryStore store = mock(ITelemetryStore.class);
        BatchIngestionService withMock = new BatchIngestionService(
                new TelemetryStoreAdapter(store, clock, 24), clock, 100);
        List<Double> values = new ArrayList<>(Collections.nCopies(101, 20.0));

        assertThatThrownBy(() -> withMock.ingestBatch(room, values, null))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("100");
        verify(store, never()).write(anyList());
    }

    @Test
    @DisplayName("Configurar un tope mayor a 100 no permite lotes más grandes")
    void shouldClampConfiguredMaxBatchSize() {
        ITelemetryStore store = mock(ITelemetryStore.class);
        BatchIngestionService generous = new BatchIngestionService(
                new TelemetryStoreAdapter(store, clock, 24), clock, 500);
        List<Double> values = new ArrayList<>(Collections.nCopies(101, 20.0));

        assertThatThrownBy(() -> generous.ingestBatch(room, values, null))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("100");
        verify(store, never()).write(anyList());
    }

    @Test
    @DisplayName("Un tope configurado menor a 100 se respeta")
    void shouldHonourLowerConfiguredMaxBatchSize() {
        BatchIngestionService strict = new BatchIngestionService(adapter, clock, 2);

        assertThatThrownBy(() -> strict.ingestBatch(room, List.of(1.0, 2.0, 3.0), null))
                .isInstanceOf(InvalidArgumentException.class);
        assertThat(strict.ingestBatch(room, List.of(1.0, 2.0), null)).isEqualTo(2);
    }

    @Test
    @DisplayName("Exactamente 100 valores se aceptan en una sola escritura")
    void shouldAcceptMaxBatchInOneWrite() {
        ITelemetryStore store = mock(ITelemetryStore.class);
        BatchIngestionService withMock = new BatchIngestionService(
                new TelemetryStoreAdapter(store, clock, 24), clock, 100);

        int count = withMock.ingestBatch(room, new ArrayList<>(Collections.nCopies(100, 20.0)), null);

        assertThat(count).isEqualTo(100);
        verify(store, times(1)).write(anyList());
    }

    @Test
    @DisplayName("Un valor nulo invalida todo el lote")
    void shouldRejectNullValue() {
        ITelemetryStore store = mock(ITelemetryStore.class);
        BatchIngestionService withMock = new BatchIngestionService(
                new TelemetryStoreAdapter(store, clock, 24), clock, 100);

        assertThatThrownBy(() -> withMock.ingestBatch(room, Arrays.asList(20.0, null), null))
                .isInstanceOf(InvalidArgumentException.class);
        verify(store, never()).write(anyList());
    }

    @Test
    @DisplayName("Lote vacío: cero valores y ninguna escritura")
    void shouldAcceptEmptyBatch() {
        ITelemetryStore store = mock(ITelemetryStore.class);
        BatchIngestionService withMock = new BatchIngestionService(
                new TelemetryStoreAdapter(store, clock, 24), clock, 100);

        assertThat(withMock.ingestBatch(room, List.of(), null)).isZero();
        verify(store, never()).write(anyList());
    }
}
