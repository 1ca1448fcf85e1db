package com.farmsentinel.core.port;

import com.farmsentinel.core.error.NoDataException;
import com.farmsentinel.core.model.SignalWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryWindowSupplier}.
 */
class InMemoryWindowSupplierTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private InMemoryWindowSupplier supplier;

    @BeforeEach
    void setUp() {
        supplier = new InMemoryWindowSupplier();
        for (int i = 0; i < 10; i++) {
            supplier.addReading("farm-1", "room-a", "temperature", T0.plus(Duration.ofDays(i)), 20 + i);
        }
        supplier.addReading("farm-1", "room-a", "humidity", T0, 60);
        supplier.registerRoom("farm-1", "room-b");
    }

    @Test
    @DisplayName("Should end the window at the newest reading and exclude its lower bound")
    void shouldAnchorWindowAtLatestReading() {
        SignalWindow window = supplier.fetchWindow("room-a", "temperature", 3);

        assertThat(window.values()).containsExactly(27, 28, 29);
        assertThat(window.getDays()).isEqualTo(3);
        assertThat(window.getRoomId()).isEqualTo("room-a");
    }

    @Test
    @DisplayName("Should report topology in registration order")
    void shouldExposeTopology() {
        assertThat(supplier.roomsOf("farm-1")).containsExactly("room-a", "room-b");
        assertThat(supplier.roomsOf("farm-2")).isEmpty();
        assertThat(supplier.farmOf("room-b")).contains("farm-1");
        assertThat(supplier.metricsOf("room-a")).containsExactly("temperature", "humidity");
        assertThat(supplier.metricsOf("room-b")).isEmpty();
    }

    @Test
    @DisplayName("Should throw NoDataException for a series without readings")
    void shouldThrowForMissingSeries() {
        assertThatThrownBy(() -> supplier.fetchWindow("room-b", "temperature", 7))
                .isInstanceOf(NoDataException.class)
                .hasMessageContaining("room-b");
    }

    @Test
    @DisplayName("Should overwrite a reading at the same timestamp")
    void shouldReplaceDuplicateTimestamp() {
        supplier.addReading("farm-1", "room-a", "humidity", T0, 65);

        assertThat(supplier.fetchWindow("room-a", "humidity", 1).values()).containsExactly(65);
    }
}
