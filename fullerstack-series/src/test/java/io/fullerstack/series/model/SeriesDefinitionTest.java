package io.fullerstack.series.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SeriesDefinitionTest {

    @Test
    void optionalFieldsDefaultToEmpty() {
        SeriesDefinition series = new SeriesDefinition("F", "Flow", null, null, null, null);

        assertThat(series.description()).isEmpty();
        assertThat(series.units()).isEmpty();
        assertThat(series.kind()).isEqualTo(SeriesKind.NUMERIC);
        assertThat(series.states()).isEmpty();
    }

    @Test
    void statesKeepOrderAndLookupIgnoresCase() {
        Map<String, Integer> states = new LinkedHashMap<>();
        states.put("Stopped", 0);
        states.put("Running", 1);
        SeriesDefinition motor = SeriesDefinition.state("Motor", states);
        states.put("Broken", 2);

        assertThat(motor.states().keySet()).containsExactly("Stopped", "Running");
        assertThat(motor.stateValue("RUNNING")).hasValue(1);
        assertThat(motor.stateValue("Broken")).isEmpty();
        assertThat(motor.stateName(0)).hasValue("Stopped");
        assertThat(motor.stateName(0.5)).isEmpty();
    }

    @Test
    void idAndNameAreRequired() {
        assertThatThrownBy(() -> SeriesDefinition.numeric(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SeriesDefinition(null, "x", "", "", null, null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void withTimestampChangesOnlyTheTimestamp() {
        SeriesPoint point = SeriesPoint.of(Instant.EPOCH, 3.5, "3.5", "bar");

        SeriesPoint shifted = point.withTimestamp(Instant.EPOCH.plusSeconds(60));

        assertThat(shifted).usingRecursiveComparison().ignoringFields("timestamp").isEqualTo(point);
        assertThat(shifted.timestamp()).isEqualTo(Instant.EPOCH.plusSeconds(60));
    }
}
