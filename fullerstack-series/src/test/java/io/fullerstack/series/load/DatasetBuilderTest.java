package io.fullerstack.series.load;

import io.fullerstack.series.model.SeriesDefinition;
import io.fullerstack.series.model.SeriesPoint;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DatasetBuilderTest {

    private static Instant t(long seconds) {
        return Instant.EPOCH.plusSeconds(seconds);
    }

    @Test
    void acceptsSamplesInAnyOrderAndLaterDuplicatesWin() {
        Dataset dataset = new DatasetBuilder()
            .add("A", t(20), "3")
            .add("A", t(0), "1")
            .add("B", t(5), "7")
            .add("A", t(20), "4")
            .build();

        assertThat(dataset.points("A").keySet()).containsExactly(t(0), t(20));
        assertThat(dataset.points("A").get(t(20)).value()).isEqualTo(4.0);
        assertThat(dataset.sampleTimes()).containsExactly(t(0), t(5), t(20));
        assertThat(dataset.earliest()).isEqualTo(t(0));
        assertThat(dataset.latest()).isEqualTo(t(20));
        assertThat(dataset.duration()).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    void stateSeriesAcceptNamesOrNumbers() {
        SeriesDefinition valve = SeriesDefinition.state("Valve", Map.of("Open", 1));
        Dataset dataset = new DatasetBuilder()
            .define(valve)
            .add("valve", t(0), "open")
            .add("Valve", t(1), "1")
            .add("Valve", t(2), "7")
            .add("Valve", t(3), "Jammed")
            .build();

        SeriesPoint byName = dataset.points("Valve").get(t(0));
        assertThat(byName.value()).isEqualTo(1.0);
        assertThat(byName.text()).isEqualTo("Open");
        assertThat(dataset.points("Valve").get(t(1)).text()).isEqualTo("Open");
        assertThat(dataset.points("Valve").get(t(2)).text()).isEqualTo("7");
        assertThat(dataset.points("Valve")).doesNotContainKey(t(3));
    }

    @Test
    void numbersFollowTheLocaleAndCarryUnits() {
        Dataset dataset = new DatasetBuilder(Locale.GERMANY)
            .define(new SeriesDefinition("P", "Pressure", "", "bar", null, null))
            .add("Pressure", t(0), "1.234,5")
            .add("P", t(1), "2,25")
            .add("P", t(2), "1e3")
            .build();

        SeriesPoint first = dataset.points("P").get(t(0));
        assertThat(first.value()).isEqualTo(1234.5);
        assertThat(first.text()).isEqualTo("1234,5");
        assertThat(first.units()).isEqualTo("bar");
        assertThat(dataset.points("P").get(t(1)).value()).isEqualTo(2.25);
        assertThat(dataset.points("P").get(t(2)).value()).isEqualTo(1000.0);
    }

    @Test
    void unparseableAndBlankValuesAreSkipped() {
        Dataset dataset = new DatasetBuilder()
            .add("A", t(0), "abc")
            .add("A", t(1), "  ")
            .add("A", t(2), "12abc")
            .build();

        assertThat(dataset.definitions()).extracting(SeriesDefinition::id).containsExactly("A");
        assertThat(dataset.points("A")).isEmpty();
        assertThat(dataset.isEmpty()).isTrue();
        assertThat(dataset.hasDuration()).isFalse();
        assertThat(dataset.duration()).isZero();
    }

    @Test
    void redefiningSeriesKeepsItsPoints() {
        Dataset dataset = new DatasetBuilder()
            .add("A", t(0), 1)
            .define(new SeriesDefinition("A", "Alpha", "renamed", "", null, null))
            .add("Alpha", t(1), 2)
            .build();

        assertThat(dataset.definitions()).singleElement().extracting(SeriesDefinition::name).isEqualTo("Alpha");
        assertThat(dataset.points("A")).hasSize(2);
    }

    @Test
    void builtDatasetIsImmutable() {
        Dataset dataset = new DatasetBuilder().add("A", t(0), 1).add("A", t(1), 2).build();

        assertThatThrownBy(() -> dataset.points("A").clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> dataset.sampleTimes().add(t(9))).isInstanceOf(UnsupportedOperationException.class);
        assertThat(dataset.points("missing")).isEmpty();
    }
}
