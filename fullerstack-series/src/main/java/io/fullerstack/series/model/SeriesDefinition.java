package io.fullerstack.series.model;

import java.util.*;

/**
 * Describes one series in a dataset. Immutable.
 *
 * @param id          stable identifier; lookups by id ignore case
 * @param name        display name
 * @param description free text, never null
 * @param units       engineering units, never null
 * @param kind        numeric or discrete-state
 * @param states      state name to value mapping, in declaration order; empty for numeric series
 */
public record SeriesDefinition(
    String id,
    String name,
    String description,
    String units,
    SeriesKind kind,
    Map<String, Integer> states
) {

    public SeriesDefinition {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        description = description == null ? "" : description;
        units = units == null ? "" : units;
        states = states == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(states));
        kind = kind == null ? (states.isEmpty() ? SeriesKind.NUMERIC : SeriesKind.STATE) : kind;
    }

    /**
     * A numeric series whose id and name are both {@code name}.
     */
    public static SeriesDefinition numeric(String name) {
        return new SeriesDefinition(name, name, "", "", SeriesKind.NUMERIC, Map.of());
    }

    /**
     * A discrete-state series whose id and name are both {@code name}.
     */
    public static SeriesDefinition state(String name, Map<String, Integer> states) {
        return new SeriesDefinition(name, name, "", "", SeriesKind.STATE, states);
    }

    public boolean isState() {
        return kind == SeriesKind.STATE;
    }

    /**
     * @return value of the state named {@code stateName}, ignoring case
     */
    public OptionalInt stateValue(String stateName) {
        if (stateName == null) {
            return OptionalInt.empty();
        }
        for (Map.Entry<String, Integer> state : states.entrySet()) {
            if (state.getKey().equalsIgnoreCase(stateName.trim())) {
                return OptionalInt.of(state.getValue());
            }
        }
        return OptionalInt.empty();
    }

    /**
     * @return name of the first state whose value equals {@code value}
     */
    public Optional<String> stateName(double value) {
        for (Map.Entry<String, Integer> state : states.entrySet()) {
            if (state.getValue() == value) {
                return Optional.of(state.getKey());
            }
        }
        return Optional.empty();
    }
}
