package io.fullerstack.series;

import io.fullerstack.series.model.SeriesDefinition;

import java.util.*;

/**
 * Immutable lookup of series definitions by id (ignoring case) and by name
 * (ignoring case, first declared wins). Changes produce a new index.
 */
final class SeriesIndex {

    private final List<SeriesDefinition> definitions;
    private final Map<String, SeriesDefinition> byId;
    private final Map<String, SeriesDefinition> byName;

    SeriesIndex(List<SeriesDefinition> definitions) {
        this.definitions = List.copyOf(definitions);
        Map<String, SeriesDefinition> ids = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        Map<String, SeriesDefinition> names = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (SeriesDefinition definition : this.definitions) {
            ids.putIfAbsent(definition.id(), definition);
            names.putIfAbsent(definition.name(), definition);
        }
        this.byId = Collections.unmodifiableMap(ids);
        this.byName = Collections.unmodifiableMap(names);
    }

    List<SeriesDefinition> definitions() {
        return definitions;
    }

    boolean containsId(String id) {
        return byId.containsKey(id);
    }

    Optional<SeriesDefinition> resolve(String idOrName) {
        if (idOrName == null) {
            return Optional.empty();
        }
        SeriesDefinition definition = byId.get(idOrName);
        return Optional.ofNullable(definition != null ? definition : byName.get(idOrName));
    }

    /**
     * Resolves each id or name once; unknown entries are skipped and duplicates
     * collapse onto the first occurrence.
     */
    List<SeriesDefinition> resolveAll(Collection<String> idsOrNames) {
        Map<String, SeriesDefinition> resolved = new LinkedHashMap<>();
        for (String idOrName : idsOrNames) {
            resolve(idOrName).ifPresent(definition -> resolved.putIfAbsent(definition.id(), definition));
        }
        return new ArrayList<>(resolved.values());
    }

    SeriesIndex with(SeriesDefinition added) {
        List<SeriesDefinition> extended = new ArrayList<>(definitions);
        extended.add(added);
        return new SeriesIndex(extended);
    }
}
