package io.fullerstack.series.query;

import io.fullerstack.series.model.SeriesDefinition;
import lombok.Builder;
import lombok.Getter;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Series search criteria with paging.
 *
 * <p>Each pattern is optional; a blank pattern matches every series. Patterns use
 * {@code *} and {@code ?} wildcards, ignore case and may match anywhere in the
 * field. Results are ordered by name, ignoring case.
 */
@Getter
public final class SeriesFilter {

    private final String name;
    private final String description;
    private final String units;
    private final int page;
    private final int pageSize;

    @Builder(toBuilder = true)
    private SeriesFilter(String name, String description, String units, Integer page, Integer pageSize) {
        this.name = name;
        this.description = description;
        this.units = units;
        this.page = page != null ? page : 1;
        this.pageSize = pageSize != null ? pageSize : 100;
        if (this.page < 1) {
            throw new IllegalArgumentException("page must be at least 1, was " + this.page);
        }
        if (this.pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1, was " + this.pageSize);
        }
    }

    /**
     * First page of every series.
     */
    public static SeriesFilter all() {
        return builder().build();
    }

    /**
     * Filters, orders and pages {@code candidates}.
     */
    public List<SeriesDefinition> apply(List<SeriesDefinition> candidates) {
        LikePattern namePattern = LikePattern.compile(name);
        LikePattern descriptionPattern = LikePattern.compile(description);
        LikePattern unitsPattern = LikePattern.compile(units);
        return candidates.stream()
            .filter(s -> matches(namePattern, s.name())
                && matches(descriptionPattern, s.description())
                && matches(unitsPattern, s.units()))
            .sorted(Comparator.comparing(SeriesDefinition::name, String.CASE_INSENSITIVE_ORDER))
            .skip((long) pageSize * (page - 1))
            .limit(pageSize)
            .collect(Collectors.toList());
    }

    private static boolean matches(LikePattern pattern, String value) {
        return pattern == null || pattern.matches(value);
    }

    @Override
    public String toString() {
        return "SeriesFilter[name=" + name + ", description=" + description + ", units=" + units
            + ", page=" + page + ", pageSize=" + pageSize + "]";
    }
}
