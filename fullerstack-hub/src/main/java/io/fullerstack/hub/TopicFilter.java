package io.fullerstack.hub;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Immutable set of topics a subscription is interested in.
 *
 * <p>An empty filter matches every value, including values published without a
 * topic. A non-empty filter never matches a topic-less value.
 *
 * <p>With wildcards enabled, topics are split into levels on the configured
 * separator and two wildcard levels are recognised:
 * <ul>
 *   <li>{@code +} matches exactly one level: {@code plant/+/temp} matches
 *       {@code plant/line1/temp}</li>
 *   <li>{@code #} matches the parent level and every level below it, and may only
 *       appear as the final level: {@code plant/#} matches {@code plant} and
 *       {@code plant/line1/temp}</li>
 * </ul>
 * Without wildcards topics match by plain equality.
 */
final class TopicFilter {

    static final String SINGLE_LEVEL = "+";
    static final String MULTI_LEVEL = "#";

    private final Set<String> topics;
    private final boolean wildcards;
    private final String separator;
    private final Pattern splitter;

    private TopicFilter(Set<String> topics, boolean wildcards, String separator) {
        this.topics = Collections.unmodifiableSet(topics);
        this.wildcards = wildcards;
        this.separator = separator;
        this.splitter = Pattern.compile(Pattern.quote(separator));
    }

    static TopicFilter of(Collection<String> topics, HubOptions options) {
        TopicFilter empty = new TopicFilter(new LinkedHashSet<>(), options.isWildcardTopics(), options.getTopicLevelSeparator());
        return topics == null ? empty : empty.update(topics, List.of());
    }

    /**
     * @return a new filter with {@code add} added and then {@code remove} removed
     * @throws IllegalArgumentException if an added topic is blank or a malformed wildcard
     */
    TopicFilter update(Collection<String> add, Collection<String> remove) {
        Set<String> next = new LinkedHashSet<>(topics);
        if (add != null) {
            for (String topic : add) {
                validate(topic);
                next.add(topic);
            }
        }
        if (remove != null) {
            next.removeAll(remove);
        }
        return new TopicFilter(next, wildcards, separator);
    }

    boolean isEmpty() {
        return topics.isEmpty();
    }

    Set<String> topics() {
        return topics;
    }

    boolean matches(String topic) {
        if (topics.isEmpty()) {
            return true;
        }
        if (topic == null) {
            return false;
        }
        if (topics.contains(topic)) {
            return true;
        }
        if (!wildcards) {
            return false;
        }
        for (String pattern : topics) {
            if (isWildcard(pattern) && matchesLevels(splitter.split(pattern, -1), splitter.split(topic, -1))) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesLevels(String[] pattern, String[] topic) {
        for (int i = 0; i < pattern.length; i++) {
            if (MULTI_LEVEL.equals(pattern[i])) {
                return true;
            }
            if (i >= topic.length) {
                return false;
            }
            if (!SINGLE_LEVEL.equals(pattern[i]) && !pattern[i].equals(topic[i])) {
                return false;
            }
        }
        return pattern.length == topic.length;
    }

    private boolean isWildcard(String pattern) {
        return pattern.contains(SINGLE_LEVEL) || pattern.contains(MULTI_LEVEL);
    }

    private void validate(String topic) {
        Objects.requireNonNull(topic, "topic cannot be null");
        if (topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be blank");
        }
        if (!wildcards || !isWildcard(topic)) {
            return;
        }
        String[] levels = splitter.split(topic, -1);
        for (int i = 0; i < levels.length; i++) {
            String level = levels[i];
            boolean hasWildcard = level.contains(SINGLE_LEVEL) || level.contains(MULTI_LEVEL);
            if (hasWildcard && !(SINGLE_LEVEL.equals(level) || MULTI_LEVEL.equals(level))) {
                throw new IllegalArgumentException(
                    "Wildcard must occupy a whole topic level: '" + topic + "'"
                );
            }
            if (MULTI_LEVEL.equals(level) && i != levels.length - 1) {
                throw new IllegalArgumentException(
                    "'" + MULTI_LEVEL + "' is only allowed as the last topic level: '" + topic + "'"
                );
            }
        }
    }

    @Override
    public String toString() {
        return topics.isEmpty() ? "<all>" : topics.toString();
    }
}
