package com.disease.normalization.api;

import com.disease.normalization.core.model.SourceName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Restricts a search to a subset of sources.
 * Built from comma-separated include or exclude lists, never both.
 */
public final class SourceFilter {

    private static final SourceFilter ALL = new SourceFilter(EnumSet.allOf(SourceName.class));

    private final Set<SourceName> sources;

    private SourceFilter(Set<SourceName> sources) {
        this.sources = Collections.unmodifiableSet(sources);
    }

    public static SourceFilter all() {
        return ALL;
    }

    public static SourceFilter only(SourceName source) {
        return new SourceFilter(EnumSet.of(source));
    }

    /**
     * Parses include/exclude parameters. Blank or null parameters are ignored.
     *
     * @param incl comma-separated source names to search
     * @param excl comma-separated source names to leave out
     * @throws InvalidParameterException if both are given or a name is unknown
     */
    public static SourceFilter of(String incl, String excl) {
        boolean hasIncl = incl != null && !incl.isBlank();
        boolean hasExcl = excl != null && !excl.isBlank();
        if (hasIncl && hasExcl) {
            throw new InvalidParameterException("Cannot request both source inclusions and exclusions.");
        }
        if (hasIncl) {
            return new SourceFilter(parse(incl));
        }
        if (hasExcl) {
            EnumSet<SourceName> remaining = EnumSet.allOf(SourceName.class);
            remaining.removeAll(parse(excl));
            return new SourceFilter(remaining);
        }
        return ALL;
    }

    private static EnumSet<SourceName> parse(String names) {
        EnumSet<SourceName> parsed = EnumSet.noneOf(SourceName.class);
        List<String> invalid = new ArrayList<>();
        for (String raw : names.split(",")) {
            String name = raw.trim();
            if (name.isEmpty()) {
                continue;
            }
            Optional<SourceName> source = SourceName.fromName(name);
            if (source.isPresent()) {
                parsed.add(source.get());
            } else {
                invalid.add(name);
            }
        }
        if (!invalid.isEmpty()) {
            throw new InvalidParameterException("Invalid source name(s): " + invalid);
        }
        return parsed;
    }

    /**
     * Selected sources in priority order.
     */
    public Set<SourceName> sources() {
        return sources;
    }

    public boolean includes(SourceName source) {
        return source != null && sources.contains(source);
    }

    @Override
    public String toString() {
        return "SourceFilter" + sources;
    }
}
