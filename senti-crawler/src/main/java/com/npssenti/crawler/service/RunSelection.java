package com.npssenti.crawler.service;

import com.npssenti.crawler.model.SourceType;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Source selection for a plain (non-scheduled) run.
 *
 * @param only       source types to run; empty means all
 * @param forumSites forum site keys to run; empty means every enabled site
 * @param noGdelt    disables the news index even when selected
 * @param maxFetch   fetch cap for the run, null to use the configured limit
 */
public record RunSelection(Set<SourceType> only, Set<String> forumSites, boolean noGdelt, Integer maxFetch) {

    /**
     * Builds a selection from comma-separated flag values.
     *
     * @throws IllegalArgumentException for an unknown source group in {@code only}
     */
    public static RunSelection parse(String only, String forumSites, boolean noGdelt, Integer maxFetch) {
        Set<SourceType> types = csv(only).stream()
                .map(SourceType::fromGroup)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return new RunSelection(types, csv(forumSites), noGdelt, maxFetch);
    }

    public static RunSelection all() {
        return new RunSelection(Set.of(), Set.of(), false, null);
    }

    public boolean includes(SourceType type) {
        if (type == SourceType.NEWS_INDEX && noGdelt) {
            return false;
        }
        return only.isEmpty() || only.contains(type);
    }

    public boolean explicitlyRequested(SourceType type) {
        return only.contains(type);
    }

    private static Set<String> csv(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
