package com.npssenti.crawler.service.discovery;

/**
 * Per-call bounds handed to a discoverer.
 *
 * @param maxCandidates cap on candidates returned for the target
 * @param quotaBudget   API units the call may spend; only the video source consumes quota
 */
public record DiscoveryLimits(int maxCandidates, int quotaBudget) {

    public static DiscoveryLimits unmetered(int maxCandidates) {
        return new DiscoveryLimits(maxCandidates, Integer.MAX_VALUE);
    }
}
