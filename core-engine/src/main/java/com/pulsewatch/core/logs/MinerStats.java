package com.pulsewatch.core.logs;

/**
 * Counters of one service's template set.
 *
 * @param compressionRatio lines per template, {@code 0} before the first line
 * @since 1.0.0
 */
public record MinerStats(String service, long totalLines, int templateCount, long evictions,
        double compressionRatio, long errorTemplates, long rareTemplates) {
}
