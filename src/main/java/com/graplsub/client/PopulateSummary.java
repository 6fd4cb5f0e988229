package com.graplsub.client;

/**
 * Counts reported once the playlist has been filled.
 *
 * @param albums Albums processed
 * @param songs  Songs added to the playlist
 */
public record PopulateSummary(int albums, int songs) {}
