package io.agentmesh.server.events;

/**
 * What a bounded delivery queue does when it is full.
 */
public enum OverflowPolicy {
    /**
     * Evict the oldest queued item to make room; the publisher never waits.
     */
    DROP_OLDEST,
    /**
     * Make the publisher wait for room, up to a timeout after which the new item is dropped
     * for that subscriber only.
     */
    BLOCK_PUBLISHER
}
