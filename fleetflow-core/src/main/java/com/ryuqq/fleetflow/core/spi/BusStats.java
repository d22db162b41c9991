package com.ryuqq.fleetflow.core.spi;

import java.util.Map;

/**
 * Point-in-time bus statistics.
 *
 * @param subscriberCounts channel name to number of subscribers
 * @param messagesLogged total number of audit entries ever written
 * @param queueDepths channel name to number of buffered, undelivered messages
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public record BusStats(Map<String, Integer> subscriberCounts, long messagesLogged, Map<String, Integer> queueDepths) {

    public BusStats {
        subscriberCounts = subscriberCounts == null ? Map.of() : Map.copyOf(subscriberCounts);
        queueDepths = queueDepths == null ? Map.of() : Map.copyOf(queueDepths);
    }

    public int subscriberCount(String channel) {
        return subscriberCounts.getOrDefault(channel, 0);
    }

    public int queueDepth(String channel) {
        return queueDepths.getOrDefault(channel, 0);
    }
}
