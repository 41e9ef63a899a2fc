package com.splitttr.coedit.session;

import java.util.List;

/**
 * Result of one flush: {@code recipients} counts the participants whose outbox
 * drained cleanly; {@code failures} lists the ones dropped for a failed send.
 */
public record BroadcastReport(int recipients, List<ChannelDeliveryFailure> failures) {

    static final BroadcastReport NONE = new BroadcastReport(0, List.of());

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public List<String> failedUserIds() {
        return failures.stream().map(ChannelDeliveryFailure::userId).toList();
    }
}
