package com.splitttr.coedit.session;

/**
 * Told about participants a session dropped on its own after a failed send. Called
 * without the session lock held.
 */
@FunctionalInterface
public interface DepartureListener {

    DepartureListener NONE = (session, failure) -> {};

    void participantLost(DocumentSession session, ChannelDeliveryFailure failure);
}
