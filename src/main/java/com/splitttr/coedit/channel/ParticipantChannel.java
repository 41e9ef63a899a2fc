package com.splitttr.coedit.channel;

/**
 * Outbound half of one participant's connection. Implementations must not throw
 * from {@link #send(String)}; a failed or timed out send is reported as a
 * {@link DeliveryResult}.
 */
public interface ParticipantChannel {

    String id();

    DeliveryResult send(String payload);
}
