package com.splitttr.coedit.session;

/**
 * A participant whose outbound send failed and who was dropped from the session
 * because of it.
 */
public record ChannelDeliveryFailure(String sessionId, String userId, String channelId, String reason) {}
