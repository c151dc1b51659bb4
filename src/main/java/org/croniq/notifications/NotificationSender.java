package org.croniq.notifications;

/**
 * Thin adapter to one external transport.
 */
public interface NotificationSender {

    /** The channel type this sender delivers to. */
    ChannelType channelType();

    /**
     * @param channel destination, its configuration carries the address / URL / key
     * @param payload normalized alert content
     * @return true if the transport accepted the message
     */
    boolean send(NotificationChannel channel, NotificationPayload payload);
}
