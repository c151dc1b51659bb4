package org.croniq.channels;

import java.util.Map;

/**
 * Partial edit of a channel. The channel type cannot change.
 */
public record ChannelUpdate(String name, Map<String, Object> configurationDetails) {
}
