package com.engagewatch.slack.link;

import java.util.Objects;

/**
 * A message addressed by channel id and ts ("1700000000.123456").
 */
public record MessageRef(String channel, String ts) {

    public MessageRef {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(ts, "ts");
    }

    @Override
    public String toString() {
        return channel + "/" + ts;
    }
}
