package com.texflow.core.events;

/**
 * Outbound broadcast channel consumed by the external notification layer.
 * No subscription side is part of the pipeline.
 */
public interface PubSubChannel {

    void publish(String channel, String message);
}
