package com.opsbuddy.relay;

@FunctionalInterface
public interface RelayMessageHandler {

    void onMessage(String channel, String message);
}
