package com.jobbus.client;

public enum EntityKind {
    TOPIC_SENDER,
    SUBSCRIPTION_RECEIVER,
    DEAD_LETTER_RECEIVER
}
