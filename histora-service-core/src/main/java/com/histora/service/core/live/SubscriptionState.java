package com.histora.service.core.live;

public enum SubscriptionState {
    OPEN,
    CLOSED
}
