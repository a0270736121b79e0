package com.disksentinel.websocket;

import lombok.Value;

@Value
public class SubscriptionHandle {
    String id;
}
