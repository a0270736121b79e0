package com.disksentinel.websocket;

import java.io.IOException;

/**
 * 一个在线的推送连接
 */
public interface Subscriber {

    String getId();

    boolean isOpen();

    void send(String payload) throws IOException;

    /**
     * 发送存活探测
     */
    void ping() throws IOException;

    /**
     * 最近一次收到对端数据（pong 或消息）的时间，epoch 毫秒
     */
    long getLastActivityMs();

    void close();
}
