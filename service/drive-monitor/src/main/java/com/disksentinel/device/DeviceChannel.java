package com.disksentinel.device;

import java.io.Closeable;

/**
 * 一次扫描期间打开的设备读通道
 */
public interface DeviceChannel extends Closeable {

    /**
     * 从 offset 处定位读取 length 字节，返回实际读到的字节数。
     *
     * @throws com.disksentinel.exception.BadSectorException 该分块读取失败
     * @throws com.disksentinel.exception.DeviceUnavailableException 设备已不可用
     */
    int read(long offset, int length);

    @Override
    void close();
}
