package com.disksentinel.device;

/**
 * 原始块读取原语，与三个外部工具调用相互独立
 */
public interface BlockDeviceReader {

    /**
     * 设备可寻址总字节数
     */
    long sizeOf(String device);

    DeviceChannel open(String device);
}
