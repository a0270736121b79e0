package com.disksentinel.model;

import lombok.Value;

/**
 * 块设备 - 每次枚举时重新生成，不做缓存
 */
@Value
public class Device {
    String name;
    DeviceKind kind;
}
