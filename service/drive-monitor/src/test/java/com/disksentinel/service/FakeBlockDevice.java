package com.disksentinel.service;

import com.disksentinel.device.BlockDeviceReader;
import com.disksentinel.device.DeviceChannel;
import com.disksentinel.exception.BadSectorException;
import com.disksentinel.exception.DeviceUnavailableException;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;

/**
 * 内存中的假设备：可配置坏扇区、消失位置、读取闸门与挂起的设备名
 */
class FakeBlockDevice implements BlockDeviceReader {

    final long size;
    final Set<Long> badOffsets = new HashSet<>();
    final List<Long> reads = new CopyOnWriteArrayList<>();
    volatile Long vanishAt;
    volatile CountDownLatch gate;
    volatile LongConsumer onRead = offset -> { };
    volatile boolean openFails;
    // 这些设备的读取一直阻塞，直到 release 打开
    final Set<String> hung = ConcurrentHashMap.newKeySet();
    final CountDownLatch release = new CountDownLatch(1);

    FakeBlockDevice(long size) {
        this.size = size;
    }

    @Override
    public long sizeOf(String device) {
        return size;
    }

    @Override
    public DeviceChannel open(String device) {
        if (openFails) {
            throw new DeviceUnavailableException(device, "Device not found: /dev/" + device);
        }
        return new DeviceChannel() {
            @Override
            public int read(long offset, int length) {
                if (hung.contains(device)) {
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                CountDownLatch g = gate;
                if (g != null) {
                    try {
                        g.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                reads.add(offset);
                onRead.accept(offset);
                if (vanishAt != null && offset >= vanishAt) {
                    throw new DeviceUnavailableException(device, "Device disappeared: /dev/" + device);
                }
                if (badOffsets.contains(offset)) {
                    throw new BadSectorException(device, offset, new IOException("Input/output error"));
                }
                return length;
            }

            @Override
            public void close() {
            }
        };
    }
}
