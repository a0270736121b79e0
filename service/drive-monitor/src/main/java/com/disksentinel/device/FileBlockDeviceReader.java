package com.disksentinel.device;

import com.disksentinel.config.ApplicationConfig;
import com.disksentinel.exception.BadSectorException;
import com.disksentinel.exception.DeviceAccessDeniedException;
import com.disksentinel.exception.DeviceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 基于 FileChannel 的设备读取。
 *
 * 块设备的 st_size 为 0，因此容量优先取 /sys/class/block/&lt;dev&gt;/size（512 字节扇区数），
 * 取不到时再退回到 FileChannel.size()（普通文件、镜像文件）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileBlockDeviceReader implements BlockDeviceReader {

    private static final int SYSFS_SECTOR_SIZE = 512;

    private final ApplicationConfig config;

    @Override
    public long sizeOf(String device) {
        Path sysSize = Path.of(config.getTools().getSysBlockDir(), device, "size");
        if (Files.isReadable(sysSize)) {
            try {
                String text = new String(Files.readAllBytes(sysSize), StandardCharsets.US_ASCII).trim();
                long sectors = Long.parseLong(text);
                if (sectors > 0) {
                    return sectors * SYSFS_SECTOR_SIZE;
                }
            } catch (IOException | NumberFormatException e) {
                log.debug("sysfs size unreadable for {}: {}", device, e.toString());
            }
        }
        Path path = config.devicePath(device);
        try (FileChannel ch = FileChannel.open(path, StandardOpenOption.READ)) {
            return ch.size();
        } catch (NoSuchFileException e) {
            throw new DeviceUnavailableException(device, "Device not found: " + path, e);
        } catch (AccessDeniedException e) {
            throw new DeviceAccessDeniedException(device, "Permission denied: " + path);
        } catch (IOException e) {
            throw new DeviceUnavailableException(device, "Cannot determine size of " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public DeviceChannel open(String device) {
        Path path = config.devicePath(device);
        try {
            return new FileDeviceChannel(device, path, FileChannel.open(path, StandardOpenOption.READ));
        } catch (NoSuchFileException e) {
            throw new DeviceUnavailableException(device, "Device not found: " + path, e);
        } catch (AccessDeniedException e) {
            throw new DeviceAccessDeniedException(device, "Permission denied: " + path);
        } catch (IOException e) {
            throw new DeviceUnavailableException(device, "Cannot open " + path + ": " + e.getMessage(), e);
        }
    }

    private static final class FileDeviceChannel implements DeviceChannel {

        private final String device;
        private final Path path;
        private final FileChannel channel;

        FileDeviceChannel(String device, Path path, FileChannel channel) {
            this.device = device;
            this.path = path;
            this.channel = channel;
        }

        @Override
        public int read(long offset, int length) {
            ByteBuffer buf = ByteBuffer.allocate(length);
            try {
                while (buf.hasRemaining()) {
                    int n = channel.read(buf, offset + buf.position());
                    if (n < 0) {
                        throw new DeviceUnavailableException(device,
                                "Unexpected end of device at offset " + (offset + buf.position()));
                    }
                }
                return buf.position();
            } catch (ClosedChannelException e) {
                throw new DeviceUnavailableException(device, "Device channel closed", e);
            } catch (IOException e) {
                if (!Files.exists(path)) {
                    throw new DeviceUnavailableException(device, "Device disappeared: " + path, e);
                }
                throw new BadSectorException(device, offset, e);
            }
        }

        @Override
        public void close() {
            try {
                channel.close();
            } catch (IOException e) {
                log.warn("Failed to close {}: {}", path, e.getMessage());
            }
        }
    }
}
