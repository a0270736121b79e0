package com.disksentinel.service;

import com.disksentinel.config.ApplicationConfig;
import com.disksentinel.device.ProcessResult;
import com.disksentinel.device.ProcessRunner;
import com.disksentinel.exception.DeviceAccessDeniedException;
import com.disksentinel.exception.ToolExecutionException;
import com.disksentinel.model.Device;
import com.disksentinel.model.DeviceKind;
import com.disksentinel.model.EraseConfirmation;
import com.disksentinel.model.SmartAttribute;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 外部工具网关
 *
 * 职责：
 * - lsblk 枚举磁盘
 * - smartctl 读取 SMART 文本
 * - hdparm 安全擦除（破坏性操作，只由擦除接口显式调用）
 * - 将退出码与 stderr 归一为类型化异常
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceGateway {

    private static final Pattern DEVICE_NAME = Pattern.compile("[A-Za-z0-9._-]+");

    private static final List<String> ACCESS_DENIED_MARKERS = List.of(
            "permission denied",
            "operation not permitted",
            "no such file",
            "no such device",
            "unable to detect device type",
            "requires root",
            "must be root");

    private final ApplicationConfig config;
    private final ProcessRunner processRunner;
    private final SmartAttributeParser parser;

    public List<Device> listDevices() {
        ApplicationConfig.Tools tools = config.getTools();
        ProcessResult result = processRunner.run(
                List.of(tools.getLsblkPath(), "-d", "-n", "-o", "NAME,TYPE"), tools.getTimeout());
        if (!result.isSuccess()) {
            log.warn("lsblk failed with status {}: {}", result.getExitCode(), result.getStderr().trim());
            throw new ToolExecutionException(null, tools.getLsblkPath(), result.getExitCode(), result.getStderr());
        }
        List<Device> devices = new ArrayList<>();
        for (String line : result.getStdout().split("\\R")) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length == 2 && DeviceKind.fromLsblkType(parts[1]) == DeviceKind.DISK) {
                devices.add(new Device(parts[0], DeviceKind.DISK));
            }
        }
        log.info("Detected drives: {}", devices.stream().map(Device::getName).toList());
        return devices;
    }

    public String fetchSmartText(String device) {
        requireValidName(device);
        ApplicationConfig.Tools tools = config.getTools();
        List<String> command = List.of(tools.getSmartctlPath(), "-A", config.deviceArgument(device));
        log.info("Running command: {}", String.join(" ", command));

        ProcessResult result = processRunner.run(command, tools.getTimeout());
        if (!result.getStderr().isBlank()) {
            log.warn("smartctl stderr for {}: {}", device, result.getStderr().trim());
        }
        if (!result.isSuccess()) {
            // smartctl 多数错误写在 stdout，stderr 为空时退回检查 stdout
            String diagnostic = result.getStderr().isBlank() ? result.getStdout() : result.getStderr();
            log.warn("smartctl exited with status 0x{} for {}", Integer.toHexString(result.getExitCode()), device);
            if (indicatesAccessProblem(diagnostic)) {
                throw new DeviceAccessDeniedException(device, diagnostic.trim());
            }
            throw new ToolExecutionException(device, tools.getSmartctlPath(), result.getExitCode(), diagnostic);
        }
        return result.getStdout();
    }

    public Map<String, SmartAttribute> fetchSmartAttributes(String device) {
        Map<String, SmartAttribute> attributes = parser.parse(fetchSmartText(device));
        log.info("Parsed {} SMART attributes for {}", attributes.size(), device);
        return attributes;
    }

    public EraseConfirmation secureErase(String device) {
        requireValidName(device);
        ApplicationConfig.Tools tools = config.getTools();
        List<String> command = List.of(tools.getHdparmPath(),
                "--user-master", "u",
                "--security-erase", config.getErase().getPassword(),
                config.deviceArgument(device));
        log.warn("Issuing secure erase on {}", device);

        ProcessResult result = processRunner.run(command, tools.getTimeout());
        if (!result.isSuccess()) {
            if (indicatesAccessProblem(result.getStderr())) {
                throw new DeviceAccessDeniedException(device, result.getStderr().trim());
            }
            throw new ToolExecutionException(device, tools.getHdparmPath(), result.getExitCode(), result.getStderr());
        }
        log.warn("Secure erase finished on {}", device);
        return new EraseConfirmation(device, result.getStdout());
    }

    /**
     * 设备名只允许简单名称，防止拼接成任意路径
     */
    public static String requireValidName(String device) {
        if (device == null || !DEVICE_NAME.matcher(device).matches() || device.startsWith(".")) {
            throw new IllegalArgumentException("Invalid device name: " + device);
        }
        return device;
    }

    private static boolean indicatesAccessProblem(String text) {
        if (text == null) return false;
        String lower = text.toLowerCase(Locale.ROOT);
        return ACCESS_DENIED_MARKERS.stream().anyMatch(lower::contains);
    }
}
