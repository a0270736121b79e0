package com.disksentinel.service;

import com.disksentinel.config.ApplicationConfig;
import com.disksentinel.device.ProcessResult;
import com.disksentinel.device.ProcessRunner;
import com.disksentinel.exception.DeviceAccessDeniedException;
import com.disksentinel.exception.ToolExecutionException;
import com.disksentinel.exception.ToolUnavailableException;
import com.disksentinel.model.Device;
import com.disksentinel.model.EraseConfirmation;
import com.disksentinel.model.SmartAttribute;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeviceGatewayTest {

    private final List<List<String>> commands = new ArrayList<>();
    private ApplicationConfig config;
    private ProcessResult nextResult;
    private RuntimeException nextFailure;
    private DeviceGateway gateway;

    @BeforeEach
    void setUp() {
        config = new ApplicationConfig();
        ProcessRunner runner = (command, timeout) -> {
            commands.add(command);
            if (nextFailure != null) throw nextFailure;
            return nextResult;
        };
        gateway = new DeviceGateway(config, runner, new SmartAttributeParser());
    }

    @Test
    void lists_only_whole_disks() {
        nextResult = new ProcessResult(0, "sda  disk\nsr0  rom\nsdb  disk\nloop0 loop\n", "");

        List<Device> devices = gateway.listDevices();

        assertThat(devices).extracting(Device::getName).containsExactly("sda", "sdb");
        assertThat(commands.get(0)).containsExactly("lsblk", "-d", "-n", "-o", "NAME,TYPE");
    }

    @Test
    void empty_lsblk_output_gives_empty_list() {
        nextResult = new ProcessResult(0, "", "");
        assertThat(gateway.listDevices()).isEmpty();
    }

    @Test
    void lsblk_failure_carries_stderr() {
        nextResult = new ProcessResult(32, "", "lsblk: failed to access sysfs directory");

        assertThatThrownBy(() -> gateway.listDevices())
                .isInstanceOfSatisfying(ToolExecutionException.class, e -> {
                    assertThat(e.getExitCode()).isEqualTo(32);
                    assertThat(e.getStderr()).contains("sysfs");
                });
    }

    @Test
    void missing_tool_is_reported_as_unavailable() {
        nextFailure = new ToolUnavailableException("lsblk", new java.io.IOException("No such file or directory"));

        assertThatThrownBy(() -> gateway.listDevices()).isInstanceOf(ToolUnavailableException.class);
    }

    @Test
    void smart_attributes_are_parsed_from_smartctl_output() {
        nextResult = new ProcessResult(0,
                "ID# ATTRIBUTE_NAME FLAG VALUE WORST THRESH TYPE UPDATED WHEN_FAILED RAW_VALUE\n"
                        + "  9 Power_On_Hours  0x0032  100  100  000  Old_age  Always  -  1234\n", "");

        Map<String, SmartAttribute> attrs = gateway.fetchSmartAttributes("sda");

        assertThat(attrs).containsOnlyKeys("Power_On_Hours");
        assertThat(attrs.get("Power_On_Hours").getRawValue()).isEqualTo(1234L);
        assertThat(commands.get(0)).containsExactly("smartctl", "-A", "/dev/sda");
    }

    @Test
    void any_non_zero_smartctl_status_fails() {
        // bit 2: SMART 命令失败，stdout 仍有属性表
        nextResult = new ProcessResult(4,
                "  5 Reallocated_Sector_Ct 0x0033 200 200 140 Pre-fail Always - 8\n", "");

        assertThatThrownBy(() -> gateway.fetchSmartText("sda"))
                .isInstanceOfSatisfying(ToolExecutionException.class, e -> {
                    assertThat(e.getExitCode()).isEqualTo(4);
                    assertThat(e.getStderr()).contains("Reallocated_Sector_Ct");
                });
    }

    @Test
    void smartctl_health_status_bit_fails_attribute_fetch() {
        // bit 5: 曾有属性低于阈值
        nextResult = new ProcessResult(32,
                "  5 Reallocated_Sector_Ct 0x0033 200 200 140 Pre-fail Always - 8\n", "");

        assertThatThrownBy(() -> gateway.fetchSmartAttributes("sda"))
                .isInstanceOf(ToolExecutionException.class);
    }

    @Test
    void smartctl_open_failure_on_stdout_maps_to_access_denied() {
        nextResult = new ProcessResult(2,
                "Smartctl open device: /dev/sda failed: Permission denied\n", "");

        assertThatThrownBy(() -> gateway.fetchSmartText("sda"))
                .isInstanceOf(DeviceAccessDeniedException.class)
                .hasMessageContaining("Permission denied");
    }

    @Test
    void smartctl_other_failure_maps_to_tool_error() {
        nextResult = new ProcessResult(1, "", "smartctl: unrecognized option '-Q'");

        assertThatThrownBy(() -> gateway.fetchSmartText("sda"))
                .isInstanceOfSatisfying(ToolExecutionException.class,
                        e -> assertThat(e.getStderr()).contains("unrecognized option"));
    }

    @Test
    void path_like_device_names_are_rejected_before_running_tools() {
        assertThatThrownBy(() -> gateway.fetchSmartText("../sda")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> gateway.fetchSmartText(".hidden")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> gateway.secureErase("sda;reboot")).isInstanceOf(IllegalArgumentException.class);
        assertThat(commands).isEmpty();
    }

    @Test
    void secure_erase_invokes_hdparm_with_configured_password() {
        config.getErase().setPassword("s3cret");
        nextResult = new ProcessResult(0, "security_password: \"s3cret\"\n", "");

        EraseConfirmation confirmation = gateway.secureErase("sdb");

        assertThat(confirmation.getDrive()).isEqualTo("sdb");
        assertThat(commands.get(0)).containsExactly(
                "hdparm", "--user-master", "u", "--security-erase", "s3cret", "/dev/sdb");
    }

    @Test
    void secure_erase_failure_is_typed() {
        nextResult = new ProcessResult(5, "", "SECURITY_ERASE: Input/output error");

        assertThatThrownBy(() -> gateway.secureErase("sdb")).isInstanceOf(ToolExecutionException.class);
    }
}
