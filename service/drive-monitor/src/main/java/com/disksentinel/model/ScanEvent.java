package com.disksentinel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * 推送给订阅端的事件，创建后不可变
 *
 * 线上格式：
 * {"type":"scan_progress","drive":"sda","progress":25,"bad_sectors":0}
 * {"type":"scan_complete","drive":"sda"}
 * {"type":"info","message":"connected"}
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanEvent {

    ScanEventType type;

    @JsonProperty("drive")
    String device;

    @JsonProperty("progress")
    Integer progressPercent;

    @JsonProperty("bad_sectors")
    Long badSectors;

    String message;

    public static ScanEvent progress(String device, int percent, long badSectors) {
        return ScanEvent.builder()
                .type(ScanEventType.PROGRESS)
                .device(device)
                .progressPercent(percent)
                .badSectors(badSectors)
                .build();
    }

    public static ScanEvent completed(String device, long badSectors) {
        return ScanEvent.builder().type(ScanEventType.COMPLETE).device(device).badSectors(badSectors).build();
    }

    public static ScanEvent failed(String device, String message) {
        return ScanEvent.builder().type(ScanEventType.FAILED).device(device).message(message).build();
    }

    public static ScanEvent cancelled(String device) {
        return ScanEvent.builder().type(ScanEventType.CANCELLED).device(device).build();
    }

    public static ScanEvent info(String message) {
        return ScanEvent.builder().type(ScanEventType.INFO).message(message).build();
    }

    public static ScanEvent error(String message) {
        return ScanEvent.builder().type(ScanEventType.ERROR).message(message).build();
    }
}
