package com.disksentinel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * SMART 属性模型
 *
 * 对应 smartctl -A 属性表中的一行：
 * ID# ATTRIBUTE_NAME FLAG VALUE WORST THRESH TYPE UPDATED WHEN_FAILED RAW_VALUE
 */
@Value
@Builder
public class SmartAttribute {

    int id;

    String name;

    /**
     * 当前归一化值
     */
    int value;

    /**
     * 历史最差值
     */
    int worst;

    /**
     * 失效阈值
     */
    int threshold;

    /**
     * 厂商原始值（取原始列的首个整数）
     */
    @JsonProperty("raw_value")
    long rawValue;
}
