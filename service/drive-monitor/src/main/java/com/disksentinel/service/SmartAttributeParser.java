package com.disksentinel.service;

import com.disksentinel.model.SmartAttribute;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * smartctl 属性表解析
 *
 * 职责：
 * - 逐行匹配固定列布局：ID# NAME FLAG VALUE WORST THRESH TYPE UPDATED WHEN_FAILED RAW_VALUE
 * - 不匹配的行（版本横幅、表头、空行）直接跳过
 * - 数值溢出的行单独丢弃，不影响其他行
 * - 重名属性以最后一次出现为准
 */
@Slf4j
@Component
public class SmartAttributeParser {

    private static final Pattern ATTRIBUTE_LINE = Pattern.compile(
            "^\\s*(\\d+)\\s+(\\S+)\\s+0x[0-9A-Fa-f]+\\s+(\\d+)\\s+(\\d+)\\s+(\\d+)\\s+\\S+\\s+\\S+\\s+\\S+\\s+(\\d+)");

    public Map<String, SmartAttribute> parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return Collections.emptyMap();
        }
        Map<String, SmartAttribute> attributes = new LinkedHashMap<>();
        for (String line : rawText.split("\\R")) {
            Matcher m = ATTRIBUTE_LINE.matcher(line);
            if (!m.lookingAt()) {
                continue;
            }
            try {
                SmartAttribute attr = SmartAttribute.builder()
                        .id(Integer.parseInt(m.group(1)))
                        .name(m.group(2))
                        .value(Integer.parseInt(m.group(3)))
                        .worst(Integer.parseInt(m.group(4)))
                        .threshold(Integer.parseInt(m.group(5)))
                        .rawValue(Long.parseLong(m.group(6)))
                        .build();
                attributes.put(attr.getName(), attr);
            } catch (NumberFormatException e) {
                log.debug("Dropping SMART line with unparsable numbers: {}", line.trim());
            }
        }
        return attributes;
    }
}
