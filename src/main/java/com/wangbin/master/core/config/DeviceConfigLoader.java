package com.wangbin.master.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.master.common.exception.ConfigException;
import com.wangbin.master.core.address.AddressResolver;
import com.wangbin.master.core.codec.ModbusUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 设备配置加载
 */
@Slf4j
@Component
public class DeviceConfigLoader {

    private static final TypeReference<List<Map<String, Object>>> DEVICE_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final DeviceConfigValidator validator;

    public DeviceConfigLoader(ObjectMapper objectMapper, DeviceConfigValidator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    /**
     * 从文件加载设备列表，依次尝试类路径、绝对路径、相对路径
     */
    public List<DeviceConfig> loadFromPath(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            throw ConfigException.loadError("设备配置文件路径不能为空", null);
        }

        log.info("开始加载设备配置: {}", filePath);
        List<Map<String, Object>> rawDevices;
        try (InputStream inputStream = open(filePath)) {
            rawDevices = objectMapper.readValue(inputStream, DEVICE_LIST_TYPE);
        } catch (IOException e) {
            throw ConfigException.loadError("读取设备配置失败: " + filePath + ", " + e.getMessage(), e);
        }
        return build(rawDevices);
    }

    /**
     * 从 JSON 字符串加载设备列表
     */
    public List<DeviceConfig> loadFromJson(String json) {
        if (json == null || json.isBlank()) {
            throw ConfigException.loadError("设备配置 JSON 不能为空", null);
        }
        List<Map<String, Object>> rawDevices;
        try {
            rawDevices = objectMapper.readValue(json, DEVICE_LIST_TYPE);
        } catch (IOException e) {
            throw ConfigException.loadError("设备配置 JSON 格式错误: " + e.getMessage(), e);
        }
        return build(rawDevices);
    }

    private InputStream open(String filePath) throws IOException {
        Resource resource = new ClassPathResource(filePath);
        if (resource.exists()) {
            log.debug("从类路径加载文件: {}", filePath);
            return resource.getInputStream();
        }

        Path path = Paths.get(filePath);
        if (Files.exists(path)) {
            log.debug("从绝对路径加载文件: {}", filePath);
            return Files.newInputStream(path);
        }

        Path relativePath = Paths.get("src/main/resources/", filePath);
        if (Files.exists(relativePath)) {
            log.debug("从相对路径加载文件: {}", relativePath);
            return Files.newInputStream(relativePath);
        }
        throw new IOException("文件不存在: " + filePath);
    }

    private List<DeviceConfig> build(List<Map<String, Object>> rawDevices) {
        validator.validate(rawDevices);

        List<DeviceConfig> devices = new ArrayList<>(rawDevices.size());
        for (Map<String, Object> raw : rawDevices) {
            devices.add(toDeviceConfig(raw));
        }
        log.info("成功加载 {} 个 Modbus 设备", devices.size());
        return List.copyOf(devices);
    }

    private DeviceConfig toDeviceConfig(Map<String, Object> raw) {
        Map<String, Object> config = ConfigMaps.getMap(raw, "config");
        long deviceCycle = ConfigMaps.getLong(config, "cycle_time_ms");

        List<IoPoint> points = new ArrayList<>();
        for (Map<String, Object> point : ConfigMaps.getMapList(config, "io_points")) {
            points.add(toIoPoint(point, deviceCycle));
        }

        Long unitId = ConfigMaps.getLong(config, "unit_id");
        Boolean bigEndian = ConfigMaps.getBoolean(config, "big_endian");
        return DeviceConfig.builder()
                .name(ConfigMaps.getString(raw, "name"))
                .host(ConfigMaps.getString(config, "host"))
                .port(ConfigMaps.getLong(config, "port").intValue())
                .timeoutMs(ConfigMaps.getLong(config, "timeout_ms"))
                .cycleTimeMs(deviceCycle)
                .unitId(unitId != null ? unitId.intValue() : DeviceConfig.DEFAULT_UNIT_ID)
                .bigEndian(Boolean.TRUE.equals(bigEndian))
                .ioPoints(List.copyOf(points))
                .build();
    }

    private IoPoint toIoPoint(Map<String, Object> point, long deviceCycle) {
        String rawOffset = ConfigMaps.getString(point, "offset");
        Long cycle = ConfigMaps.getLong(point, "cycle_time_ms");
        return IoPoint.builder()
                .functionCode(FunctionCode.fromCode(ConfigMaps.getLong(point, "fc").intValue()))
                .rawOffset(rawOffset)
                .offset(ModbusUtils.parseOffset(rawOffset))
                .location(AddressResolver.parse(ConfigMaps.getString(point, "iec_location")))
                .length(ConfigMaps.getLong(point, "len").intValue())
                .cycleTimeMs(cycle != null ? cycle : deviceCycle)
                .build();
    }
}
