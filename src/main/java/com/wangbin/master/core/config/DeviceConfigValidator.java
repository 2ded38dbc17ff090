package com.wangbin.master.core.config;

import com.wangbin.master.common.exception.ConfigException;
import com.wangbin.master.common.exception.MasterException;
import com.wangbin.master.core.address.AccessDirection;
import com.wangbin.master.core.address.AddressResolver;
import com.wangbin.master.core.address.SymbolicAddress;
import com.wangbin.master.core.codec.ModbusUtils;
import com.wangbin.master.core.codec.RegisterCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 设备配置校验
 * <p>
 * 在设备进入引擎之前检查原始 JSON 结构，发现第一个错误即抛出 {@link ConfigException}。
 */
@Slf4j
@Component
public class DeviceConfigValidator {

    private static final int MAX_FUNCTION_CODE = 255;
    private static final int MAX_LENGTH = 65535;

    public void validate(List<Map<String, Object>> devices) {
        if (devices == null) {
            throw ConfigException.invalid(null, "设备列表不能为空");
        }

        Set<String> names = new HashSet<>();
        Set<String> endpoints = new HashSet<>();
        for (int i = 0; i < devices.size(); i++) {
            Map<String, Object> device = devices.get(i);
            if (device == null) {
                throw ConfigException.invalid(null, "第 " + i + " 个设备为空");
            }

            String name = ConfigMaps.getString(device, "name");
            if (name == null || name.isEmpty()) {
                throw ConfigException.invalid(null, "第 " + i + " 个设备缺少 name");
            }
            if (!names.add(name)) {
                throw ConfigException.invalid(name, "设备名称重复");
            }

            String protocol = ConfigMaps.getString(device, "protocol");
            if (!DeviceConfig.PROTOCOL_MODBUS.equalsIgnoreCase(protocol)) {
                throw ConfigException.invalid(name, "不支持的协议: " + protocol);
            }

            Map<String, Object> config = ConfigMaps.getMap(device, "config");
            if (config == null) {
                throw ConfigException.invalid(name, "缺少 config 节点");
            }

            String endpoint = validateConnection(name, config);
            if (!endpoints.add(endpoint)) {
                throw ConfigException.invalid(name, "连接地址与其他设备重复: " + endpoint);
            }

            validateIoPoints(name, config);
        }
    }

    private String validateConnection(String name, Map<String, Object> config) {
        String host = ConfigMaps.getString(config, "host");
        if (host == null || host.isEmpty()) {
            throw ConfigException.invalid(name, "host 不能为空");
        }

        Long port = ConfigMaps.getLong(config, "port");
        if (port == null || port <= 0 || port > 65535) {
            throw ConfigException.invalid(name, "port 必须在 1-65535 之间: " + config.get("port"));
        }

        requirePositive(name, config, "timeout_ms");
        requirePositive(name, config, "cycle_time_ms");

        if (config.containsKey("unit_id")) {
            Long unitId = ConfigMaps.getLong(config, "unit_id");
            if (unitId == null || unitId < 0 || unitId > 255) {
                throw ConfigException.invalid(name, "unit_id 必须在 0-255 之间: " + config.get("unit_id"));
            }
        }
        if (config.containsKey("big_endian") && ConfigMaps.getBoolean(config, "big_endian") == null) {
            throw ConfigException.invalid(name, "big_endian 必须为布尔值: " + config.get("big_endian"));
        }
        return host.toLowerCase() + ":" + port;
    }

    private void validateIoPoints(String name, Map<String, Object> config) {
        List<Map<String, Object>> points = ConfigMaps.getMapList(config, "io_points");
        if (points == null) {
            throw ConfigException.invalid(name, "io_points 必须为对象数组");
        }
        if (points.isEmpty()) {
            log.warn("设备 {} 未配置 io_points，启动后将直接退出", name);
        }

        for (int i = 0; i < points.size(); i++) {
            validateIoPoint(name, i, points.get(i));
        }
    }

    private void validateIoPoint(String name, int index, Map<String, Object> point) {
        String where = "io_points[" + index + "] ";

        Long fcValue = ConfigMaps.getLong(point, "fc");
        if (fcValue == null || fcValue <= 0 || fcValue > MAX_FUNCTION_CODE) {
            throw ConfigException.invalid(name, where + "fc 必须在 1-" + MAX_FUNCTION_CODE + " 之间: " + point.get("fc"));
        }
        FunctionCode fc = FunctionCode.fromCode(fcValue.intValue());
        if (fc == null) {
            throw ConfigException.invalid(name, where + "不支持的功能码: " + fcValue);
        }

        String offset = ConfigMaps.getString(point, "offset");
        if (offset == null || offset.isEmpty()) {
            throw ConfigException.invalid(name, where + "offset 不能为空");
        }
        try {
            ModbusUtils.parseOffset(offset);
        } catch (IllegalArgumentException e) {
            throw ConfigException.invalid(name, where + e.getMessage());
        }

        String iecLocation = ConfigMaps.getString(point, "iec_location");
        if (iecLocation == null || iecLocation.isEmpty()) {
            throw ConfigException.invalid(name, where + "iec_location 不能为空");
        }
        SymbolicAddress address;
        try {
            address = AddressResolver.parse(iecLocation);
            AddressResolver.resolve(address, fc.isRead() ? AccessDirection.READ : AccessDirection.WRITE);
        } catch (MasterException e) {
            throw ConfigException.invalid(name, where + e.getMessage());
        }

        if (fc.isCoil() && !address.isBit()) {
            throw ConfigException.invalid(name, where + "功能码 " + fc.getCode() + " 需要位地址: " + iecLocation);
        }
        if (!fc.isCoil() && address.isBit()) {
            throw ConfigException.invalid(name, where + "功能码 " + fc.getCode() + " 不能使用位地址: " + iecLocation);
        }

        Long len = ConfigMaps.getLong(point, "len");
        if (len == null || len <= 0 || len > MAX_LENGTH) {
            throw ConfigException.invalid(name, where + "len 必须在 1-" + MAX_LENGTH + " 之间: " + point.get("len"));
        }
        if (!fc.isSingleWrite()) {
            long quantity = fc.isCoil() ? len : len * RegisterCodec.registersNeeded(address.size());
            if (quantity > fc.getMaxQuantity()) {
                throw ConfigException.invalid(name, where + "len=" + len + " 超出功能码 " + fc.getCode()
                        + " 单次请求上限 " + fc.getMaxQuantity() + (fc.isCoil() ? " 个线圈" : " 个寄存器"));
            }
        } else if (len > 1) {
            log.warn("设备 {} {}功能码 {} 只写入第一个元素，len={} 的其余元素将被忽略", name, where, fc.getCode(), len);
        }

        if (point.containsKey("cycle_time_ms")) {
            requirePositive(name, point, "cycle_time_ms");
        }
    }

    private void requirePositive(String name, Map<String, Object> map, String key) {
        Long value = ConfigMaps.getLong(map, key);
        if (value == null || value <= 0) {
            throw ConfigException.invalid(name, key + " 必须为正整数: " + map.get(key));
        }
    }
}
