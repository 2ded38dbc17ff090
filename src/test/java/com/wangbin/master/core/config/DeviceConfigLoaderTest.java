package com.wangbin.master.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.master.common.exception.ConfigException;
import com.wangbin.master.common.exception.ErrorCode;
import com.wangbin.master.core.address.IecArea;
import com.wangbin.master.core.address.IecSize;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeviceConfigLoaderTest {

    private static final String DEVICES = """
            [
              {
                "name": "press",
                "protocol": "MODBUS",
                "config": {
                  "host": "10.0.0.5",
                  "port": 502,
                  "cycle_time_ms": 500,
                  "timeout_ms": 1000,
                  "unit_id": 3,
                  "big_endian": true,
                  "io_points": [
                    {"fc": 3, "offset": "0x10", "iec_location": "%IW4", "len": 2},
                    {"fc": 15, "offset": "32", "iec_location": "%QX1.2", "len": 10, "cycle_time_ms": 1500}
                  ]
                }
              },
              {
                "name": "pump",
                "protocol": "modbus",
                "config": {
                  "host": "10.0.0.6",
                  "port": "502",
                  "cycle_time_ms": 1000,
                  "timeout_ms": 500,
                  "io_points": []
                }
              }
            ]
            """;

    private DeviceConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new DeviceConfigLoader(new ObjectMapper(), new DeviceConfigValidator());
    }

    @Test
    void loadsDevicesFromJson() {
        List<DeviceConfig> devices = loader.loadFromJson(DEVICES);
        assertEquals(2, devices.size());

        DeviceConfig press = devices.get(0);
        assertEquals("press", press.getName());
        assertEquals("10.0.0.5:502", press.endpoint());
        assertEquals(1000, press.getTimeoutMs());
        assertEquals(3, press.getUnitId());
        assertTrue(press.isBigEndian());
        assertEquals(2, press.getIoPoints().size());

        IoPoint read = press.getIoPoints().get(0);
        assertEquals(FunctionCode.READ_HOLDING_REGISTERS, read.getFunctionCode());
        assertEquals(16, read.getOffset());
        assertEquals("0x10", read.getRawOffset());
        assertEquals(IecArea.INPUT, read.getLocation().area());
        assertEquals(IecSize.WORD, read.getLocation().size());
        assertEquals(500, read.getCycleTimeMs());

        IoPoint write = press.getIoPoints().get(1);
        assertEquals(FunctionCode.WRITE_MULTIPLE_COILS, write.getFunctionCode());
        assertEquals(1500, write.getCycleTimeMs());
        assertFalse(write.isRead());

        DeviceConfig pump = devices.get(1);
        assertEquals(DeviceConfig.DEFAULT_UNIT_ID, pump.getUnitId());
        assertFalse(pump.isBigEndian());
        assertTrue(pump.getIoPoints().isEmpty());
    }

    @Test
    void loadsFromFileSystemPath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("devices.json");
        Files.writeString(file, DEVICES, StandardCharsets.UTF_8);

        assertEquals(2, loader.loadFromPath(file.toString()).size());
    }

    @Test
    void loadsBundledClasspathConfig() {
        List<DeviceConfig> devices = loader.loadFromPath("config/modbus_master.json");
        assertFalse(devices.isEmpty());
        assertFalse(devices.get(0).getIoPoints().isEmpty());
    }

    @Test
    void missingFileIsLoadError() {
        ConfigException e = assertThrows(ConfigException.class, () -> loader.loadFromPath("no/such/devices.json"));
        assertEquals(ErrorCode.CONFIG_LOAD_ERROR, e.getErrorCode());
    }

    @Test
    void malformedJsonIsLoadError() {
        assertEquals(ErrorCode.CONFIG_LOAD_ERROR,
                assertThrows(ConfigException.class, () -> loader.loadFromJson("{not json")).getErrorCode());
        assertEquals(ErrorCode.CONFIG_LOAD_ERROR,
                assertThrows(ConfigException.class, () -> loader.loadFromJson("{\"name\": \"x\"}")).getErrorCode());
        assertEquals(ErrorCode.CONFIG_LOAD_ERROR,
                assertThrows(ConfigException.class, () -> loader.loadFromJson(" ")).getErrorCode());
    }

    @Test
    void loadedListsAreImmutable() {
        List<DeviceConfig> devices = loader.loadFromJson(DEVICES);
        assertThrows(UnsupportedOperationException.class, () -> devices.remove(0));
        assertThrows(UnsupportedOperationException.class, () -> devices.get(0).getIoPoints().clear());
    }
}
