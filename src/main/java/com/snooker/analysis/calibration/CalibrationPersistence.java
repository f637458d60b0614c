package com.snooker.analysis.calibration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.snooker.analysis.model.CalibrationData;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 标定结果的本地缓存，按摄像头ID保存为JSON
 * 读取结果只是一个假设，使用前必须重新校验
 */
public class CalibrationPersistence {

    private static final Logger LOG = LoggerFactory.getLogger(CalibrationPersistence.class);

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path directory;
    private final long maxAgeMillis;

    public CalibrationPersistence(String directory, double maxAgeHours) {
        this.directory = Paths.get(directory);
        this.maxAgeMillis = (long) (maxAgeHours * TimeUnit.HOURS.toMillis(1));
    }

    /**
     * 保存有效标定，失败只记录日志
     */
    public boolean save(String cameraId, CalibrationData data) {
        if (data == null || !data.usable()) {
            LOG.debug("Skipping cache write for camera {}: calibration not usable", cameraId);
            return false;
        }
        Path file = fileFor(cameraId);
        try {
            Files.createDirectories(directory);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(),
                    new CachedCalibration(cameraId, System.currentTimeMillis(), data));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            LOG.info("Calibration cached for camera {} at {}", cameraId, file);
            return true;
        } catch (IOException e) {
            LOG.error("Failed to cache calibration for camera {}", cameraId, e);
            return false;
        }
    }

    /**
     * 读取缓存，不存在、过期或损坏时返回 empty
     */
    public Optional<CalibrationData> load(String cameraId) {
        Path file = fileFor(cameraId);
        if (!Files.isRegularFile(file)) {
            LOG.debug("No cached calibration for camera {}", cameraId);
            return Optional.empty();
        }
        try {
            CachedCalibration cached = objectMapper.readValue(file.toFile(), CachedCalibration.class);
            long age = System.currentTimeMillis() - cached.getSavedAt();
            if (age > maxAgeMillis) {
                LOG.info("Cached calibration for camera {} is too old ({} h)",
                        cameraId, String.format("%.1f", age / (double) TimeUnit.HOURS.toMillis(1)));
                return Optional.empty();
            }
            return Optional.ofNullable(cached.getCalibration());
        } catch (IOException e) {
            LOG.warn("Ignoring unreadable calibration cache {}", file, e);
            return Optional.empty();
        }
    }

    public boolean clear(String cameraId) {
        try {
            return Files.deleteIfExists(fileFor(cameraId));
        } catch (IOException e) {
            LOG.error("Failed to clear calibration cache for camera {}", cameraId, e);
            return false;
        }
    }

    Path fileFor(String cameraId) {
        String safe = cameraId == null ? "default" : cameraId.replaceAll("[^A-Za-z0-9._-]", "_");
        return directory.resolve("calibration_" + safe + ".json");
    }

    /**
     * 缓存文件内容
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CachedCalibration {
        private String cameraId;
        private long savedAt;
        private CalibrationData calibration;
    }
}
