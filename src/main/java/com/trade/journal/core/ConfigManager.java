package com.trade.journal.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 配置管理器
 * 先加载 classpath 下的 journal.properties 作为默认值，
 * 再用工作目录下的 journal.properties（若存在）覆盖
 */
public class ConfigManager {

    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    private static final String CONFIG_FILE = "journal.properties";
    private static ConfigManager instance;
    private Properties properties;

    private ConfigManager() {
        loadConfiguration();
    }

    public static synchronized ConfigManager getInstance() {
        if (instance == null) {
            instance = new ConfigManager();
        }
        return instance;
    }

    /**
     * 加载配置文件
     */
    private void loadConfiguration() {
        Properties loaded = new Properties();

        try (InputStream in = ConfigManager.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (in != null) {
                loaded.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            } else {
                logger.warn("classpath 中未找到 {}，使用内置默认值", CONFIG_FILE);
            }
        } catch (IOException e) {
            throw new RuntimeException("无法加载默认配置: " + CONFIG_FILE, e);
        }

        Path overridePath = Paths.get(CONFIG_FILE);
        if (Files.exists(overridePath)) {
            try (InputStreamReader reader = new InputStreamReader(
                    new FileInputStream(overridePath.toFile()),
                    StandardCharsets.UTF_8
            )) {
                loaded.load(reader);
                logger.info("已加载覆盖配置: {}", overridePath.toAbsolutePath());
            } catch (IOException e) {
                throw new RuntimeException("无法加载配置文件: " + overridePath.toAbsolutePath(), e);
            }
        }

        properties = loaded;
    }

    /**
     * 获取配置属性，缺失时返回默认值
     */
    public String getProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    /**
     * 获取整数配置
     */
    public int getIntProperty(String key, int defaultValue) {
        String value = getProperty(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.warn("配置项 {} 不是有效整数: {}，使用默认值 {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * 获取布尔配置
     */
    public boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = getProperty(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value);
    }

    /**
     * 获取小数配置
     */
    public BigDecimal getBigDecimalProperty(String key, BigDecimal defaultValue) {
        String value = getProperty(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            logger.warn("配置项 {} 不是有效数字: {}，使用默认值 {}", key, value, defaultValue);
            return defaultValue;
        }
    }
}
