package org.muma.tiny.redis.config;

import lombok.Getter;
import lombok.Setter;
import org.muma.tiny.redis.protocol.RespParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * 全局配置中心
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (redis.properties) > 默认值
 */
@Getter
@Setter
public class TinyRedisConfig {

    private static final Logger log = LoggerFactory.getLogger(TinyRedisConfig.class);
    private static final TinyRedisConfig INSTANCE = new TinyRedisConfig();

    // --- Core Settings ---
    private String host = "127.0.0.1";
    private int port = 6379;
    private IoMode ioMode = IoMode.NETTY;
    private int workerThreads = 0; // 0 = Netty default

    // --- Protocol Limits ---
    private int maxNestingDepth = RespParser.DEFAULT_MAX_NESTING_DEPTH;
    private long maxBulkLength = RespParser.DEFAULT_MAX_BULK_LENGTH;
    private int maxLineLength = RespParser.DEFAULT_MAX_LINE_LENGTH;

    private String configFilePath = "redis.properties"; // 默认

    // --- Enums ---
    public enum IoMode {
        // Netty 事件循环
        NETTY,
        // 每个连接一个阻塞线程
        BLOCKING
    }

    public TinyRedisConfig() {
    }

    public static TinyRedisConfig getInstance() {
        return INSTANCE;
    }

    // --- Loading Logic ---

    /**
     * 启动入口：先找 --config，再依次应用配置文件、环境变量和命令行参数
     */
    public void load(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                this.configFilePath = args[i + 1];
            }
        }
        loadConfig(configFilePath);
        parseArgs(args);
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            boolean hasValue = i + 1 < args.length;
            if ("--config".equals(arg) && hasValue) {
                this.configFilePath = args[++i];
            } else if ("--host".equals(arg) && hasValue) {
                this.host = args[++i];
            } else if ("--port".equals(arg) && hasValue) {
                this.port = checkRange("--port", parseInt("--port", args[++i], this.port), 0, 65535, this.port);
            } else if ("--io-mode".equals(arg) && hasValue) {
                this.ioMode = parseIoMode("--io-mode", args[++i], this.ioMode);
            } else {
                log.warn("Ignoring unknown argument: {}", arg);
            }
        }
        log.info("Config loaded from args: host={}, port={}, ioMode={}", host, port, ioMode);
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Core
        this.host = getString(props, "server.host", this.host);
        this.port = checkRange("server.port", getInt(props, "server.port", this.port), 0, 65535, this.port);
        this.workerThreads = checkRange("server.worker_threads",
                getInt(props, "server.worker_threads", this.workerThreads), 0, Integer.MAX_VALUE, this.workerThreads);
        String mode = props.getProperty("server.io_mode");
        if (mode != null) {
            this.ioMode = parseIoMode("server.io_mode", mode, this.ioMode);
        }

        // 2. Protocol
        this.maxNestingDepth = checkRange("proto.max_nesting_depth",
                getInt(props, "proto.max_nesting_depth", this.maxNestingDepth), 1, Integer.MAX_VALUE, this.maxNestingDepth);
        this.maxBulkLength = getSize(props, "proto.max_bulk_len", 0, Long.MAX_VALUE, this.maxBulkLength);
        this.maxLineLength = (int) getSize(props, "proto.max_inline_len", 1, Integer.MAX_VALUE, this.maxLineLength);

        // 3. Env Vars Override
        applyEnvOverrides();

        log.info("TinyRedisConfig initialized: {}", this);
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    private void applyEnvOverrides() {
        String envHost = System.getenv("REDIS_HOST");
        if (envHost != null) {
            this.host = envHost;
            log.info("Host overridden by ENV: {}", this.host);
        }

        String envPort = System.getenv("REDIS_PORT");
        if (envPort != null) {
            this.port = checkRange("REDIS_PORT", parseInt("REDIS_PORT", envPort, this.port), 0, 65535, this.port);
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envMode = System.getenv("REDIS_IO_MODE");
        if (envMode != null) {
            this.ioMode = parseIoMode("REDIS_IO_MODE", envMode, this.ioMode);
            log.info("IO mode overridden by ENV: {}", this.ioMode);
        }
    }

    // 辅助：解析带单位的大小 (64mb, 1gb)，溢出时抛 ArithmeticException
    static long parseSize(String sizeStr) {
        String s = sizeStr.toLowerCase(Locale.ROOT).trim();
        long multiplier = 1;
        if (s.endsWith("kb")) {
            multiplier = 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("mb")) {
            multiplier = 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("gb")) {
            multiplier = 1024 * 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("b")) {
            s = s.substring(0, s.length() - 1);
        }
        return Math.multiplyExact(Long.parseLong(s.trim()), multiplier);
    }

    private long getSize(Properties props, String key, long min, long max, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) {
            return defaultValue;
        }
        long size;
        try {
            size = parseSize(val);
        } catch (NumberFormatException | ArithmeticException e) {
            log.warn("Invalid {} value '{}', using default {}.", key, val, defaultValue);
            return defaultValue;
        }
        return checkRange(key, size, min, max, defaultValue);
    }

    private int checkRange(String source, int value, int min, int max, int defaultValue) {
        return (int) checkRange(source, (long) value, min, max, defaultValue);
    }

    private long checkRange(String source, long value, long min, long max, long defaultValue) {
        if (value < min || value > max) {
            log.warn("{} value {} is out of range [{}, {}], using default {}.", source, value, min, max, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseInt(key, val, defaultValue) : defaultValue;
    }

    private String getString(Properties props, String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    private int parseInt(String source, String value, int defaultValue) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using default {}.", source, value, defaultValue);
            return defaultValue;
        }
    }

    private IoMode parseIoMode(String source, String value, IoMode defaultValue) {
        try {
            return IoMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid {} value '{}', using default {}.", source, value, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "Config{host=" + host + ", port=" + port + ", ioMode=" + ioMode
                + ", maxNestingDepth=" + maxNestingDepth + ", maxBulkLength=" + maxBulkLength
                + ", maxLineLength=" + maxLineLength + "}";
    }
}
