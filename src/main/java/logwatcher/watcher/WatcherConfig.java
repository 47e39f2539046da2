package logwatcher.watcher;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * 日志监控配置，进程启动时读取一次，之后不再变化
 */
@Slf4j
@Getter
@Builder
public class WatcherConfig {

    public static final String LOG_PATH_KEY = "NGINX_LOG_PATH";
    public static final String WEBHOOK_URL_KEY = "SLACK_WEBHOOK_URL";
    public static final String ERROR_RATE_THRESHOLD_KEY = "ERROR_RATE_THRESHOLD";
    public static final String WINDOW_SIZE_KEY = "WINDOW_SIZE";
    public static final String ALERT_COOLDOWN_SEC_KEY = "ALERT_COOLDOWN_SEC";
    public static final String MAINTENANCE_MODE_KEY = "MAINTENANCE_MODE";
    public static final String WATCHER_DEBUG_KEY = "WATCHER_DEBUG";
    public static final String POLL_INTERVAL_MS_KEY = "WATCHER_POLL_INTERVAL_MS";
    public static final String FILE_WAIT_MAX_MS_KEY = "WATCHER_FILE_WAIT_MAX_MS";
    public static final String WEBHOOK_TIMEOUT_SEC_KEY = "WEBHOOK_TIMEOUT_SEC";

    public static final String DEFAULT_LOG_PATH = "/var/log/nginx/access.log";
    public static final double DEFAULT_ERROR_RATE_THRESHOLD = 2.0;
    public static final int DEFAULT_WINDOW_SIZE = 200;
    public static final int DEFAULT_ALERT_COOLDOWN_SEC = 300;
    public static final int DEFAULT_POLL_INTERVAL_MS = 200;
    public static final int DEFAULT_FILE_WAIT_MAX_MS = 5000;
    public static final int DEFAULT_WEBHOOK_TIMEOUT_SEC = 5;

    private final Path logPath;
    @Getter(AccessLevel.NONE)
    private final String webhookUrl;
    private final double errorRateThreshold;
    private final int windowSize;
    private final Duration cooldown;
    private final boolean maintenanceMode;
    private final boolean debug;
    private final Duration pollInterval;
    private final Duration fileWaitMax;
    private final Duration webhookTimeout;

    /**
     * 从环境变量（或其他 key-value 来源）加载配置
     */
    public static WatcherConfig load(Function<String, String> source) {
        Reader reader = new Reader(source);
        WatcherConfig config = WatcherConfig.builder()
                .logPath(Paths.get(reader.getString(LOG_PATH_KEY, DEFAULT_LOG_PATH)))
                .webhookUrl(StringUtils.trimToNull(reader.getString(WEBHOOK_URL_KEY, null)))
                .errorRateThreshold(reader.getDouble(ERROR_RATE_THRESHOLD_KEY, DEFAULT_ERROR_RATE_THRESHOLD))
                .windowSize(reader.getInt(WINDOW_SIZE_KEY, DEFAULT_WINDOW_SIZE))
                .cooldown(Duration.ofSeconds(reader.getInt(ALERT_COOLDOWN_SEC_KEY, DEFAULT_ALERT_COOLDOWN_SEC)))
                .maintenanceMode(reader.getBoolean(MAINTENANCE_MODE_KEY, false))
                .debug(reader.getBoolean(WATCHER_DEBUG_KEY, false))
                .pollInterval(Duration.ofMillis(reader.getInt(POLL_INTERVAL_MS_KEY, DEFAULT_POLL_INTERVAL_MS)))
                .fileWaitMax(Duration.ofMillis(reader.getInt(FILE_WAIT_MAX_MS_KEY, DEFAULT_FILE_WAIT_MAX_MS)))
                .webhookTimeout(Duration.ofSeconds(reader.getInt(WEBHOOK_TIMEOUT_SEC_KEY, DEFAULT_WEBHOOK_TIMEOUT_SEC)))
                .build();
        config.validate();
        return config;
    }

    public Optional<String> getWebhookUrl() {
        return Optional.ofNullable(webhookUrl);
    }

    /**
     * 验证配置
     */
    public void validate() {
        if (windowSize < 1) {
            throw new IllegalArgumentException(WINDOW_SIZE_KEY + " 必须 >= 1: " + windowSize);
        }
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException(ALERT_COOLDOWN_SEC_KEY + " 不能为负数: " + cooldown.getSeconds());
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException(POLL_INTERVAL_MS_KEY + " 必须 > 0: " + pollInterval.toMillis());
        }
        if (webhookTimeout.isNegative() || webhookTimeout.isZero()) {
            throw new IllegalArgumentException(WEBHOOK_TIMEOUT_SEC_KEY + " 必须 > 0: " + webhookTimeout.getSeconds());
        }
    }

    /**
     * 宽松的类型转换，格式错误时回退默认值
     */
    private static final class Reader {
        private final Function<String, String> source;

        private Reader(Function<String, String> source) {
            this.source = source;
        }

        String getString(String key, String defaultValue) {
            String value = source.apply(key);
            return StringUtils.isBlank(value) ? defaultValue : value.trim();
        }

        int getInt(String key, int defaultValue) {
            String value = getString(key, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                log.warn("配置项 {} 不是合法整数: {}，使用默认值 {}", key, value, defaultValue);
                return defaultValue;
            }
        }

        double getDouble(String key, double defaultValue) {
            String value = getString(key, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                double parsed = Double.parseDouble(value);
                if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                    throw new NumberFormatException(value);
                }
                return parsed;
            } catch (NumberFormatException e) {
                log.warn("配置项 {} 不是合法数字: {}，使用默认值 {}", key, value, defaultValue);
                return defaultValue;
            }
        }

        /**
         * 1/true/yes/on/y/t（不区分大小写）视为 true，其余为 false
         */
        boolean getBoolean(String key, boolean defaultValue) {
            String value = getString(key, null);
            if (value == null) {
                return defaultValue;
            }
            return "1".equals(value) || BooleanUtils.toBoolean(value);
        }
    }
}
