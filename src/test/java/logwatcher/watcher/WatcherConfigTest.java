package logwatcher.watcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WatcherConfig 测试")
class WatcherConfigTest {

    @Test
    @DisplayName("未设置任何变量时使用默认值")
    void shouldUseDefaults() {
        WatcherConfig config = WatcherConfig.load(key -> null);

        assertThat(config.getLogPath()).isEqualTo(Paths.get("/var/log/nginx/access.log"));
        assertThat(config.getWebhookUrl()).isEmpty();
        assertThat(config.getErrorRateThreshold()).isEqualTo(2.0);
        assertThat(config.getWindowSize()).isEqualTo(200);
        assertThat(config.getCooldown()).isEqualTo(Duration.ofSeconds(300));
        assertThat(config.isMaintenanceMode()).isFalse();
        assertThat(config.isDebug()).isFalse();
        assertThat(config.getPollInterval()).isEqualTo(Duration.ofMillis(200));
        assertThat(config.getFileWaitMax()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getWebhookTimeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("读取环境变量覆盖默认值")
    void shouldReadEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("NGINX_LOG_PATH", "/tmp/access.log");
        env.put("SLACK_WEBHOOK_URL", " https://hooks.slack.com/services/T/B/X ");
        env.put("ERROR_RATE_THRESHOLD", "5.5");
        env.put("WINDOW_SIZE", "50");
        env.put("ALERT_COOLDOWN_SEC", "60");
        env.put("MAINTENANCE_MODE", "yes");
        env.put("WATCHER_DEBUG", "1");

        WatcherConfig config = WatcherConfig.load(env::get);

        assertThat(config.getLogPath()).isEqualTo(Paths.get("/tmp/access.log"));
        assertThat(config.getWebhookUrl()).contains("https://hooks.slack.com/services/T/B/X");
        assertThat(config.getErrorRateThreshold()).isEqualTo(5.5);
        assertThat(config.getWindowSize()).isEqualTo(50);
        assertThat(config.getCooldown()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.isMaintenanceMode()).isTrue();
        assertThat(config.isDebug()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"1", "true", "TRUE", "yes", "Yes", "on"})
    @DisplayName("多种写法都能开启布尔开关")
    void shouldAcceptTruthyValues(String value) {
        assertThat(WatcherConfig.load(key -> "MAINTENANCE_MODE".equals(key) ? value : null).isMaintenanceMode())
                .isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "false", "no", "off", "enabled", "2"})
    @DisplayName("其他写法视为关闭")
    void shouldTreatOtherValuesAsFalse(String value) {
        assertThat(WatcherConfig.load(key -> "MAINTENANCE_MODE".equals(key) ? value : null).isMaintenanceMode())
                .isFalse();
    }

    @Test
    @DisplayName("空白 webhook 视为未配置")
    void shouldTreatBlankWebhookAsMissing() {
        WatcherConfig config = WatcherConfig.load(key -> "SLACK_WEBHOOK_URL".equals(key) ? "   " : null);

        assertThat(config.getWebhookUrl()).isEmpty();
    }

    @Test
    @DisplayName("格式错误的数字回退到默认值")
    void shouldFallBackOnMalformedNumbers() {
        Map<String, String> env = Map.of(
                "ERROR_RATE_THRESHOLD", "two",
                "WINDOW_SIZE", "lots",
                "ALERT_COOLDOWN_SEC", "NaN");

        WatcherConfig config = WatcherConfig.load(env::get);

        assertThat(config.getErrorRateThreshold()).isEqualTo(2.0);
        assertThat(config.getWindowSize()).isEqualTo(200);
        assertThat(config.getCooldown()).isEqualTo(Duration.ofSeconds(300));
    }

    @Test
    @DisplayName("窗口大小小于 1 时启动失败")
    void shouldRejectInvalidWindowSize() {
        assertThatThrownBy(() -> WatcherConfig.load(key -> "WINDOW_SIZE".equals(key) ? "0" : null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("WINDOW_SIZE");
    }

    @Test
    @DisplayName("负的冷却时间启动失败")
    void shouldRejectNegativeCooldown() {
        assertThatThrownBy(() -> WatcherConfig.load(key -> "ALERT_COOLDOWN_SEC".equals(key) ? "-1" : null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ALERT_COOLDOWN_SEC");
    }
}
