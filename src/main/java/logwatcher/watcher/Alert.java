package logwatcher.watcher;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 待发送的告警 - 标题、正文以及少量元数据
 */
@Data
@Builder
public class Alert {
    private final String alertId;              // 告警唯一ID
    private final AlertType type;              // 告警类型
    private final Instant createTime;          // 告警创建时间
    private final String title;                // 告警标题
    private final String text;                 // 告警正文
    private final Map<String, Object> metadata; // 附加信息

    /**
     * 池切换告警
     */
    public static Alert failover(FailoverEvent event, LogRecord record, Instant now) {
        String text = String.format("Failover detected: %s -> %s%nSample log: %s",
                event.getPreviousPool(), event.getCurrentPool(), record.getRawLine());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("previous_pool", event.getPreviousPool());
        metadata.put("current_pool", event.getCurrentPool());

        return create(AlertType.FAILOVER, text, metadata, now);
    }

    /**
     * 错误率告警，样本行取自触发本次计算的记录，活跃池取自检测器状态
     */
    public static Alert errorRate(double rate, int windowSize, double threshold,
                                  LogRecord record, String activePool, Instant now) {
        String text = String.format(
                "High upstream 5xx error rate detected: %.2f%% over last %d requests%n"
                        + "Threshold: %s%%%n"
                        + "Latest sample: pool=%s status=%s upstream=%s%n"
                        + "Active pool: %s",
                rate, windowSize, threshold,
                display(record.getPool().orElse(null)),
                display(record.getUpstreamStatus().orElse(null)),
                display(record.getUpstreamAddr().orElse(null)),
                display(activePool));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("error_rate", rate);
        metadata.put("window_size", windowSize);
        metadata.put("threshold", threshold);

        return create(AlertType.ERROR_RATE, text, metadata, now);
    }

    private static Alert create(AlertType type, String text, Map<String, Object> metadata, Instant now) {
        return Alert.builder()
                .alertId(UUID.randomUUID().toString())
                .type(type)
                .createTime(now)
                .title(type.getTitle())
                .text(text)
                .metadata(Collections.unmodifiableMap(metadata))
                .build();
    }

    private static String display(String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }
}
