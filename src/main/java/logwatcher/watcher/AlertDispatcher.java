package logwatcher.watcher;

import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 告警分发器 - 经过闸门判定后交给投递通道，并记录统计
 */
public class AlertDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(AlertDispatcher.class);

    private final AlertGate gate;
    private final Notifier notifier;
    private final Map<AlertType, AlertStats> alertStats = new EnumMap<>(AlertType.class);

    public AlertDispatcher(AlertGate gate, Notifier notifier) {
        this.gate = gate;
        this.notifier = notifier;
        for (AlertType type : AlertType.values()) {
            alertStats.put(type, new AlertStats());
        }
    }

    /**
     * 处理告警
     *
     * @return 闸门判定结果
     */
    public AlertGate.Decision dispatch(Alert alert) {
        AlertStats stats = alertStats.get(alert.getType());
        AlertGate.Decision decision = gate.evaluate(alert.getType());

        switch (decision) {
            case SUPPRESSED:
                stats.setSuppressedCount(stats.getSuppressedCount() + 1);
                break;
            case THROTTLED:
                stats.setThrottledCount(stats.getThrottledCount() + 1);
                break;
            case FIRE:
                stats.setFiredCount(stats.getFiredCount() + 1);
                stats.setLastFiredTime(alert.getCreateTime());
                if (deliver(alert)) {
                    stats.setDeliveredCount(stats.getDeliveredCount() + 1);
                } else {
                    stats.setFailureCount(stats.getFailureCount() + 1);
                }
                break;
            default:
                throw new IllegalStateException("未知的判定结果: " + decision);
        }
        return decision;
    }

    private boolean deliver(Alert alert) {
        try {
            boolean delivered = notifier.deliver(alert.getTitle(), alert.getText());
            if (!delivered) {
                logger.warn("告警未投递成功: {} ({})", alert.getTitle(), alert.getAlertId());
            }
            return delivered;
        } catch (RuntimeException e) {
            logger.error("执行告警动作失败: {} ({})", alert.getTitle(), alert.getAlertId(), e);
            return false;
        }
    }

    public AlertGate getGate() {
        return gate;
    }

    /**
     * 获取告警统计信息
     */
    public Map<AlertType, AlertStats> getAlertStats() {
        return Collections.unmodifiableMap(alertStats);
    }

    public AlertStats getAlertStats(AlertType type) {
        return alertStats.get(type);
    }

    @Data
    public static class AlertStats {
        private long firedCount;
        private long deliveredCount;
        private long failureCount;
        private long suppressedCount;
        private long throttledCount;
        private Instant lastFiredTime;
    }
}
