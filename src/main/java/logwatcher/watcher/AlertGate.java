package logwatcher.watcher;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 告警闸门 - 维护模式抑制 + 按类型的冷却时间
 *
 * <p>判定顺序：维护模式 -> 冷却期 -> 发送。只有返回 {@link Decision#FIRE} 时才更新
 * 上次发送时间，与投递结果无关，投递失败同样占用冷却时间。</p>
 */
@Slf4j
public class AlertGate {

    public enum Decision {
        FIRE,
        SUPPRESSED,
        THROTTLED
    }

    private final Duration cooldown;
    private final boolean maintenanceMode;
    private final Clock clock;
    private final Map<AlertType, Instant> lastFired = new EnumMap<>(AlertType.class);

    public AlertGate(Duration cooldown, boolean maintenanceMode, Clock clock) {
        this.cooldown = cooldown;
        this.maintenanceMode = maintenanceMode;
        this.clock = clock;
    }

    public Decision evaluate(AlertType type) {
        if (maintenanceMode) {
            log.info("维护模式已开启，抑制告警: {}", type);
            return Decision.SUPPRESSED;
        }

        Instant now = clock.instant();
        Instant last = lastFired.get(type);
        if (last != null && Duration.between(last, now).compareTo(cooldown) <= 0) {
            log.info("告警处于冷却期，已跳过: {}, 上次发送: {}, 冷却时间: {}", type, last, cooldown);
            return Decision.THROTTLED;
        }

        // 时钟回拨时 elapsed 为负，已在上面按冷却处理，这里 now 一定不早于 last
        lastFired.put(type, now);
        return Decision.FIRE;
    }

    public Optional<Instant> getLastFired(AlertType type) {
        return Optional.ofNullable(lastFired.get(type));
    }

    public boolean isMaintenanceMode() {
        return maintenanceMode;
    }

    public Duration getCooldown() {
        return cooldown;
    }
}
