package logwatcher.watcher;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * 主备池切换检测器
 *
 * <p>第一次看到的非空 pool 作为基线，不产生事件；之后每次 pool 变化产生一个事件，
 * 并立即采用新值，无论告警最终是否发送。</p>
 */
@Slf4j
public class FailoverDetector {

    private String activePool;

    public Optional<FailoverEvent> observe(LogRecord record) {
        return observe(record.getPool().orElse(null));
    }

    public Optional<FailoverEvent> observe(String pool) {
        if (StringUtils.isEmpty(pool)) {
            return Optional.empty();
        }

        if (activePool == null) {
            log.info("初始活跃池: {}", pool);
            activePool = pool;
            return Optional.empty();
        }

        if (activePool.equals(pool)) {
            return Optional.empty();
        }

        FailoverEvent event = new FailoverEvent(activePool, pool);
        activePool = pool;
        return Optional.of(event);
    }

    public Optional<String> getActivePool() {
        return Optional.ofNullable(activePool);
    }

    public boolean isTracking() {
        return activePool != null;
    }
}
