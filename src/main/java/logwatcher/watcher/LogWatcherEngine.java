package logwatcher.watcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.time.Clock;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * 日志监控引擎 - 逐行推进池切换检测和错误率窗口，并通过分发器发出告警
 *
 * <p>所有状态只属于运行 {@link #run(SourceReader)} 的那个线程。</p>
 */
public class LogWatcherEngine {
    private static final Logger logger = LoggerFactory.getLogger(LogWatcherEngine.class);

    private final WatcherConfig config;
    private final ErrorWindow window;
    private final FailoverDetector failoverDetector;
    private final AlertDispatcher dispatcher;
    private final Clock clock;

    private long linesRead;
    private long linesParsed;

    public LogWatcherEngine(WatcherConfig config, Notifier notifier, Clock clock) {
        this(config, new AlertDispatcher(
                new AlertGate(config.getCooldown(), config.isMaintenanceMode(), clock), notifier), clock);
    }

    public LogWatcherEngine(WatcherConfig config, AlertDispatcher dispatcher, Clock clock) {
        this.config = config;
        this.window = new ErrorWindow(config.getWindowSize());
        this.failoverDetector = new FailoverDetector();
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /**
     * 持续消费日志行，直到线程被中断
     */
    public void run(SourceReader source) {
        logger.info("开始监控日志: {}, 错误率阈值: {}%, 窗口大小: {}, 冷却时间: {}秒, 维护模式: {}",
                config.getLogPath(), config.getErrorRateThreshold(), config.getWindowSize(),
                config.getCooldown().getSeconds(), config.isMaintenanceMode());

        while (!Thread.currentThread().isInterrupted()) {
            String line;
            try {
                line = source.nextLine();
            } catch (InterruptedException | ClosedByInterruptException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (IOException e) {
                logger.warn("读取日志失败，稍后重试: {}", e.getMessage(), e);
                if (!pause()) {
                    break;
                }
                continue;
            }

            try {
                process(line);
            } catch (RuntimeException e) {
                logger.error("处理日志行失败: {}", line, e);
            }
        }
        logger.info("收到中断，日志监控退出");
    }

    /**
     * 处理一行日志
     */
    public void process(String line) {
        linesRead++;
        Optional<LogRecord> parsed = LogRecord.parse(line);
        if (parsed.isEmpty()) {
            logger.debug("无法解析的日志行，已跳过: {}", line);
            return;
        }
        linesParsed++;
        LogRecord record = parsed.get();

        failoverDetector.observe(record).ifPresent(event -> onFailover(event, record));

        Optional<String> status = record.getUpstreamStatus();
        if (status.isEmpty()) {
            return;
        }
        boolean isError = ServerErrorClassifier.isServerError(status.get());
        window.observe(isError);
        logger.debug("窗口追加: status={} is_err={} window_size={}", status.get(), isError, window.size());

        evaluateErrorRate(record);
    }

    private void onFailover(FailoverEvent event, LogRecord record) {
        logger.info("检测到池切换: {} -> {}", event.getPreviousPool(), event.getCurrentPool());
        dispatcher.dispatch(Alert.failover(event, record, clock.instant()));
    }

    private void evaluateErrorRate(LogRecord record) {
        OptionalDouble rate = window.currentRate();
        if (rate.isEmpty() || rate.getAsDouble() <= config.getErrorRateThreshold()) {
            return;
        }

        logger.debug("错误率超过阈值: {}% > {}%", rate.getAsDouble(), config.getErrorRateThreshold());
        dispatcher.dispatch(Alert.errorRate(rate.getAsDouble(), window.size(), config.getErrorRateThreshold(),
                record, failoverDetector.getActivePool().orElse(null), clock.instant()));
    }

    private boolean pause() {
        try {
            Thread.sleep(config.getPollInterval().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * 当前状态快照
     */
    public WatcherSnapshot snapshot() {
        OptionalDouble rate = window.currentRate();
        return WatcherSnapshot.builder()
                .activePool(failoverDetector.getActivePool().orElse(null))
                .windowSize(window.size())
                .errorCount(window.errorCount())
                .errorRate(rate.isPresent() ? rate.getAsDouble() : null)
                .linesRead(linesRead)
                .linesParsed(linesParsed)
                .alertStats(dispatcher.getAlertStats())
                .build();
    }

    ErrorWindow getWindow() {
        return window;
    }

    FailoverDetector getFailoverDetector() {
        return failoverDetector;
    }
}
