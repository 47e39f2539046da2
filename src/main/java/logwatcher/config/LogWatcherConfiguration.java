package logwatcher.config;

import logwatcher.watcher.FileTailReader;
import logwatcher.watcher.LogWatcherApplication;
import logwatcher.watcher.LogWatcherEngine;
import logwatcher.watcher.LoggingNotifier;
import logwatcher.watcher.Notifier;
import logwatcher.watcher.SlackWebhookNotifier;
import logwatcher.watcher.SourceReader;
import logwatcher.watcher.WatcherConfig;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;

@Slf4j
@Configuration
public class LogWatcherConfiguration {

    @Bean
    public WatcherConfig watcherConfig(Environment environment) {
        WatcherConfig config = WatcherConfig.load(environment::getProperty);
        if (config.isDebug()) {
            LoggingSystem.get(getClass().getClassLoader()).setLogLevel("logwatcher", LogLevel.DEBUG);
            log.debug("WATCHER_DEBUG 已开启");
        }
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Notifier notifier(WatcherConfig config, Clock clock) {
        String url = config.getWebhookUrl().orElse(null);
        if (url == null) {
            log.warn("SLACK_WEBHOOK_URL 未配置，告警只写入本地日志");
            return new LoggingNotifier();
        }
        if (HttpUrl.parse(url) == null) {
            log.warn("SLACK_WEBHOOK_URL 不是合法的 http(s) 地址，告警只写入本地日志: {}", url);
            return new LoggingNotifier();
        }
        return new SlackWebhookNotifier(url, config.getWebhookTimeout(), clock);
    }

    @Bean
    public LogWatcherEngine logWatcherEngine(WatcherConfig config, Notifier notifier, Clock clock) {
        return new LogWatcherEngine(config, notifier, clock);
    }

    @Bean
    public SourceReader sourceReader(WatcherConfig config) {
        return new FileTailReader(config.getLogPath(), config.getPollInterval(), config.getFileWaitMax());
    }

    /**
     * 启动监控线程；测试中可通过 logwatcher.autostart=false 关闭
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "logwatcher.autostart", havingValue = "true", matchIfMissing = true)
    public LogWatcherApplication logWatcherApplication(LogWatcherEngine engine, SourceReader sourceReader) {
        LogWatcherApplication app = new LogWatcherApplication(engine, sourceReader);
        app.start();
        return app;
    }
}
