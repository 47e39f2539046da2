package logwatcher.watcher;

import lombok.extern.slf4j.Slf4j;

/**
 * 未配置 webhook 时的降级通道，只写本地日志
 */
@Slf4j
public class LoggingNotifier implements Notifier {

    @Override
    public boolean deliver(String title, String body) {
        log.warn("SLACK_WEBHOOK_URL 未配置，告警未投递: {}\n{}", title, body);
        return false;
    }
}
