package logwatcher.watcher;

/**
 * 告警类型，每种类型独立计算冷却时间
 */
public enum AlertType {
    FAILOVER("Failover Detected"),
    ERROR_RATE("High Error Rate");

    private final String title;

    AlertType(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}
