package logwatcher.watcher;

/**
 * 告警投递异常
 */
public class AlertException extends RuntimeException {
    public AlertException(String message) {
        super(message);
    }

    public AlertException(String message, Throwable cause) {
        super(message, cause);
    }
}
