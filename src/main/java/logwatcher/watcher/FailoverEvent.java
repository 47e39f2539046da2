package logwatcher.watcher;

import lombok.Data;

/**
 * 池切换事件
 */
@Data
public class FailoverEvent {
    private final String previousPool;
    private final String currentPool;
}
