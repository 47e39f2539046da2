package logwatcher.watcher;

/**
 * 告警投递通道
 */
public interface Notifier {

    /**
     * 投递一条告警
     *
     * @return 是否投递成功；调用方只记录日志，不做重试
     */
    boolean deliver(String title, String body);
}
