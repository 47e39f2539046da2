package logwatcher.watcher;

import java.io.IOException;

/**
 * 日志行来源，无新数据时阻塞等待
 */
public interface SourceReader extends AutoCloseable {

    /**
     * 读取下一整行（不含换行符）
     *
     * @throws InterruptedException 等待期间线程被中断
     * @throws IOException          底层读取失败
     */
    String nextLine() throws InterruptedException, IOException;

    @Override
    void close() throws IOException;
}
