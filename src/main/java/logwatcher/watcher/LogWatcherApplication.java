package logwatcher.watcher;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 日志监控应用 - 在单独的工作线程上运行引擎，负责启动和关闭
 */
public class LogWatcherApplication implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LogWatcherApplication.class);

    private final LogWatcherEngine engine;
    private final SourceReader source;
    private final ExecutorService worker;
    private volatile boolean running;

    public LogWatcherApplication(LogWatcherEngine engine, SourceReader source) {
        this.engine = engine;
        this.source = source;
        this.worker = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder()
                        .setNameFormat("log-watcher-%d")
                        .build()
        );
    }

    /**
     * 启动应用
     */
    public void start() {
        if (running) {
            logger.warn("日志监控已经在运行");
            return;
        }

        running = true;
        worker.submit(() -> {
            try {
                engine.run(source);
            } catch (Exception e) {
                logger.error("日志监控异常退出", e);
            } finally {
                running = false;
            }
        });
        logger.info("日志监控启动成功");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 关闭应用
     */
    @Override
    public void close() {
        try {
            logger.info("正在关闭日志监控...");

            // 中断工作线程，引擎在下一次等待时退出
            worker.shutdownNow();
            if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("等待日志监控线程退出超时");
            }

            source.close();
            logger.info("日志监控已关闭，最终状态: {}", engine.snapshot());

        } catch (InterruptedException e) {
            logger.error("关闭日志监控时被中断", e);
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            logger.error("关闭日志文件失败", e);
        }
    }
}
