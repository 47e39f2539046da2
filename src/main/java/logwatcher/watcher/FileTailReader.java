package logwatcher.watcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 追踪持续追加的日志文件，类似 tail -F 的单文件版本
 *
 * <ul>
 *   <li>文件不存在时按退避间隔等待其出现</li>
 *   <li>打开后跳到文件末尾，无法定位时从当前位置读</li>
 *   <li>没有新数据时休眠一个轮询间隔</li>
 *   <li>非法 UTF-8 字节直接丢弃，写了一半的多字节字符留到下次读取时解码</li>
 *   <li>不完整的末行保留到换行符写入为止，超过上限的超长行整行丢弃</li>
 * </ul>
 */
public class FileTailReader implements SourceReader {
    private static final Logger logger = LoggerFactory.getLogger(FileTailReader.class);

    static final Duration INITIAL_WAIT = Duration.ofMillis(500);
    static final int MAX_LINE_LENGTH = 256 * 1024;

    private final Path path;
    private final Duration pollInterval;
    private final Duration maxWait;
    private final int maxLineLength;

    private FileChannel channel;
    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.IGNORE)
            .onUnmappableCharacter(CodingErrorAction.IGNORE);
    private final ByteBuffer bytes = ByteBuffer.allocate(8192);
    private final CharBuffer chars = CharBuffer.allocate(8192);
    private final StringBuilder pending = new StringBuilder();
    private final Deque<String> lines = new ArrayDeque<>();
    // 当前行已超长，丢弃到下一个换行符
    private boolean discarding;

    public FileTailReader(Path path, Duration pollInterval, Duration maxWait) {
        this(path, pollInterval, maxWait, MAX_LINE_LENGTH);
    }

    FileTailReader(Path path, Duration pollInterval, Duration maxWait, int maxLineLength) {
        this.path = path;
        this.pollInterval = pollInterval;
        this.maxWait = maxWait.compareTo(INITIAL_WAIT) < 0 ? INITIAL_WAIT : maxWait;
        this.maxLineLength = maxLineLength;
    }

    @Override
    public String nextLine() throws InterruptedException, IOException {
        if (channel == null) {
            open();
        }

        while (lines.isEmpty()) {
            int read;
            try {
                read = channel.read(bytes);
            } catch (IOException e) {
                // 通道已不可用，下次调用时重新打开
                reset();
                throw e;
            }
            if (read <= 0) {
                Thread.sleep(pollInterval.toMillis());
                continue;
            }
            decode();
        }
        return lines.poll();
    }

    /**
     * 解码已读到的字节；末尾不完整的多字节序列留在 bytes 中等待后续数据
     */
    private void decode() {
        bytes.flip();
        CoderResult result;
        do {
            result = decoder.decode(bytes, chars, false);
            chars.flip();
            split();
            chars.clear();
        } while (result.isOverflow());
        bytes.compact();
    }

    private void reset() {
        try {
            close();
        } catch (IOException e) {
            logger.debug("关闭日志文件失败: {}", path, e);
        }
        channel = null;
        bytes.clear();
        chars.clear();
        decoder.reset();
        pending.setLength(0);
        discarding = false;
    }

    /**
     * 等待文件出现后打开，并尝试定位到末尾
     */
    private void open() throws InterruptedException, IOException {
        Duration wait = INITIAL_WAIT;
        boolean announced = false;
        while (!Files.exists(path)) {
            if (!announced) {
                logger.info("日志文件尚不存在，等待创建: {}", path);
                announced = true;
            }
            Thread.sleep(wait.toMillis());
            wait = wait.multipliedBy(2);
            if (wait.compareTo(maxWait) > 0) {
                wait = maxWait;
            }
        }

        channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            channel.position(channel.size());
        } catch (IOException | UnsupportedOperationException e) {
            logger.debug("日志文件不支持定位，从当前位置读取: {}", path, e);
        }
        logger.info("开始追踪日志文件: {}", path);
    }

    private void split() {
        while (chars.hasRemaining()) {
            char c = chars.get();
            if (c == '\n') {
                if (discarding) {
                    discarding = false;
                    continue;
                }
                int end = pending.length();
                if (end > 0 && pending.charAt(end - 1) == '\r') {
                    pending.setLength(end - 1);
                }
                lines.add(pending.toString());
                pending.setLength(0);
            } else if (!discarding) {
                pending.append(c);
                if (pending.length() > maxLineLength) {
                    logger.debug("单行超过 {} 个字符仍无换行符，丢弃该行: {}", maxLineLength, path);
                    pending.setLength(0);
                    discarding = true;
                }
            }
        }
    }

    @Override
    public void close() throws IOException {
        if (channel != null) {
            channel.close();
        }
    }
}
