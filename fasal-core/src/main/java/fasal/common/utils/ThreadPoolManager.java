package fasal.common.utils;

import cn.hutool.core.util.StrUtil;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import fasal.common.exception.RRException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.*;

public class ThreadPoolManager {

    private static Logger logger = LoggerFactory.getLogger(ThreadPoolManager.class);

    private static final Map<String, ExecutorService> executors = new ConcurrentHashMap<>();

    /**
     * Returns the pool registered under the name, creating it on first use.
     */
    public static ExecutorService getOrRegister(String name, int corePoolSize, int maxPoolSize, int queueSize) {
        return executors.computeIfAbsent(name, n -> newExecutor(n, corePoolSize, maxPoolSize, queueSize));
    }

    public static ExecutorService getExecutor(String name) {
        return executors.get(name);
    }

    public static void shutdown(String name) {
        ExecutorService executor = executors.remove(name);
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private static ExecutorService newExecutor(String name, int corePoolSize, int maxPoolSize, int queueSize) {
        int core = Math.max(1, corePoolSize);
        int max = Math.max(core, maxPoolSize);
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat(name + "-%d")
                .setDaemon(true)
                .build();
        return new ThreadPoolExecutor(core, max, 10, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueSize)),
                threadFactory,
                (r, executor) -> {
                    logger.error(StrUtil.format("Thread pool ({}) queue is full, request rejected", name));
                    throw new RRException(503, "Server is busy, please retry later");
                }
        );
    }

}
