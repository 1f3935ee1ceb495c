package fasal.common.utils;

import fasal.common.exception.RRException;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ThreadPoolManagerTest {

    @Test
    public void testGetOrRegisterReturnsSamePool() {
        String name = "tpm-same";
        try {
            ExecutorService first = ThreadPoolManager.getOrRegister(name, 1, 1, 1);
            assertSame(first, ThreadPoolManager.getOrRegister(name, 4, 4, 4));
            assertSame(first, ThreadPoolManager.getExecutor(name));
        } finally {
            ThreadPoolManager.shutdown(name);
        }
        assertNull(ThreadPoolManager.getExecutor(name));
    }

    @Test
    public void testFullQueueRejectsWithBusyCode() throws InterruptedException {
        String name = "tpm-full";
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = ThreadPoolManager.getOrRegister(name, 1, 1, 1);
        try {
            pool.submit(() -> awaitQuietly(release));
            pool.submit(() -> awaitQuietly(release));
            try {
                pool.submit(() -> awaitQuietly(release));
                fail("Third task should be rejected");
            } catch (RRException e) {
                assertEquals(503, e.getCode());
            }
        } finally {
            release.countDown();
            ThreadPoolManager.shutdown(name);
        }
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
