import exception.ErrorCode;
import exception.LockNotOwnedException;
import exception.LockUnavailableException;
import model.LockRequest;
import model.LockType;
import model.ResourceLock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import service.impl.LockManager;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 锁管理器测试
 */
public class LockManagerTest {

    private MutableClock clock;
    private LockManager lockManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        lockManager = new LockManager(clock);
    }

    private static LockRequest request(LockType type, String userId, String sessionId, long timeoutMillis) {
        return LockRequest.builder()
                .resourceType("record")
                .resourceId("rec1")
                .lockType(type)
                .userId(userId)
                .sessionId(sessionId)
                .timeoutMillis(timeoutMillis)
                .build();
    }

    @Test
    @DisplayName("写锁被占用时其他用户获取失败")
    void testWriteLockDeniedToOtherUser() {
        ResourceLock lock = lockManager.acquireLock(request(LockType.WRITE, "user1", "s1", 30_000));
        assertEquals("user1", lock.getOwnerId());
        assertEquals(lock.getAcquiredAt() + 30_000, lock.getExpiresAt());

        LockUnavailableException e = assertThrows(LockUnavailableException.class,
                () -> lockManager.acquireLock(request(LockType.WRITE, "user2", "s2", 30_000)));
        assertTrue(e.getMessage().contains("resource locked by user1"));
        assertEquals("record:rec1", e.getResourceKey());
        assertEquals(ErrorCode.LOCK_UNAVAILABLE, e.getErrorCode());
    }

    @Test
    @DisplayName("读锁之间兼容")
    void testReadLocksCompatible() {
        lockManager.acquireLock(request(LockType.READ, "user1", "s1", 30_000));
        lockManager.acquireLock(request(LockType.READ, "user2", "s2", 30_000));

        List<ResourceLock> holders = lockManager.getActiveLocks().get("record:rec1");
        assertEquals(2, holders.size());
    }

    @Test
    @DisplayName("读锁与写锁、排他锁互斥")
    void testReadIncompatibleWithWriteAndExclusive() {
        lockManager.acquireLock(request(LockType.READ, "user1", "s1", 30_000));

        assertThrows(LockUnavailableException.class,
                () -> lockManager.acquireLock(request(LockType.WRITE, "user2", "s2", 30_000)));
        assertThrows(LockUnavailableException.class,
                () -> lockManager.acquireLock(request(LockType.EXCLUSIVE, "user2", "s2", 30_000)));
    }

    @Test
    @DisplayName("排他锁拒绝读锁")
    void testExclusiveRejectsRead() {
        lockManager.acquireLock(request(LockType.EXCLUSIVE, "user1", "s1", 30_000));

        assertThrows(LockUnavailableException.class,
                () -> lockManager.acquireLock(request(LockType.READ, "user2", "s2", 30_000)));
    }

    @Test
    @DisplayName("同一用户同一会话可重入，并刷新过期时间")
    void testReentrantAcquire() {
        lockManager.acquireLock(request(LockType.WRITE, "user1", "s1", 1_000));
        clock.advanceMillis(500);
        ResourceLock again = lockManager.acquireLock(request(LockType.EXCLUSIVE, "user1", "s1", 1_000));

        assertEquals(LockType.EXCLUSIVE, again.getLockType());
        List<ResourceLock> holders = lockManager.getActiveLocks().get("record:rec1");
        assertEquals(1, holders.size());
        assertEquals(again.getExpiresAt(), holders.get(0).getExpiresAt());
    }

    @Test
    @DisplayName("同一用户不同会话视为不同持有者")
    void testSameUserDifferentSessionConflicts() {
        lockManager.acquireLock(request(LockType.WRITE, "user1", "s1", 30_000));

        assertThrows(LockUnavailableException.class,
                () -> lockManager.acquireLock(request(LockType.WRITE, "user1", "s2", 30_000)));
    }

    @Test
    @DisplayName("过期锁在下次获取时被惰性清理")
    void testExpiredLockEvictedOnAcquire() {
        lockManager.acquireLock(request(LockType.WRITE, "user1", "s1", 1_000));

        clock.advanceMillis(1_001);
        assertTrue(lockManager.getActiveLocks().isEmpty());

        ResourceLock lock = lockManager.acquireLock(request(LockType.WRITE, "user2", "s2", 1_000));
        assertEquals("user2", lock.getOwnerId());
        assertEquals(1, lockManager.getActiveLocks().get("record:rec1").size());
    }

    @Test
    @DisplayName("到期时刻本身仍然有效")
    void testLockValidUntilExpiry() {
        lockManager.acquireLock(request(LockType.WRITE, "user1", "s1", 1_000));
        clock.advanceMillis(1_000);

        assertThrows(LockUnavailableException.class,
                () -> lockManager.acquireLock(request(LockType.WRITE, "user2", "s2", 1_000)));
    }

    @Test
    @DisplayName("清理任务移除过期锁，保留未过期锁")
    void testCleanupExpiredLocks() {
        lockManager.acquireLock(request(LockType.WRITE, "user1", "s1", 1_000));
        lockManager.acquireLock(LockRequest.builder()
                .resourceType("table").resourceId("tbl1").lockType(LockType.WRITE)
                .userId("user2").sessionId("s2").timeoutMillis(60_000).build());

        clock.advanceMillis(5_000);
        lockManager.cleanupExpiredLocks();

        Map<String, List<ResourceLock>> active = lockManager.getActiveLocks();
        assertEquals(1, active.size());
        assertTrue(active.containsKey("table:tbl1"));

        // 过期锁已被移除，原持有者释放时找不到锁
        assertThrows(LockNotOwnedException.class,
                () -> lockManager.releaseLock("record", "rec1", "user1", "s1"));
    }

    @Test
    @DisplayName("释放锁后其他用户可以获取")
    void testReleaseLock() {
        lockManager.acquireLock(request(LockType.WRITE, "user1", "s1", 30_000));
        lockManager.releaseLock("record", "rec1", "user1", "s1");

        assertTrue(lockManager.getActiveLocks().isEmpty());
        assertDoesNotThrow(() -> lockManager.acquireLock(request(LockType.WRITE, "user2", "s2", 30_000)));
    }

    @Test
    @DisplayName("非持有者释放锁失败")
    void testReleaseByNonOwner() {
        lockManager.acquireLock(request(LockType.WRITE, "user1", "s1", 30_000));

        LockNotOwnedException e = assertThrows(LockNotOwnedException.class,
                () -> lockManager.releaseLock("record", "rec1", "user2", "s2"));
        assertEquals("lock not owned by user user2 session s2", e.getMessage());
        assertEquals(ErrorCode.LOCK_NOT_OWNED, e.getErrorCode());

        // 原锁仍然有效
        assertEquals(1, lockManager.getActiveLocks().size());
    }

    @Test
    @DisplayName("释放不存在的锁失败")
    void testReleaseMissingLock() {
        LockNotOwnedException e = assertThrows(LockNotOwnedException.class,
                () -> lockManager.releaseLock("record", "rec1", "user1", "s1"));
        assertEquals("lock not found for resource record:rec1", e.getMessage());
    }

    @Test
    @DisplayName("读锁持有者各自独立释放")
    void testReadHoldersReleasedIndependently() {
        lockManager.acquireLock(request(LockType.READ, "user1", "s1", 30_000));
        lockManager.acquireLock(request(LockType.READ, "user2", "s2", 30_000));

        lockManager.releaseLock("record", "rec1", "user1", "s1");

        List<ResourceLock> holders = lockManager.getActiveLocks().get("record:rec1");
        assertEquals(1, holders.size());
        assertEquals("user2", holders.get(0).getOwnerId());
        assertThrows(LockUnavailableException.class,
                () -> lockManager.acquireLock(request(LockType.WRITE, "user3", "s3", 30_000)));
    }

    @Test
    @DisplayName("活跃锁快照不可修改且与内部状态隔离")
    void testActiveLocksSnapshotIsolated() {
        lockManager.acquireLock(request(LockType.WRITE, "user1", "s1", 30_000));

        Map<String, List<ResourceLock>> snapshot = lockManager.getActiveLocks();
        assertThrows(UnsupportedOperationException.class, snapshot::clear);

        snapshot.get("record:rec1").get(0).setOwnerId("intruder");
        assertEquals("user1", lockManager.getActiveLocks().get("record:rec1").get(0).getOwnerId());
    }

    @Test
    @DisplayName("参数验证")
    void testParameterValidation() {
        assertThrows(IllegalArgumentException.class, () -> lockManager.acquireLock(null));
        assertThrows(IllegalArgumentException.class,
                () -> lockManager.acquireLock(request(null, "user1", "s1", 30_000)));
        assertThrows(IllegalArgumentException.class,
                () -> lockManager.acquireLock(request(LockType.WRITE, null, "s1", 30_000)));
        assertThrows(IllegalArgumentException.class,
                () -> lockManager.acquireLock(request(LockType.WRITE, "user1", "s1", -1)));
    }

    @Test
    @DisplayName("并发获取写锁只有一个成功")
    void testConcurrentWriteAcquisition() throws InterruptedException {
        LockManager realClockManager = new LockManager();
        int threadCount = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger deniedCount = new AtomicInteger();

        for (int i = 0; i < threadCount; i++) {
            final String userId = "user" + i;
            executor.submit(() -> {
                try {
                    start.await();
                    realClockManager.acquireLock(request(LockType.WRITE, userId, "session-" + userId, 30_000));
                    successCount.incrementAndGet();
                } catch (LockUnavailableException e) {
                    deniedCount.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(5, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, successCount.get());
        assertEquals(threadCount - 1, deniedCount.get());
    }
}
