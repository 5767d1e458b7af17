package service.impl;

import exception.LockNotOwnedException;
import exception.LockUnavailableException;
import model.LockRequest;
import model.ResourceKey;
import model.ResourceLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 锁管理器
 * <p>
 * 按资源键维护当前持有者列表。获取锁是非阻塞的：要么立即成功，要么立即抛出
 * {@link LockUnavailableException}，没有等待队列。
 */
public class LockManager {

    private static final Logger logger = LoggerFactory.getLogger(LockManager.class);

    // 资源键 -> 持有者（读锁可以有多个持有者）
    private final Map<String, List<ResourceLock>> locks = new HashMap<>();

    private final ReentrantReadWriteLock tableLock = new ReentrantReadWriteLock();

    private final Clock clock;

    public LockManager() {
        this(Clock.systemUTC());
    }

    public LockManager(Clock clock) {
        this.clock = clock;
    }

    /**
     * 获取锁
     *
     * @param request 锁请求
     * @return 授予的锁（副本）
     * @throws LockUnavailableException 资源被其他用户/会话以不兼容的锁持有
     */
    public ResourceLock acquireLock(LockRequest request) {
        validate(request);
        String resourceKey = ResourceKey.of(request.getResourceType(), request.getResourceId());

        tableLock.writeLock().lock();
        try {
            long now = clock.millis();
            List<ResourceLock> holders = locks.computeIfAbsent(resourceKey, k -> new ArrayList<>());

            // 清理过期锁
            evictExpired(resourceKey, holders, now);

            ResourceLock reentrant = null;
            for (ResourceLock existing : holders) {
                if (existing.isOwnedBy(request.getUserId(), request.getSessionId())) {
                    reentrant = existing;
                    continue;
                }
                if (!existing.getLockType().isCompatibleWith(request.getLockType())) {
                    logger.warn("获取锁失败: resource={}, requestType={}, userId={}, holder={}, holderType={}",
                            resourceKey, request.getLockType(), request.getUserId(),
                            existing.getOwnerId(), existing.getLockType());
                    throw new LockUnavailableException(resourceKey, existing);
                }
            }

            ResourceLock lock = ResourceLock.builder()
                    .resourceId(request.getResourceId())
                    .resourceType(request.getResourceType())
                    .lockType(request.getLockType())
                    .ownerId(request.getUserId())
                    .sessionId(request.getSessionId())
                    .acquiredAt(now)
                    .expiresAt(now + request.getTimeoutMillis())
                    .build();

            if (reentrant != null) {
                holders.remove(reentrant);
            }
            holders.add(lock);

            logger.info("获取锁成功: resource={}, lockType={}, userId={}, sessionId={}, reentrant={}",
                    resourceKey, lock.getLockType(), lock.getOwnerId(), lock.getSessionId(), reentrant != null);
            return lock.copy();
        } finally {
            tableLock.writeLock().unlock();
        }
    }

    /**
     * 释放锁
     *
     * @throws LockNotOwnedException 不存在该用户+会话持有的锁
     */
    public void releaseLock(String resourceType, String resourceId, String userId, String sessionId) {
        String resourceKey = ResourceKey.of(resourceType, resourceId);

        tableLock.writeLock().lock();
        try {
            List<ResourceLock> holders = locks.get(resourceKey);
            if (holders == null || holders.isEmpty()) {
                throw LockNotOwnedException.notFound(resourceKey);
            }

            Iterator<ResourceLock> iterator = holders.iterator();
            while (iterator.hasNext()) {
                ResourceLock lock = iterator.next();
                if (lock.isOwnedBy(userId, sessionId)) {
                    iterator.remove();
                    if (holders.isEmpty()) {
                        locks.remove(resourceKey);
                    }
                    logger.info("锁已释放: resource={}, userId={}, sessionId={}", resourceKey, userId, sessionId);
                    return;
                }
            }
            throw LockNotOwnedException.notOwned(userId, sessionId);
        } finally {
            tableLock.writeLock().unlock();
        }
    }

    /**
     * 清理所有过期锁
     */
    public void cleanupExpiredLocks() {
        tableLock.writeLock().lock();
        try {
            long now = clock.millis();
            Iterator<Map.Entry<String, List<ResourceLock>>> iterator = locks.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<String, List<ResourceLock>> entry = iterator.next();
                evictExpired(entry.getKey(), entry.getValue(), now);
                if (entry.getValue().isEmpty()) {
                    iterator.remove();
                }
            }
        } finally {
            tableLock.writeLock().unlock();
        }
    }

    /**
     * 获取所有未过期的锁快照
     *
     * @return 资源键 -> 持有的锁（均为副本）
     */
    public Map<String, List<ResourceLock>> getActiveLocks() {
        tableLock.readLock().lock();
        try {
            long now = clock.millis();
            Map<String, List<ResourceLock>> result = new HashMap<>();
            for (Map.Entry<String, List<ResourceLock>> entry : locks.entrySet()) {
                List<ResourceLock> active = new ArrayList<>();
                for (ResourceLock lock : entry.getValue()) {
                    if (!lock.isExpired(now)) {
                        active.add(lock.copy());
                    }
                }
                if (!active.isEmpty()) {
                    result.put(entry.getKey(), Collections.unmodifiableList(active));
                }
            }
            return Collections.unmodifiableMap(result);
        } finally {
            tableLock.readLock().unlock();
        }
    }

    private void evictExpired(String resourceKey, List<ResourceLock> holders, long now) {
        holders.removeIf(lock -> {
            boolean expired = lock.isExpired(now);
            if (expired) {
                logger.warn("锁已超时自动释放: resource={}, userId={}, sessionId={}",
                        resourceKey, lock.getOwnerId(), lock.getSessionId());
            }
            return expired;
        });
    }

    private static void validate(LockRequest request) {
        if (request == null || isBlank(request.getResourceType()) || isBlank(request.getResourceId())
                || isBlank(request.getUserId()) || request.getSessionId() == null
                || request.getLockType() == null) {
            throw new IllegalArgumentException("lock request parameters must not be empty");
        }
        if (request.getTimeoutMillis() < 0) {
            throw new IllegalArgumentException("lock timeout must not be negative: " + request.getTimeoutMillis());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
