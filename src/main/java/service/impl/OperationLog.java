package service.impl;

import model.Operation;
import model.ResourceKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 操作日志
 * <p>
 * 按资源保存最近提交的操作，仅作为冲突检测的依据，不是审计记录。
 */
public class OperationLog {

    private static final Logger logger = LoggerFactory.getLogger(OperationLog.class);

    // 资源键 -> 按提交顺序排列的操作
    private final Map<String, List<Operation>> operations = new HashMap<>();

    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();

    private final Clock clock;

    public OperationLog() {
        this(Clock.systemUTC());
    }

    public OperationLog(Clock clock) {
        this.clock = clock;
    }

    public void addOperation(Operation op) {
        rwLock.writeLock().lock();
        try {
            operations.computeIfAbsent(op.getResourceKey(), k -> new ArrayList<>()).add(op);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * 获取资源的操作列表
     *
     * @return 副本，调用方修改不影响日志
     */
    public List<Operation> getOperations(String resourceType, String resourceId) {
        rwLock.readLock().lock();
        try {
            List<Operation> ops = operations.get(ResourceKey.of(resourceType, resourceId));
            return ops == null ? new ArrayList<>() : new ArrayList<>(ops);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    /**
     * 移除第一个匹配的操作，不存在时忽略
     */
    public void removeOperation(String resourceType, String resourceId, String operationId) {
        String resourceKey = ResourceKey.of(resourceType, resourceId);

        rwLock.writeLock().lock();
        try {
            List<Operation> ops = operations.get(resourceKey);
            if (ops == null) {
                return;
            }
            Iterator<Operation> iterator = ops.iterator();
            while (iterator.hasNext()) {
                if (iterator.next().getId().equals(operationId)) {
                    iterator.remove();
                    break;
                }
            }
            if (ops.isEmpty()) {
                operations.remove(resourceKey);
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * 清理早于 now - maxAgeMillis 的操作，并移除空的资源键
     */
    public void cleanupOldOperations(long maxAgeMillis) {
        rwLock.writeLock().lock();
        try {
            long cutoff = clock.millis() - maxAgeMillis;
            int removed = 0;
            Iterator<Map.Entry<String, List<Operation>>> iterator = operations.entrySet().iterator();
            while (iterator.hasNext()) {
                List<Operation> ops = iterator.next().getValue();
                int before = ops.size();
                ops.removeIf(op -> op.getTimestamp() < cutoff);
                removed += before - ops.size();
                if (ops.isEmpty()) {
                    iterator.remove();
                }
            }
            if (removed > 0) {
                logger.debug("清理旧操作: removed={}, remainingResources={}", removed, operations.size());
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * 当前保留的操作总数
     */
    public int size() {
        rwLock.readLock().lock();
        try {
            int total = 0;
            for (List<Operation> ops : operations.values()) {
                total += ops.size();
            }
            return total;
        } finally {
            rwLock.readLock().unlock();
        }
    }
}
