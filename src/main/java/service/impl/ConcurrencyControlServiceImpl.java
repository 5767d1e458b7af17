package service.impl;

import exception.ConcurrencyControlException;
import exception.ConflictRejectedException;
import exception.ErrorCode;
import model.ConcurrencyConfig;
import model.ConcurrencyStats;
import model.ConflictResult;
import model.LockRequest;
import model.LockType;
import model.Operation;
import model.OperationType;
import model.Resolution;
import model.ResourceLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import service.ConcurrencyControlService;
import service.OperationExecutor;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 并发控制服务实现
 * <p>
 * 锁管理器、操作日志和冲突检测器由本实例独占，不共享给其他组件。
 * 冲突检测只是合并策略的依据，防止重复执行依靠的是写锁。
 */
public class ConcurrencyControlServiceImpl implements ConcurrencyControlService {

    private static final Logger logger = LoggerFactory.getLogger(ConcurrencyControlServiceImpl.class);

    private final LockManager lockManager;
    private final OperationLog operationLog;
    private final ConflictDetector conflictDetector;
    private final ConcurrencyConfig config;

    // 后台清理任务
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> cleanupFuture;

    public ConcurrencyControlServiceImpl() {
        this(ConcurrencyConfig.defaults());
    }

    public ConcurrencyControlServiceImpl(ConcurrencyConfig config) {
        this(config, Clock.systemUTC());
    }

    public ConcurrencyControlServiceImpl(ConcurrencyConfig config, Clock clock) {
        this(new LockManager(clock),
                new OperationLog(clock),
                new ConflictDetector(config.getConflictWindowMillis()),
                config);
    }

    public ConcurrencyControlServiceImpl(LockManager lockManager,
                                         OperationLog operationLog,
                                         ConflictDetector conflictDetector,
                                         ConcurrencyConfig config) {
        this.lockManager = lockManager;
        this.operationLog = operationLog;
        this.conflictDetector = conflictDetector;
        this.config = config;
        logger.info("并发控制服务初始化完成: lockTimeout={}ms, conflictWindow={}ms, cleanupInterval={}ms, retention={}ms",
                config.getLockTimeoutMillis(), conflictDetector.getConflictWindowMillis(),
                config.getCleanupIntervalMillis(), config.getOperationRetentionMillis());
    }

    @Override
    public <E extends Exception> void execute(Operation op, OperationExecutor<E> executor) throws E {
        validate(op, executor);

        // 1. 获取写锁，失败直接抛出，操作不会入日志也不会执行
        lockManager.acquireLock(LockRequest.builder()
                .resourceId(op.getResourceId())
                .resourceType(op.getResourceType())
                .lockType(LockType.WRITE)
                .userId(op.getUserId())
                .sessionId(op.getSessionId())
                .timeoutMillis(config.getLockTimeoutMillis())
                .build());

        try {
            // 2. 检测冲突
            List<Operation> existingOps = operationLog.getOperations(op.getResourceType(), op.getResourceId());
            ConflictResult conflict = conflictDetector.detectConflict(op, existingOps);

            if (conflict.hasConflict()) {
                logger.warn("检测到操作冲突: operationId={}, conflictType={}, conflictingOpId={}",
                        op.getId(), conflict.getConflictType().getValue(),
                        conflict.getConflictingOperation().getId());
                handleConflict(op, conflict);
            }

            // 3. 记录操作
            operationLog.addOperation(op);

            // 4. 执行操作
            try {
                executor.apply(op);
            } catch (Throwable t) {
                operationLog.removeOperation(op.getResourceType(), op.getResourceId(), op.getId());
                logger.warn("操作执行失败，已从操作日志移除: operationId={}, error={}", op.getId(), t.toString());
                throw t;
            }

            logger.info("操作执行成功: operationId={}, resourceType={}, resourceId={}, userId={}",
                    op.getId(), op.getResourceType(), op.getResourceId(), op.getUserId());
        } finally {
            releaseLock(op);
        }
    }

    /**
     * 根据解决策略处理冲突，拒绝时抛出 {@link ConflictRejectedException}
     */
    private void handleConflict(Operation op, ConflictResult conflict) {
        Resolution resolution = conflict.getResolution();
        if (resolution == null || resolution.getStrategy() == null) {
            throw new ConflictRejectedException(ErrorCode.INVALID_RESOLUTION,
                    "invalid conflict resolution strategy", conflict);
        }

        switch (resolution.getStrategy()) {
            case MERGE:
                if (resolution.getMergedData() != null) {
                    op.setData(new HashMap<>(resolution.getMergedData()));
                }
                logger.info("冲突已合并: operationId={}, winner={}", op.getId(), resolution.getWinner());
                return;
            case DELETE_WINS:
                if (op.getType() != OperationType.DELETE) {
                    throw reject(op, "operation cancelled due to delete conflict", conflict);
                }
                return;
            case LATEST_WINS:
                if (resolution.getWinner() != null && !resolution.getWinner().equals(op.getId())) {
                    throw reject(op, "operation cancelled, latest operation wins", conflict);
                }
                return;
            case MANUAL_RESOLVE:
                throw reject(op, "manual conflict resolution required", conflict);
            default:
                throw new ConflictRejectedException(ErrorCode.INVALID_RESOLUTION,
                        "unknown conflict resolution strategy: " + resolution.getStrategy().getValue(), conflict);
        }
    }

    private static ConflictRejectedException reject(Operation op, String message, ConflictResult conflict) {
        logger.warn("操作被冲突策略拒绝: operationId={}, strategy={}, reason={}",
                op.getId(), conflict.getResolution().getStrategy().getValue(), message);
        return new ConflictRejectedException(message, conflict);
    }

    private void releaseLock(Operation op) {
        try {
            lockManager.releaseLock(op.getResourceType(), op.getResourceId(), op.getUserId(), op.getSessionId());
        } catch (ConcurrencyControlException e) {
            logger.error("释放锁失败: resourceType={}, resourceId={}, userId={}",
                    op.getResourceType(), op.getResourceId(), op.getUserId(), e);
        }
    }

    @Override
    public ConcurrencyStats getConcurrencyStats() {
        Map<String, List<ResourceLock>> activeLocks = lockManager.getActiveLocks();
        int lockCount = 0;
        for (List<ResourceLock> holders : activeLocks.values()) {
            lockCount += holders.size();
        }
        return new ConcurrencyStats(lockCount, activeLocks.size(), operationLog.size(), activeLocks);
    }

    @Override
    public void cleanup() {
        lockManager.cleanupExpiredLocks();
        operationLog.cleanupOldOperations(config.getOperationRetentionMillis());
    }

    @Override
    public synchronized void startCleanupTasks() {
        if (cleanupFuture != null && !cleanupFuture.isDone()) {
            return;
        }
        if (scheduler == null || scheduler.isShutdown()) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "concurrency-control-cleanup");
                thread.setDaemon(true);
                return thread;
            });
        }
        long interval = config.getCleanupIntervalMillis();
        cleanupFuture = scheduler.scheduleAtFixedRate(() -> {
            try {
                cleanup();
            } catch (RuntimeException e) {
                logger.error("后台清理任务执行失败", e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
        logger.info("后台清理任务已启动: interval={}ms", interval);
    }

    @Override
    public synchronized void shutdown() {
        if (cleanupFuture != null) {
            cleanupFuture.cancel(false);
            cleanupFuture = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            logger.info("后台清理任务已停止");
        }
    }

    public synchronized boolean isCleanupRunning() {
        return cleanupFuture != null && !cleanupFuture.isDone();
    }

    private static void validate(Operation op, OperationExecutor<?> executor) {
        if (op == null || executor == null) {
            throw new IllegalArgumentException("operation and executor must not be null");
        }
        if (op.getId() == null || op.getType() == null || op.getResourceType() == null
                || op.getResourceId() == null || op.getUserId() == null || op.getSessionId() == null) {
            throw new IllegalArgumentException("operation fields must not be empty: " + op.getId());
        }
    }
}
