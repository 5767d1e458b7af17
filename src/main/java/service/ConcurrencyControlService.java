package service;

import model.ConcurrencyStats;
import model.Operation;

/**
 * 并发控制服务接口
 */
public interface ConcurrencyControlService extends AutoCloseable {

    /**
     * 在并发控制下执行操作
     * <p>
     * 依次获取写锁、检测并解决冲突、记录操作、调用执行回调，无论成功与否都会释放锁。
     * 回调失败时操作会从日志中移除，但回调自身已产生的副作用不会被撤销。
     *
     * @param op 待执行的操作；merge 策略下其 data 会被替换为合并后的数据
     * @param executor 执行回调，每次调用最多执行一次
     * @throws exception.LockUnavailableException 资源被其他用户/会话锁定
     * @throws exception.ConflictRejectedException 冲突解决策略拒绝了该操作
     * @throws E 回调抛出的异常，原样抛出
     */
    <E extends Exception> void execute(Operation op, OperationExecutor<E> executor) throws E;

    /**
     * 获取并发控制统计信息
     */
    ConcurrencyStats getConcurrencyStats();

    /**
     * 立即执行一次清理：过期锁和超过保留时间的操作
     */
    void cleanup();

    /**
     * 启动后台定时清理任务，重复调用无副作用
     */
    void startCleanupTasks();

    /**
     * 停止后台清理任务
     */
    void shutdown();

    @Override
    default void close() {
        shutdown();
    }
}
