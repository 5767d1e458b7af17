package service;

import model.Operation;

/**
 * 实际执行领域变更的回调（如持久化记录修改），在持有写锁期间调用
 *
 * @param <E> 回调可能抛出的异常类型，原样抛回给调用方
 */
@FunctionalInterface
public interface OperationExecutor<E extends Exception> {

    void apply(Operation operation) throws E;
}
