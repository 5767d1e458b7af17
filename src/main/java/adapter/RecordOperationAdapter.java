package adapter;

import model.Operation;
import model.OperationType;
import model.RecordChangeRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import service.ConcurrencyControlService;
import service.OperationExecutor;

import java.time.Clock;
import java.util.HashMap;
import java.util.UUID;

/**
 * 记录变更适配器
 * 将记录服务的变更请求转换为并发控制操作，并在并发控制下执行持久化回调
 */
public class RecordOperationAdapter {

    private static final Logger logger = LoggerFactory.getLogger(RecordOperationAdapter.class);

    public static final String RESOURCE_TYPE_RECORD = "record";

    private final ConcurrencyControlService concurrencyControlService;

    private final Clock clock;

    public RecordOperationAdapter(ConcurrencyControlService concurrencyControlService) {
        this(concurrencyControlService, Clock.systemUTC());
    }

    public RecordOperationAdapter(ConcurrencyControlService concurrencyControlService, Clock clock) {
        this.concurrencyControlService = concurrencyControlService;
        this.clock = clock;
    }

    /**
     * 在并发控制下执行记录变更
     *
     * @param request 记录变更请求
     * @param persister 持久化回调
     * @return 实际执行的操作，发生合并时其 data 为合并后的字段
     * @throws IllegalArgumentException 必要参数缺失或动作未知
     */
    public <E extends Exception> Operation apply(RecordChangeRequest request, OperationExecutor<E> persister) throws E {
        Operation operation = toOperation(request);

        logger.info("记录变更请求转换: tableId={}, recordId={}, action={} -> operationId={}, type={}",
                request.getTableId(), request.getRecordId(), request.getAction(),
                operation.getId(), operation.getType().getValue());

        concurrencyControlService.execute(operation, persister);
        return operation;
    }

    /**
     * 将记录变更请求转换为操作
     */
    private Operation toOperation(RecordChangeRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        if (request.getRecordId() == null || request.getUserId() == null
                || request.getSessionId() == null || request.getAction() == null) {
            logger.error("必要参数缺失: recordId={}, userId={}, sessionId={}, action={}",
                    request.getRecordId(), request.getUserId(), request.getSessionId(), request.getAction());
            throw new IllegalArgumentException("recordId, userId, sessionId and action are required");
        }

        return Operation.builder()
                .id(UUID.randomUUID().toString())
                .type(OperationType.fromValue(request.getAction()))
                .resourceType(RESOURCE_TYPE_RECORD)
                .resourceId(request.getRecordId())
                .userId(request.getUserId())
                .sessionId(request.getSessionId())
                .data(request.getFields() == null ? new HashMap<>() : new HashMap<>(request.getFields()))
                .timestamp(clock.millis())
                .version(request.getVersion())
                .build();
    }
}
