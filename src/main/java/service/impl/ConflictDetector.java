package service.impl;

import model.ConflictResult;
import model.ConflictType;
import model.Operation;
import model.OperationType;
import model.Resolution;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 冲突检测器
 * <p>
 * 两个操作满足以下全部条件时视为冲突：同一资源、不同操作者（用户+会话）、
 * 时间差不超过冲突窗口、修改了至少一个相同字段。只返回第一个冲突。
 */
public class ConflictDetector {

    private final long conflictWindowMillis;

    public ConflictDetector() {
        this(5_000);
    }

    public ConflictDetector(long conflictWindowMillis) {
        this.conflictWindowMillis = conflictWindowMillis;
    }

    public long getConflictWindowMillis() {
        return conflictWindowMillis;
    }

    public ConflictResult detectConflict(Operation op, List<Operation> existingOps) {
        for (Operation existingOp : existingOps) {
            if (hasConflict(op, existingOp)) {
                ConflictType conflictType = determineConflictType(op, existingOp);
                Resolution resolution = generateResolution(op, existingOp, conflictType);
                return ConflictResult.conflict(conflictType, existingOp, resolution);
            }
        }
        return ConflictResult.noConflict();
    }

    boolean hasConflict(Operation op1, Operation op2) {
        if (!op1.isSameResource(op2)) {
            return false;
        }
        if (op1.isSameActor(op2)) {
            return false;
        }
        if (Math.abs(op1.getTimestamp() - op2.getTimestamp()) > conflictWindowMillis) {
            return false;
        }
        return hasDataConflict(dataOf(op1), dataOf(op2));
    }

    private static boolean hasDataConflict(Map<String, Object> data1, Map<String, Object> data2) {
        for (String key : data1.keySet()) {
            if (data2.containsKey(key)) {
                return true;
            }
        }
        return false;
    }

    ConflictType determineConflictType(Operation op1, Operation op2) {
        if (op1.getType() == OperationType.DELETE || op2.getType() == OperationType.DELETE) {
            return ConflictType.DELETE_CONFLICT;
        }
        if (op1.getType() == OperationType.UPDATE && op2.getType() == OperationType.UPDATE) {
            return ConflictType.CONCURRENT_UPDATE;
        }
        if (op1.getType() == OperationType.CREATE && op2.getType() == OperationType.CREATE) {
            return ConflictType.DUPLICATE_CREATE;
        }
        return ConflictType.UNKNOWN_CONFLICT;
    }

    private Resolution generateResolution(Operation op, Operation existingOp, ConflictType conflictType) {
        switch (conflictType) {
            case CONCURRENT_UPDATE:
                return Resolution.merge(mergeData(op, existingOp), selectWinner(op, existingOp));
            case DELETE_CONFLICT:
                return Resolution.deleteWins();
            case DUPLICATE_CREATE:
                return Resolution.latestWins(selectWinner(op, existingOp));
            default:
                return Resolution.manualResolve();
        }
    }

    /**
     * 浅合并两个操作的数据，较新的操作（时间戳更晚，相同时取当前操作）覆盖较旧的
     */
    Map<String, Object> mergeData(Operation op, Operation existingOp) {
        Operation older = existingOp;
        Operation newer = op;
        if (existingOp.getTimestamp() > op.getTimestamp()) {
            older = op;
            newer = existingOp;
        }
        Map<String, Object> merged = new HashMap<>(dataOf(older));
        merged.putAll(dataOf(newer));
        return merged;
    }

    /**
     * 选择获胜操作：版本号高者胜，其次时间戳晚者胜，仍相同时取第二个参数
     */
    String selectWinner(Operation op1, Operation op2) {
        if (op1.getVersion() > op2.getVersion()) {
            return op1.getId();
        }
        if (op2.getVersion() > op1.getVersion()) {
            return op2.getId();
        }
        if (op1.getTimestamp() > op2.getTimestamp()) {
            return op1.getId();
        }
        return op2.getId();
    }

    private static Map<String, Object> dataOf(Operation op) {
        return op.getData() == null ? Collections.emptyMap() : op.getData();
    }
}
