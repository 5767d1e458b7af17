package model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 并发控制统计信息
 */
@Data
@AllArgsConstructor
public class ConcurrencyStats {
    private int activeLocks;                          // 活跃锁数量
    private int lockedResources;                      // 被锁定的资源数量
    private int pendingOperations;                    // 操作日志中保留的操作数量
    private Map<String, List<ResourceLock>> lockDetails;
}
