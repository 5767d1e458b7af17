package model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 锁请求
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LockRequest {
    private String resourceId;
    private String resourceType;
    private LockType lockType;
    private String userId;
    private String sessionId;
    private long timeoutMillis;        // 锁持有时间(ms)，到期后可被清理
}
