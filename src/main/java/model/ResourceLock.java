package model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 资源锁
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResourceLock {
    private String resourceId;
    private String resourceType;       // record, table, field, view
    private LockType lockType;
    private String ownerId;            // 持有者用户ID
    private String sessionId;          // 持有者会话ID
    private long acquiredAt;           // 获取时间(ms)
    private long expiresAt;            // 过期时间(ms)

    public boolean isExpired(long now) {
        return now > expiresAt;
    }

    public boolean isOwnedBy(String userId, String session) {
        return ownerId.equals(userId) && sessionId.equals(session);
    }

    public String getResourceKey() {
        return ResourceKey.of(resourceType, resourceId);
    }

    public ResourceLock copy() {
        return toBuilder().build();
    }
}
