package model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 待执行的变更操作
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Operation {
    private String id;
    private OperationType type;
    private String resourceType;
    private String resourceId;
    private String userId;
    private String sessionId;
    private Map<String, Object> data;  // 字段名 -> 新值
    private long timestamp;            // 提交时间(ms)
    private long version;              // 调用方提供的单调版本号

    public String getResourceKey() {
        return ResourceKey.of(resourceType, resourceId);
    }

    public boolean isSameResource(Operation other) {
        return resourceType.equals(other.resourceType) && resourceId.equals(other.resourceId);
    }

    /**
     * 同一用户同一会话视为同一操作者
     */
    public boolean isSameActor(Operation other) {
        return userId.equals(other.userId) && sessionId.equals(other.sessionId);
    }
}
