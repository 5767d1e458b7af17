package model;

import lombok.Data;

import java.util.Map;

/**
 * 记录变更请求
 */
@Data
public class RecordChangeRequest {
    private String tableId;              // 表ID
    private String recordId;             // 记录ID，对应 resourceId
    private String userId;
    private String sessionId;
    private String action;               // create / update / delete
    private Map<String, Object> fields;  // 变更的字段，对应 data
    private long version;                // 记录版本号
}
