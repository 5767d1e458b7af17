package model;

/**
 * 操作类型
 */
public enum OperationType {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete");

    private final String value;

    OperationType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 按字符串值解析，忽略大小写
     *
     * @throws IllegalArgumentException 未知的操作类型
     */
    public static OperationType fromValue(String value) {
        for (OperationType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown operation type: " + value);
    }
}
