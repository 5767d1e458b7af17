package model;

/**
 * 冲突类型
 */
public enum ConflictType {
    CONCURRENT_UPDATE("concurrent_update"),
    DELETE_CONFLICT("delete_conflict"),
    DUPLICATE_CREATE("duplicate_create"),
    UNKNOWN_CONFLICT("unknown_conflict");

    private final String value;

    ConflictType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
