package model;

/**
 * 锁类型
 */
public enum LockType {
    /**
     * 读锁，读锁之间兼容
     */
    READ("read"),

    /**
     * 写锁，不兼容任何其他持有者
     */
    WRITE("write"),

    /**
     * 排他锁
     */
    EXCLUSIVE("exclusive");

    private final String value;

    LockType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 判断新请求的锁能否与已有锁共存（不考虑持有者身份）
     */
    public boolean isCompatibleWith(LockType other) {
        if (this == EXCLUSIVE || other == EXCLUSIVE) {
            return false;
        }
        if (this == WRITE || other == WRITE) {
            return false;
        }
        return this == READ && other == READ;
    }
}
