package exception;

import model.ResourceLock;

/**
 * 资源已被其他用户/会话以不兼容的方式锁定
 */
public class LockUnavailableException extends ConcurrencyControlException {

    private static final long serialVersionUID = 1L;

    private final String resourceKey;
    private final String holderId;

    public LockUnavailableException(String resourceKey, ResourceLock holder) {
        super(ErrorCode.LOCK_UNAVAILABLE, "resource locked by " + holder.getOwnerId() + ": " + resourceKey);
        this.resourceKey = resourceKey;
        this.holderId = holder.getOwnerId();
    }

    public String getResourceKey() {
        return resourceKey;
    }

    public String getHolderId() {
        return holderId;
    }
}
