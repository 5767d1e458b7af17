package exception;

/**
 * 释放锁时未找到该用户+会话持有的锁
 */
public class LockNotOwnedException extends ConcurrencyControlException {

    private static final long serialVersionUID = 1L;

    public LockNotOwnedException(String message) {
        super(ErrorCode.LOCK_NOT_OWNED, message);
    }

    public static LockNotOwnedException notFound(String resourceKey) {
        return new LockNotOwnedException("lock not found for resource " + resourceKey);
    }

    public static LockNotOwnedException notOwned(String userId, String sessionId) {
        return new LockNotOwnedException("lock not owned by user " + userId + " session " + sessionId);
    }
}
