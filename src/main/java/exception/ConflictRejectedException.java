package exception;

import model.ConflictResult;

/**
 * 冲突解决策略拒绝了当前操作
 */
public class ConflictRejectedException extends ConcurrencyControlException {

    private static final long serialVersionUID = 1L;

    private final transient ConflictResult conflict;

    public ConflictRejectedException(String message, ConflictResult conflict) {
        this(ErrorCode.CONFLICT_REJECTED, message, conflict);
    }

    public ConflictRejectedException(ErrorCode errorCode, String message, ConflictResult conflict) {
        super(errorCode, message);
        this.conflict = conflict;
    }

    public ConflictResult getConflict() {
        return conflict;
    }
}
