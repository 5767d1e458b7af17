package model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;

/**
 * 冲突检测结果
 */
@Data
@AllArgsConstructor
public class ConflictResult {
    @Getter(AccessLevel.NONE)
    private boolean hasConflict;
    private ConflictType conflictType;
    private Operation conflictingOperation;   // 与之冲突的较早操作
    private Resolution resolution;

    public boolean hasConflict() {
        return hasConflict;
    }

    public static ConflictResult noConflict() {
        return new ConflictResult(false, null, null, null);
    }

    public static ConflictResult conflict(ConflictType type, Operation conflictingOperation, Resolution resolution) {
        return new ConflictResult(true, type, conflictingOperation, resolution);
    }
}
