package model;

/**
 * 冲突解决策略
 */
public enum ResolutionStrategy {
    /**
     * 合并两次更新的字段
     */
    MERGE("merge"),

    /**
     * 删除优先，非删除操作被取消
     */
    DELETE_WINS("delete_wins"),

    /**
     * 最新操作获胜
     */
    LATEST_WINS("latest_wins"),

    /**
     * 需要人工处理
     */
    MANUAL_RESOLVE("manual_resolve");

    private final String value;

    ResolutionStrategy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
