package model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 冲突解决方案：策略 + 策略相关的数据
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Resolution {
    public static final String ACTION_CONFIRM_DELETE = "confirm_delete";

    private ResolutionStrategy strategy;
    private Map<String, Object> mergedData;   // merge
    private String winner;                    // merge / latest_wins 的获胜操作ID
    private String action;                    // delete_wins

    public static Resolution merge(Map<String, Object> mergedData, String winner) {
        return Resolution.builder()
                .strategy(ResolutionStrategy.MERGE)
                .mergedData(mergedData)
                .winner(winner)
                .build();
    }

    public static Resolution deleteWins() {
        return Resolution.builder()
                .strategy(ResolutionStrategy.DELETE_WINS)
                .action(ACTION_CONFIRM_DELETE)
                .build();
    }

    public static Resolution latestWins(String winner) {
        return Resolution.builder()
                .strategy(ResolutionStrategy.LATEST_WINS)
                .winner(winner)
                .build();
    }

    public static Resolution manualResolve() {
        return Resolution.builder()
                .strategy(ResolutionStrategy.MANUAL_RESOLVE)
                .build();
    }
}
