package com.z254.loom.delegation;

import com.z254.loom.domain.model.AgentState;

import java.util.ArrayList;
import java.util.List;

/**
 * State keys written by the delegation nodes. Values are lists of task ids.
 */
public final class DelegationStateKeys {

    public static final String PENDING_TASK_IDS = "delegation.pendingTaskIds";
    public static final String COMPLETED_TASK_IDS = "delegation.completedTaskIds";
    public static final String FAILED_TASK_IDS = "delegation.failedTaskIds";

    private DelegationStateKeys() {
    }

    /**
     * Read a task-id list, tolerating the generic lists a checkpoint round trip produces.
     */
    public static List<String> readIds(AgentState state, String key) {
        Object value = state.getValue(key);
        List<String> ids = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object id : list) {
                if (id != null) {
                    ids.add(String.valueOf(id));
                }
            }
        }
        return ids;
    }
}
