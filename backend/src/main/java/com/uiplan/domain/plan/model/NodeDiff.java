package com.uiplan.domain.plan.model;

import java.util.Map;

/**
 * Change classification for a single node id.
 *
 * @param oldProps props before the change (nullable for added nodes)
 * @param newProps props after the change (nullable for removed nodes)
 */
public record NodeDiff(
        DiffType type,
        String nodeId,
        String kind,
        Map<String, Object> oldProps,
        Map<String, Object> newProps
) {
    public boolean isChange() {
        return type != DiffType.UNCHANGED;
    }
}
