package com.demo.messaging.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rows the post-deletion cleanup pass still found and removed.
 * All zeros means the database cascade had already done the work.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanupReport {

    private Long userId;
    private int messagesRemoved;
    private int historiesRemoved;
    private int notificationsRemoved;
    private int failedSteps;

    public boolean isClean() {
        return failedSteps == 0;
    }
}
