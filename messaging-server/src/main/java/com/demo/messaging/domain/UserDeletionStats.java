package com.demo.messaging.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything that goes away with a user account.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserDeletionStats {

    private Long userId;
    private String username;
    private long sentMessages;
    private long receivedMessages;
    private long totalMessages;
    private long notifications;
    private long messageHistories;
    private long totalDataPoints;
}
