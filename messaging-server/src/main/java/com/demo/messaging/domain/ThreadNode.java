package com.demo.messaging.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One reply in a reconstructed thread.
 * Direct replies of the thread root sit at depth 0.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreadNode {

    private Message message;
    private int depth;

    @Builder.Default
    private List<ThreadNode> replies = new ArrayList<>();

    public static ThreadNode of(Message message, int depth) {
        return ThreadNode.builder()
            .message(message)
            .depth(depth)
            .build();
    }
}
