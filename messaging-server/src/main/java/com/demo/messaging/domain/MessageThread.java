package com.demo.messaging.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageThread {

    private Message root;

    @Builder.Default
    private List<ThreadNode> replies = new ArrayList<>();

    private int totalReplies;
}
