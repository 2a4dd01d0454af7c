package com.demo.messaging.service;

import com.demo.messaging.domain.Message;
import com.demo.messaging.domain.MessageThread;
import com.demo.messaging.domain.ThreadNode;
import com.demo.messaging.exception.MessageNotFoundException;
import com.demo.messaging.exception.MessagePermissionDeniedException;
import com.demo.messaging.repository.MessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds reply threads from parent links.
 *
 * Both directions are walked iteratively, so thread depth is bounded by the
 * data and not by the call stack. Replies of one parent are ordered by
 * timestamp, then by id for messages sent at the same instant.
 */
@Service
@Slf4j
public class ThreadReconstructor {

    private final MessageRepository messageRepository;
    private final int batchSize;

    public ThreadReconstructor(MessageRepository messageRepository,
                               @Value("${messaging.thread.batch-size:500}") int batchSize) {
        this.messageRepository = messageRepository;
        this.batchSize = batchSize;
    }

    /**
     * Whole thread around a message, as seen by {@code actorId}.
     * Only the sender or receiver of the requested message may view it. The
     * check covers that message alone: a participant of any reply sees the
     * full thread from its root, including messages between other users.
     */
    @Transactional(readOnly = true)
    public MessageThread getThread(Long messageId, Long actorId) {
        Message requested = load(messageId);
        if (!requested.isParticipant(actorId)) {
            throw new MessagePermissionDeniedException(messageId, actorId, "view the thread of");
        }

        Message root = walkToRoot(requested);
        List<ThreadNode> replies = new ArrayList<>();
        int total = collectReplies(root.getId(), replies);

        log.debug("Thread rebuilt: requestedId={}, rootId={}, replies={}", messageId, root.getId(), total);
        return MessageThread.builder()
            .root(root)
            .replies(replies)
            .totalReplies(total)
            .build();
    }

    /**
     * Ancestor-most message reached by following parent links.
     */
    @Transactional(readOnly = true)
    public Message findThreadRoot(Long messageId) {
        return walkToRoot(load(messageId));
    }

    /**
     * Nested replies below a message; its direct replies sit at depth 0.
     */
    @Transactional(readOnly = true)
    public List<ThreadNode> buildReplyTree(Long messageId) {
        if (!messageRepository.existsById(messageId)) {
            throw MessageNotFoundException.message(messageId);
        }
        List<ThreadNode> replies = new ArrayList<>();
        collectReplies(messageId, replies);
        return replies;
    }

    private Message walkToRoot(Message start) {
        Set<Long> seen = new HashSet<>();
        seen.add(start.getId());

        Message current = start;
        while (current.getParentMessageId() != null) {
            Long parentId = current.getParentMessageId();
            if (!seen.add(parentId)) {
                throw new IllegalStateException("Reply cycle detected at message " + parentId);
            }
            current = load(parentId);
        }
        return current;
    }

    /**
     * Breadth-first over one level of replies per round trip. Nodes live in an
     * arena keyed by message id; each reply is attached to its parent's node.
     *
     * @return number of replies collected
     */
    private int collectReplies(Long startId, List<ThreadNode> topLevel) {
        Map<Long, ThreadNode> arena = new HashMap<>();
        Set<Long> visited = new HashSet<>();
        visited.add(startId);

        List<Long> frontier = List.of(startId);
        int depth = 0;

        while (!frontier.isEmpty()) {
            List<Long> next = new ArrayList<>();

            for (int from = 0; from < frontier.size(); from += batchSize) {
                List<Long> parents = frontier.subList(from, Math.min(from + batchSize, frontier.size()));

                for (Message reply : messageRepository.findRepliesOf(parents)) {
                    if (!visited.add(reply.getId())) {
                        continue;
                    }
                    ThreadNode node = ThreadNode.of(reply, depth);
                    arena.put(reply.getId(), node);

                    Long parentId = reply.getParentMessageId();
                    if (startId.equals(parentId)) {
                        topLevel.add(node);
                    } else {
                        arena.get(parentId).getReplies().add(node);
                    }
                    next.add(reply.getId());
                }
            }

            frontier = next;
            depth++;
        }
        return arena.size();
    }

    private Message load(Long messageId) {
        return messageRepository.findWithParticipantsById(messageId)
            .orElseThrow(() -> MessageNotFoundException.message(messageId));
    }
}
