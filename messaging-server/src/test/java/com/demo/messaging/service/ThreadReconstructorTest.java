package com.demo.messaging.service;

import com.demo.messaging.MessagingIntegrationTest;
import com.demo.messaging.domain.Message;
import com.demo.messaging.domain.MessageThread;
import com.demo.messaging.domain.ThreadNode;
import com.demo.messaging.domain.UserAccount;
import com.demo.messaging.exception.MessageNotFoundException;
import com.demo.messaging.exception.MessagePermissionDeniedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadReconstructorTest extends MessagingIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");

    @Autowired
    private ThreadReconstructor threadReconstructor;

    private UserAccount alice;
    private UserAccount bob;

    @BeforeEach
    void setUp() {
        alice = user("alice");
        bob = user("bob");
    }

    @Test
    void rebuildsWholeThreadFromAnyMessage() {
        Message root = post(alice, bob, "R", null, T0);
        Message a = post(bob, alice, "A", root, T0.plusSeconds(10));
        Message b = post(alice, bob, "B", root, T0.plusSeconds(20));
        Message c = post(alice, bob, "C", a, T0.plusSeconds(30));

        MessageThread thread = threadReconstructor.getThread(c.getId(), bob.getId());

        assertThat(thread.getRoot().getId()).isEqualTo(root.getId());
        assertThat(thread.getTotalReplies()).isEqualTo(3);
        assertThat(thread.getReplies()).extracting(node -> node.getMessage().getId())
            .containsExactly(a.getId(), b.getId());
        assertThat(thread.getReplies()).extracting(ThreadNode::getDepth).containsOnly(0);

        ThreadNode nodeA = thread.getReplies().get(0);
        assertThat(nodeA.getReplies()).hasSize(1);
        assertThat(nodeA.getReplies().get(0).getMessage().getId()).isEqualTo(c.getId());
        assertThat(nodeA.getReplies().get(0).getDepth()).isEqualTo(1);
        assertThat(thread.getReplies().get(1).getReplies()).isEmpty();
    }

    @Test
    void rootOfRootIsItself() {
        Message root = post(alice, bob, "R", null, T0);

        assertThat(threadReconstructor.findThreadRoot(root.getId()).getId()).isEqualTo(root.getId());
        assertThat(threadReconstructor.buildReplyTree(root.getId())).isEmpty();
    }

    @Test
    void repliesSentAtTheSameInstantAreOrderedById() {
        Message root = post(alice, bob, "R", null, T0);
        Message first = post(bob, alice, "first", root, T0.plusSeconds(5));
        Message second = post(alice, bob, "second", root, T0.plusSeconds(5));
        Message earlier = post(bob, alice, "earlier", root, T0.plusSeconds(1));

        List<ThreadNode> replies = threadReconstructor.buildReplyTree(root.getId());

        assertThat(replies).extracting(node -> node.getMessage().getId())
            .containsExactly(earlier.getId(), first.getId(), second.getId());
    }

    @Test
    void subtreeDepthStartsAtZeroBelowRequestedMessage() {
        Message root = post(alice, bob, "R", null, T0);
        Message a = post(bob, alice, "A", root, T0.plusSeconds(1));
        Message c = post(alice, bob, "C", a, T0.plusSeconds(2));

        List<ThreadNode> replies = threadReconstructor.buildReplyTree(a.getId());

        assertThat(replies).hasSize(1);
        assertThat(replies.get(0).getMessage().getId()).isEqualTo(c.getId());
        assertThat(replies.get(0).getDepth()).isZero();
    }

    @Test
    void deepChainDoesNotExhaustTheStack() {
        int length = 300;
        Message root = post(alice, bob, "m0", null, T0);
        Message current = root;
        for (int i = 1; i <= length; i++) {
            current = post(i % 2 == 0 ? alice : bob, i % 2 == 0 ? bob : alice, "m" + i, current, T0.plusSeconds(i));
        }

        assertThat(threadReconstructor.findThreadRoot(current.getId()).getId()).isEqualTo(root.getId());

        MessageThread thread = threadReconstructor.getThread(current.getId(), alice.getId());
        assertThat(thread.getTotalReplies()).isEqualTo(length);

        ThreadNode node = thread.getReplies().get(0);
        int depth = 0;
        while (!node.getReplies().isEmpty()) {
            assertThat(node.getReplies()).hasSize(1);
            node = node.getReplies().get(0);
            depth++;
        }
        assertThat(depth).isEqualTo(length - 1);
        assertThat(node.getDepth()).isEqualTo(length - 1);
        assertThat(node.getMessage().getId()).isEqualTo(current.getId());
    }

    @Test
    void outsiderCannotViewThread() {
        UserAccount carol = user("carol");
        Message root = post(alice, bob, "R", null, T0);

        assertThatThrownBy(() -> threadReconstructor.getThread(root.getId(), carol.getId()))
            .isInstanceOf(MessagePermissionDeniedException.class);
    }

    @Test
    void accessIsCheckedAgainstRequestedMessage() {
        UserAccount carol = user("carol");
        Message root = post(alice, bob, "R", null, T0);
        Message aside = post(bob, carol, "aside", root, T0.plusSeconds(1));

        MessageThread thread = threadReconstructor.getThread(aside.getId(), carol.getId());

        assertThat(thread.getRoot().getId()).isEqualTo(root.getId());
        assertThat(thread.getTotalReplies()).isEqualTo(1);
    }

    @Test
    void missingMessageIsNotFound() {
        assertThatThrownBy(() -> threadReconstructor.getThread(999_999L, alice.getId()))
            .isInstanceOf(MessageNotFoundException.class);
        assertThatThrownBy(() -> threadReconstructor.findThreadRoot(999_999L))
            .isInstanceOf(MessageNotFoundException.class);
        assertThatThrownBy(() -> threadReconstructor.buildReplyTree(999_999L))
            .isInstanceOf(MessageNotFoundException.class);
    }

    private Message post(UserAccount sender, UserAccount receiver, String content, Message parent, Instant at) {
        return messageService.create(Message.builder()
            .sender(sender)
            .receiver(receiver)
            .parentMessage(parent)
            .content(content)
            .timestamp(at)
            .build());
    }
}
