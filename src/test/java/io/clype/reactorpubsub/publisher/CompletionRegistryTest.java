package io.clype.reactorpubsub.publisher;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import io.clype.reactorpubsub.model.PubsubMessage;

import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompletionRegistryTest {

    private final CompletionRegistry registry = new CompletionRegistry();

    private static PubsubMessage message(String data) {
        return PubsubMessage.builder().data(data).build();
    }

    @Test
    void shouldResolveHandleOnlyOnce() {
        PublishHandle handle = registry.register(message("a"));

        assertTrue(registry.succeed(handle, "id-1"));
        assertFalse(registry.succeed(handle, "id-2"));
        assertFalse(registry.fail(handle, new RuntimeException("late")));

        assertEquals(CompletionState.SUCCEEDED, handle.state());
        assertEquals("id-1", handle.messageId().orElseThrow());
        assertEquals(0, registry.pendingCount());
    }

    @Test
    void shouldReplayOutcomeToLateObservers() {
        PublishHandle handle = registry.register(message("a"));
        registry.fail(handle, new IllegalStateException("rejected"));

        StepVerifier.create(handle.result())
                .expectErrorMessage("rejected")
                .verify();
        StepVerifier.create(handle.result())
                .expectError(IllegalStateException.class)
                .verify();
        StepVerifier.create(handle.whenResolved())
                .verifyComplete();
    }

    @Test
    void shouldAssignIncreasingSequences() {
        PublishHandle first = registry.register(message("a"));
        PublishHandle second = registry.register(message("b"));

        assertTrue(second.sequence() > first.sequence());
        assertEquals(2, registry.pendingCount());
    }

    @Test
    void shouldCompleteWhenAllPendingResolved() {
        PublishHandle first = registry.register(message("a"));
        PublishHandle second = registry.register(message("b"));

        StepVerifier.create(registry.whenAllResolved())
                .then(() -> registry.succeed(first, "id-1"))
                .expectNoEvent(Duration.ofMillis(10))
                .then(() -> registry.fail(second, new RuntimeException("boom")))
                .verifyComplete();
    }

    @Test
    void shouldCompleteImmediatelyWhenNothingPending() {
        StepVerifier.create(registry.whenAllResolved())
                .verifyComplete();
    }

    @Test
    void shouldNotCancelResolvedHandle() {
        PublishHandle handle = registry.register(message("a"));
        handle.cancelWith(() -> true);
        registry.succeed(handle, "id-1");

        assertFalse(handle.cancel());
    }
}
