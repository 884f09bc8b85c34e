package io.clype.reactorpubsub.publisher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.clype.reactorpubsub.flowcontrol.FlowControlSettings;
import io.clype.reactorpubsub.flowcontrol.FlowController;
import io.clype.reactorpubsub.flowcontrol.FlowDirection;
import io.clype.reactorpubsub.model.AdmissionTimeoutException;
import io.clype.reactorpubsub.model.BatchSendFailureException;
import io.clype.reactorpubsub.model.PublishCancelledException;
import io.clype.reactorpubsub.model.PubsubMessage;
import io.clype.reactorpubsub.model.TopicName;

import reactor.test.scheduler.VirtualTimeScheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchingPublisherTest {

    private static final TopicName TOPIC = TopicName.parse("projects/test-project/topics/orders");

    private VirtualTimeScheduler timer;
    private CompletionRegistry registry;

    @BeforeEach
    void setUp() {
        timer = VirtualTimeScheduler.create();
        registry = new CompletionRegistry();
    }

    private BatchingPublisher publisher(RecordingPublisherTransport transport, BatchingSettings settings,
                                        FlowController flowController, Duration admissionTimeout) {
        BatchSender sender = new BatchSender(TOPIC, transport, registry, flowController, null);
        return new BatchingPublisher(sender, settings, flowController, registry, timer, admissionTimeout);
    }

    private BatchingPublisher publisher(RecordingPublisherTransport transport, BatchingSettings settings) {
        return publisher(transport, settings, FlowController.disabled(), null);
    }

    private static PubsubMessage message(String data) {
        return PubsubMessage.builder().data(data).build();
    }

    @Test
    void shouldSendBatchWhenLingerElapses() {
        RecordingPublisherTransport transport = RecordingPublisherTransport.answering();
        BatchingPublisher publisher = publisher(transport,
                new BatchingSettings(100, 1024 * 1024, Duration.ofMillis(100)));

        List<PublishHandle> handles = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            handles.add(publisher.publish(message("m" + i)));
        }

        timer.advanceTimeBy(Duration.ofMillis(99));
        assertEquals(0, transport.batchCount());

        timer.advanceTimeBy(Duration.ofMillis(1));
        assertEquals(1, transport.batchCount());
        assertEquals(List.of("m0", "m1", "m2", "m3", "m4"), transport.payloads().get(0));
        for (int i = 0; i < 5; i++) {
            assertEquals("id-" + (i + 1), handles.get(i).await(Duration.ofSeconds(1)));
        }
    }

    @Test
    void shouldCloseBatchAtMessageLimit() {
        RecordingPublisherTransport transport = RecordingPublisherTransport.answering();
        BatchingPublisher publisher = publisher(transport,
                new BatchingSettings(3, 1024 * 1024, Duration.ofSeconds(1)));

        for (int i = 0; i < 7; i++) {
            publisher.publish(message("m" + i));
        }

        assertEquals(2, transport.batchCount());
        assertEquals(1, publisher.openBatchSize());

        timer.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals(List.of(
                List.of("m0", "m1", "m2"),
                List.of("m3", "m4", "m5"),
                List.of("m6")), transport.payloads());
    }

    @Test
    void shouldStartNewBatchWhenMessageWouldOverflowBytes() {
        RecordingPublisherTransport transport = RecordingPublisherTransport.answering();
        BatchingPublisher publisher = publisher(transport, new BatchingSettings(100, 10, Duration.ofSeconds(1)));

        publisher.publish(message("aaaa"));
        publisher.publish(message("bbbb"));
        publisher.publish(message("cccc"));

        assertEquals(List.of(List.of("aaaa", "bbbb")), transport.payloads());
        assertEquals(1, publisher.openBatchSize());
    }

    @Test
    void shouldSendOversizedMessageAlone() {
        RecordingPublisherTransport transport = RecordingPublisherTransport.answering();
        BatchingPublisher publisher = publisher(transport, new BatchingSettings(100, 10, Duration.ofSeconds(1)));

        publisher.publish(message("ab"));
        PublishHandle oversized = publisher.publish(message("x".repeat(25)));

        assertEquals(2, transport.batchCount());
        assertEquals(List.of("ab"), transport.payloads().get(0));
        assertEquals(1, transport.batch(1).size());
        assertEquals(CompletionState.SUCCEEDED, oversized.state());
    }

    @Test
    void shouldSendEveryMessageImmediatelyWithZeroLinger() {
        RecordingPublisherTransport transport = RecordingPublisherTransport.answering();
        BatchingPublisher publisher = publisher(transport, new BatchingSettings(100, 1024, Duration.ZERO));

        publisher.publish(message("a"));
        publisher.publish(message("b"));

        assertEquals(List.of(List.of("a"), List.of("b")), transport.payloads());
    }

    @Test
    void shouldResolveBatchesIndependently() {
        RecordingPublisherTransport transport = RecordingPublisherTransport.holding();
        BatchingPublisher publisher = publisher(transport, new BatchingSettings(1, 1024, Duration.ofSeconds(1)));

        PublishHandle first = publisher.publish(message("a"));
        PublishHandle second = publisher.publish(message("b"));
        assertEquals(2, transport.batchCount());

        transport.succeed(1);

        assertEquals(CompletionState.PENDING, first.state());
        assertEquals(CompletionState.SUCCEEDED, second.state());

        transport.fail(0, new RuntimeException("unavailable"));
        assertEquals(CompletionState.FAILED, first.state());
    }

    @Test
    void shouldFailEveryMessageOfFailedBatchAndReleaseBudget() {
        RecordingPublisherTransport transport = RecordingPublisherTransport.holding();
        FlowController flowController = new FlowController(FlowControlSettings.of(0, 10), FlowControlSettings.disabled());
        BatchingPublisher publisher = publisher(transport, new BatchingSettings(3, 1024, Duration.ofSeconds(1)),
                flowController, null);

        List<PublishHandle> handles = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            handles.add(publisher.publish(message("m" + i)));
        }
        assertEquals(3, flowController.outstandingMessages(FlowDirection.PUBLISH));

        transport.fail(0, new RuntimeException("unavailable"));

        for (PublishHandle handle : handles) {
            assertEquals(CompletionState.FAILED, handle.state());
            assertThat(handle.error()).get().isInstanceOf(BatchSendFailureException.class);
            assertThat(handle.error().orElseThrow().getCause()).hasMessage("unavailable");
        }
        assertEquals(0, flowController.outstandingMessages(FlowDirection.PUBLISH));
        assertEquals(0, registry.pendingCount());
    }

    @Test
    void shouldFailBatchWhenIdCountDoesNotMatch() {
        FlowController flowController = FlowController.disabled();
        BatchSender sender = new BatchSender(TOPIC,
                (topic, messages) -> CompletableFuture.completedFuture(List.of("only-one")),
                registry, flowController, null);
        BatchingPublisher publisher = new BatchingPublisher(sender,
                new BatchingSettings(2, 1024, Duration.ofSeconds(1)), flowController, registry, timer, null);

        PublishHandle first = publisher.publish(message("a"));
        PublishHandle second = publisher.publish(message("b"));

        assertThat(first.error()).get().isInstanceOf(BatchSendFailureException.class);
        assertThat(second.error()).get().isInstanceOf(BatchSendFailureException.class);
    }

    @Test
    void shouldCancelMessageBeforeBatchCloses() {
        RecordingPublisherTransport transport = RecordingPublisherTransport.answering();
        BatchingPublisher publisher = publisher(transport, new BatchingSettings(100, 1024, Duration.ofMillis(50)));

        PublishHandle kept = publisher.publish(message("kept"));
        PublishHandle withdrawn = publisher.publish(message("withdrawn"));

        assertTrue(withdrawn.cancel());
        assertThat(withdrawn.error()).get().isInstanceOf(PublishCancelledException.class);

        timer.advanceTimeBy(Duration.ofMillis(50));
        assertEquals(List.of(List.of("kept")), transport.payloads());
        assertEquals(CompletionState.SUCCEEDED, kept.state());
        assertFalse(kept.cancel());
    }

    @Test
    void shouldNotCancelAfterBatchClosed() {
        RecordingPublisherTransport transport = RecordingPublisherTransport.holding();
        BatchingPublisher publisher = publisher(transport, new BatchingSettings(1, 1024, Duration.ofSeconds(1)));

        PublishHandle handle = publisher.publish(message("a"));

        assertFalse(handle.cancel());
        transport.succeed(0);
        assertEquals(CompletionState.SUCCEEDED, handle.state());
    }

    @Test
    void shouldSendOpenBatchOnFlush() {
        RecordingPublisherTransport transport = RecordingPublisherTransport.answering();
        BatchingPublisher publisher = publisher(transport, new BatchingSettings(100, 1024, Duration.ofSeconds(10)));

        publisher.publish(message("a"));
        publisher.publish(message("b"));
        publisher.flush();

        assertEquals(List.of(List.of("a", "b")), transport.payloads());

        timer.advanceTimeBy(Duration.ofSeconds(10));
        assertEquals(1, transport.batchCount());
    }

    @Test
    void shouldTimeOutAdmissionWhileBudgetExhausted() {
        RecordingPublisherTransport transport = RecordingPublisherTransport.holding();
        FlowController flowController = new FlowController(FlowControlSettings.of(0, 2), FlowControlSettings.disabled());
        BatchingPublisher publisher = publisher(transport, new BatchingSettings(2, 1024, Duration.ofSeconds(1)),
                flowController, Duration.ofMillis(50));

        publisher.publish(message("a"));
        publisher.publish(message("b"));

        assertThrows(AdmissionTimeoutException.class, () -> publisher.publish(message("c")));
        assertEquals(0, flowController.waiterCount(FlowDirection.PUBLISH));

        transport.succeed(0);
        PublishHandle afterRelease = publisher.publish(message("d"));
        assertEquals(CompletionState.PENDING, afterRelease.state());
        assertEquals(1, flowController.outstandingMessages(FlowDirection.PUBLISH));
    }
}
