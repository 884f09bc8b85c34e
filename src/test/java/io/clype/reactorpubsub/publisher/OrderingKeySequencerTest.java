package io.clype.reactorpubsub.publisher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.clype.reactorpubsub.flowcontrol.FlowControlSettings;
import io.clype.reactorpubsub.flowcontrol.FlowController;
import io.clype.reactorpubsub.flowcontrol.FlowDirection;
import io.clype.reactorpubsub.metrics.PublisherMetrics;
import io.clype.reactorpubsub.model.BatchSendFailureException;
import io.clype.reactorpubsub.model.LaneHaltedException;
import io.clype.reactorpubsub.model.PublishCancelledException;
import io.clype.reactorpubsub.model.PubsubMessage;
import io.clype.reactorpubsub.model.TopicName;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import reactor.test.scheduler.VirtualTimeScheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrderingKeySequencerTest {

    private static final TopicName TOPIC = TopicName.parse("projects/test-project/topics/orders");

    private VirtualTimeScheduler timer;
    private CompletionRegistry registry;
    private FlowController flowController;
    private SimpleMeterRegistry meterRegistry;
    private RecordingPublisherTransport transport;

    @BeforeEach
    void setUp() {
        timer = VirtualTimeScheduler.create();
        registry = new CompletionRegistry();
        flowController = new FlowController(FlowControlSettings.of(0, 100), FlowControlSettings.disabled());
        meterRegistry = new SimpleMeterRegistry();
        transport = RecordingPublisherTransport.holding();
    }

    private OrderingKeySequencer sequencer(BatchingSettings settings) {
        PublisherMetrics metrics = new PublisherMetrics(meterRegistry, TOPIC.topic());
        BatchSender sender = new BatchSender(TOPIC, transport, registry, flowController, metrics);
        return new OrderingKeySequencer(sender, settings, flowController, registry, timer, null, metrics);
    }

    private static PubsubMessage message(String key, String data) {
        return PubsubMessage.builder().data(data).orderingKey(key).build();
    }

    @Test
    void shouldKeepOneBatchInFlightPerKey() {
        OrderingKeySequencer sequencer = sequencer(new BatchingSettings(2, 1024, Duration.ZERO));

        for (int i = 1; i <= 4; i++) {
            sequencer.publish(message("a", "a" + i));
        }
        assertEquals(List.of(List.of("a1")), transport.payloads());

        transport.succeed(0);
        assertEquals(List.of("a2", "a3"), transport.payloads().get(1));
        assertEquals(2, transport.batchCount());

        transport.succeed(1);
        assertEquals(List.of("a4"), transport.payloads().get(2));
    }

    @Test
    void shouldPreservePublishOrderAcrossBatches() {
        OrderingKeySequencer sequencer = sequencer(new BatchingSettings(3, 1024, Duration.ZERO));
        List<PublishHandle> handles = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            handles.add(sequencer.publish(message("k", "m" + i)));
        }

        for (int batch = 0; batch < transport.batchCount(); batch++) {
            transport.succeed(batch);
        }

        List<String> sent = new ArrayList<>();
        transport.payloads().forEach(sent::addAll);
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            expected.add("m" + i);
        }
        assertEquals(expected, sent);
        assertThat(handles).allMatch(handle -> handle.state() == CompletionState.SUCCEEDED);
    }

    @Test
    void shouldSendDifferentKeysConcurrently() {
        OrderingKeySequencer sequencer = sequencer(new BatchingSettings(10, 1024, Duration.ZERO));

        sequencer.publish(message("a", "a1"));
        sequencer.publish(message("b", "b1"));

        assertEquals(List.of(List.of("a1"), List.of("b1")), transport.payloads());
        assertEquals(2, sequencer.laneCount());
    }

    @Test
    void shouldHaltKeyAfterFailedBatch() {
        OrderingKeySequencer sequencer = sequencer(new BatchingSettings(10, 1024, Duration.ZERO));

        PublishHandle a1 = sequencer.publish(message("a", "a1"));
        PublishHandle a2 = sequencer.publish(message("a", "a2"));
        PublishHandle b1 = sequencer.publish(message("b", "b1"));

        transport.fail(0, new RuntimeException("unavailable"));

        assertThat(a1.error()).get().isInstanceOf(BatchSendFailureException.class);
        assertThat(a2.error()).get().isInstanceOf(LaneHaltedException.class);
        assertTrue(sequencer.isHalted("a"));
        assertEquals(1, sequencer.haltedLaneCount());

        PublishHandle a3 = sequencer.publish(message("a", "a3"));
        assertThat(a3.error()).get().isInstanceOf(LaneHaltedException.class);
        assertThat(a3.error().orElseThrow().getCause()).isInstanceOf(BatchSendFailureException.class);

        // Only a1 and b1 ever reached the transport.
        assertEquals(2, transport.batchCount());
        transport.succeed(1);
        assertEquals(CompletionState.SUCCEEDED, b1.state());
        assertFalse(sequencer.isHalted("b"));

        assertEquals(0, flowController.outstandingMessages(FlowDirection.PUBLISH));
        assertEquals(1.0, meterRegistry.counter("pubsub.publisher.lanes.halted", "topic", "orders").count());
    }

    @Test
    void shouldPublishAgainAfterResume() {
        OrderingKeySequencer sequencer = sequencer(new BatchingSettings(10, 1024, Duration.ZERO));
        sequencer.publish(message("a", "a1"));
        transport.fail(0, new RuntimeException("unavailable"));

        assertTrue(sequencer.resume("a"));
        assertFalse(sequencer.resume("a"));
        assertFalse(sequencer.resume("unknown"));

        PublishHandle next = sequencer.publish(message("a", "a2"));
        assertEquals(2, transport.batchCount());
        transport.succeed(1);
        assertEquals(CompletionState.SUCCEEDED, next.state());
    }

    @Test
    void shouldWaitForLingerBeforeStartingLaneBatch() {
        OrderingKeySequencer sequencer = sequencer(new BatchingSettings(10, 1024, Duration.ofMillis(100)));

        sequencer.publish(message("a", "a1"));
        sequencer.publish(message("a", "a2"));
        sequencer.publish(message("a", "a3"));
        assertEquals(0, transport.batchCount());

        timer.advanceTimeBy(Duration.ofMillis(100));

        assertEquals(List.of(List.of("a1", "a2", "a3")), transport.payloads());
    }

    @Test
    void shouldStartLaneBatchWhenQueueReachesLimit() {
        OrderingKeySequencer sequencer = sequencer(new BatchingSettings(2, 1024, Duration.ofSeconds(1)));

        sequencer.publish(message("a", "a1"));
        assertEquals(0, transport.batchCount());
        sequencer.publish(message("a", "a2"));

        assertEquals(List.of(List.of("a1", "a2")), transport.payloads());
    }

    @Test
    void shouldSendQueueOnFlush() {
        OrderingKeySequencer sequencer = sequencer(new BatchingSettings(10, 1024, Duration.ofSeconds(10)));
        sequencer.publish(message("a", "a1"));
        sequencer.publish(message("b", "b1"));

        sequencer.flush();

        assertEquals(2, transport.batchCount());
    }

    @Test
    void shouldCancelQueuedMessage() {
        OrderingKeySequencer sequencer = sequencer(new BatchingSettings(10, 1024, Duration.ZERO));
        PublishHandle inFlight = sequencer.publish(message("a", "a1"));
        PublishHandle queued = sequencer.publish(message("a", "a2"));
        PublishHandle kept = sequencer.publish(message("a", "a3"));

        assertFalse(inFlight.cancel());
        assertTrue(queued.cancel());
        assertThat(queued.error()).get().isInstanceOf(PublishCancelledException.class);

        transport.succeed(0);
        assertEquals(List.of("a3"), transport.payloads().get(1));
        transport.succeed(1);
        assertEquals(CompletionState.SUCCEEDED, kept.state());
    }

    @Test
    void shouldRejectMessageWithoutOrderingKey() {
        OrderingKeySequencer sequencer = sequencer(BatchingSettings.defaults());

        assertThrows(IllegalArgumentException.class,
                () -> sequencer.publish(PubsubMessage.builder().data("x").build()));
    }
}
