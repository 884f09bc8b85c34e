package io.clype.reactorpubsub.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.clype.reactorpubsub.flowcontrol.FlowControlSettings;
import io.clype.reactorpubsub.publisher.BatchingSettings;
import io.clype.reactorpubsub.publisher.DrainPolicy;
import io.clype.reactorpubsub.subscriber.SubscriberSettings;

/**
 * Configuration properties for the publisher and subscription session.
 *
 * <p>These properties are bound to the {@code pubsub} prefix in your application
 * configuration.</p>
 *
 * <p><b>Example Configuration (application.yml):</b></p>
 * <pre>{@code
 * pubsub:
 *   publisher:
 *     topic: projects/my-project/topics/orders
 *     drain-policy: flush-immediately
 *     batching:
 *       max-messages: 100
 *       max-bytes: 1048576
 *       max-linger: 10ms
 *     flow-control:
 *       max-outstanding-bytes: 104857600
 *       max-outstanding-messages: 1000
 *   subscriber:
 *     subscription: projects/my-project/subscriptions/orders-worker
 *     max-concurrency: 8
 *     ack-deadline: 10s
 *     max-lease-extension: 10m
 *     flow-control:
 *       max-outstanding-messages: 1000
 *   metrics:
 *     enabled: true
 * }</pre>
 *
 * <p>A flow-control limit of 0 disables that dimension. Resume watermarks default to the
 * limits themselves.</p>
 *
 * @see PubsubPublisherAutoConfiguration
 * @see PubsubSubscriberAutoConfiguration
 */
@ConfigurationProperties(prefix = "pubsub")
public class PubsubProperties {

    private PublisherConfig publisher = new PublisherConfig();
    private SubscriberConfig subscriber = new SubscriberConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public PublisherConfig getPublisher() { return publisher; }
    public void setPublisher(PublisherConfig publisher) { this.publisher = publisher; }

    public SubscriberConfig getSubscriber() { return subscriber; }
    public void setSubscriber(SubscriberConfig subscriber) { this.subscriber = subscriber; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /** Publisher configuration. */
    public static class PublisherConfig {
        /** Fully qualified topic name, {@code projects/{project}/topics/{topic}}. */
        private String topic;
        private DrainPolicy drainPolicy = DrainPolicy.FLUSH_IMMEDIATELY;
        /** How long publish may block on flow control; unset waits indefinitely. */
        private Duration admissionTimeout;
        private BatchingConfig batching = new BatchingConfig();
        private FlowControlConfig flowControl = new FlowControlConfig();

        public String getTopic() { return topic; }
        public void setTopic(String topic) { this.topic = topic; }

        public DrainPolicy getDrainPolicy() { return drainPolicy; }
        public void setDrainPolicy(DrainPolicy drainPolicy) { this.drainPolicy = drainPolicy; }

        public Duration getAdmissionTimeout() { return admissionTimeout; }
        public void setAdmissionTimeout(Duration admissionTimeout) { this.admissionTimeout = admissionTimeout; }

        public BatchingConfig getBatching() { return batching; }
        public void setBatching(BatchingConfig batching) { this.batching = batching; }

        public FlowControlConfig getFlowControl() { return flowControl; }
        public void setFlowControl(FlowControlConfig flowControl) { this.flowControl = flowControl; }
    }

    /** Batch limits of the publisher. */
    public static class BatchingConfig {
        private int maxMessages = BatchingSettings.DEFAULT_MAX_MESSAGES;
        private long maxBytes = BatchingSettings.DEFAULT_MAX_BYTES;
        private Duration maxLinger = BatchingSettings.DEFAULT_MAX_LINGER;

        public int getMaxMessages() { return maxMessages; }
        public void setMaxMessages(int maxMessages) { this.maxMessages = maxMessages; }

        public long getMaxBytes() { return maxBytes; }
        public void setMaxBytes(long maxBytes) { this.maxBytes = maxBytes; }

        public Duration getMaxLinger() { return maxLinger; }
        public void setMaxLinger(Duration maxLinger) { this.maxLinger = maxLinger; }

        public BatchingSettings toSettings() {
            return new BatchingSettings(maxMessages, maxBytes, maxLinger);
        }
    }

    /** Subscription session configuration. */
    public static class SubscriberConfig {
        /** Fully qualified subscription name, {@code projects/{project}/subscriptions/{subscription}}. */
        private String subscription;
        private int maxConcurrency = Runtime.getRuntime().availableProcessors();
        private Duration ackDeadline = SubscriberSettings.DEFAULT_ACK_DEADLINE;
        private Duration maxLeaseExtension = SubscriberSettings.DEFAULT_MAX_LEASE_EXTENSION;
        private boolean autoStart = true;
        private FlowControlConfig flowControl = new FlowControlConfig();

        public String getSubscription() { return subscription; }
        public void setSubscription(String subscription) { this.subscription = subscription; }

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

        public Duration getAckDeadline() { return ackDeadline; }
        public void setAckDeadline(Duration ackDeadline) { this.ackDeadline = ackDeadline; }

        public Duration getMaxLeaseExtension() { return maxLeaseExtension; }
        public void setMaxLeaseExtension(Duration maxLeaseExtension) { this.maxLeaseExtension = maxLeaseExtension; }

        public boolean isAutoStart() { return autoStart; }
        public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }

        public FlowControlConfig getFlowControl() { return flowControl; }
        public void setFlowControl(FlowControlConfig flowControl) { this.flowControl = flowControl; }

        public SubscriberSettings toSettings() {
            return new SubscriberSettings(maxConcurrency, ackDeadline, maxLeaseExtension);
        }
    }

    /** Watermarks of one flow-control direction. */
    public static class FlowControlConfig {
        private long maxOutstandingBytes;
        private long maxOutstandingMessages;
        /** Defaults to {@code maxOutstandingBytes}. */
        private Long resumeBytes;
        /** Defaults to {@code maxOutstandingMessages}. */
        private Long resumeMessages;

        public long getMaxOutstandingBytes() { return maxOutstandingBytes; }
        public void setMaxOutstandingBytes(long maxOutstandingBytes) { this.maxOutstandingBytes = maxOutstandingBytes; }

        public long getMaxOutstandingMessages() { return maxOutstandingMessages; }
        public void setMaxOutstandingMessages(long maxOutstandingMessages) { this.maxOutstandingMessages = maxOutstandingMessages; }

        public Long getResumeBytes() { return resumeBytes; }
        public void setResumeBytes(Long resumeBytes) { this.resumeBytes = resumeBytes; }

        public Long getResumeMessages() { return resumeMessages; }
        public void setResumeMessages(Long resumeMessages) { this.resumeMessages = resumeMessages; }

        public FlowControlSettings toSettings() {
            return new FlowControlSettings(
                    maxOutstandingBytes,
                    maxOutstandingMessages,
                    resumeBytes != null ? resumeBytes : maxOutstandingBytes,
                    resumeMessages != null ? resumeMessages : maxOutstandingMessages);
        }
    }

    /** Metrics configuration. */
    public static class MetricsConfig {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
