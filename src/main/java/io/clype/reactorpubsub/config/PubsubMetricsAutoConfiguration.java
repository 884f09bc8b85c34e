package io.clype.reactorpubsub.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import io.clype.reactorpubsub.metrics.PublisherMetrics;
import io.clype.reactorpubsub.metrics.SubscriberMetrics;
import io.clype.reactorpubsub.model.SubscriptionName;
import io.clype.reactorpubsub.model.TopicName;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Auto-configuration for publisher and subscriber metrics.
 *
 * <p>This configuration is automatically enabled when:</p>
 * <ul>
 *   <li>Micrometer is on the classpath</li>
 *   <li>A {@link MeterRegistry} bean exists</li>
 *   <li>The {@code pubsub.metrics.enabled} property is true (default)</li>
 * </ul>
 *
 * <p>Publisher metrics are created when {@code pubsub.publisher.topic} is set, subscriber
 * metrics when {@code pubsub.subscriber.subscription} is.</p>
 *
 * <p><b>Disabling Metrics:</b></p>
 * <pre>{@code
 * pubsub:
 *   metrics:
 *     enabled: false
 * }</pre>
 *
 * @see PublisherMetrics
 * @see SubscriberMetrics
 */
@AutoConfiguration(after = {PubsubPublisherAutoConfiguration.class, PubsubSubscriberAutoConfiguration.class})
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "pubsub.metrics", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class PubsubMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "pubsub.publisher", name = "topic")
    public PublisherMetrics pubsubPublisherMetrics(MeterRegistry registry, PubsubProperties properties) {
        return new PublisherMetrics(registry, TopicName.parse(properties.getPublisher().getTopic()).topic());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "pubsub.subscriber", name = "subscription")
    public SubscriberMetrics pubsubSubscriberMetrics(MeterRegistry registry, PubsubProperties properties) {
        return new SubscriberMetrics(registry,
                SubscriptionName.parse(properties.getSubscriber().getSubscription()).subscription());
    }
}
