package io.clype.reactorpubsub.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import io.clype.reactorpubsub.flowcontrol.FlowController;
import io.clype.reactorpubsub.metrics.PublisherMetrics;
import io.clype.reactorpubsub.model.TopicName;
import io.clype.reactorpubsub.publisher.PubsubPublisher;
import io.clype.reactorpubsub.transport.PublisherTransport;

/**
 * Spring Boot auto-configuration for the publisher.
 *
 * <p>This configuration is enabled when the {@code pubsub.publisher.topic} property is set and
 * the application provides a {@link PublisherTransport} bean.</p>
 *
 * <p><b>Configuration Example (application.yml):</b></p>
 * <pre>{@code
 * pubsub:
 *   publisher:
 *     topic: projects/my-project/topics/orders
 *     batching:
 *       max-linger: 5ms                # Optional, default: 10ms
 *     flow-control:
 *       max-outstanding-messages: 1000 # Optional, default: unlimited
 * }</pre>
 *
 * <p><b>Bean Customization:</b> All beans created by this configuration use
 * {@code @ConditionalOnMissingBean}, allowing you to provide your own implementations
 * by defining beans of the same type in your application configuration.</p>
 *
 * <p>The {@link FlowController} bean carries both directions. When the subscription session is
 * configured as well, it shares this instance.</p>
 *
 * @see PubsubProperties
 * @see PubsubPublisher
 */
@AutoConfiguration
@EnableConfigurationProperties(PubsubProperties.class)
@ConditionalOnProperty(prefix = "pubsub.publisher", name = "topic")
public class PubsubPublisherAutoConfiguration {

    private final PubsubProperties properties;

    public PubsubPublisherAutoConfiguration(PubsubProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates the flow controller from the publisher and subscriber flow-control properties.
     *
     * @return the flow controller
     */
    @Bean
    @ConditionalOnMissingBean
    public FlowController pubsubFlowController() {
        return flowControllerOf(properties);
    }

    /**
     * Creates the publisher bean.
     *
     * @param transport      sends batches to the service
     * @param flowController the shared flow controller
     * @param metrics        optional metrics collector (may be null if metrics are disabled)
     * @return the configured publisher
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(PublisherTransport.class)
    public PubsubPublisher pubsubPublisher(
            PublisherTransport transport,
            FlowController flowController,
            @Autowired(required = false) PublisherMetrics metrics) {
        var publisher = properties.getPublisher();

        return new PubsubPublisher(
                TopicName.parse(publisher.getTopic()),
                transport,
                publisher.getBatching().toSettings(),
                flowController,
                null,
                metrics,
                publisher.getDrainPolicy(),
                publisher.getAdmissionTimeout());
    }

    static FlowController flowControllerOf(PubsubProperties properties) {
        return new FlowController(
                properties.getPublisher().getFlowControl().toSettings(),
                properties.getSubscriber().getFlowControl().toSettings());
    }
}
