package io.clype.reactorpubsub.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import io.clype.reactorpubsub.flowcontrol.FlowController;
import io.clype.reactorpubsub.metrics.SubscriberMetrics;
import io.clype.reactorpubsub.model.SubscriptionName;
import io.clype.reactorpubsub.subscriber.MessageHandler;
import io.clype.reactorpubsub.subscriber.SubscriptionSession;
import io.clype.reactorpubsub.transport.SubscriberTransport;

/**
 * Spring Boot auto-configuration for the subscription session.
 *
 * <p>This configuration is enabled when the {@code pubsub.subscriber.subscription} property is
 * set and the application provides a {@link SubscriberTransport} and a {@link MessageHandler}
 * bean. The session starts as soon as it is created unless
 * {@code pubsub.subscriber.auto-start} is false, and drains when the context closes.</p>
 *
 * <p><b>Configuration Example (application.yml):</b></p>
 * <pre>{@code
 * pubsub:
 *   subscriber:
 *     subscription: projects/my-project/subscriptions/orders-worker
 *     max-concurrency: 8   # Optional, default: available processors
 *     ack-deadline: 10s    # Optional, default: 10s
 * }</pre>
 *
 * @see PubsubProperties
 * @see SubscriptionSession
 */
@AutoConfiguration(after = PubsubPublisherAutoConfiguration.class)
@EnableConfigurationProperties(PubsubProperties.class)
@ConditionalOnProperty(prefix = "pubsub.subscriber", name = "subscription")
public class PubsubSubscriberAutoConfiguration {

    private final PubsubProperties properties;

    public PubsubSubscriberAutoConfiguration(PubsubProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnMissingBean
    public FlowController pubsubFlowController() {
        return PubsubPublisherAutoConfiguration.flowControllerOf(properties);
    }

    /**
     * Creates the subscription session bean.
     *
     * @param transport      delivery stream and ack/nack/deadline calls
     * @param handler        the application's message handler
     * @param flowController the shared flow controller
     * @param metrics        optional metrics collector (may be null if metrics are disabled)
     * @return the session, started unless auto-start is off
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({SubscriberTransport.class, MessageHandler.class})
    public SubscriptionSession pubsubSubscriptionSession(
            SubscriberTransport transport,
            MessageHandler handler,
            FlowController flowController,
            @Autowired(required = false) SubscriberMetrics metrics) {
        var subscriber = properties.getSubscriber();

        SubscriptionSession session = new SubscriptionSession(
                SubscriptionName.parse(subscriber.getSubscription()),
                transport,
                handler,
                subscriber.toSettings(),
                flowController,
                null,
                null,
                metrics);
        if (subscriber.isAutoStart()) {
            session.start();
        }
        return session;
    }
}
