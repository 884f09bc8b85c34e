package io.clype.reactorpubsub.subscriber;

import io.clype.reactorpubsub.model.PubsubMessage;

/**
 * Application callback for delivered messages.
 *
 * <p>The handler settles each message through its {@link AckHandler}, during the call or later
 * from any thread. Until then the message's lease is renewed. A handler that throws is treated
 * as having nacked the message.</p>
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(PubsubMessage message, AckHandler ackHandler) throws Exception;
}
