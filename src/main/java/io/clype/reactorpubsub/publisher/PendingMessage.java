package io.clype.reactorpubsub.publisher;

import io.clype.reactorpubsub.flowcontrol.FlowPermit;
import io.clype.reactorpubsub.model.PubsubMessage;

/**
 * A published message that has been admitted by flow control but not yet resolved.
 */
record PendingMessage(PubsubMessage message, PublishHandle handle, FlowPermit permit) {

    long sizeInBytes() {
        return permit.bytes();
    }
}
