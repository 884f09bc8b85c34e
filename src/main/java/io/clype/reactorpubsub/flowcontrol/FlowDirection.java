package io.clype.reactorpubsub.flowcontrol;

/**
 * The two independent flow-control budgets: outgoing publishes and incoming deliveries.
 */
public enum FlowDirection {
    PUBLISH("publish"),
    DELIVERY("delivery");

    private final String label;

    FlowDirection(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
