package io.clype.reactorpubsub.model;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fully qualified subscription name: {@code projects/{project}/subscriptions/{subscription}}.
 *
 * @param project      the project id
 * @param subscription the subscription id
 */
public record SubscriptionName(String project, String subscription) {

    private static final Pattern FULL_NAME_PATTERN =
            Pattern.compile("^projects/([^/]+)/subscriptions/([^/]+)$");

    public SubscriptionName {
        Objects.requireNonNull(project, "project cannot be null");
        Objects.requireNonNull(subscription, "subscription cannot be null");
        if (project.isEmpty()) {
            throw new IllegalArgumentException("project cannot be empty");
        }
        if (!TopicName.RESOURCE_ID_PATTERN.matcher(subscription).matches()) {
            throw new IllegalArgumentException("Invalid subscription id '" + subscription
                    + "'. Expected 3-255 characters starting with a letter");
        }
    }

    /**
     * Parses a name of the form {@code projects/{project}/subscriptions/{subscription}}.
     *
     * @param fullName the fully qualified name
     * @return the parsed name
     * @throws IllegalArgumentException if the name does not match the expected format
     */
    public static SubscriptionName parse(String fullName) {
        Objects.requireNonNull(fullName, "fullName cannot be null");
        Matcher matcher = FULL_NAME_PATTERN.matcher(fullName);
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                    "Invalid subscription name format. Expected: projects/<project>/subscriptions/<subscription>");
        }
        return new SubscriptionName(matcher.group(1), matcher.group(2));
    }

    public String fullName() {
        return "projects/" + project + "/subscriptions/" + subscription;
    }

    @Override
    public String toString() {
        return fullName();
    }
}
