package io.clype.reactorpubsub.model;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fully qualified topic name: {@code projects/{project}/topics/{topic}}.
 *
 * @param project the project id
 * @param topic   the topic id
 */
public record TopicName(String project, String topic) {

    private static final Pattern FULL_NAME_PATTERN =
            Pattern.compile("^projects/([^/]+)/topics/([^/]+)$");

    /**
     * Topic ids start with a letter, are 3-255 characters long and use letters, digits and
     * {@code -_.~+%}.
     */
    static final Pattern RESOURCE_ID_PATTERN = Pattern.compile("^[a-zA-Z][a-zA-Z0-9\\-_.~+%]{2,254}$");

    public TopicName {
        Objects.requireNonNull(project, "project cannot be null");
        Objects.requireNonNull(topic, "topic cannot be null");
        if (project.isEmpty()) {
            throw new IllegalArgumentException("project cannot be empty");
        }
        if (!RESOURCE_ID_PATTERN.matcher(topic).matches()) {
            throw new IllegalArgumentException("Invalid topic id '" + topic
                    + "'. Expected 3-255 characters starting with a letter");
        }
    }

    /**
     * Parses a name of the form {@code projects/{project}/topics/{topic}}.
     *
     * @param fullName the fully qualified name
     * @return the parsed name
     * @throws IllegalArgumentException if the name does not match the expected format
     */
    public static TopicName parse(String fullName) {
        Objects.requireNonNull(fullName, "fullName cannot be null");
        Matcher matcher = FULL_NAME_PATTERN.matcher(fullName);
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                    "Invalid topic name format. Expected: projects/<project>/topics/<topic>");
        }
        return new TopicName(matcher.group(1), matcher.group(2));
    }

    public String fullName() {
        return "projects/" + project + "/topics/" + topic;
    }

    @Override
    public String toString() {
        return fullName();
    }
}
