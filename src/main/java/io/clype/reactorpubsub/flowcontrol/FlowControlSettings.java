package io.clype.reactorpubsub.flowcontrol;

/**
 * Watermarks for one flow-control direction.
 *
 * <p>Admission is denied once outstanding work would exceed a high watermark
 * ({@code maxOutstandingBytes}, {@code maxOutstandingMessages}). After a denial, admission
 * resumes only when outstanding work has dropped to the low watermarks
 * ({@code resumeBytes}, {@code resumeMessages}). A high watermark of zero disables that
 * dimension.</p>
 *
 * @param maxOutstandingBytes    high watermark for outstanding bytes, 0 to disable
 * @param maxOutstandingMessages high watermark for outstanding messages, 0 to disable
 * @param resumeBytes            low watermark for outstanding bytes
 * @param resumeMessages         low watermark for outstanding messages
 */
public record FlowControlSettings(
    long maxOutstandingBytes,
    long maxOutstandingMessages,
    long resumeBytes,
    long resumeMessages
) {
    private static final FlowControlSettings DISABLED = new FlowControlSettings(0, 0, 0, 0);

    public FlowControlSettings {
        if (maxOutstandingBytes < 0) {
            throw new IllegalArgumentException("maxOutstandingBytes cannot be negative, got: " + maxOutstandingBytes);
        }
        if (maxOutstandingMessages < 0) {
            throw new IllegalArgumentException("maxOutstandingMessages cannot be negative, got: " + maxOutstandingMessages);
        }
        if (resumeBytes < 0 || (maxOutstandingBytes > 0 && resumeBytes > maxOutstandingBytes)) {
            throw new IllegalArgumentException("resumeBytes must be between 0 and maxOutstandingBytes, got: " + resumeBytes);
        }
        if (resumeMessages < 0 || (maxOutstandingMessages > 0 && resumeMessages > maxOutstandingMessages)) {
            throw new IllegalArgumentException("resumeMessages must be between 0 and maxOutstandingMessages, got: " + resumeMessages);
        }
    }

    /**
     * Creates settings that resume admission as soon as there is room under the high watermarks.
     *
     * @param maxOutstandingBytes    high watermark for bytes, 0 to disable
     * @param maxOutstandingMessages high watermark for messages, 0 to disable
     * @return the settings
     */
    public static FlowControlSettings of(long maxOutstandingBytes, long maxOutstandingMessages) {
        return new FlowControlSettings(maxOutstandingBytes, maxOutstandingMessages,
                maxOutstandingBytes, maxOutstandingMessages);
    }

    public static FlowControlSettings disabled() {
        return DISABLED;
    }

    public FlowControlSettings withResumeWatermarks(long resumeBytes, long resumeMessages) {
        return new FlowControlSettings(maxOutstandingBytes, maxOutstandingMessages, resumeBytes, resumeMessages);
    }

    public boolean isEnabled() {
        return maxOutstandingBytes > 0 || maxOutstandingMessages > 0;
    }
}
