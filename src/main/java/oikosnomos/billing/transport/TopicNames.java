package oikosnomos.billing.transport;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Topic layout shared with the simulators and dashboards.
 */
public final class TopicNames {

    private static final Pattern READING_TOPIC = Pattern.compile("^home/([^/+#]+)/device/([^/+#]+)/power$");

    private TopicNames() {
    }

    /** Subscription filter covering every device of a home. */
    public static String readingFilter(String homeId) {
        return "home/" + homeId + "/device/+/power";
    }

    public static String billingTopic(String homeId) {
        return "home/" + homeId + "/billing/today_cost";
    }

    public static Optional<ReadingTopic> parseReadingTopic(String topic) {
        if (topic == null) {
            return Optional.empty();
        }
        Matcher matcher = READING_TOPIC.matcher(topic);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new ReadingTopic(matcher.group(1), matcher.group(2)));
    }

    public record ReadingTopic(String homeId, String category) {
    }
}
