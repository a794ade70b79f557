package oikosnomos.billing.transport;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TopicNamesTest {

    @Test
    void parseReadingTopic_extractsHomeAndCategory() {
        TopicNames.ReadingTopic topic = TopicNames.parseReadingTopic("home/home-42/device/ev_charger/power").orElseThrow();

        assertEquals("home-42", topic.homeId());
        assertEquals("ev_charger", topic.category());
    }

    @Test
    void parseReadingTopic_rejectsOtherTopics() {
        assertTrue(TopicNames.parseReadingTopic("home/home-1/billing/today_cost").isEmpty());
        assertTrue(TopicNames.parseReadingTopic("home/home-1/device/hvac/power/extra").isEmpty());
        assertTrue(TopicNames.parseReadingTopic("home/home-1/device/+/power").isEmpty());
        assertTrue(TopicNames.parseReadingTopic(null).isEmpty());
    }

    @Test
    void topicsForHome() {
        assertEquals("home/home-1/device/+/power", TopicNames.readingFilter("home-1"));
        assertEquals("home/home-1/billing/today_cost", TopicNames.billingTopic("home-1"));
    }
}
