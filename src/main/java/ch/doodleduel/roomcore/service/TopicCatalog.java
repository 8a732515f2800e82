package ch.doodleduel.roomcore.service;

/**
 * Source of drawing topics.
 */
public interface TopicCatalog {

    /**
     * Returns the next topic, never the same as the previous one when more than one topic exists.
     *
     * @return topic text
     */
    String nextTopic();
}
