package com.collab.sync.core.event;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TopicRouterTest {

    private final TopicRouter router = new TopicRouter();

    @Test
    void longestPrefixWins() {
        assertThat(router.route("user_joined_session")).isEqualTo(Topics.COLLABORATION);
        assertThat(router.route("user_left_session")).isEqualTo(Topics.COLLABORATION);
        assertThat(router.route("document_changed")).isEqualTo(Topics.COLLABORATION);
    }

    @Test
    void familyPrefixesRouteToTheirTopics() {
        assertThat(router.route("user_registered")).isEqualTo(Topics.USER);
        assertThat(router.route("document_saved")).isEqualTo(Topics.DOCUMENT);
        assertThat(router.route("document_shared")).isEqualTo(Topics.DOCUMENT);
    }

    @Test
    void unmatchedTypeGoesToDeadLetter() {
        assertThat(router.route("session_expired")).isEqualTo(Topics.DEAD_LETTER);
    }
}
