package com.homestead.household.infrastructure.persistence;

import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.exception.PollClosedException;
import com.homestead.household.domain.model.Poll;
import com.homestead.household.domain.model.PollOption;
import com.homestead.household.domain.model.PollStatus;
import com.homestead.household.domain.model.Vote;
import com.homestead.household.support.PostgresDatabase;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Testcontainers(disabledWithoutDocker = true)
class JdbcPollRepositoryIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> postgres = PostgresDatabase.container();

    private static JdbcTemplate jdbcTemplate;
    private static JdbcPollRepository pollRepository;

    private long userId;
    private long homeId;

    @BeforeAll
    static void setup() {
        jdbcTemplate = PostgresDatabase.migrate(postgres);
        pollRepository = new JdbcPollRepository(jdbcTemplate);
    }

    @BeforeEach
    void seed() {
        PostgresDatabase.clean(jdbcTemplate);
        userId = PostgresDatabase.insertUser(jdbcTemplate, "kim@example.com");
        homeId = new JdbcHomeRepository(jdbcTemplate).create("Loft", "POLL0001").id();
    }

    @Test
    void shouldStoreOptionsInOrder() {
        // When
        Poll poll = pollRepository.create(draft(), List.of("Pizza", "Sushi", "Tacos"));

        // Then
        assertThat(poll.status()).isEqualTo(PollStatus.OPEN);
        assertThat(poll.options()).extracting(PollOption::title).containsExactly("Pizza", "Sushi", "Tacos");
        assertThat(pollRepository.findByOptionId(poll.options().get(1).id())).contains(poll);
    }

    @Test
    void shouldAttachVotesToTheirOption() {
        // Given
        Poll poll = pollRepository.create(draft(), List.of("Pizza", "Sushi"));
        long sushi = poll.options().get(1).id();

        // When
        Vote vote = pollRepository.vote(userId, sushi);
        Vote again = pollRepository.vote(userId, sushi);

        // Then
        assertThat(again.id()).isEqualTo(vote.id());
        Poll reloaded = pollRepository.findById(poll.id()).orElseThrow();
        assertThat(reloaded.options().get(0).votes()).isEmpty();
        assertThat(reloaded.options().get(1).votes()).extracting(Vote::userId).containsExactly(userId);
    }

    @Test
    void shouldRejectVotesOnClosedPoll() {
        // Given
        Poll poll = pollRepository.create(draft(), List.of("Yes", "No"));
        pollRepository.close(poll.id());

        // When & Then
        assertThatThrownBy(() -> pollRepository.vote(userId, poll.options().get(0).id()))
                .isInstanceOf(PollClosedException.class);
        assertThatThrownBy(() -> pollRepository.close(poll.id()))
                .isInstanceOf(PollClosedException.class);
    }

    @Test
    void shouldReportUnknownOptionAsNotFound() {
        assertThatThrownBy(() -> pollRepository.vote(userId, 404))
                .isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    void shouldRemoveOnlyVotesOfThatPoll() {
        // Given
        Poll lunch = pollRepository.create(draft(), List.of("Pizza", "Sushi"));
        Poll dinner = pollRepository.create(draft(), List.of("Curry", "Soup"));
        pollRepository.vote(userId, lunch.options().get(0).id());
        pollRepository.vote(userId, dinner.options().get(0).id());

        // When
        int removed = pollRepository.unvote(userId, lunch.id());

        // Then
        assertThat(removed).isEqualTo(1);
        assertThat(pollRepository.unvote(userId, lunch.id())).isZero();
        assertThat(pollRepository.findById(lunch.id()).orElseThrow().options().get(0).votes()).isEmpty();
        assertThat(pollRepository.findById(dinner.id()).orElseThrow().options().get(0).votes()).hasSize(1);
    }

    private Poll draft() {
        return new Poll(null, homeId, "What's for lunch?", "single", null, true, null, null, List.of());
    }
}
