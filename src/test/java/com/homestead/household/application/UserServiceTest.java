package com.homestead.household.application;

import com.homestead.household.domain.event.Action;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.event.Module;
import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.User;
import com.homestead.household.domain.port.out.UserRepository;
import com.homestead.household.support.CacheFixtures;
import com.homestead.household.support.InMemoryCacheStore;
import com.homestead.household.support.RecordingEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    private RecordingEventPublisher publisher;
    private UserService userService;

    @BeforeEach
    void setUp() {
        publisher = new RecordingEventPublisher();
        userService = new UserService(userRepository,
                CacheFixtures.cacheAside(CacheFixtures.typedCache(new InMemoryCacheStore()), publisher));
    }

    @Test
    void shouldPublishFreshUserOnRename() {
        // Given
        User renamed = new User(2L, "sam@example.com", "Sam", null, Instant.parse("2025-01-01T00:00:00Z"));
        when(userRepository.updateName(2, "Sam")).thenReturn(renamed);

        // When
        User result = userService.updateName(2, "Sam");

        // Then
        assertThat(result).isEqualTo(renamed);
        assertThat(publisher.single()).isEqualTo(DomainEvent.of(Module.USER, Action.UPDATED, renamed));
    }

    @Test
    void shouldThrowNotFoundForUnknownUser() {
        when(userRepository.findById(99)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> userService.getUser(99))
                .isInstanceOf(EntityNotFoundException.class);
    }
}
