package com.homestead.household.application;

import com.homestead.household.domain.event.Action;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.event.Module;
import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.User;
import com.homestead.household.domain.port.out.UserRepository;
import com.homestead.household.infrastructure.cache.CacheAsideTemplate;
import com.homestead.household.infrastructure.cache.CacheMutation;
import org.springframework.stereotype.Service;

/**
 * Users are not cached; updates are still broadcast.
 */
@Service
public class UserService {

    private final UserRepository userRepository;
    private final CacheAsideTemplate cacheAside;

    public UserService(UserRepository userRepository, CacheAsideTemplate cacheAside) {
        this.userRepository = userRepository;
        this.cacheAside = cacheAside;
    }

    public User getUser(long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new EntityNotFoundException("user", userId));
    }

    public User updateName(long userId, String name) {
        return cacheAside.execute(CacheMutation
                .writing(() -> userRepository.updateName(userId, name))
                .publish(user -> DomainEvent.of(Module.USER, Action.UPDATED, user))
                .build());
    }

    public User updateAvatar(long userId, String avatar) {
        return cacheAside.execute(CacheMutation
                .writing(() -> userRepository.updateAvatar(userId, avatar))
                .publish(user -> DomainEvent.of(Module.USER, Action.UPDATED, user))
                .build());
    }
}
