package com.homestead.household.application;

import com.fasterxml.jackson.core.type.TypeReference;
import com.homestead.household.domain.event.Action;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.event.Module;
import com.homestead.household.domain.exception.BusinessRuleException;
import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.Poll;
import com.homestead.household.domain.model.PollStatus;
import com.homestead.household.domain.model.Vote;
import com.homestead.household.domain.port.out.PollRepository;
import com.homestead.household.infrastructure.cache.CacheAsideTemplate;
import com.homestead.household.infrastructure.cache.CacheMutation;
import com.homestead.household.infrastructure.cache.key.CacheKey;
import com.homestead.household.infrastructure.cache.key.CacheKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Polls with their options and votes. A poll is cached as a whole, votes included,
 * so every vote change drops the poll and its home's poll list.
 */
@Service
public class PollService {

    private static final Logger logger = LoggerFactory.getLogger(PollService.class);

    private static final TypeReference<List<Poll>> POLL_LIST = new TypeReference<>() {};

    private final PollRepository pollRepository;
    private final CacheAsideTemplate cacheAside;

    public PollService(PollRepository pollRepository, CacheAsideTemplate cacheAside) {
        this.pollRepository = pollRepository;
        this.cacheAside = cacheAside;
    }

    public Poll createPoll(long homeId, String question, String type, List<String> options,
                           boolean allowRevote, Instant endsAt) {
        if (options == null || options.isEmpty()) {
            throw new BusinessRuleException("a poll needs at least one option");
        }

        Poll draft = new Poll(null, homeId, question, type, PollStatus.OPEN, allowRevote, endsAt, null, List.of());

        Poll poll = cacheAside.execute(CacheMutation
                .writing(() -> pollRepository.create(draft, options))
                .invalidate(CacheKeys.pollsForHome(homeId))
                .publish(created -> DomainEvent.of(Module.POLL, Action.CREATED, created))
                .build());

        logger.info("Created poll {} with {} options in home {}", poll.id(), options.size(), homeId);
        return poll;
    }

    public Poll getPoll(long pollId) {
        return cacheAside.readThrough(CacheKeys.poll(pollId), Poll.class, () -> findPoll(pollId));
    }

    public List<Poll> getPollsForHome(long homeId) {
        return cacheAside.readThrough(CacheKeys.pollsForHome(homeId), POLL_LIST,
                () -> pollRepository.findByHomeId(homeId));
    }

    /**
     * Open to closed. Closed polls reject further votes and cannot be reopened.
     */
    public void closePoll(long pollId, long homeId) {
        Poll poll = findPollInHome(pollId, homeId);

        cacheAside.execute(CacheMutation
                .writing(() -> pollRepository.close(pollId))
                .invalidate(pollKeys(poll))
                .publish(closed -> DomainEvent.of(Module.POLL, Action.CLOSED, Map.of("id", pollId)))
                .build());

        logger.info("Closed poll {}", pollId);
    }

    public void deletePoll(long pollId, long homeId) {
        Poll poll = findPollInHome(pollId, homeId);

        cacheAside.execute(CacheMutation
                .running(() -> pollRepository.delete(pollId))
                .invalidate(pollKeys(poll))
                .publish(ignored -> DomainEvent.deleted(Module.POLL, pollId))
                .build());
    }

    public Vote vote(long userId, long optionId, long homeId) {
        Poll poll = pollRepository.findByOptionId(optionId)
                .orElseThrow(() -> new EntityNotFoundException("poll option", optionId));
        requireHome(poll, homeId);

        return cacheAside.execute(CacheMutation
                .writing(() -> pollRepository.vote(userId, optionId))
                .invalidate(pollKeys(poll))
                .publish(vote -> DomainEvent.of(Module.POLL, Action.VOTED, vote))
                .build());
    }

    /**
     * Removes the user's votes on the poll. Nothing is published when the user had not voted.
     */
    public void unvote(long userId, long pollId, long homeId) {
        Poll poll = findPollInHome(pollId, homeId);
        if (!poll.allowRevote()) {
            throw new BusinessRuleException("revoting is not allowed for this poll");
        }

        cacheAside.execute(CacheMutation
                .writing(() -> pollRepository.unvote(userId, pollId))
                .invalidate(pollKeys(poll))
                .publish(removed -> removed == 0 ? null : DomainEvent.of(Module.POLL, Action.UNVOTED,
                        Map.of("user_id", userId, "poll_id", pollId)))
                .build());
    }

    private Poll findPoll(long pollId) {
        return pollRepository.findById(pollId)
                .orElseThrow(() -> new EntityNotFoundException("poll", pollId));
    }

    private Poll findPollInHome(long pollId, long homeId) {
        Poll poll = findPoll(pollId);
        requireHome(poll, homeId);
        return poll;
    }

    private static void requireHome(Poll poll, long homeId) {
        if (poll.homeId() == null || poll.homeId() != homeId) {
            throw new BusinessRuleException("poll " + poll.id() + " belongs to another home");
        }
    }

    private static List<CacheKey> pollKeys(Poll poll) {
        return List.of(CacheKeys.poll(poll.id()), CacheKeys.pollsForHome(poll.homeId()));
    }
}
