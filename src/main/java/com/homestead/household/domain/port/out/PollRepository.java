package com.homestead.household.domain.port.out;

import com.homestead.household.domain.model.Poll;
import com.homestead.household.domain.model.Vote;
import java.util.List;
import java.util.Optional;

/**
 * Repository port for polls, their options and votes.
 * Polls are always returned with options and votes loaded.
 */
public interface PollRepository {

    Poll create(Poll poll, List<String> optionTitles);

    Optional<Poll> findById(long id);

    Optional<Poll> findByOptionId(long optionId);

    List<Poll> findByHomeId(long homeId);

    /**
     * @throws com.homestead.household.domain.exception.PollClosedException if already closed
     */
    Poll close(long id);

    void delete(long id);

    /**
     * @throws com.homestead.household.domain.exception.PollClosedException if the option's poll is closed
     */
    Vote vote(long userId, long optionId);

    /**
     * Removes every vote of the user on the poll.
     *
     * @return number of votes removed
     */
    int unvote(long userId, long pollId);
}
