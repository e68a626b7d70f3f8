package com.homestead.household.domain.exception;

public class PollClosedException extends InvalidStateTransitionException {

    public PollClosedException(long pollId) {
        super("poll " + pollId + " is closed");
    }
}
