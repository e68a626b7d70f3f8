package com.homestead.household.infrastructure.web;

import com.homestead.household.application.PollService;
import com.homestead.household.domain.model.Poll;
import com.homestead.household.domain.model.Vote;
import com.homestead.household.infrastructure.web.dto.CreatePollRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/homes/{homeId}/polls")
public class PollController {

    private final PollService pollService;

    public PollController(PollService pollService) {
        this.pollService = pollService;
    }

    @PostMapping
    public ResponseEntity<Poll> createPoll(@PathVariable long homeId, @Valid @RequestBody CreatePollRequest request) {
        Poll poll = pollService.createPoll(homeId, request.question(), request.type(), request.options(),
                request.allowRevote(), request.endsAt());
        return ResponseEntity.status(HttpStatus.CREATED).body(poll);
    }

    @GetMapping
    public ResponseEntity<List<Poll>> getPolls(@PathVariable long homeId) {
        return ResponseEntity.ok(pollService.getPollsForHome(homeId));
    }

    @GetMapping("/{pollId}")
    public ResponseEntity<Poll> getPoll(@PathVariable long homeId, @PathVariable long pollId) {
        return ResponseEntity.ok(pollService.getPoll(pollId));
    }

    @PostMapping("/{pollId}/close")
    public ResponseEntity<Void> closePoll(@PathVariable long homeId, @PathVariable long pollId) {
        pollService.closePoll(pollId, homeId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{pollId}")
    public ResponseEntity<Void> deletePoll(@PathVariable long homeId, @PathVariable long pollId) {
        pollService.deletePoll(pollId, homeId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/options/{optionId}/vote")
    public ResponseEntity<Vote> vote(@RequestHeader(ApiHeaders.USER_ID) long userId,
                                     @PathVariable long homeId,
                                     @PathVariable long optionId) {
        return ResponseEntity.ok(pollService.vote(userId, optionId, homeId));
    }

    @DeleteMapping("/{pollId}/vote")
    public ResponseEntity<Void> unvote(@RequestHeader(ApiHeaders.USER_ID) long userId,
                                       @PathVariable long homeId,
                                       @PathVariable long pollId) {
        pollService.unvote(userId, pollId, homeId);
        return ResponseEntity.noContent().build();
    }
}
