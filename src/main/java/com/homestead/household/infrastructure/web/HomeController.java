package com.homestead.household.infrastructure.web;

import com.homestead.household.application.HomeService;
import com.homestead.household.domain.model.Home;
import com.homestead.household.domain.model.HomeMembership;
import com.homestead.household.infrastructure.web.dto.CreateHomeRequest;
import com.homestead.household.infrastructure.web.dto.JoinHomeRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/homes")
public class HomeController {

    private final HomeService homeService;

    public HomeController(HomeService homeService) {
        this.homeService = homeService;
    }

    @PostMapping
    public ResponseEntity<Home> createHome(@RequestHeader(ApiHeaders.USER_ID) long userId,
                                           @Valid @RequestBody CreateHomeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(homeService.createHome(request.name(), userId));
    }

    @GetMapping("/{homeId}")
    public ResponseEntity<Home> getHome(@PathVariable long homeId) {
        return ResponseEntity.ok(homeService.getHome(homeId));
    }

    @PostMapping("/join")
    public ResponseEntity<HomeMembership> joinHome(@RequestHeader(ApiHeaders.USER_ID) long userId,
                                                   @Valid @RequestBody JoinHomeRequest request) {
        return ResponseEntity.ok(homeService.joinHome(request.inviteCode(), userId));
    }

    @PostMapping("/{homeId}/leave")
    public ResponseEntity<Void> leaveHome(@RequestHeader(ApiHeaders.USER_ID) long userId, @PathVariable long homeId) {
        homeService.leaveHome(homeId, userId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{homeId}/members/{memberId}")
    public ResponseEntity<Void> removeMember(@RequestHeader(ApiHeaders.USER_ID) long userId,
                                             @PathVariable long homeId,
                                             @PathVariable long memberId) {
        homeService.removeMember(homeId, memberId, userId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{homeId}")
    public ResponseEntity<Void> deleteHome(@PathVariable long homeId) {
        homeService.deleteHome(homeId);
        return ResponseEntity.noContent().build();
    }
}
