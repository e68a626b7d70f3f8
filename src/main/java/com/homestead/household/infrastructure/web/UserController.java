package com.homestead.household.infrastructure.web;

import com.homestead.household.application.UserService;
import com.homestead.household.domain.model.User;
import com.homestead.household.infrastructure.web.dto.UpdateUserRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping("/me")
    public ResponseEntity<User> getMe(@RequestHeader(ApiHeaders.USER_ID) long userId) {
        return ResponseEntity.ok(userService.getUser(userId));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<User> getUser(@PathVariable long userId) {
        return ResponseEntity.ok(userService.getUser(userId));
    }

    @PatchMapping("/me")
    public ResponseEntity<User> updateMe(@RequestHeader(ApiHeaders.USER_ID) long userId,
                                         @Valid @RequestBody UpdateUserRequest request) {
        User user = null;
        if (request.name() != null) {
            user = userService.updateName(userId, request.name());
        }
        if (request.avatar() != null) {
            user = userService.updateAvatar(userId, request.avatar());
        }
        return ResponseEntity.ok(user != null ? user : userService.getUser(userId));
    }
}
