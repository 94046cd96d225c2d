package com.salescrm.backend.controllers;

import com.salescrm.backend.dto.user.RegisterUserRequest;
import com.salescrm.backend.dto.user.UserDto;
import com.salescrm.backend.models.User;
import com.salescrm.backend.services.UserService;
import com.salescrm.backend.util.UserMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
@Slf4j
public class UserController {

    private final UserService userService;

    /**
     * Public sign up of a new organization and its admin.
     */
    @PostMapping("/register")
    public ResponseEntity<UserDto> register(@Valid @RequestBody RegisterUserRequest request) {
        log.info("Registration request for {}", request.getEmail());
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.register(request));
    }

    @GetMapping("/me")
    public ResponseEntity<UserDto> getProfile(Authentication authentication) {
        return ResponseEntity.ok(UserMapper.toDto(getCurrentUser(authentication)));
    }

    @GetMapping
    public ResponseEntity<List<UserDto>> getUsers(Authentication authentication) {
        return ResponseEntity.ok(userService.getUsers(getCurrentUser(authentication)));
    }

    @GetMapping("/team")
    public ResponseEntity<List<UserDto>> getTeam(Authentication authentication) {
        return ResponseEntity.ok(userService.getTeam(getCurrentUser(authentication)));
    }

    @PostMapping
    public ResponseEntity<UserDto> createUser(
            @Valid @RequestBody RegisterUserRequest request,
            Authentication authentication) {
        User admin = getCurrentUser(authentication);
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.createUser(admin, request));
    }

    @PatchMapping("/{userId}/active")
    public ResponseEntity<UserDto> setActive(
            @PathVariable Long userId,
            @RequestParam boolean active,
            Authentication authentication) {
        return ResponseEntity.ok(userService.setActive(getCurrentUser(authentication), userId, active));
    }

    private User getCurrentUser(Authentication authentication) {
        return userService.getByEmail(authentication.getName());
    }
}
