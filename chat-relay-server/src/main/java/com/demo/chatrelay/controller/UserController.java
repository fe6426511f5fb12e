package com.demo.chatrelay.controller;

import com.demo.chatrelay.domain.UserEntity;
import com.demo.chatrelay.service.UserService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping
    public ResponseEntity<?> listUsers() {
        try {
            List<UserEntity> users = userService.listUsers();
            return ResponseEntity.ok(users);
        } catch (Exception e) {
            log.error("Failed to list users", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to fetch users"));
        }
    }

    /**
     * Log in by username, creating the user on first use.
     * POST /api/users/login {username, email?, company?}
     */
    @PostMapping("/login")
    public ResponseEntity<?> login(@RequestBody Map<String, String> request) {
        String username = request.get("username");
        if (username == null || username.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Username is required"));
        }

        try {
            UserEntity user = userService.login(username.trim(), request.get("email"), request.get("company"));
            return ResponseEntity.ok(user);
        } catch (Exception e) {
            log.error("Login failed: username={}", username, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to login"));
        }
    }
}
