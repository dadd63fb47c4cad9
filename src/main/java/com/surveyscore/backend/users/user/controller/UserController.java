package com.surveyscore.backend.users.user.controller;

import com.surveyscore.backend.users.user.dto.CreateUserRequest;
import com.surveyscore.backend.users.user.dto.UserDto;
import com.surveyscore.backend.users.user.service.UserRegistrationService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/users")
public class UserController {

    private final UserRegistrationService service;

    public UserController(UserRegistrationService service) {
        this.service = service;
    }

    @PostMapping({"", "/"})
    public ResponseEntity<UserDto> create(@Valid @RequestBody CreateUserRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.register(req));
    }

    @GetMapping({"", "/"})
    public ResponseEntity<List<UserDto>> list() {
        return ResponseEntity.ok(service.listAll());
    }
}
