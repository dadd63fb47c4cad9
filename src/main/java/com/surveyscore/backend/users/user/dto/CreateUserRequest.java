package com.surveyscore.backend.users.user.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** POST /users/ 的 body，欄位名沿用前端既有的 snake_case */
public record CreateUserRequest(
        @NotBlank @Size(max = 50) String username,
        @NotBlank @Size(min = 6, max = 72) String password,
        @JsonProperty("last_name") @NotBlank @Size(max = 100) String lastName,
        @JsonProperty("first_name") @NotBlank @Size(max = 100) String firstName,
        @NotBlank @Size(max = 30) String gender,
        @NotBlank @Email @Size(max = 255) String email,
        @JsonProperty("registry_number") @NotBlank @Size(max = 12) String registryNumber,
        @Size(max = 50) String country
) {}
