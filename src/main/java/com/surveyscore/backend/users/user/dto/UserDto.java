package com.surveyscore.backend.users.user.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.surveyscore.backend.users.user.entity.UserAccount;

import java.time.Instant;

/** 對外回傳的使用者資料（不含密碼） */
public record UserDto(
        @JsonProperty("user_id") Long userId,
        String username,
        @JsonProperty("last_name") String lastName,
        @JsonProperty("first_name") String firstName,
        String gender,
        String email,
        @JsonProperty("registry_number") String registryNumber,
        String country,
        @JsonProperty("created_at") Instant createdAt
) {
    public static UserDto from(UserAccount u) {
        return new UserDto(
                u.getId(),
                u.getAccountName(),
                u.getSurname(),
                u.getFirstname(),
                u.getGender(),
                u.getEmail(),
                u.getRegisterId(),
                u.getCountry(),
                u.getCreatedAt()
        );
    }
}
