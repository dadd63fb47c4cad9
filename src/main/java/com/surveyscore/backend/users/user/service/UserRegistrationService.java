package com.surveyscore.backend.users.user.service;

import com.surveyscore.backend.users.user.dto.CreateUserRequest;
import com.surveyscore.backend.users.user.dto.UserDto;
import com.surveyscore.backend.users.user.entity.UserAccount;
import com.surveyscore.backend.users.user.repo.UserAccountRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserRegistrationService {

    private final UserAccountRepo users;
    private final PasswordEncoder passwordEncoder;

    /**
     * 帳號 / email / 身分證號 三者都要唯一。
     * 先查一次給明確錯誤碼；同時送進來的兩筆靠 DB unique constraint 擋。
     */
    @Transactional
    public UserDto register(CreateUserRequest req) {
        String username = req.username().trim();
        String registryNumber = req.registryNumber().trim();

        if (users.existsByAccountName(username)) throw taken("USERNAME_TAKEN", username);
        if (users.existsByEmailIgnoreCase(req.email().trim())) throw taken("EMAIL_TAKEN", username);
        if (users.existsByRegisterId(registryNumber)) throw taken("REGISTER_ID_TAKEN", username);

        UserAccount u = new UserAccount();
        u.setAccountName(username);
        u.setPasswordHash(passwordEncoder.encode(req.password()));
        u.setSurname(req.lastName().trim());
        u.setFirstname(req.firstName().trim());
        u.setGender(req.gender().trim());
        u.setEmail(req.email());
        u.setRegisterId(registryNumber);
        u.setCountry(blankToNull(req.country()));

        UserAccount saved;
        try {
            saved = users.saveAndFlush(u);
        } catch (DataIntegrityViolationException e) {
            log.warn("[Users] concurrent duplicate registration username={}", username);
            throw new IllegalArgumentException("USER_ALREADY_REGISTERED", e);
        }

        log.info("[Users] registered userId={} username={}", saved.getId(), saved.getAccountName());
        return UserDto.from(saved);
    }

    @Transactional(readOnly = true)
    public List<UserDto> listAll() {
        return users.findAllByOrderByIdAsc().stream().map(UserDto::from).toList();
    }

    @Transactional(readOnly = true)
    public boolean exists(Long userId) {
        return userId != null && users.existsById(userId);
    }

    private static IllegalArgumentException taken(String code, String username) {
        log.warn("[Users] registration rejected code={} username={}", code, username);
        return new IllegalArgumentException(code);
    }

    private static String blankToNull(String v) {
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
