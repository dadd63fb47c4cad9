package com.surveyscore.backend.users.user.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.Locale;

@Data
@Entity
@Table(
        name = "user_information",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_user_account_name", columnNames = {"account_name"}),
                @UniqueConstraint(name = "ux_user_email", columnNames = {"email"}),
                @UniqueConstraint(name = "ux_user_registerid", columnNames = {"registerid"})
        }
)
public class UserAccount {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "user_id")
    private Long id;

    @Column(name = "account_name", nullable = false, length = 50)
    private String accountName;

    // BCrypt hash，不存明碼
    @Column(name = "user_password", nullable = false, length = 100)
    private String passwordHash;

    @Column(name = "surname", nullable = false, length = 100)
    private String surname;

    @Column(name = "firstname", nullable = false, length = 100)
    private String firstname;

    @Column(name = "gender", nullable = false, length = 30)
    private String gender;

    @Column(name = "email", nullable = false, length = 255)
    private String email;

    @Column(name = "registerid", nullable = false, length = 12)
    private String registerId;

    @Column(name = "country", length = 50)
    private String country;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /** 統一以小寫寫入，避免大小寫造成重複帳號 */
    public void setEmail(String email) {
        this.email = (email == null) ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
