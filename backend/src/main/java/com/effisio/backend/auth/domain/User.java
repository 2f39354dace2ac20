package com.effisio.backend.auth.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * users 테이블 = "자격 증명 저장소"
 *
 * 로그인 흐름:
 * - LoginService.login()에서 username으로 조회
 * - password_hash 비교 (PasswordEncoder)
 * - status/role로 인증/인가 정책 적용 (role -> RoleCapabilityMap -> 권한 스냅샷)
 */
@Getter
@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(name = "uq_users_username", columnNames = "username"),
        @UniqueConstraint(name = "uq_users_email", columnNames = "email")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id; // JWT의 sub(subject)

    @Column(nullable = false, length = 50)
    private String username; // 로그인 ID

    @Column(nullable = false, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash; // 원문 저장 금지

    @Column(name = "full_name", length = 100)
    private String fullName;

    @Column(length = 100)
    private String department;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserStatus status;

    @Column(name = "last_login_at")
    private LocalDateTime lastLoginAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static User create(
            String username,
            String email,
            String passwordHash,
            String fullName,
            String department,
            UserRole role,
            LocalDateTime now
    ) {
        require(username != null && !username.isBlank(), "username must not be blank");
        require(email != null && !email.isBlank(), "email must not be blank");
        require(passwordHash != null && !passwordHash.isBlank(), "passwordHash must not be blank");
        require(role != null, "role must not be null");
        require(now != null, "now must not be null");

        User u = new User();
        u.username = username;
        u.email = email;
        u.passwordHash = passwordHash;
        u.fullName = fullName;
        u.department = department;
        u.role = role;
        u.status = UserStatus.ACTIVE;
        u.createdAt = now;
        u.updatedAt = now;
        return u;
    }

    public boolean isActive() {
        return status == UserStatus.ACTIVE;
    }

    public void recordLogin(LocalDateTime now) {
        this.lastLoginAt = now;
        this.updatedAt = now;
    }

    public void changeStatus(UserStatus status, LocalDateTime now) {
        require(status != null, "status must not be null");
        this.status = status;
        this.updatedAt = now;
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
