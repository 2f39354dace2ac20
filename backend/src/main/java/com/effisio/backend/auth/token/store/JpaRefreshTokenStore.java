package com.effisio.backend.auth.token.store;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.effisio.backend.auth.token.domain.RefreshRevokeReason;
import com.effisio.backend.auth.token.domain.RefreshToken;
import com.effisio.backend.auth.token.repo.RefreshTokenRepository;

import lombok.RequiredArgsConstructor;

/**
 * Spring Data JPA 기반 RefreshTokenStore.
 * 조건부 revoke는 JPQL bulk UPDATE(affected rows)로 구현한다.
 */
@Repository
@RequiredArgsConstructor
public class JpaRefreshTokenStore implements RefreshTokenStore {

    private final RefreshTokenRepository repository;

    @Override
    @Transactional
    public RefreshToken create(RefreshToken token) {
        return repository.save(token);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RefreshToken> findByTokenId(String tokenId) {
        if (tokenId == null || tokenId.isBlank()) return Optional.empty();
        return repository.findByTokenId(tokenId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RefreshToken> findActiveByUser(Long userId, LocalDateTime now) {
        return repository.findActiveByUserId(userId, now);
    }

    @Override
    @Transactional
    public boolean revoke(String tokenId, RefreshRevokeReason reason, String replacedByTokenId, LocalDateTime now) {
        return repository.revokeIfActive(tokenId, reason, replacedByTokenId, now) == 1;
    }

    @Override
    @Transactional
    public int revokeAllForUser(Long userId, RefreshRevokeReason reason, LocalDateTime now) {
        return repository.revokeAllActiveByUserId(userId, reason, now);
    }

    @Override
    @Transactional
    public void touch(String tokenId, LocalDateTime now) {
        repository.touchLastUsed(tokenId, now);
    }

    @Override
    @Transactional
    public int deleteExpired(LocalDateTime now) {
        return repository.deleteExpiredAsOf(now);
    }
}
