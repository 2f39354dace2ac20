package com.effisio.backend.auth.token.repo;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.effisio.backend.auth.token.domain.RefreshRevokeReason;
import com.effisio.backend.auth.token.domain.RefreshToken;

@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, Long> {

    Optional<RefreshToken> findByTokenId(String tokenId);

    @Query("""
            select r from RefreshToken r
             where r.userId = :userId
               and r.revoked = false
               and r.expiresAt > :now
             order by r.createdAt desc
            """)
    List<RefreshToken> findActiveByUserId(@Param("userId") Long userId, @Param("now") LocalDateTime now);

    /**
     * 조건부 revoke. "revoked = false"인 row만 바꾼다.
     *
     * - InnoDB에서 UPDATE는 대상 row에 X-lock을 잡으므로, 같은 token_id로 동시에 두 트랜잭션이 들어오면
     *   뒤에 온 쪽은 앞 트랜잭션 커밋 후 조건(revoked = false)을 다시 평가해서 0 row가 된다.
     * - 반환값(affected rows)이 1이면 이번 호출이 상태를 바꾼 "승자"다.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update RefreshToken r
               set r.revoked = true,
                   r.revokedAt = :now,
                   r.revokeReason = :reason,
                   r.replacedByTokenId = :replacedBy,
                   r.lastUsedAt = :now
             where r.tokenId = :tokenId
               and r.revoked = false
            """)
    int revokeIfActive(
            @Param("tokenId") String tokenId,
            @Param("reason") RefreshRevokeReason reason,
            @Param("replacedBy") String replacedByTokenId,
            @Param("now") LocalDateTime now
    );

    // 이미 폐기된 row(특히 ROTATED)의 revoked_at/사유는 건드리지 않는다.
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update RefreshToken r
               set r.revoked = true,
                   r.revokedAt = :now,
                   r.revokeReason = :reason
             where r.userId = :userId
               and r.revoked = false
            """)
    int revokeAllActiveByUserId(
            @Param("userId") Long userId,
            @Param("reason") RefreshRevokeReason reason,
            @Param("now") LocalDateTime now
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update RefreshToken r set r.lastUsedAt = :now where r.tokenId = :tokenId")
    int touchLastUsed(@Param("tokenId") String tokenId, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from RefreshToken r where r.expiresAt <= :now")
    int deleteExpiredAsOf(@Param("now") LocalDateTime now);
}
