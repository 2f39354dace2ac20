package com.effisio.backend.auth.token.store;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import com.effisio.backend.auth.token.domain.RefreshRevokeReason;
import com.effisio.backend.auth.token.domain.RefreshToken;

/**
 * refresh token 레코드 저장소.
 *
 * 세션 서비스(RefreshTokenService, LoginService)만 사용한다. 요청 인증 필터는 이 저장소를 보지 않는다.
 * 구현체는 revoke()를 원자적인 조건부 갱신으로 제공해야 한다. (동시 로테이션 방어의 유일한 수단)
 */
public interface RefreshTokenStore {

    /** 새 Issued 레코드 저장 */
    RefreshToken create(RefreshToken token);

    Optional<RefreshToken> findByTokenId(String tokenId);

    /** 폐기되지 않았고 만료되지 않은 레코드 (최근 발급 순) */
    List<RefreshToken> findActiveByUser(Long userId, LocalDateTime now);

    /**
     * revoked = false 인 경우에만 폐기한다.
     * @return 이번 호출이 실제로 상태를 바꿨으면 true, 이미 폐기돼 있었거나 없으면 false
     */
    boolean revoke(String tokenId, RefreshRevokeReason reason, String replacedByTokenId, LocalDateTime now);

    /** 사용자의 폐기되지 않은 레코드를 전부 폐기. 바뀐 개수를 돌려준다. */
    int revokeAllForUser(Long userId, RefreshRevokeReason reason, LocalDateTime now);

    void touch(String tokenId, LocalDateTime now);

    /** expires_at <= now 인 레코드 삭제. 정확성과는 무관한 정리 작업이다. */
    int deleteExpired(LocalDateTime now);
}
