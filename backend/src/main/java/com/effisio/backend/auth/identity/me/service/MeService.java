package com.effisio.backend.auth.identity.me.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.effisio.backend.auth.domain.User;
import com.effisio.backend.auth.identity.me.dto.MeResponse;
import com.effisio.backend.auth.repo.UserRepository;
import com.effisio.backend.global.ApiException;
import com.effisio.backend.global.ErrorCode;
import com.effisio.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/**
 * 내 정보 조회 유스케이스
 *
 * 정책:
 * - 인증이 없으면 AUTH_REQUIRED
 * - 토큰은 유효하지만 사용자 없음 -> USER_NOT_FOUND (비정상 상태)
 * - 계정 상태가 ACTIVE가 아니면 -> ACCOUNT_DISABLED
 * - permissions는 DB가 아니라 토큰에 실린 스냅샷을 그대로 보여준다.
 */
@Service
@RequiredArgsConstructor
public class MeService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public MeResponse me(AuthPrincipal principal) {
        Long userId = requireUserId(principal);
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ApiException(ErrorCode.USER_NOT_FOUND));

        if (!user.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_DISABLED);
        }
        return MeResponse.from(user, principal.capabilities());
    }

    private Long requireUserId(AuthPrincipal principal) {
        if (principal == null || principal.userId() == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }
        return principal.userId();
    }
}
