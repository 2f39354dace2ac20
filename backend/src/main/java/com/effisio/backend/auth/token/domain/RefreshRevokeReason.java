package com.effisio.backend.auth.token.domain;

/**
 * RefreshToken 폐기(Revoke) 사유
 *
 * ROTATED: 정상 로테이션으로 폐기됨. 폐기 직후 reuse grace 동안의 재제출은 중복 요청으로 취급한다.
 * LOGOUT: 사용자가 해당 세션을 로그아웃
 * LOGOUT_ALL: 사용자/관리자가 "모든 기기에서 로그아웃"
 * REUSE_DETECTED: 폐기된 토큰 재제출(탈취 신호)로 패밀리 전체를 폐기
 */
public enum RefreshRevokeReason { ROTATED, LOGOUT, LOGOUT_ALL, REUSE_DETECTED }
