package com.effisio.backend.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;

import com.effisio.backend.auth.config.AuthProperties;
import com.effisio.backend.auth.rbac.CapabilitySet;
import com.effisio.backend.auth.rbac.RoleCapabilityMap;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.PrematureJwtException;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;

/**
 * Access / Refresh Token(JWT) 발급/검증 서비스
 *
 * - HTTP(상태코드/응답)도 DB도 모른다. "유효/무효"만 판단한다.
 * - 검증 실패는 InvalidJwtException(Reason 포함)으로 통일해서 던지고,
 *   필터/서비스가 클라이언트에게는 사유를 뭉갠 401로 변환한다.
 *
 * 기능:
 * - issueAccessToken(userId, username, role, capabilities): 권한 스냅샷이 실린 짧은 수명 토큰
 * - issueRefreshToken(userId, tokenId): 서버 저장소의 토큰 식별자(jti)를 감싼 긴 수명 토큰
 * - verifyAccessToken / verifyRefreshToken: 서명/알고리즘/issuer/nbf/exp/토큰 종류 검증
 * - extractBearer(header): "Bearer <token>" 파싱 (대소문자 구분)
 * - capabilitiesForRole(role): RoleCapabilityMap 조회
 *
 * JWT 구조: header.payload.signature
 * - header: {"alg":"HS256"} 만 허용한다. (다른 알고리즘을 주장하는 토큰은 알고리즘 혼동 공격으로 보고 거부)
 * - payload: iss/sub/username/role/permissions/token_type/iat/nbf/exp (+ refresh는 jti)
 */
@Service
public class JwtService {

    public static final String BEARER_PREFIX = "Bearer ";

    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_PERMISSIONS = "permissions";
    static final String CLAIM_TOKEN_TYPE = "token_type";

    static final String TYPE_ACCESS = "access";
    static final String TYPE_REFRESH = "refresh";

    private static final int MIN_SECRET_BYTES = 32;

    private final AuthProperties.Jwt jwtProps;
    private final RoleCapabilityMap roleCapabilityMap;
    private final Clock clock;
    private final SecretKey key;
    private final JwtParser parser;

    public JwtService(AuthProperties props, RoleCapabilityMap roleCapabilityMap, Clock clock) {
        this.jwtProps = props.jwt();
        this.roleCapabilityMap = roleCapabilityMap;
        this.clock = clock;

        // secret length 검증 + 키 생성 (설정 오류는 부팅 시점에 터뜨린다)
        this.key = buildHmacKey(jwtProps.secret());
        this.parser = buildParser(jwtProps.issuer(), this.key, this.clock);
    }

    /** 권한 스냅샷이 실린 Access JWT 발급 */
    public String issueAccessToken(Long userId, String username, String role, CapabilitySet capabilities) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        if (role == null || role.isBlank()) throw new IllegalArgumentException("role must not be blank");

        CapabilitySet caps = (capabilities == null) ? CapabilitySet.EMPTY : capabilities;
        Instant now = clock.instant();
        Instant exp = now.plusSeconds(jwtProps.accessTtlSeconds());

        return Jwts.builder()
                .setIssuer(jwtProps.issuer())                // iss
                .setSubject(String.valueOf(userId))          // sub
                .claim(CLAIM_USERNAME, username)
                .claim(CLAIM_ROLE, role)                     // role: "manager"
                .claim(CLAIM_PERMISSIONS, caps.names())      // ["tasks:read","tasks:write"]
                .claim(CLAIM_TOKEN_TYPE, TYPE_ACCESS)
                .setIssuedAt(Date.from(now))                 // iat
                .setNotBefore(Date.from(now))                // nbf = iat
                .setExpiration(Date.from(exp))               // exp
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /** 서버 저장소의 토큰 식별자(jti)를 감싼 Refresh JWT 발급 */
    public String issueRefreshToken(Long userId, String tokenId) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        if (tokenId == null || tokenId.isBlank()) throw new IllegalArgumentException("tokenId must not be blank");

        Instant now = clock.instant();
        Instant exp = now.plusSeconds(jwtProps.refreshTtlSeconds());

        return Jwts.builder()
                .setIssuer(jwtProps.issuer())
                .setSubject(String.valueOf(userId))
                .setId(tokenId)                              // jti
                .claim(CLAIM_TOKEN_TYPE, TYPE_REFRESH)
                .setIssuedAt(Date.from(now))
                .setNotBefore(Date.from(now))
                .setExpiration(Date.from(exp))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public AccessClaims verifyAccessToken(String token) {
        Claims claims = parseAndCheck(token, TYPE_ACCESS);
        try {
            return new AccessClaims(
                    parseUserId(claims.getSubject()),
                    claims.get(CLAIM_USERNAME, String.class),
                    requireText(claims.get(CLAIM_ROLE, String.class), "role claim missing"),
                    parsePermissions(claims.get(CLAIM_PERMISSIONS)),
                    claims.getIssuedAt().toInstant(),
                    claims.getExpiration().toInstant()
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidJwtException(InvalidJwtException.Reason.MALFORMED, "Invalid access claims", e);
        }
    }

    public RefreshClaims verifyRefreshToken(String token) {
        Claims claims = parseAndCheck(token, TYPE_REFRESH);
        try {
            return new RefreshClaims(
                    parseUserId(claims.getSubject()),
                    requireText(claims.getId(), "jti missing"),
                    claims.getIssuedAt().toInstant(),
                    claims.getExpiration().toInstant()
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidJwtException(InvalidJwtException.Reason.MALFORMED, "Invalid refresh claims", e);
        }
    }

    public CapabilitySet capabilitiesForRole(String role) {
        return roleCapabilityMap.forRole(role);
    }

    /**
     * Authorization 헤더 값에서 토큰만 꺼낸다.
     * - "Bearer abc" -> "abc", "Bearer " -> "" (빈 토큰은 verify 단계에서 거른다)
     * - null/빈 문자열, 다른 스킴, 대소문자 불일치("bearer abc")는 MALFORMED
     */
    public static String extractBearer(String headerValue) {
        if (headerValue == null || headerValue.isEmpty()) {
            throw new InvalidJwtException(InvalidJwtException.Reason.MALFORMED, "authorization header is empty");
        }
        if (!headerValue.startsWith(BEARER_PREFIX)) {
            throw new InvalidJwtException(InvalidJwtException.Reason.MALFORMED, "authorization scheme is not Bearer");
        }
        return headerValue.substring(BEARER_PREFIX.length());
    }

    private Claims parseAndCheck(String token, String expectedType) {
        if (token == null || token.isBlank()) {
            throw new InvalidJwtException(InvalidJwtException.Reason.MALFORMED, "token is null or blank");
        }

        Jws<Claims> jws;
        try {
            // 서명/issuer/nbf/exp/포맷 검증 (하나라도 실패하면 JwtException)
            jws = parser.parseClaimsJws(token);
        } catch (ExpiredJwtException e) {
            throw new InvalidJwtException(InvalidJwtException.Reason.EXPIRED, "token expired", e);
        } catch (PrematureJwtException e) {
            throw new InvalidJwtException(InvalidJwtException.Reason.NOT_YET_VALID, "token not yet valid", e);
        } catch (SecurityException | UnsupportedJwtException e) {
            throw new InvalidJwtException(InvalidJwtException.Reason.BAD_SIGNATURE, "signature rejected", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidJwtException(InvalidJwtException.Reason.MALFORMED, "token malformed", e);
        }

        // 같은 키로 서명됐더라도 HS256이 아니면 거부 (알고리즘 혼동 방어)
        String alg = jws.getHeader().getAlgorithm();
        if (!SignatureAlgorithm.HS256.getValue().equals(alg)) {
            throw new InvalidJwtException(InvalidJwtException.Reason.BAD_SIGNATURE, "unexpected signing algorithm: " + alg);
        }

        Claims claims = jws.getBody();

        // exp는 필수. JJWT는 초 단위 비교라 수명 0인 토큰을 같은 초 안에서 통과시키므로 직접 한 번 더 본다.
        Date exp = claims.getExpiration();
        if (exp == null) {
            throw new InvalidJwtException(InvalidJwtException.Reason.MALFORMED, "exp claim missing");
        }
        if (!exp.after(Date.from(clock.instant()))) {
            throw new InvalidJwtException(InvalidJwtException.Reason.EXPIRED, "token expired");
        }
        if (claims.getIssuedAt() == null) {
            throw new InvalidJwtException(InvalidJwtException.Reason.MALFORMED, "iat claim missing");
        }

        String type = claims.get(CLAIM_TOKEN_TYPE, String.class);
        if (!expectedType.equals(type)) {
            throw new InvalidJwtException(InvalidJwtException.Reason.MALFORMED,
                    "token type mismatch: expected=" + expectedType + ", actual=" + type);
        }
        return claims;
    }

    private static SecretKey buildHmacKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must not be blank");
        }

        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }

        return Keys.hmacShaKeyFor(bytes);
    }

    private static JwtParser buildParser(String issuer, SecretKey key, Clock clock) {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalStateException("JWT issuer must not be blank");
        }

        return Jwts.parserBuilder()
                .requireIssuer(issuer)
                .setSigningKey(key)
                // JJWT는 Date 기반 clock을 쓰므로 여기서 bridge
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    // subject:userId -> Long userId 파싱
    private static Long parseUserId(String sub) {
        if (sub == null || sub.isBlank()) {
            throw new JwtException("subject (userId) is missing");
        }
        try {
            return Long.valueOf(sub);
        } catch (NumberFormatException e) {
            throw new JwtException("subject is not a valid Long: " + sub, e);
        }
    }

    private static CapabilitySet parsePermissions(Object raw) {
        if (raw == null) return CapabilitySet.EMPTY;
        if (!(raw instanceof List)) {
            throw new JwtException("permissions claim is not an array");
        }
        List<?> list = (List<?>) raw;

        List<String> names = new ArrayList<>(list.size());
        for (Object o : list) {
            if (!(o instanceof String)) {
                throw new JwtException("permissions claim contains a non-string value");
            }
            names.add((String) o);
        }
        return CapabilitySet.ofNames(names);
    }

    private static String requireText(String v, String message) {
        if (v == null || v.isBlank()) throw new JwtException(message);
        return v;
    }

    /** 검증된 access token 클레임 */
    public record AccessClaims(
            Long userId,
            String username,
            String role,
            CapabilitySet capabilities,
            Instant issuedAt,
            Instant expiresAt
    ) {}

    /** 검증된 refresh token 클레임 (tokenId = 저장소 조회 키) */
    public record RefreshClaims(
            Long userId,
            String tokenId,
            Instant issuedAt,
            Instant expiresAt
    ) {}

    /**
     * HTTP 레벨과 분리된 "JWT 검증 실패" 도메인 예외
     * - reason은 로그/테스트용이다. 클라이언트 응답에는 절대 싣지 않는다.
     */
    public static class InvalidJwtException extends RuntimeException {

        public enum Reason { MALFORMED, BAD_SIGNATURE, EXPIRED, NOT_YET_VALID }

        private final Reason reason;

        public InvalidJwtException(Reason reason, String message) {
            super(message);
            this.reason = reason;
        }

        public InvalidJwtException(Reason reason, String message, Throwable cause) {
            super(message, cause);
            this.reason = reason;
        }

        public Reason getReason() {
            return reason;
        }
    }
}
