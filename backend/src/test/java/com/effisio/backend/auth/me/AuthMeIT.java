package com.effisio.backend.auth.me;

import static org.hamcrest.Matchers.containsString;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.effisio.backend.auth.AbstractAuthIntegrationTest;
import com.effisio.backend.auth.config.AuthProperties;
import com.effisio.backend.auth.domain.User;
import com.effisio.backend.auth.domain.UserStatus;
import com.effisio.backend.auth.support.AuthFlowSupport;
import com.effisio.backend.auth.support.AuthHttpSupport;
import com.effisio.backend.auth.support.AuthHttpSupport.LoginResult;
import com.effisio.backend.global.ErrorCode;
import com.effisio.backend.infra.TestClockConfig;

/**
 * /api/v1/auth/me 통합 테스트 (SecurityFilterChain + Controller + Service)
 *
 * [JwtAuthenticationFilter - REQUIRED]
 * - Authorization 헤더 없음 → 통과 → authenticated()에 걸려 EntryPoint 401(AUTH_REQUIRED)
 * - 헤더 있음 + 형식/서명/만료 실패 → Filter에서 즉시 401(ACCESS_INVALID)
 *
 * [MeService]
 * - DB에서 user 없으면 USER_NOT_FOUND, status != ACTIVE면 ACCOUNT_DISABLED
 */
@DisplayName("[Auth][Me] 내 정보 조회 통합 테스트")
class AuthMeIT extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired JdbcTemplate jdbc;
    @Autowired AuthProperties authProps;

    private User user;

    @BeforeEach
    void seedUser() {
        user = createDefaultUser();
    }

    // 1) 인증 자체가 없음 (EntryPoint -> AUTH_REQUIRED)

    @Test
    @DisplayName("me: Authorization 없음 → 401 AUTH_REQUIRED + no-store")
    void me_requires_auth_when_no_authorization_header() throws Exception {
        ResultActions actions = AuthHttpSupport.performMe(mvc, null);
        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.AUTH_REQUIRED);
        actions.andExpect(header().string("Cache-Control", containsString("no-store")));
    }

    // 2) 헤더는 있는데 무효 (Filter -> ACCESS_INVALID)

    @Test
    @DisplayName("me: Bearer가 아닌 Authorization → 401 ACCESS_INVALID")
    void me_rejects_non_bearer_header() throws Exception {
        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, "Basic abcdefg"), ErrorCode.ACCESS_INVALID);
    }

    @Test
    @DisplayName("me: 형식이 깨진 JWT → 401 ACCESS_INVALID")
    void me_rejects_invalid_jwt() throws Exception {
        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, "Bearer not-a-jwt"), ErrorCode.ACCESS_INVALID);
    }

    @Test
    @DisplayName("me: refresh 토큰을 access처럼 사용 → 401 ACCESS_INVALID")
    void me_rejects_refresh_token_used_as_access_token() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, USERNAME, PASSWORD);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.refreshRaw())),
                ErrorCode.ACCESS_INVALID
        );
    }

    @Test
    @DisplayName("me: access TTL이 지나면 → 401 ACCESS_INVALID")
    void me_rejects_expired_access_token() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, USERNAME, PASSWORD);

        TestClockConfig.TEST_CLOCK.advanceSeconds(authProps.jwt().accessTtlSeconds());

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken())),
                ErrorCode.ACCESS_INVALID
        );
    }

    // 3) 인증은 성공했지만 서비스 정책/DB에서 막힘

    @Test
    @DisplayName("me: 토큰은 유효하지만 DB에 유저 없음 → USER_NOT_FOUND")
    void me_returns_user_not_found_when_user_deleted_after_login() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, USERNAME, PASSWORD);

        jdbc.update("delete from users where id = ?", user.getId());

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken())),
                ErrorCode.USER_NOT_FOUND
        );
    }

    @Test
    @DisplayName("me: 토큰은 유효하지만 비활성 계정 → ACCOUNT_DISABLED")
    void me_blocks_when_user_not_active() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, USERNAME, PASSWORD);
        jdbc.update("update users set status = ? where id = ?", UserStatus.SUSPENDED.name(), user.getId());

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken())),
                ErrorCode.ACCOUNT_DISABLED
        );
    }

    // 4) 성공

    @Test
    @DisplayName("me: 유효한 access 토큰 → 200 + 사용자 정보 + 권한 스냅샷")
    void me_returns_user_info_when_access_token_valid() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, USERNAME, PASSWORD);

        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken()))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.userId").value(user.getId()))
                .andExpect(jsonPath("$.username").value(USERNAME))
                .andExpect(jsonPath("$.role").value("manager"))
                .andExpect(jsonPath("$.status").value(UserStatus.ACTIVE.name()))
                .andExpect(jsonPath("$.permissions[0]").value("tasks:delete"))
                .andExpect(jsonPath("$.permissions.length()").value(4));
    }
}
