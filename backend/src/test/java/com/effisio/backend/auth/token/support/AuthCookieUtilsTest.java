package com.effisio.backend.auth.token.support;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import com.effisio.backend.auth.support.AuthTestFixtures;
import com.effisio.backend.infra.TestClockConfig;
import com.effisio.backend.infra.TestClockConfig.MutableClock;

import jakarta.servlet.http.Cookie;

@DisplayName("[Token] refresh 쿠키 정책")
class AuthCookieUtilsTest {

    private MutableClock clock;
    private AuthCookieUtils cookies;

    @BeforeEach
    void setUp() {
        clock = TestClockConfig.fresh();
        cookies = new AuthCookieUtils(AuthTestFixtures.defaultProps(), clock);
    }

    @Test
    @DisplayName("Max-Age = 레코드 만료까지 남은 초, HttpOnly/Path/SameSite 고정")
    void set_cookie_uses_remaining_lifetime() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        cookies.setRefreshCookie(response, "jwt-value", clock.localNow().plusSeconds(3600));

        String line = response.getHeader(HttpHeaders.SET_COOKIE);
        assertThat(line)
                .startsWith("EF_REFRESH=jwt-value")
                .contains("Max-Age=3600")
                .contains("Path=/api/v1/auth")
                .contains("HttpOnly")
                .contains("SameSite=Lax")
                .doesNotContain("Secure");
    }

    @Test
    @DisplayName("이미 지난 만료 시각이면 Max-Age=0")
    void past_expiry_clamps_to_zero() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        cookies.setRefreshCookie(response, "jwt-value", clock.localNow().minusSeconds(5));

        assertThat(response.getHeader(HttpHeaders.SET_COOKIE)).contains("Max-Age=0");
    }

    @Test
    @DisplayName("clear: 같은 속성 + 빈 값 + Max-Age=0")
    void clear_cookie() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        cookies.clearRefreshCookie(response);

        assertThat(response.getHeader(HttpHeaders.SET_COOKIE))
                .startsWith("EF_REFRESH=;")
                .contains("Max-Age=0")
                .contains("Path=/api/v1/auth");
    }

    @Test
    @DisplayName("read: 이름이 맞고 비어 있지 않은 첫 쿠키만")
    void read_cookie() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        assertThat(cookies.readRefreshCookie(request)).isNull();

        request.setCookies(new Cookie("OTHER", "x"), new Cookie("EF_REFRESH", " token "));
        assertThat(cookies.readRefreshCookie(request)).isEqualTo("token");
    }
}
