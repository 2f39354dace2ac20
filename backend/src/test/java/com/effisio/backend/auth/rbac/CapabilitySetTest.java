package com.effisio.backend.auth.rbac;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("[RBAC] Permission / CapabilitySet")
class CapabilitySetTest {

    @Test
    @DisplayName("contains / containsAny")
    void membership() {
        CapabilitySet caps = CapabilitySet.of("tasks:read", "tasks:write");

        assertThat(caps.contains("tasks:read")).isTrue();
        assertThat(caps.contains("tasks:delete")).isFalse();
        assertThat(caps.containsAny(List.of("users:read", "tasks:write"))).isTrue();
        assertThat(caps.containsAny(List.of())).isFalse();
        assertThat(caps.contains((String) null)).isFalse();
    }

    @Test
    @DisplayName("names()는 입력 순서와 무관하게 정렬되고 중복이 없다")
    void names_are_sorted_and_distinct() {
        CapabilitySet caps = CapabilitySet.of("users:read", "tasks:write", "tasks:read", "tasks:read");

        assertThat(caps.names()).containsExactly("tasks:read", "tasks:write", "users:read");
        assertThat(caps.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("값 동등성: 같은 권한이면 같은 집합")
    void value_equality() {
        assertThat(CapabilitySet.of("a:b", "c:d")).isEqualTo(CapabilitySet.of("c:d", "a:b"));
        assertThat(CapabilitySet.ofNames(List.of())).isSameAs(CapabilitySet.EMPTY);
    }

    @Test
    @DisplayName("불변: permissions()는 수정할 수 없다")
    void immutable() {
        CapabilitySet caps = CapabilitySet.of("tasks:read");

        assertThatThrownBy(() -> caps.permissions().add(Permission.of("tasks:write")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Permission: 빈 값/공백 포함은 거부")
    void permission_rejects_blank_and_whitespace() {
        assertThatThrownBy(() -> Permission.of(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Permission.of("tasks: read")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Permission.of(" tasks:read")).isInstanceOf(IllegalArgumentException.class);
        assertThat(Permission.of("tasks:read").toString()).isEqualTo("tasks:read");
    }
}
