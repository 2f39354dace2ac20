package com.effisio.backend.auth.rbac;

/**
 * 단일 권한(capability) 식별자. "resource:action" 형태 (ex: tasks:read)
 *
 * - 문자열 비교를 코드 곳곳에 흩뿌리지 않도록 타입으로 감싼다.
 * - 공백이 섞인 값은 설정 오타일 확률이 높아서 생성 시점에 막는다.
 */
public record Permission(String name) {

    public Permission {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("permission name must not be blank");
        }
        if (!name.equals(name.strip()) || name.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("permission name must not contain whitespace: '" + name + "'");
        }
    }

    public static Permission of(String name) {
        return new Permission(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
