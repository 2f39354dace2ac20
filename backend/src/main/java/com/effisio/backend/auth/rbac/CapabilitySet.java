package com.effisio.backend.auth.rbac;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 불변 권한 집합.
 *
 * - 토큰 발급 시점의 스냅샷으로 access token에 실리고, 요청 시점에는 이 집합만 보고 인가한다.
 * - 순서는 의미가 없다. names()는 직렬화 안정성을 위해 정렬해서 돌려준다.
 */
public record CapabilitySet(Set<Permission> permissions) {

    public static final CapabilitySet EMPTY = new CapabilitySet(Set.of());

    public CapabilitySet {
        permissions = (permissions == null) ? Set.of() : Set.copyOf(permissions);
    }

    public static CapabilitySet of(String... names) {
        return names == null ? EMPTY : ofNames(Arrays.asList(names));
    }

    public static CapabilitySet ofNames(Collection<String> names) {
        if (names == null || names.isEmpty()) return EMPTY;

        Set<Permission> set = new LinkedHashSet<>();
        for (String n : names) {
            set.add(Permission.of(n));
        }
        return new CapabilitySet(set);
    }

    public boolean contains(Permission permission) {
        return permission != null && permissions.contains(permission);
    }

    public boolean contains(String name) {
        if (name == null || name.isBlank()) return false;
        return contains(Permission.of(name.strip()));
    }

    /** 하나라도 가지고 있으면 true. 후보가 비어 있으면 false. */
    public boolean containsAny(Collection<String> names) {
        if (names == null) return false;
        return names.stream().anyMatch(this::contains);
    }

    public boolean isEmpty() {
        return permissions.isEmpty();
    }

    public int size() {
        return permissions.size();
    }

    public List<String> names() {
        return permissions.stream()
                .map(Permission::name)
                .collect(Collectors.toCollection(TreeSet::new))
                .stream()
                .toList();
    }
}
