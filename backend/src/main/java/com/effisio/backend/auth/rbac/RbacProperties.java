package com.effisio.backend.auth.rbac;

import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotEmpty;

/*
  app:
    rbac:
      roles:
        admin:   [users:read, users:write, users:delete, tasks:read, tasks:write, tasks:delete, settings:read, settings:write]
        manager: [users:read, tasks:read, tasks:write, tasks:delete]
        user:    [tasks:read, tasks:write]
        viewer:  [tasks:read]
 */
@Validated
@ConfigurationProperties(prefix = "app.rbac")
public record RbacProperties(@NotEmpty Map<String, List<String>> roles) {
}
