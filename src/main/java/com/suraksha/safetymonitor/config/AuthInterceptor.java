package com.suraksha.safetymonitor.config;

import com.suraksha.safetymonitor.exception.AuthenticationException;
import com.suraksha.safetymonitor.model.RequestActor;
import com.suraksha.safetymonitor.model.Role;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Turns the identity forwarded by the auth gateway into a {@link RequestActor}.
 *
 * The gateway verifies credentials and forwards:
 *   X-User-Id   - authenticated user id (required)
 *   X-User-Role - user | officer | admin (defaults to user)
 *
 * Nothing is re-verified here. Requests without a user id, or with a role the
 * gateway never issues, are rejected with 401 before reaching a controller.
 * Role checks for individual actions happen in the services, before any mutation.
 */
@Component
@Slf4j
public class AuthInterceptor implements HandlerInterceptor {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-User-Role";

    /** Request attribute holding the resolved RequestActor */
    public static final String ACTOR_ATTRIBUTE = "safety.actor";

    @Override
    public boolean preHandle(HttpServletRequest request,
                             HttpServletResponse response,
                             Object handler) {

        String userId = request.getHeader(USER_ID_HEADER);
        if (userId == null || userId.isBlank()) {
            log.warn("Auth: no identity on {} {}", request.getMethod(), request.getRequestURI());
            throw new AuthenticationException("Missing " + USER_ID_HEADER + " header");
        }

        String roleHeader = request.getHeader(ROLE_HEADER);
        Role role = roleHeader == null || roleHeader.isBlank() ? Role.USER : Role.fromCode(roleHeader.trim());
        if (role == null) {
            log.warn("Auth: unknown role '{}' for user '{}'", roleHeader, userId);
            throw new AuthenticationException("Unknown role '" + roleHeader + "'");
        }

        request.setAttribute(ACTOR_ATTRIBUTE, new RequestActor(userId.trim(), role));
        log.debug("Auth: {} as {} — {} {}", userId, role.getCode(), request.getMethod(), request.getRequestURI());
        return true;
    }
}
