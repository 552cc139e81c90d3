package com.suraksha.safetymonitor.model;

import com.suraksha.safetymonitor.exception.AuthorizationException;
import lombok.Value;

import java.util.Arrays;

/**
 * Identity attached to an authenticated request by the auth middleware.
 * Credentials are verified upstream; this service trusts {userId, role} as given.
 */
@Value
public class RequestActor {

    String userId;

    Role role;

    public boolean hasAnyRole(Role... roles) {
        return Arrays.asList(roles).contains(role);
    }

    /**
     * @throws AuthorizationException if the actor holds none of {@code roles}
     */
    public void requireAnyRole(Role... roles) {
        if (!hasAnyRole(roles)) {
            throw new AuthorizationException("Role '" + role.getCode() + "' may not perform this action; requires one of "
                    + Arrays.toString(Arrays.stream(roles).map(Role::getCode).toArray()));
        }
    }
}
