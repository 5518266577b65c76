package com.ehrportal.security;

import com.ehrportal.entity.Role;
import com.ehrportal.exception.ForbiddenException;
import com.ehrportal.exception.UnauthenticatedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Decides whether a caller may perform an action on a target.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>no verified caller: deny UNAUTHENTICATED</li>
 *   <li>caller role not in the action's role set: deny FORBIDDEN</li>
 *   <li>patient caller and a target owned by someone else: deny FORBIDDEN</li>
 *   <li>otherwise allow</li>
 * </ol>
 * Doctors and admins are never subject to rule 3.
 * <p>
 * Holds no state; safe to call from any number of request threads.
 */
@Slf4j
@Component
public class AuthorizationGuard {

    public AccessDecision evaluate(UserPrincipal caller, Action action, ProtectedResource target) {
        if (caller == null || caller.getId() == null) {
            return AccessDecision.unauthenticated();
        }
        Role role = caller.getRole();
        if (!action.permits(role)) {
            return AccessDecision.forbidden("Role " + (role == null ? "none" : role.getValue())
                    + " may not perform " + action);
        }
        if (role == Role.PATIENT && target.isOwned() && !caller.getId().equals(target.getOwnerUserId())) {
            return AccessDecision.forbidden("Not authorized to access another patient's data");
        }
        return AccessDecision.allow();
    }

    /**
     * Checks an action that has no owned target.
     *
     * @return the caller, once allowed
     */
    public UserPrincipal authorize(UserPrincipal caller, Action action) {
        return authorize(caller, action, ProtectedResource.none());
    }

    public UserPrincipal authorize(UserPrincipal caller, Action action, ProtectedResource target) {
        enforce(caller, action, evaluate(caller, action, target));
        return caller;
    }

    /**
     * Checks the caller and role first, then loads the target and applies the
     * ownership gate to it. The loader runs only for callers that passed the
     * role gate, and may itself throw (typically NOT_FOUND).
     *
     * @return the loaded target, once allowed
     */
    public <T> T authorize(UserPrincipal caller, Action action, Supplier<T> loader, Function<T, UUID> owner) {
        authorize(caller, action);
        T target = loader.get();
        authorize(caller, action, ProtectedResource.ownedBy(owner.apply(target)));
        return target;
    }

    private void enforce(UserPrincipal caller, Action action, AccessDecision decision) {
        if (decision.isAllowed()) {
            return;
        }
        switch (decision.getDenyReason()) {
            case UNAUTHENTICATED:
                throw new UnauthenticatedException(decision.getMessage());
            case FORBIDDEN:
                log.warn("Denied {} for {}: {}", action, caller, decision.getMessage());
                throw new ForbiddenException(decision.getMessage());
            default:
                throw new IllegalStateException("Unexpected deny reason " + decision.getDenyReason());
        }
    }
}
