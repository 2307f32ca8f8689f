package com.mailroute.gateway.routing;

import com.mailroute.gateway.model.TaskType;
import com.mailroute.gateway.store.ConsentStatus;
import com.mailroute.gateway.store.ConsentStore;

/**
 * Decides whether a recipient may receive a message of a given category.
 *
 * <ul>
 *   <li>{@link TaskType.ConsentPolicy#ALWAYS}: auth and transactional mail is
 *       never blocked.</li>
 *   <li>{@link TaskType.ConsentPolicy#OPT_IN}: marketing requires a recorded
 *       {@link ConsentStatus#GRANTED}.</li>
 *   <li>{@link TaskType.ConsentPolicy#OPT_OUT}: allowed unless the recipient
 *       has {@link ConsentStatus#REVOKED} it.</li>
 * </ul>
 */
public class ConsentGate {

    private final ConsentStore store;

    public ConsentGate(final ConsentStore store) {
        this.store = store;
    }

    /** Pure decision on an already looked-up status. */
    public static boolean isAllowed(final TaskType taskType, final ConsentStatus status) {
        return switch (taskType.getConsentPolicy()) {
            case ALWAYS  -> true;
            case OPT_IN  -> status == ConsentStatus.GRANTED;
            case OPT_OUT -> status != ConsentStatus.REVOKED;
        };
    }

    /**
     * Looks up {@code userId} only when the category needs it. A null user
     * means there is no known recipient account, which is always allowed.
     */
    public boolean check(final String userId, final TaskType taskType) {
        if (userId == null || userId.isBlank()) return true;
        if (taskType.getConsentPolicy() == TaskType.ConsentPolicy.ALWAYS) return true;
        final ConsentStatus status = store.lookup(userId, taskType);
        return isAllowed(taskType, status != null ? status : ConsentStatus.UNKNOWN);
    }
}
