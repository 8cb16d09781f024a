package com.familygraph.controller;

import org.springframework.security.core.userdetails.UserDetails;

/**
 * Name recorded in the audit trail for a request.
 */
final class CurrentActor {

    static final String ANONYMOUS = "anonymous";

    private CurrentActor() {
    }

    static String of(UserDetails user) {
        return user != null ? user.getUsername() : ANONYMOUS;
    }
}
