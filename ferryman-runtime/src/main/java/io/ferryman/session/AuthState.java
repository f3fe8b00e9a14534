/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.session;

import java.util.Objects;
import java.util.Optional;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Authentication state of a session: anonymous, or authenticated as an account.
 */
public sealed interface AuthState permits AuthState.Anonymous, AuthState.Authenticated {

    static AuthState of(@Nullable String accountId) {
        return accountId == null ? Anonymous.INSTANCE : new Authenticated(accountId);
    }

    record Anonymous() implements AuthState {
        public static final Anonymous INSTANCE = new Anonymous();
    }

    record Authenticated(String account) implements AuthState {
        public Authenticated {
            Objects.requireNonNull(account, "account");
        }
    }

    default boolean isAuthenticated() {
        return this instanceof Authenticated;
    }

    default Optional<String> accountId() {
        return this instanceof Authenticated authenticated ? Optional.of(authenticated.account()) : Optional.empty();
    }
}
