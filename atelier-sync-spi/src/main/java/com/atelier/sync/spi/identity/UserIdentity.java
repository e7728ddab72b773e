package com.atelier.sync.spi.identity;

import java.util.Objects;

public record UserIdentity(String uid, String displayName) {

    public UserIdentity {
        Objects.requireNonNull(uid, "uid");
    }

    public static UserIdentity of(String uid) {
        return new UserIdentity(uid, null);
    }
}
