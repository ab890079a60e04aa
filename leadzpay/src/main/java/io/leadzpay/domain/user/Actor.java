package io.leadzpay.domain.user;

/**
 * An already-authenticated user acting on the marketplace.
 */
public record Actor(String userId, Role role) {

    public Actor {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("Actor userId is required");
        }
        if (role == null) {
            throw new IllegalArgumentException("Actor role is required");
        }
    }

    public static Actor provider(String userId) {
        return new Actor(userId, Role.PROVIDER);
    }

    public static Actor buyer(String userId) {
        return new Actor(userId, Role.BUYER);
    }

    public static Actor admin(String userId) {
        return new Actor(userId, Role.ADMIN);
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean isProvider() {
        return role == Role.PROVIDER;
    }

    public boolean isBuyer() {
        return role == Role.BUYER;
    }
}
