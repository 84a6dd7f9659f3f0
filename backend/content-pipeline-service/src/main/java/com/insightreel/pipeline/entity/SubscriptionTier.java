package com.insightreel.pipeline.entity;

/**
 * Subscription tiers, ordered from lowest to highest.
 * A tier may use avatar profiles of its own tier and every tier below it.
 */
public enum SubscriptionTier {
    FREE,
    PRO,
    ENTERPRISE;

    public boolean includes(SubscriptionTier other) {
        return other != null && other.ordinal() <= this.ordinal();
    }
}
