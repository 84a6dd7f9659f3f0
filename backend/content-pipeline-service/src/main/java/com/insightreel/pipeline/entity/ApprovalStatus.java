package com.insightreel.pipeline.entity;

/**
 * Review state of a completed campaign video that waits for a human decision before posting.
 * PENDING -> {APPROVED | REJECTED}; videos outside the review flow carry no approval status.
 */
public enum ApprovalStatus {
    PENDING,

    /**
     * Approved and handed to the publisher
     */
    APPROVED,

    REJECTED
}
