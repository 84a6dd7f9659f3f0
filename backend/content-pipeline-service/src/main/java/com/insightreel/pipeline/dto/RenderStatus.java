package com.insightreel.pipeline.dto;

/**
 * Status snapshot reported by the avatar render provider.
 */
public record RenderStatus(
        State state,
        String assetUrl,
        String thumbnailUrl,
        Double durationSeconds,
        String errorMessage
) {
    public enum State {
        PENDING,
        PROCESSING,
        COMPLETED,
        FAILED;

        /**
         * Map provider status strings ("completed", "failed", "error", "processing", ...)
         */
        public static State fromProvider(String value) {
            if (value == null) {
                return PENDING;
            }
            return switch (value.trim().toLowerCase()) {
                case "completed", "success", "succeeded" -> COMPLETED;
                case "failed", "error" -> FAILED;
                case "processing", "rendering" -> PROCESSING;
                default -> PENDING;
            };
        }
    }

    public static RenderStatus processing() {
        return new RenderStatus(State.PROCESSING, null, null, null, null);
    }

    public static RenderStatus completed(String assetUrl) {
        return new RenderStatus(State.COMPLETED, assetUrl, null, null, null);
    }

    public static RenderStatus failed(String errorMessage) {
        return new RenderStatus(State.FAILED, null, null, null, errorMessage);
    }

    public boolean isTerminal() {
        return state == State.COMPLETED || state == State.FAILED;
    }
}
