package com.insightreel.pipeline.entity;

/**
 * Output frame of a rendered video.
 */
public enum AspectRatio {
    PORTRAIT(720, 1280),
    LANDSCAPE(1280, 720),
    SQUARE(720, 720);

    private final int width;
    private final int height;

    AspectRatio(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }
}
