package com.jobbus.admin;

public class CreateTopicOptions {

    public static final int DEFAULT_MAX_SIZE_IN_MEGABYTES = 1024;

    private final String name;
    private int maxSizeInMegabytes = DEFAULT_MAX_SIZE_IN_MEGABYTES;
    private boolean enablePartitioning;

    public CreateTopicOptions(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Topic name must not be blank");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public int getMaxSizeInMegabytes() {
        return maxSizeInMegabytes;
    }

    public CreateTopicOptions setMaxSizeInMegabytes(int maxSizeInMegabytes) {
        if (maxSizeInMegabytes < 1) {
            throw new IllegalArgumentException("maxSizeInMegabytes must be >= 1");
        }
        this.maxSizeInMegabytes = maxSizeInMegabytes;
        return this;
    }

    public boolean isEnablePartitioning() {
        return enablePartitioning;
    }

    public CreateTopicOptions setEnablePartitioning(boolean enablePartitioning) {
        this.enablePartitioning = enablePartitioning;
        return this;
    }
}
