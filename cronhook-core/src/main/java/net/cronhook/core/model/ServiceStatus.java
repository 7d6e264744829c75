package net.cronhook.core.model;

public record ServiceStatus(
        boolean initialized,
        boolean clusterMode,
        int activeLocalTaskCount,
        int totalJobCount
) {
}
