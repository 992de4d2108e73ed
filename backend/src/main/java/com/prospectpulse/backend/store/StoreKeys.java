package com.prospectpulse.backend.store;

/**
 * Key and channel layout of the shared store. Other tools read these records,
 * so the names are part of the external contract.
 */
public final class StoreKeys {

    public static final String WORKSPACE_PATTERN = "workspaces:*:keys";
    public static final String LEAD_PATTERN = "leads:*";

    private StoreKeys() {
    }

    public static String workspace(String workspaceId) {
        return "workspaces:" + workspaceId + ":keys";
    }

    /**
     * Inverse of {@link #workspace(String)}; returns null for keys outside the namespace.
     */
    public static String workspaceIdFromKey(String key) {
        String[] parts = key.split(":");
        if (parts.length >= 3 && "workspaces".equals(parts[0]) && "keys".equals(parts[parts.length - 1])) {
            return key.substring("workspaces:".length(), key.length() - ":keys".length());
        }
        return null;
    }

    public static String lock(String resource) {
        return "locks:" + resource;
    }

    public static String operation(String operationId) {
        return "operations:" + operationId;
    }

    public static String job(String jobId) {
        return "jobs:" + jobId;
    }

    public static String jobEvents(String jobId) {
        return "jobs:" + jobId + ":events";
    }

    public static String jobLeads(String jobId) {
        return "jobs:" + jobId + ":leads";
    }

    public static String lead(String leadId) {
        return "leads:" + leadId;
    }
}
