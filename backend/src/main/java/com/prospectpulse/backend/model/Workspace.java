package com.prospectpulse.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tenant configuration: provider choice plus the credentials used by the pipeline.
 * Stored as the hash {@code workspaces:{id}:keys}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Workspace {

    public static final String FIELD_PROVIDER = "provider";
    public static final String FIELD_OPENAI_KEY = "openai_key";
    public static final String FIELD_GEMINI_KEY = "gemini_key";
    public static final String FIELD_TAVILY_KEY = "tavily_key";

    private String id;

    private WorkspaceProvider provider;

    @Builder.Default
    private String openaiKey = "";

    @Builder.Default
    private String geminiKey = "";

    @Builder.Default
    private String tavilyKey = "";

    /**
     * Hash fields as persisted. Absent credentials are written as empty strings.
     */
    public Map<String, String> toFields() {
        if (provider == null) {
            throw new IllegalArgumentException("provider is required");
        }
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_PROVIDER, provider.value());
        fields.put(FIELD_OPENAI_KEY, openaiKey != null ? openaiKey : "");
        fields.put(FIELD_GEMINI_KEY, geminiKey != null ? geminiKey : "");
        fields.put(FIELD_TAVILY_KEY, tavilyKey != null ? tavilyKey : "");
        return fields;
    }

    public static Workspace fromFields(String id, Map<String, String> fields) {
        return Workspace.builder()
                .id(id)
                .provider(WorkspaceProvider.fromValue(fields.get(FIELD_PROVIDER)))
                .openaiKey(fields.getOrDefault(FIELD_OPENAI_KEY, ""))
                .geminiKey(fields.getOrDefault(FIELD_GEMINI_KEY, ""))
                .tavilyKey(fields.getOrDefault(FIELD_TAVILY_KEY, ""))
                .build();
    }
}
