package com.zzf.workbridge.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Prompt sent to the agent of a freshly created workspace. {@code agent} selects the agent mode
 * ({@code plan} for read-only); {@code model} overrides the agent's default model.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InitialPrompt {
    private String prompt;
    private String agent;
    private PromptModel model;

    public static InitialPrompt of(String prompt) {
        return new InitialPrompt(prompt, null, null);
    }
}
