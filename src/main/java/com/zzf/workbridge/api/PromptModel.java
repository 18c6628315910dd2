package com.zzf.workbridge.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PromptModel {
    @JsonProperty("providerID")
    private String providerId;
    @JsonProperty("modelID")
    private String modelId;

    @Override
    public String toString() {
        return providerId + "/" + modelId;
    }
}
