package com.zzf.workbridge.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Aggregated state of the agent sessions of one workspace. {@code counts} is absent for
 * {@link Type#NONE}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentStatus {
    private Type type;
    private Counts counts;

    public static AgentStatus none() {
        return new AgentStatus(Type.NONE, null);
    }

    public static AgentStatus of(int idle, int busy) {
        Counts counts = new Counts(idle, busy, idle + busy);
        if (counts.getTotal() == 0) {
            return none();
        }
        Type type = busy == 0 ? Type.IDLE : idle == 0 ? Type.BUSY : Type.MIXED;
        return new AgentStatus(type, counts);
    }

    public enum Type {
        NONE,
        IDLE,
        BUSY,
        MIXED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Counts {
        private int idle;
        private int busy;
        private int total;
    }
}
