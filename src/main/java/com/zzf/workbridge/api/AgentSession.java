package com.zzf.workbridge.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Location of a running agent server and its session.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AgentSession {
    private int port;
    private String sessionId;
}
