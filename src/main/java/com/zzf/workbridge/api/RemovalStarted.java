package com.zzf.workbridge.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RemovalStarted {
    private boolean started;

    public static RemovalStarted started() {
        return new RemovalStarted(true);
    }
}
