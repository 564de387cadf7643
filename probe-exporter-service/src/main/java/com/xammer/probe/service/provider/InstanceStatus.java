package com.xammer.probe.service.provider;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class InstanceStatus {

    public enum State {
        PENDING,
        RUNNING,
        STOPPING,
        STOPPED,
        SHUTTING_DOWN,
        TERMINATED,
        UNKNOWN;

        public boolean isGone() {
            return this == SHUTTING_DOWN || this == TERMINATED;
        }
    }

    private State state;
    private String privateIp;
}
