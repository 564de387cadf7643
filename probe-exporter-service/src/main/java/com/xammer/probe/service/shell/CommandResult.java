package com.xammer.probe.service.shell;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CommandResult {
    private int exitStatus;
    private String output;

    public boolean isSuccess() {
        return exitStatus == 0;
    }
}
