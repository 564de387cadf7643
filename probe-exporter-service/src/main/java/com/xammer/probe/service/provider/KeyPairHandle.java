package com.xammer.probe.service.provider;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class KeyPairHandle {
    private final String keyName;
    private final String privateKeyPem;

    @Override
    public String toString() {
        return "KeyPairHandle{keyName=" + keyName + "}";
    }
}
