package com.xammer.probe.service.provider;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class AddressHandle {
    private String allocationId;
    private String publicIp;
}
