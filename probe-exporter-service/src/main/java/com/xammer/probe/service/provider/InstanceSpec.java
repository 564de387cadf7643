package com.xammer.probe.service.provider;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class InstanceSpec {
    private String flavor;
    private String image;
    private String internalNetwork;
    private String keyName;
}
