package com.xammer.probe.service.provider.aws;

import com.xammer.probe.domain.ResourceName;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.ResourceType;
import software.amazon.awssdk.services.ec2.model.Tag;
import software.amazon.awssdk.services.ec2.model.TagSpecification;

import java.util.List;

final class AwsTags {

    static final String NAME_KEY = "Name";
    static final String CREATED_BY_KEY = "created-by";

    private AwsTags() {
    }

    static TagSpecification tagSpecification(ResourceType type, ResourceName name) {
        return TagSpecification.builder()
                .resourceType(type)
                .tags(Tag.builder().key(NAME_KEY).value(name.value()).build(),
                        Tag.builder().key(CREATED_BY_KEY).value(ResourceName.TAG).build())
                .build();
    }

    /** Server-side pre-filter; the exact match is {@link ResourceName#parse}. */
    static Filter nameTagFilter() {
        return Filter.builder().name("tag:" + NAME_KEY).values(ResourceName.TAG + "-*").build();
    }

    static String nameOf(List<Tag> tags) {
        if (tags == null) {
            return null;
        }
        return tags.stream()
                .filter(tag -> NAME_KEY.equals(tag.key()))
                .map(Tag::value)
                .findFirst()
                .orElse(null);
    }
}
