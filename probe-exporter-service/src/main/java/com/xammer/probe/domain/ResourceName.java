package com.xammer.probe.domain;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Name of a resource created by this exporter: {@code {tag}-{suffix}-{unix seconds}}.
 * <p>
 * The creation timestamp is embedded in the name because not every provider
 * resource exposes a reliable creation time. It is the only source of truth for
 * the age of a resource during garbage collection.
 */
public final class ResourceName {

    public static final String TAG = "cloud-probe-exporter";
    public static final int SUFFIX_LENGTH = 8;

    private static final Pattern FORMAT = Pattern.compile(
            "^" + Pattern.quote(TAG) + "-([a-z0-9]{" + SUFFIX_LENGTH + "})-(\\d{1,19})$");

    private final String suffix;
    private final Instant createdAt;

    public ResourceName(String suffix, Instant createdAt) {
        this.suffix = Objects.requireNonNull(suffix, "suffix");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    /**
     * Parses a provider-side name. Anything that was not produced by this
     * exporter (wrong tag, malformed suffix or timestamp) yields an empty result.
     */
    public static Optional<ResourceName> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher matcher = FORMAT.matcher(value);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            long epochSeconds = Long.parseLong(matcher.group(2));
            return Optional.of(new ResourceName(matcher.group(1), Instant.ofEpochSecond(epochSeconds)));
        } catch (NumberFormatException | DateTimeException e) {
            return Optional.empty();
        }
    }

    public String getTag() {
        return TAG;
    }

    public String getSuffix() {
        return suffix;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String value() {
        return TAG + "-" + suffix + "-" + createdAt.getEpochSecond();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceName)) return false;
        ResourceName that = (ResourceName) o;
        return suffix.equals(that.suffix) && createdAt.getEpochSecond() == that.createdAt.getEpochSecond();
    }

    @Override
    public int hashCode() {
        return Objects.hash(suffix, createdAt.getEpochSecond());
    }

    @Override
    public String toString() {
        return value();
    }
}
