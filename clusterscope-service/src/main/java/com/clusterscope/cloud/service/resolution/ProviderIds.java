package com.clusterscope.cloud.service.resolution;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of node provider identifiers of the form {@code <provider>:///<zone>/<instance-id>}.
 */
final class ProviderIds {

    private static final Pattern PROVIDER_ID = Pattern.compile("^[^:/]+:///([^/]+)/(.*)$");
    private static final Pattern ZONE = Pattern.compile("^(.+)[a-z]$");

    private ProviderIds() {
    }

    /** Region of the zone segment, i.e. the zone without its trailing letter. */
    static Optional<String> region(String providerId) {
        if (providerId == null) {
            return Optional.empty();
        }
        Matcher matcher = PROVIDER_ID.matcher(providerId);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Matcher zone = ZONE.matcher(matcher.group(1));
        return zone.matches() ? Optional.of(zone.group(1)) : Optional.empty();
    }

    /** EC2 instance id from the last path segment, if it looks like one. */
    static Optional<String> instanceId(String providerId) {
        if (providerId == null || providerId.isEmpty()) {
            return Optional.empty();
        }
        String last = providerId.substring(providerId.lastIndexOf('/') + 1);
        return last.startsWith("i-") ? Optional.of(last) : Optional.empty();
    }
}
