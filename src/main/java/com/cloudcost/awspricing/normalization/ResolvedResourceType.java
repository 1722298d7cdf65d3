package com.cloudcost.awspricing.normalization;

import com.cloudcost.awspricing.domain.model.ServiceIdentifier;

/**
 * Once-computed result of resolving a raw resource type string.
 *
 * Resolve once per incoming resource and pass the value along; nothing
 * downstream needs to normalize again.
 */
public record ResolvedResourceType(
        String original,
        String normalizedType,
        ServiceIdentifier service
) {
    public boolean isKnown() {
        return service != ServiceIdentifier.UNKNOWN;
    }
}
