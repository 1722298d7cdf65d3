package com.cloudcost.awspricing.estimation;

import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.ServiceIdentifier;
import com.cloudcost.awspricing.normalization.ResolvedResourceType;

/**
 * A resource that passed validation, carrying its effective region and
 * its once-resolved type.
 */
public record ValidatedResource(
        ResourceDescriptor resource,
        ResolvedResourceType type
) {
    public ServiceIdentifier service() {
        return type.service();
    }
}
