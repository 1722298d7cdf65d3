package com.cloudcost.awspricing.domain.model;

/**
 * FinOps FOCUS service categories.
 *
 * Each AWS service is classified by its primary function:
 * - COMPUTE: EC2, Lambda, EKS control plane
 * - STORAGE: S3, EBS
 * - DATABASE: RDS, DynamoDB, ElastiCache
 * - NETWORK: ELB, NAT Gateway, VPC primitives
 * - MANAGEMENT: CloudWatch
 */
public enum ServiceCategory {
    COMPUTE("Compute"),
    STORAGE("Storage"),
    DATABASE("Databases"),
    NETWORK("Networking"),
    MANAGEMENT("Management and Governance"),
    OTHER("Other");

    private final String focusName;

    ServiceCategory(String focusName) {
        this.focusName = focusName;
    }

    public String getFocusName() {
        return focusName;
    }
}
