package com.cloudcost.awspricing.recommendation;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static knowledge about instance families: which newer generation or
 * Graviton family replaces which, and which database engines run on
 * Graviton.
 *
 * The maps only list upgrades that are usually price-neutral or cheaper.
 * Every candidate is still priced before it is recommended.
 */
public final class InstanceFamilyCatalog {

    static final Map<String, String> GENERATION_UPGRADES = Map.ofEntries(
            Map.entry("t2", "t3"),
            Map.entry("t3", "t3a"),
            Map.entry("m4", "m5"),
            Map.entry("m5", "m6i"),
            Map.entry("m5a", "m6a"),
            Map.entry("m6i", "m7i"),
            Map.entry("m6a", "m7a"),
            Map.entry("c4", "c5"),
            Map.entry("c5", "c6i"),
            Map.entry("c5a", "c6a"),
            Map.entry("c6i", "c7i"),
            Map.entry("c6a", "c7a"),
            Map.entry("r4", "r5"),
            Map.entry("r5", "r6i"),
            Map.entry("r5a", "r6a"),
            Map.entry("r6i", "r7i"),
            Map.entry("r6a", "r7a"),
            Map.entry("i3", "i3en"),
            Map.entry("d2", "d3")
    );

    static final Map<String, String> GRAVITON_EQUIVALENTS = Map.ofEntries(
            Map.entry("m5", "m6g"),
            Map.entry("m5a", "m6g"),
            Map.entry("m5n", "m6g"),
            Map.entry("m6i", "m6g"),
            Map.entry("m6a", "m6g"),
            Map.entry("m7i", "m7g"),
            Map.entry("m7a", "m7g"),
            Map.entry("c5", "c6g"),
            Map.entry("c5a", "c6g"),
            Map.entry("c5n", "c6gn"),
            Map.entry("c6i", "c6g"),
            Map.entry("c6a", "c6g"),
            Map.entry("c7i", "c7g"),
            Map.entry("c7a", "c7g"),
            Map.entry("r5", "r6g"),
            Map.entry("r5a", "r6g"),
            Map.entry("r5n", "r6g"),
            Map.entry("r6i", "r6g"),
            Map.entry("r6a", "r6g"),
            Map.entry("r7i", "r7g"),
            Map.entry("r7a", "r7g"),
            Map.entry("t3", "t4g"),
            Map.entry("t3a", "t4g")
    );

    static final Map<String, String> RDS_GENERATION_UPGRADES = Map.of(
            "db.t2", "db.t3",
            "db.t3", "db.t4g",
            "db.m4", "db.m5",
            "db.m5", "db.m6i",
            "db.m6i", "db.m7i",
            "db.r4", "db.r5",
            "db.r5", "db.r6i",
            "db.r6i", "db.r7i"
    );

    static final Map<String, String> RDS_GRAVITON_EQUIVALENTS = Map.of(
            "db.m5", "db.m6g",
            "db.m6i", "db.m7g",
            "db.r5", "db.r6g",
            "db.r6i", "db.r7g",
            "db.t3", "db.t4g"
    );

    // Oracle and SQL Server have no Graviton instances
    static final Set<String> RDS_GRAVITON_ENGINES = Set.of(
            "mysql", "postgres", "postgresql", "mariadb", "aurora", "aurora-mysql", "aurora-postgresql"
    );

    private static final String RDS_PREFIX = "db.";

    private InstanceFamilyCatalog() {
        // Utility class
    }

    /**
     * Family and size of an EC2 instance type: "t2.medium" is ("t2", "medium").
     */
    public static Optional<InstanceType> parseEc2(String instanceType) {
        if (instanceType == null) {
            return Optional.empty();
        }
        int dot = instanceType.indexOf('.');
        if (dot <= 0 || dot == instanceType.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new InstanceType(instanceType.substring(0, dot), instanceType.substring(dot + 1)));
    }

    /**
     * Family and size of an RDS instance class: "db.t3.medium" is ("db.t3", "medium").
     */
    public static Optional<InstanceType> parseRds(String instanceClass) {
        if (instanceClass == null || !instanceClass.startsWith(RDS_PREFIX)) {
            return Optional.empty();
        }
        return parseEc2(instanceClass.substring(RDS_PREFIX.length()))
                .map(type -> new InstanceType(RDS_PREFIX + type.family(), type.size()));
    }

    public static Optional<String> generationUpgrade(String family) {
        return Optional.ofNullable(GENERATION_UPGRADES.get(family));
    }

    public static Optional<String> gravitonEquivalent(String family) {
        return Optional.ofNullable(GRAVITON_EQUIVALENTS.get(family));
    }

    public static Optional<String> rdsGenerationUpgrade(String family) {
        return Optional.ofNullable(RDS_GENERATION_UPGRADES.get(family));
    }

    public static Optional<String> rdsGravitonEquivalent(String family) {
        return Optional.ofNullable(RDS_GRAVITON_EQUIVALENTS.get(family));
    }

    public static boolean supportsGraviton(String rdsEngine) {
        return rdsEngine != null && RDS_GRAVITON_ENGINES.contains(rdsEngine.toLowerCase(Locale.ROOT));
    }

    /**
     * Canonical engine name used for RDS price lookups.
     * Version-suffixed and edition-suffixed aliases collapse to their base engine.
     */
    public static String normalizeRdsEngine(String engine) {
        String key = engine.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "mysql", "mysql8", "mysql-8.0" -> "mysql";
            case "postgres", "postgresql", "postgres13", "postgres14", "postgres15" -> "postgresql";
            case "mariadb", "maria" -> "mariadb";
            case "oracle", "oracle-ee", "oracle-se", "oracle-se1", "oracle-se2" -> "oracle";
            case "sqlserver", "sql-server", "sqlserver-ee", "sqlserver-se", "sqlserver-ex", "sqlserver-web" -> "sqlserver";
            case "aurora", "aurora-mysql" -> "aurora-mysql";
            case "aurora-postgresql" -> "aurora-postgresql";
            default -> engine.toLowerCase(Locale.ROOT);
        };
    }

    public record InstanceType(String family, String size) {
        public String withFamily(String newFamily) {
            return newFamily + "." + size;
        }
    }
}
