package ai.attackframework.tools.opensearch.utils;

import java.util.Optional;

/**
 * Library version, for the {@code User-Agent} header and exported configuration.
 *
 * <p>Read from the jar manifest's {@code Implementation-Version}; the
 * {@value #OVERRIDE_PROPERTY} system property wins when set (the test run sets it).</p>
 */
public final class Version {

    static final String OVERRIDE_PROPERTY = "attackframework.version";
    static final String PRODUCT = "core-opensearch";

    private Version() {}

    /** @throws IllegalStateException when neither the manifest nor the override supplies a version */
    public static String get() {
        return find().orElseThrow(() -> new IllegalStateException("Implementation-Version not found in manifest; set -D"
                + OVERRIDE_PROPERTY + " when running outside the packaged jar"));
    }

    public static Optional<String> find() {
        String override = System.getProperty(OVERRIDE_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Optional.of(override.trim());
        }
        Package pkg = Version.class.getPackage();
        return Optional.ofNullable(pkg == null ? null : pkg.getImplementationVersion())
                .filter(v -> !v.isBlank());
    }

    /** {@code core-opensearch/<version>}, or just the product name when the version is unknown. */
    public static String userAgent() {
        return find().map(v -> PRODUCT + "/" + v).orElse(PRODUCT);
    }
}
