package org.dataone.artifactcache;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * PackageConfig is a record that holds the install-time settings of the package whose prebuilt
 * archive is being fetched: the download URL template, the expected checksum, the package
 * version substituted into the template and an optional proxy endpoint.
 */
public record PackageConfig(
    String prebuildUrlTemplate, String prebuildChecksum, String version, String proxyEndpoint) {
    private static final Log logPackageConfig = LogFactory.getLog(PackageConfig.class);

    public static final String VERSION_PLACEHOLDER = "${npm_package_version}";

    public enum EnvironmentKeys {
        npm_package_json, npm_package_version, npm_package_config_prebuildUrl,
        npm_package_config_prebuildChecksum, HTTPS_PROXY, https_proxy
    }

    /**
     * Reads the package settings from the given environment. When 'npm_package_json' points at
     * a package.json file, its 'version' and its 'config.prebuildUrl' and
     * 'config.prebuildChecksum' entries are used. Otherwise the 'npm_package_version',
     * 'npm_package_config_prebuildUrl' and 'npm_package_config_prebuildChecksum' variables are
     * used. The proxy endpoint comes from 'HTTPS_PROXY' (or 'https_proxy').
     *
     * @param env Environment variables, ex. {@code System.getenv()}
     * @return PackageConfig with any missing value left null
     * @throws IOException If package.json cannot be read or parsed
     */
    public static PackageConfig fromEnvironment(Map<String, String> env) throws IOException {
        String proxyEndpoint = env.get(EnvironmentKeys.HTTPS_PROXY.name());
        if (proxyEndpoint == null) {
            proxyEndpoint = env.get(EnvironmentKeys.https_proxy.name());
        }

        String packageJson = env.get(EnvironmentKeys.npm_package_json.name());
        if (packageJson != null && !packageJson.trim().isEmpty()) {
            return fromPackageJson(Paths.get(packageJson), proxyEndpoint);
        }

        logPackageConfig.debug("npm_package_json not set, reading package config variables.");
        return new PackageConfig(
            env.get(EnvironmentKeys.npm_package_config_prebuildUrl.name()),
            env.get(EnvironmentKeys.npm_package_config_prebuildChecksum.name()),
            env.get(EnvironmentKeys.npm_package_version.name()),
            proxyEndpoint
        );
    }

    /**
     * Get the package settings from a package.json file
     *
     * @param packageJsonPath Path to package.json
     * @param proxyEndpoint   Proxy endpoint to carry along, may be null
     * @return PackageConfig
     * @throws IOException If the file doesn't exist or isn't valid JSON
     */
    public static PackageConfig fromPackageJson(Path packageJsonPath, String proxyEndpoint)
        throws IOException {
        ObjectMapper om = new ObjectMapper();
        JsonNode pkg;
        try {
            pkg = om.readTree(packageJsonPath.toFile());

        } catch (IOException ioe) {
            logPackageConfig.fatal(
                "Unable to read package.json: " + packageJsonPath + ". IOException: "
                    + ioe.getMessage());
            throw ioe;
        }
        if (pkg == null || !pkg.isObject()) {
            String errMsg = "package.json does not contain a JSON object: " + packageJsonPath;
            logPackageConfig.fatal(errMsg);
            throw new IOException(errMsg);
        }

        JsonNode config = pkg.path("config");
        return new PackageConfig(
            textOrNull(config.get("prebuildUrl")),
            textOrNull(config.get("prebuildChecksum")),
            textOrNull(pkg.get("version")),
            proxyEndpoint
        );
    }

    /**
     * Replaces every occurrence of '${npm_package_version}' in the URL template with the
     * package version.
     *
     * @return Download URL, or null if there is no template
     * @throws IllegalArgumentException If the template needs a version but none is known
     */
    public String resolveSourceUrl() throws IllegalArgumentException {
        if (prebuildUrlTemplate == null) {
            return null;
        }
        if (!prebuildUrlTemplate.contains(VERSION_PLACEHOLDER)) {
            return prebuildUrlTemplate;
        }
        if (version == null || version.trim().isEmpty()) {
            String errMsg = "Prebuild URL template contains " + VERSION_PLACEHOLDER
                + " but no package version is available: " + prebuildUrlTemplate;
            logPackageConfig.error(errMsg);
            throw new IllegalArgumentException(errMsg);
        }
        return prebuildUrlTemplate.replace(VERSION_PLACEHOLDER, version);
    }

    /**
     * Builds the ArtifactSpec for this package. A checksum without a URL template is a
     * configuration error; without a checksum the URL may be absent.
     *
     * @return ArtifactSpec to pass to an ArtifactCache
     * @throws IllegalArgumentException If a checksum is set but the URL cannot be resolved
     */
    public ArtifactSpec toArtifactSpec() throws IllegalArgumentException {
        ArtifactSpec unresolved = new ArtifactSpec(null, prebuildChecksum);
        if (!unresolved.requiresVerification()) {
            return unresolved;
        }
        String sourceUrl = resolveSourceUrl();
        if (sourceUrl == null || sourceUrl.trim().isEmpty()) {
            String errMsg = "A prebuild checksum is configured but no prebuild URL is set.";
            logPackageConfig.error(errMsg);
            throw new IllegalArgumentException(errMsg);
        }
        return new ArtifactSpec(sourceUrl, prebuildChecksum.trim());
    }

    /**
     * @return A copy with every non-null argument replacing the current value
     */
    public PackageConfig withOverrides(
        String urlTemplate, String checksum, String packageVersion, String proxy) {
        return new PackageConfig(
            urlTemplate != null ? urlTemplate : prebuildUrlTemplate,
            checksum != null ? checksum : prebuildChecksum,
            packageVersion != null ? packageVersion : version,
            proxy != null ? proxy : proxyEndpoint
        );
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        return node.asText();
    }
}
