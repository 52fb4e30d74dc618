package org.dataone.artifactcache;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.artifactcache.extract.ArchiveExtractor;
import org.dataone.artifactcache.extract.TarGzExtractor;
import org.dataone.artifactcache.filecache.FileArtifactCache.ArtifactCacheProperties;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Install-time entry point: makes sure the verified prebuilt archive is present in the install
 * root and extracts it there.
 */
public class Client {
    private static final Log logClient = LogFactory.getLog(Client.class);

    public static final String SETTINGS_FILE_NAME = "artifactcache.yaml";
    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.getenv()));
    }

    public static int run(String[] args, Map<String, String> env) {
        return run(args, env, System.out, System.err);
    }

    /**
     * Runs the fetch, verify and extract flow.
     *
     * @param args Command line arguments
     * @param env  Environment variables to read package configuration and the proxy from
     * @param out  Stream for progress messages
     * @param err  Stream for warnings and diagnostics
     * @return 0 on success, 1 on failure, 2 if the arguments cannot be parsed
     */
    public static int run(String[] args, Map<String, String> env, PrintStream out,
                          PrintStream err) {
        Options options = addArtifactCacheClientOptions();
        CommandLineParser parser = new DefaultParser(false);
        HelpFormatter formatter = new HelpFormatter();
        CommandLine cmd;
        try {
            cmd = parser.parse(options, args);
        } catch (ParseException pe) {
            err.println("Error parsing cli arguments: " + pe.getMessage());
            formatter.printHelp("artifactcache", options);
            return EXIT_USAGE;
        }

        if (cmd.hasOption("h")) {
            formatter.printHelp("artifactcache", options);
            return EXIT_SUCCESS;
        }

        try {
            Path installRoot = Paths.get(cmd.getOptionValue("root", "."));
            PackageConfig packageConfig = PackageConfig.fromEnvironment(env).withOverrides(
                cmd.getOptionValue("url"), cmd.getOptionValue("checksum"),
                cmd.getOptionValue("version"), cmd.getOptionValue("proxy")
            );
            ArtifactSpec spec = packageConfig.toArtifactSpec();
            if (!spec.requiresVerification()) {
                out.println("(no checksum provided; assuming local build)");
                return EXIT_SUCCESS;
            }

            Properties cacheProperties = loadArtifactCacheYaml(installRoot);
            if (cmd.hasOption("maxredirects")) {
                cacheProperties.setProperty(
                    ArtifactCacheProperties.maxRedirects.name(),
                    cmd.getOptionValue("maxredirects")
                );
            }
            if (cmd.hasOption("timeout")) {
                cacheProperties.setProperty(
                    ArtifactCacheProperties.requestTimeoutSeconds.name(),
                    cmd.getOptionValue("timeout")
                );
            }

            ArtifactCache artifactCache = ArtifactCacheFactory.getArtifactCache(cacheProperties);
            CachePaths paths = CachePaths.inDirectory(installRoot);
            CacheResult result = artifactCache.ensureArtifact(
                spec, paths, packageConfig.proxyEndpoint()
            );
            logClient.debug("ensureArtifact finished with: " + result);

            if (cmd.hasOption("noextract")) {
                return EXIT_SUCCESS;
            }
            out.println("extracting...");
            ArchiveExtractor extractor = new TarGzExtractor();
            List<String> warnings = extractor.extract(paths.finalPath(), installRoot);
            for (String warning : warnings) {
                err.println("warning: " + warning);
            }
            return EXIT_SUCCESS;

        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            err.println("artifactcache: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Get the cache settings from 'artifactcache.yaml' in the install root, if present
     *
     * @param installRoot Directory the archive is installed into
     * @return Properties keyed by {@link ArtifactCacheProperties}, empty if there is no file
     * @throws IOException If the file exists but cannot be parsed
     */
    protected static Properties loadArtifactCacheYaml(Path installRoot) throws IOException {
        Properties cacheProperties = new Properties();
        Path settingsYamlPath = installRoot.resolve(SETTINGS_FILE_NAME);
        if (!Files.exists(settingsYamlPath)) {
            return cacheProperties;
        }

        ObjectMapper om = new ObjectMapper(new YAMLFactory());
        HashMap<?, ?> settings;
        try {
            settings = om.readValue(settingsYamlPath.toFile(), HashMap.class);

        } catch (IOException ioe) {
            logClient.fatal(
                "Unable to read " + SETTINGS_FILE_NAME + " at: " + settingsYamlPath
                    + ". IOException: " + ioe.getMessage());
            throw ioe;
        }
        if (settings == null) {
            return cacheProperties;
        }

        putIfPresent(cacheProperties, settings, "digest_algorithm",
                     ArtifactCacheProperties.digestAlgorithm);
        putIfPresent(cacheProperties, settings, "max_redirects",
                     ArtifactCacheProperties.maxRedirects);
        putIfPresent(cacheProperties, settings, "connect_timeout_seconds",
                     ArtifactCacheProperties.connectTimeoutSeconds);
        putIfPresent(cacheProperties, settings, "request_timeout_seconds",
                     ArtifactCacheProperties.requestTimeoutSeconds);
        logClient.debug("Loaded settings from: " + settingsYamlPath);
        return cacheProperties;
    }

    private static void putIfPresent(
        Properties properties, Map<?, ?> settings, String yamlKey, ArtifactCacheProperties key) {
        Object value = settings.get(yamlKey);
        if (value != null) {
            properties.setProperty(key.name(), value.toString());
        }
    }

    private static Options addArtifactCacheClientOptions() {
        Options options = new Options();
        options.addOption("h", "help", false, "Show help options.");
        options.addOption(
            "root", "installroot", true,
            "Directory that receives prebuild.tar.gz and its extracted contents (default: .)"
        );
        options.addOption(
            "url", "prebuildurl", true,
            "Prebuild URL template, '${npm_package_version}' is replaced by the version."
        );
        options.addOption("checksum", "prebuildchecksum", true, "Expected SHA-256 hex digest.");
        options.addOption("version", "packageversion", true, "Package version.");
        options.addOption("proxy", "proxy", true, "Forward proxy, ex. http://proxy:3128");
        options.addOption("noextract", "skipextract", false, "Do not extract the archive.");
        options.addOption("maxredirects", true, "Maximum number of redirects to follow.");
        options.addOption("timeout", true, "Seconds to wait for a response.");
        return options;
    }
}
