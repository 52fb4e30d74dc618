package org.dataone.artifactcache;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Properties;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.artifactcache.exceptions.ArtifactCacheFactoryException;

/**
 * ArtifactCacheFactory is a factory class that generates an ArtifactCache, the fetch, verify and
 * cache pipeline for prebuilt archives.
 */
public class ArtifactCacheFactory {
    private static final Log logArtifactCache = LogFactory.getLog(ArtifactCacheFactory.class);

    public static final String DEFAULT_CLASS_PACKAGE =
        "org.dataone.artifactcache.filecache.FileArtifactCache";

    /**
     * Factory method to generate an ArtifactCache
     *
     * @param classPackage    String of the package name, ex.
     *                        "org.dataone.artifactcache.filecache.FileArtifactCache"
     * @param cacheProperties Properties object with any of the following keys: digestAlgorithm,
     *                        maxRedirects, connectTimeoutSeconds, requestTimeoutSeconds
     *
     * @return ArtifactCache instance ready to fetch artifacts
     * @throws ArtifactCacheFactoryException When the ArtifactCache fails to initialize due to
     *                                       class-related or configuration issues
     */
    public static ArtifactCache getArtifactCache(String classPackage, Properties cacheProperties)
        throws ArtifactCacheFactoryException {
        // Validate input parameters
        if (classPackage == null || classPackage.trim().isEmpty()) {
            String errMsg = "ArtifactCacheFactory - classPackage cannot be null or empty.";
            logArtifactCache.error(errMsg);
            throw new ArtifactCacheFactoryException(errMsg);
        }
        if (cacheProperties == null) {
            String errMsg = "ArtifactCacheFactory - cacheProperties cannot be null.";
            logArtifactCache.error(errMsg);
            throw new ArtifactCacheFactoryException(errMsg);
        }

        logArtifactCache.debug("Creating new 'ArtifactCache' from package: " + classPackage);
        ArtifactCache artifactCache;
        try {
            Class<?> artifactCacheClass = Class.forName(classPackage);
            Constructor<?> constructor = artifactCacheClass.getConstructor(Properties.class);
            artifactCache = (ArtifactCache) constructor.newInstance(cacheProperties);

        } catch (ClassNotFoundException cnfe) {
            String errMsg = "ArtifactCacheFactory - Unable to find classPackage: " + classPackage
                + " - " + cnfe.getMessage();
            logArtifactCache.error(errMsg);
            throw new ArtifactCacheFactoryException(errMsg);

        } catch (NoSuchMethodException nsme) {
            String errMsg = "ArtifactCacheFactory - Constructor(Properties) not found for: "
                + classPackage + " - " + nsme.getMessage();
            logArtifactCache.error(errMsg);
            throw new ArtifactCacheFactoryException(errMsg);

        } catch (IllegalAccessException | InstantiationException ie) {
            String errMsg = "ArtifactCacheFactory - Error instantiating: " + classPackage + " - "
                + ie.getMessage();
            logArtifactCache.error(errMsg);
            throw new ArtifactCacheFactoryException(errMsg);

        } catch (InvocationTargetException ite) {
            String errMsg = "ArtifactCacheFactory - Error creating '" + classPackage
                + "' instance: " + ite.getCause();
            logArtifactCache.error(errMsg);
            throw new ArtifactCacheFactoryException(errMsg);

        } catch (ClassCastException cce) {
            String errMsg = "ArtifactCacheFactory - " + classPackage
                + " does not implement ArtifactCache.";
            logArtifactCache.error(errMsg);
            throw new ArtifactCacheFactoryException(errMsg);
        }
        return artifactCache;
    }

    public static ArtifactCache getArtifactCache(Properties cacheProperties)
        throws ArtifactCacheFactoryException {
        return getArtifactCache(DEFAULT_CLASS_PACKAGE, cacheProperties);
    }
}
