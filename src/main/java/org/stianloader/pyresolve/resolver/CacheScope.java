package org.stianloader.pyresolve.resolver;

/**
 * Lifetime of the listings and metadata cached by the resolver.
 */
public enum CacheScope {

    /**
     * Every resolution run starts with an empty cache.
     */
    RUN,

    /**
     * The cache is shared by all runs of the same resolver, and discarded before a run once it
     * is older than the configured maximum age. It is never revalidated while a run is in progress.
     */
    RESOLVER;
}
