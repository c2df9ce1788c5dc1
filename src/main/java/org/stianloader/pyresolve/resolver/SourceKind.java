package org.stianloader.pyresolve.resolver;

/**
 * The kind of distribution a {@link Candidate} is built from.
 */
public enum SourceKind {
    WHEEL,
    SDIST;
}
