package com.synthetic.solvency.domain.port;

/**
 * Resolves the authenticated caller of the operation currently being served.
 */
public interface CallerIdentityResolver {

    String currentCaller();
}
