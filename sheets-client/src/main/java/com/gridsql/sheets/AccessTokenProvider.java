package com.gridsql.sheets;

/**
 * Supplies the OAuth bearer token sent with every request.
 *
 * <p>Called once per request, so implementations may refresh expired tokens.
 */
@FunctionalInterface
public interface AccessTokenProvider {

    /**
     * Returns a currently valid access token.
     *
     * @return the token, without the {@code Bearer} prefix
     */
    String accessToken();
}
