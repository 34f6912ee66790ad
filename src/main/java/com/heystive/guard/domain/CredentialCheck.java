package com.heystive.guard.domain;

import java.util.Set;

/**
 * Outcome of validating a presented credential.
 *
 * @param valid whether the key matched a known credential
 * @param credentialName name of the matched credential, null when invalid
 * @param tier tier of the matched credential, null when invalid
 * @param permissions permissions of the matched tier, empty when invalid
 * @param profile rate-limit profile of the matched tier, null when invalid
 */
public record CredentialCheck(
        boolean valid,
        String credentialName,
        String tier,
        Set<String> permissions,
        RateLimitProfile profile
) {
    private static final CredentialCheck INVALID = new CredentialCheck(false, null, null, Set.of(), null);

    public static CredentialCheck invalid() {
        return INVALID;
    }

    public static CredentialCheck of(Credential credential) {
        return new CredentialCheck(true, credential.name(), credential.tier(),
                credential.permissions(), credential.profile());
    }
}
