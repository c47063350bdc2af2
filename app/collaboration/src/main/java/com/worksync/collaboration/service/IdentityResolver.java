/*
 * Where: collaboration identity
 * What: resolves a bearer credential (socket handshake or REST header) to a user identity
 * Why: a single entry point keeps the development shortcut behind the profile guard
 */
package com.worksync.collaboration.service;

import com.worksync.collaboration.config.IdentityProperties;
import com.worksync.collaboration.model.UserIdentity;
import com.worksync.collaboration.repository.UserDirectoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class IdentityResolver {

    private static final Logger logger = LoggerFactory.getLogger(IdentityResolver.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenVerifier tokenVerifier;
    private final UserDirectoryRepository userDirectoryRepository;
    private final IdentityProperties.DevToken devToken;
    private final boolean devTokenActive;

    public IdentityResolver(
            TokenVerifier tokenVerifier,
            UserDirectoryRepository userDirectoryRepository,
            IdentityProperties properties,
            Environment environment) {
        this.tokenVerifier = tokenVerifier;
        this.userDirectoryRepository = userDirectoryRepository;
        this.devToken = properties.devToken();
        final boolean developmentProfile = environment.acceptsProfiles(Profiles.of("dev", "local"));
        this.devTokenActive = devToken.enabled() && developmentProfile;
        if (devToken.enabled() && !developmentProfile) {
            logger.warn("dev token is configured but ignored outside dev/local profiles");
        }
    }

    public UserIdentity resolve(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new AuthenticationFailedException(
                    AuthenticationFailedException.Reason.MISSING_CREDENTIAL, "credential is required");
        }
        if (devTokenActive && devToken.value().equals(credential)) {
            return resolveDevUser();
        }
        return tokenVerifier.verify(credential);
    }

    /** Accepts a raw {@code Authorization} header value. */
    public UserIdentity resolveAuthorizationHeader(String header) {
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            throw new AuthenticationFailedException(
                    AuthenticationFailedException.Reason.MISSING_CREDENTIAL, "bearer token is required");
        }
        return resolve(header.substring(BEARER_PREFIX.length()).trim());
    }

    private UserIdentity resolveDevUser() {
        try {
            return userDirectoryRepository.findIdentityByEmail(devToken.userEmail())
                    .orElseThrow(() -> new AuthenticationFailedException(
                            AuthenticationFailedException.Reason.UNKNOWN_USER,
                            "dev user not found email=" + devToken.userEmail()));
        } catch (DataAccessException ex) {
            throw new AuthenticationFailedException(
                    AuthenticationFailedException.Reason.UNKNOWN_USER, "dev user lookup failed", ex);
        }
    }
}
