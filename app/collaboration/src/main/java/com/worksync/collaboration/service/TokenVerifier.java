package com.worksync.collaboration.service;

import com.worksync.collaboration.model.UserIdentity;

/** Turns a bearer token into an identity or throws {@link AuthenticationFailedException}. */
public interface TokenVerifier {

  UserIdentity verify(String token);
}
