package com.gentoro.benefice.endpoints;

import com.gentoro.benefice.session.Identity;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/** Resolves the user behind a request. Empty means the request is not authenticated. */
public interface Authenticator {
  Optional<Identity> authenticate(HttpServletRequest request);
}
