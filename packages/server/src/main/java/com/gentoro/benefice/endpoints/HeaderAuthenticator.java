package com.gentoro.benefice.endpoints;

import com.gentoro.benefice.session.Identity;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Trusts identity headers set by an authenticating reverse proxy in front of the server.
 *
 * <p>The starred header accepts the usual boolean spellings ({@code true}, {@code yes}, {@code on},
 * {@code 1}); anything else counts as not starred.
 */
public final class HeaderAuthenticator implements Authenticator {
  private final String userHeader;
  private final String starredHeader;

  public HeaderAuthenticator(String userHeader, String starredHeader) {
    this.userHeader = userHeader;
    this.starredHeader = starredHeader;
  }

  @Override
  public Optional<Identity> authenticate(HttpServletRequest request) {
    String uid = StringUtils.trimToNull(request.getHeader(userHeader));
    if (uid == null) {
      return Optional.empty();
    }
    String starred = StringUtils.trimToEmpty(request.getHeader(starredHeader));
    boolean isStarred = "1".equals(starred) || BooleanUtils.toBoolean(starred);
    return Optional.of(new Identity(uid, isStarred));
  }
}
