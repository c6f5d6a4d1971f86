package com.gentoro.benefice.endpoints;

import com.gentoro.benefice.exception.BeneficeException;
import com.gentoro.benefice.exception.ExceptionUtil;
import com.gentoro.benefice.exception.JobNotFoundException;
import com.gentoro.benefice.exception.JobRejectedException;
import com.gentoro.benefice.logging.LoggingService;
import com.gentoro.benefice.session.Identity;
import com.gentoro.benefice.session.SessionRef;
import com.gentoro.benefice.session.SessionStore;
import com.gentoro.benefice.session.UserSession;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Base for endpoints that act on the caller's session. Resolves the identity, borrows the session
 * for the duration of the request and maps failures to JSON error responses.
 */
abstract class SessionServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(SessionServlet.class);

  private final SessionStore sessions;
  private final Authenticator authenticator;

  SessionServlet(SessionStore sessions, Authenticator authenticator) {
    this.sessions = sessions;
    this.authenticator = authenticator;
  }

  @FunctionalInterface
  interface SessionHandler {
    void handle(SessionRef<UserSession> session) throws IOException, ServletException;
  }

  void withSession(HttpServletRequest req, HttpServletResponse resp, SessionHandler handler)
      throws IOException, ServletException {
    Optional<Identity> identity = authenticator.authenticate(req);
    if (identity.isEmpty()) {
      ErrorResponses.write(resp, 401, "unauthorized", "Login required");
      return;
    }
    try (SessionRef<UserSession> session = sessions.acquire(identity.get())) {
      handler.handle(session);
    } catch (JobRejectedException e) {
      ErrorResponses.rejection(resp, e);
    } catch (JobNotFoundException e) {
      ErrorResponses.write(resp, 404, "not_found", e.getMessage());
    } catch (BeneficeException e) {
      log.error(
          "{} {} failed for {}: {} [{}]",
          req.getMethod(),
          req.getRequestURI(),
          identity.get().uid(),
          e.getMessage(),
          ExceptionUtil.formatCompactStackTrace(e, 5));
      ErrorResponses.internal(resp, e);
    }
  }
}
