package com.gentoro.benefice.endpoints;

import com.gentoro.benefice.jobs.JobService;
import com.gentoro.benefice.jobs.StreamKind;
import com.gentoro.benefice.session.SessionStore;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * POST /out and POST /err: up to {@value #CHUNK} bytes of output the caller has not seen yet. An
 * empty body means nothing new arrived within the read timeout.
 */
public final class OutputServlet extends SessionServlet {
  static final int CHUNK = 4096;

  private final JobService jobs;
  private final StreamKind kind;

  public OutputServlet(
      JobService jobs, StreamKind kind, SessionStore sessions, Authenticator authenticator) {
    super(sessions, authenticator);
    this.jobs = jobs;
    this.kind = kind;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp)
      throws IOException, ServletException {
    withSession(
        req,
        resp,
        session -> {
          byte[] bytes = jobs.read(session, kind, CHUNK);
          resp.setStatus(200);
          resp.setContentType("application/octet-stream");
          resp.setContentLength(bytes.length);
          resp.getOutputStream().write(bytes);
        });
  }
}
