package com.gentoro.benefice.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.benefice.ingest.ArtifactIngestor;
import com.gentoro.benefice.jobs.JobService;
import com.gentoro.benefice.jobs.Limits;
import com.gentoro.benefice.session.SessionStore;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;

/**
 * The root resource.
 *
 * <ul>
 *   <li>GET / returns the caller's limits and job as JSON
 *   <li>POST / (multipart, parts {@code wasm} and {@code toml}) starts a job, 201 with {@code
 *       {"jobId": ...}}. Admission is checked before the body is touched, and the parts are
 *       streamed into staging as they arrive
 *   <li>DELETE / kills the caller's job, if any
 * </ul>
 */
public final class WorkloadServlet extends SessionServlet {
  // room for part headers and boundaries on top of the artifacts themselves
  private static final long ENVELOPE_BYTES = 64 * 1024;

  private final JobService jobs;
  private final ObjectMapper mapper = new ObjectMapper();

  public WorkloadServlet(JobService jobs, SessionStore sessions, Authenticator authenticator) {
    super(sessions, authenticator);
    this.jobs = jobs;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp)
      throws IOException, ServletException {
    if (!isRoot(req, resp)) return;
    withSession(
        req,
        resp,
        session -> {
          JobService.StatusView status = jobs.status(session);
          ObjectNode node = mapper.createObjectNode();
          node.put("user", status.uid());
          node.put("starred", status.starred());
          node.put("sizeLimitMiB", status.limits().sizeLimitMib());
          node.put("ttlSeconds", status.limits().ttl().toSeconds());
          ObjectNode range = node.putObject("portRange");
          range.put("min", status.portRange().min());
          range.put("max", status.portRange().max());
          if (status.job().isPresent()) {
            JobService.JobView job = status.job().get();
            ObjectNode j = node.putObject("job");
            j.put("id", job.id().toString());
            j.put("state", job.state().name());
            if (job.cause().isPresent()) {
              j.put("cause", job.cause().get().name());
            } else {
              j.putNull("cause");
            }
            j.put("startedAt", job.startedAt().toString());
            job.ports().forEach(j.putArray("ports")::add);
          } else {
            node.putNull("job");
          }
          writeJson(resp, 200, node);
        });
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp)
      throws IOException, ServletException {
    if (!isRoot(req, resp)) return;
    withSession(
        req,
        resp,
        session -> {
          Limits.Decision decision = jobs.precheck(session);
          MultipartUpload upload =
              MultipartUpload.of(
                  req.getContentType(), req.getInputStream(), maxRequestBytes(decision));
          UUID id = jobs.create(session, upload);
          ObjectNode node = mapper.createObjectNode();
          node.put("jobId", id.toString());
          writeJson(resp, 201, node);
        });
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp)
      throws IOException, ServletException {
    if (!isRoot(req, resp)) return;
    withSession(
        req,
        resp,
        session -> {
          jobs.delete(session);
          resp.setStatus(200);
        });
  }

  /** The caller's workload limit plus room for the configuration part and the multipart framing. */
  static long maxRequestBytes(Limits.Decision decision) {
    return decision.sizeLimitBytes() + ArtifactIngestor.CONFIG_MAX_BYTES + ENVELOPE_BYTES;
  }

  private static boolean isRoot(HttpServletRequest req, HttpServletResponse resp)
      throws IOException {
    String path = req.getServletPath() + (req.getPathInfo() == null ? "" : req.getPathInfo());
    if (path.isEmpty() || "/".equals(path)) return true;
    resp.sendError(404);
    return false;
  }

  private void writeJson(HttpServletResponse resp, int status, ObjectNode node)
      throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }
}
