package com.gentoro.benefice.endpoints;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.benefice.exception.CapacityException;
import com.gentoro.benefice.exception.PortException;
import com.gentoro.benefice.exception.Rejection;
import com.gentoro.benefice.exception.SpawnException;
import com.gentoro.benefice.exception.ValidationException;
import com.gentoro.benefice.ingest.UploadPart;
import com.gentoro.benefice.jobs.JobService;
import com.gentoro.benefice.jobs.JobState;
import com.gentoro.benefice.jobs.Limits;
import com.gentoro.benefice.ports.PortRange;
import com.gentoro.benefice.session.SessionStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.*;

class WorkloadServletTest {

  private static final String BOUNDARY = "XyZzY";

  private final ObjectMapper mapper = new ObjectMapper();
  private final JobService jobs = mock(JobService.class);
  private final SessionStore sessions = new SessionStore(Duration.ofHours(1), null);
  private ServletTester tester;

  @BeforeEach
  void setUp() throws Exception {
    tester = new ServletTester();
    tester.setContextPath("/");
    Authenticator auth = new HeaderAuthenticator("X-Benefice-User", "X-Benefice-Starred");
    tester
        .getContext()
        .addServlet(new ServletHolder(new WorkloadServlet(jobs, sessions, auth)), "/");
    tester.start();
    when(jobs.precheck(any()))
        .thenReturn(new Limits.Decision(Duration.ofSeconds(300), 1024 * 1024));
  }

  @AfterEach
  void tearDown() throws Exception {
    tester.stop();
    sessions.close();
  }

  private HttpTester.Response send(HttpTester.Request req) throws Exception {
    return HttpTester.parseResponse(tester.getResponses(req.generate()));
  }

  private static HttpTester.Request request(String method, String user) {
    HttpTester.Request req = HttpTester.newRequest();
    req.setMethod(method);
    req.setURI("/");
    req.setVersion("HTTP/1.1");
    req.setHeader("Host", "localhost");
    if (user != null) req.setHeader("X-Benefice-User", user);
    return req;
  }

  private static HttpTester.Request upload(String user) {
    HttpTester.Request req = request("POST", user);
    req.setHeader("Content-Type", "multipart/form-data; boundary=" + BOUNDARY);
    req.setContent(
        "--"
            + BOUNDARY
            + "\r\n"
            + "Content-Disposition: form-data; name=\"wasm\"; filename=\"app.wasm\"\r\n"
            + "Content-Type: application/wasm\r\n\r\n"
            + "asm\r\n"
            + "--"
            + BOUNDARY
            + "\r\n"
            + "Content-Disposition: form-data; name=\"toml\"\r\n\r\n"
            + "[[files]]\r\n"
            + "--"
            + BOUNDARY
            + "--\r\n");
    return req;
  }

  private JsonNode json(HttpTester.Response resp) throws IOException {
    return mapper.readTree(resp.getContent());
  }

  @Test
  void unauthenticatedRequestIsRefused() throws Exception {
    HttpTester.Response resp = send(request("GET", null));

    assertEquals(401, resp.getStatus());
    assertEquals("unauthorized", json(resp).get("error").asText());
    verifyNoInteractions(jobs);
  }

  @Test
  void statusShowsLimitsAndJob() throws Exception {
    UUID id = UUID.randomUUID();
    Limits.Decision decision = new Limits.Decision(Duration.ofSeconds(300), 10L * 1024 * 1024);
    when(jobs.status(any()))
        .thenReturn(
            new JobService.StatusView(
                "alice",
                false,
                decision,
                new PortRange(2000, 30000),
                Optional.of(
                    new JobService.JobView(
                        id,
                        JobState.RUNNING,
                        Optional.empty(),
                        Instant.now(),
                        new TreeSet<>(List.of(5000))))));

    HttpTester.Response resp = send(request("GET", "alice"));

    assertEquals(200, resp.getStatus());
    JsonNode body = json(resp);
    assertEquals("alice", body.get("user").asText());
    assertEquals(10, body.get("sizeLimitMiB").asInt());
    assertEquals(300, body.get("ttlSeconds").asInt());
    assertEquals(2000, body.get("portRange").get("min").asInt());
    assertEquals(id.toString(), body.get("job").get("id").asText());
    assertEquals(5000, body.get("job").get("ports").get(0).asInt());
    assertTrue(body.get("job").get("cause").isNull());
  }

  @Test
  void statusShowsHowFinishedJobEnded() throws Exception {
    when(jobs.status(any()))
        .thenReturn(
            new JobService.StatusView(
                "alice",
                false,
                new Limits.Decision(Duration.ofSeconds(300), 10L * 1024 * 1024),
                new PortRange(2000, 30000),
                Optional.of(
                    new JobService.JobView(
                        UUID.randomUUID(),
                        JobState.REAPED,
                        Optional.of(JobState.EXITED),
                        Instant.now(),
                        new TreeSet<>()))));

    JsonNode job = json(send(request("GET", "alice"))).get("job");

    assertEquals("REAPED", job.get("state").asText());
    assertEquals("EXITED", job.get("cause").asText());
  }

  @Test
  void statusWithoutJobHasNullJob() throws Exception {
    when(jobs.status(any()))
        .thenReturn(
            new JobService.StatusView(
                "bob",
                true,
                new Limits.Decision(Duration.ofSeconds(900), 50L * 1024 * 1024),
                new PortRange(2000, 30000),
                Optional.empty()));

    JsonNode body = json(send(request("GET", "bob")));

    assertTrue(body.get("job").isNull());
    assertTrue(body.get("starred").asBoolean());
  }

  @Test
  void uploadCreatesJob() throws Exception {
    UUID id = UUID.randomUUID();
    when(jobs.create(any(), any())).thenReturn(id);

    HttpTester.Response resp = send(upload("alice"));

    assertEquals(201, resp.getStatus());
    assertEquals(id.toString(), json(resp).get("jobId").asText());
    verify(jobs).create(any(), any());
  }

  @Test
  void uploadHandsPartsToJobServiceAsTheyStream() throws Exception {
    when(jobs.create(any(), any()))
        .thenAnswer(
            inv -> {
              Iterable<UploadPart> parts = inv.getArgument(1);
              List<String> seen = new ArrayList<>();
              for (UploadPart part : parts) {
                try (var in = part.openStream()) {
                  seen.add(part.name() + "=" + new String(in.readAllBytes(), StandardCharsets.UTF_8));
                }
              }
              assertEquals(List.of("wasm=asm", "toml=[[files]]"), seen);
              return UUID.randomUUID();
            });

    assertEquals(201, send(upload("alice")).getStatus());
  }

  @Test
  void refusedPrecheckSkipsUpload() throws Exception {
    when(jobs.precheck(any())).thenThrow(CapacityException.alreadyActive("alice"));

    HttpTester.Response resp = send(upload("alice"));

    assertEquals(409, resp.getStatus());
    assertEquals("job_already_active", json(resp).get("error").asText());
    verify(jobs, never()).create(any(), any());
  }

  @Test
  void nonMultipartPostIsMalformed() throws Exception {
    HttpTester.Request req = request("POST", "alice");
    req.setHeader("Content-Type", "application/json");
    req.setContent("{}");

    HttpTester.Response resp = send(req);

    assertEquals(400, resp.getStatus());
    assertEquals("malformed_upload", json(resp).get("error").asText());
    verify(jobs, never()).create(any(), any());
  }

  @Test
  void rejectionsMapToStatusCodes() throws Exception {
    when(jobs.create(any(), any()))
        .thenThrow(CapacityException.tooManyJobs(4))
        .thenThrow(CapacityException.alreadyActive("alice"))
        .thenThrow(new ValidationException(Rejection.PAYLOAD_TOO_LARGE, "too big"))
        .thenThrow(new ValidationException(Rejection.UNSUPPORTED_MEDIA_TYPE, "not wasm"))
        .thenThrow(new ValidationException(Rejection.MALFORMED_CONFIG, "bad toml"));

    assertEquals(503, send(upload("alice")).getStatus());
    assertEquals(409, send(upload("alice")).getStatus());
    assertEquals(413, send(upload("alice")).getStatus());
    assertEquals(415, send(upload("alice")).getStatus());
    assertEquals(400, send(upload("alice")).getStatus());
  }

  @Test
  void illegalPortsReportPortsAndRange() throws Exception {
    when(jobs.create(any(), any()))
        .thenThrow(PortException.illegal(new TreeSet<>(List.of(80)), new PortRange(2000, 30000)));

    HttpTester.Response resp = send(upload("alice"));

    assertEquals(400, resp.getStatus());
    JsonNode body = json(resp);
    assertEquals("illegal_ports", body.get("error").asText());
    assertEquals(80, body.get("ports").get(0).asInt());
    assertEquals(2000, body.get("range").get("min").asInt());
    assertEquals(30000, body.get("range").get("max").asInt());
  }

  @Test
  void portConflictIs409WithPorts() throws Exception {
    when(jobs.create(any(), any()))
        .thenThrow(PortException.conflict(new TreeSet<>(List.of(5000, 5001))));

    HttpTester.Response resp = send(upload("alice"));

    assertEquals(409, resp.getStatus());
    JsonNode body = json(resp);
    assertEquals(2, body.get("ports").size());
    assertNull(body.get("range"));
  }

  @Test
  void spawnFailureIsInternalError() throws Exception {
    when(jobs.create(any(), any()))
        .thenThrow(new SpawnException("Failed to spawn enarx", new IOException("no such file")));

    HttpTester.Response resp = send(upload("alice"));

    assertEquals(500, resp.getStatus());
    assertEquals("SPAWN_ERROR", json(resp).get("code").asText());
  }

  @Test
  void deleteKillsJob() throws Exception {
    HttpTester.Response resp = send(request("DELETE", "alice"));

    assertEquals(200, resp.getStatus());
    verify(jobs).delete(any());
  }

  @Test
  void unknownPathIsNotFound() throws Exception {
    HttpTester.Request req = request("GET", "alice");
    req.setURI("/nope");

    assertEquals(404, send(req).getStatus());
    verifyNoInteractions(jobs);
  }
}
