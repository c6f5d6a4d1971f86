package com.gentoro.benefice.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.benefice.exception.ErrorDetails;
import com.gentoro.benefice.exception.ExceptionUtil;
import com.gentoro.benefice.exception.JobRejectedException;
import com.gentoro.benefice.exception.PortException;
import com.gentoro.benefice.exception.Rejection;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** JSON error bodies shared by the workload endpoints. */
final class ErrorResponses {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ErrorResponses() {}

  static int statusOf(Rejection reason) {
    return switch (reason) {
      case TOO_MANY_JOBS -> 503;
      case JOB_ALREADY_ACTIVE, PORT_CONFLICT -> 409;
      case ILLEGAL_PORTS, MALFORMED_UPLOAD, MALFORMED_CONFIG -> 400;
      case PAYLOAD_TOO_LARGE -> 413;
      case UNSUPPORTED_MEDIA_TYPE -> 415;
    };
  }

  static void rejection(HttpServletResponse resp, JobRejectedException e) throws IOException {
    ObjectNode node = body(e.reason().name().toLowerCase(), e.getMessage());
    if (e instanceof PortException pe) {
      ArrayNode ports = node.putArray("ports");
      pe.ports().forEach(ports::add);
      if (pe.range() != null) {
        ObjectNode range = node.putObject("range");
        range.put("min", pe.range().min());
        range.put("max", pe.range().max());
      }
    }
    write(resp, statusOf(e.reason()), node);
  }

  static void internal(HttpServletResponse resp, Throwable t) throws IOException {
    ErrorDetails details = ExceptionUtil.toErrorDetails(t);
    ObjectNode node = body("internal", details.message());
    node.put("code", details.code().name());
    write(resp, 500, node);
  }

  static void write(HttpServletResponse resp, int status, String error, String message)
      throws IOException {
    write(resp, status, body(error, message));
  }

  private static ObjectNode body(String error, String message) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("error", error);
    node.put("message", message);
    return node;
  }

  private static void write(HttpServletResponse resp, int status, ObjectNode node)
      throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(MAPPER.writeValueAsString(node));
  }
}
