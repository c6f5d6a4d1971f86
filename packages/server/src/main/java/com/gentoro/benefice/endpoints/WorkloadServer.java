package com.gentoro.benefice.endpoints;

import com.gentoro.benefice.Benefice;
import com.gentoro.benefice.jobs.JobService;
import com.gentoro.benefice.jobs.StreamKind;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/** Registers the workload endpoints with the shared Jetty context. */
public final class WorkloadServer {
  private final Benefice benefice;

  public WorkloadServer(Benefice benefice) {
    this.benefice = benefice;
  }

  /** Register all workload servlets with the Jetty context handler. */
  public void register() {
    ServletContextHandler ctx = benefice.httpServer().getContextHandler();
    JobService jobs = benefice.jobService();
    var sessions = benefice.sessions();
    var auth = benefice.authenticator();

    // uploads are parsed by WorkloadServlet itself, no servlet multipart config
    ctx.addServlet(new ServletHolder(new WorkloadServlet(jobs, sessions, auth)), "/");
    ctx.addServlet(
        new ServletHolder(new OutputServlet(jobs, StreamKind.OUTPUT, sessions, auth)), "/out");
    ctx.addServlet(
        new ServletHolder(new OutputServlet(jobs, StreamKind.ERROR, sessions, auth)), "/err");
  }
}
