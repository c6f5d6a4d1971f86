package com.gentoro.benefice;

import com.gentoro.benefice.logging.LoggingService;
import org.slf4j.Logger;

public class BeneficeApp {
  private static final Logger log = LoggingService.getLogger(BeneficeApp.class);

  public static void main(String[] args) {
    try {
      Benefice app = new Benefice(args);
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
