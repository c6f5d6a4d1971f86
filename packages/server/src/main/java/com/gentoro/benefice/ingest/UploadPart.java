package com.gentoro.benefice.ingest;

import java.io.IOException;
import java.io.InputStream;

/** One named part of a multipart upload, read as a stream. */
public interface UploadPart {
  String name();

  /** Declared content type, or {@code null} when the part declares none. */
  String contentType();

  InputStream openStream() throws IOException;
}
