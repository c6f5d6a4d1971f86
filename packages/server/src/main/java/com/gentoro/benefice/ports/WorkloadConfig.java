package com.gentoro.benefice.ports;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

/**
 * The slice of an Enarx.toml workload configuration this server cares about: the {@code [[files]]}
 * table array. Everything else in the document is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkloadConfig {

  @JsonProperty("files")
  private List<FileEntry> files = new ArrayList<>();

  public List<FileEntry> getFiles() {
    return files;
  }

  public void setFiles(List<FileEntry> files) {
    this.files = files == null ? new ArrayList<>() : files;
  }

  /** One {@code [[files]]} entry. Only {@code kind = "listen"} entries carry a port. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class FileEntry {
    @JsonProperty("kind")
    private String kind;

    @JsonProperty("name")
    private String name;

    @JsonProperty("prot")
    private String prot;

    @JsonProperty("port")
    private Integer port;

    public String getKind() {
      return kind;
    }

    public void setKind(String kind) {
      this.kind = kind;
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getProt() {
      return prot;
    }

    public void setProt(String prot) {
      this.prot = prot;
    }

    public Integer getPort() {
      return port;
    }

    public void setPort(Integer port) {
      this.port = port;
    }

    public boolean isListen() {
      return "listen".equals(kind);
    }
  }
}
