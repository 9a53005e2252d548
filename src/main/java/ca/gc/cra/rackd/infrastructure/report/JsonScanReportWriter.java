package ca.gc.cra.rackd.infrastructure.report;

import ca.gc.cra.rackd.domain.discovery.DiscoveredDevice;
import ca.gc.cra.rackd.domain.discovery.DiscoveryScan;
import ca.gc.cra.rackd.domain.discovery.ServiceInfo;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a scan and the devices it touched as one JSON document.
 *
 * <p>Layout: {@code {"scan": {...}, "devices": [...]}} with snake_case keys and ISO-8601 timestamps. The file is
 * written to a sibling temporary file first and moved into place.</p>
 *
 * @since 0.1.0
 */
public final class JsonScanReportWriter {
  private static final Logger log = LoggerFactory.getLogger(JsonScanReportWriter.class);

  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Writes the report.
   *
   * @param target destination file; parent directories are created
   * @param scan terminal scan snapshot
   * @param devices device records to include
   * @throws IOException when the file cannot be written
   */
  public void write(Path target, DiscoveryScan scan, List<DiscoveredDevice> devices) throws IOException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(scan, "scan");
    Path absolute = target.toAbsolutePath();
    Path parent = absolute.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path temp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
    try (OutputStream out = Files.newOutputStream(temp)) {
      write(out, scan, devices);
    }
    Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
    log.info("Wrote scan report with {} devices to {}", devices == null ? 0 : devices.size(), absolute);
  }

  /**
   * Streams the report.
   *
   * @param out destination stream; left open
   * @param scan terminal scan snapshot
   * @param devices device records to include
   * @throws IOException when the stream rejects output
   */
  public void write(OutputStream out, DiscoveryScan scan, List<DiscoveredDevice> devices) throws IOException {
    try (JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeFieldName("scan");
      writeScan(gen, scan);
      gen.writeArrayFieldStart("devices");
      if (devices != null) {
        for (DiscoveredDevice device : devices) {
          writeDevice(gen, device);
        }
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }

  private static void writeScan(JsonGenerator gen, DiscoveryScan scan) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("id", scan.id());
    gen.writeStringField("network_id", scan.networkId());
    gen.writeStringField("status", scan.status().wireName());
    gen.writeStringField("scan_type", scan.scanType() == null ? "" : scan.scanType().wireName());
    gen.writeNumberField("scan_depth", scan.scanDepth());
    gen.writeNumberField("total_hosts", scan.totalHosts());
    gen.writeNumberField("scanned_hosts", scan.scannedHosts());
    gen.writeNumberField("found_hosts", scan.foundHosts());
    gen.writeNumberField("progress_percent", scan.progressPercent());
    writeInstant(gen, "started_at", scan.startedAt());
    writeInstant(gen, "completed_at", scan.completedAt().orElse(null));
    gen.writeNumberField("duration_seconds", scan.durationSeconds());
    gen.writeStringField("error_message", scan.errorMessage());
    gen.writeEndObject();
  }

  private static void writeDevice(JsonGenerator gen, DiscoveredDevice device) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("id", device.id());
    gen.writeStringField("ip", device.ip());
    gen.writeStringField("mac_address", device.macAddress());
    gen.writeStringField("hostname", device.hostname());
    gen.writeStringField("network_id", device.networkId());
    gen.writeStringField("status", device.status().wireName());
    gen.writeNumberField("confidence", device.confidence());
    gen.writeStringField("os_guess", device.osGuess());
    gen.writeStringField("os_family", device.osFamily());
    gen.writeArrayFieldStart("open_ports");
    for (int port : device.openPorts()) {
      gen.writeNumber(port);
    }
    gen.writeEndArray();
    gen.writeArrayFieldStart("services");
    for (ServiceInfo service : device.services()) {
      gen.writeStartObject();
      gen.writeNumberField("port", service.port());
      gen.writeStringField("protocol", service.protocol());
      gen.writeStringField("service", service.service());
      gen.writeStringField("version", service.version());
      gen.writeStringField("banner", service.banner());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeStringField("last_scan_id", device.lastScanId());
    writeInstant(gen, "last_seen", device.lastSeen());
    writeInstant(gen, "first_seen", device.firstSeen());
    gen.writeEndObject();
  }

  private static void writeInstant(JsonGenerator gen, String field, Instant value) throws IOException {
    if (value == null) {
      gen.writeNullField(field);
    } else {
      gen.writeStringField(field, value.toString());
    }
  }
}
