package com.dronetrack.tracker.affiliation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AffiliationResolver} backed by an INI file.
 *
 * <p>The file has one section per affiliation, each listing comma-separated UIDs:
 * <pre>
 * [authorized]
 * uids = drone-A1, drone-B2
 * [unauthorized]
 * uids = drone-X9
 * </pre>
 *
 * <p>The file is re-read whenever its modification time changes; readers always see a complete
 * mapping. A missing or unreadable file keeps the last good mapping.
 */
public class IniAffiliationResolver implements AffiliationResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(IniAffiliationResolver.class);
  private static final String UIDS_KEY = "uids";

  private final Path path;
  private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);
  private volatile boolean unreadableReported;

  public IniAffiliationResolver(Path path) {
    this.path = path;
    refresh();
  }

  @Override
  public Affiliation resolve(String uid) {
    if (uid == null || uid.isBlank()) {
      return Affiliation.UNKNOWN;
    }
    return refresh().uids().getOrDefault(uid, Affiliation.UNKNOWN);
  }

  /** Reloads the mapping when the file changed and returns the current one. */
  Snapshot refresh() {
    Snapshot current = snapshot.get();
    FileTime modified;
    try {
      modified = Files.getLastModifiedTime(path);
    } catch (IOException ex) {
      if (!unreadableReported) {
        unreadableReported = true;
        LOGGER.warn("Affiliation file {} not readable: {}", path, ex.toString());
      }
      return current;
    }
    unreadableReported = false;
    if (modified.equals(current.modified())) {
      return current;
    }
    try {
      Snapshot loaded = new Snapshot(modified, parse(Files.readAllLines(path, StandardCharsets.UTF_8)));
      if (snapshot.compareAndSet(current, loaded)) {
        LOGGER.info("Affiliation file {} loaded ({} entries)", path, loaded.uids().size());
      }
      return snapshot.get();
    } catch (IOException ex) {
      LOGGER.warn("Failed to load affiliation file {}", path, ex);
      return current;
    }
  }

  static Map<String, Affiliation> parse(List<String> lines) {
    Map<String, StringBuilder> uidLists = new HashMap<>();
    String section = null;
    StringBuilder value = null;
    for (String raw : lines) {
      String line = raw.strip();
      if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
        continue;
      }
      if (line.startsWith("[") && line.endsWith("]")) {
        section = line.substring(1, line.length() - 1).strip();
        value = null;
        continue;
      }
      if (Character.isWhitespace(raw.charAt(0)) && value != null) {
        // Indented line continues the previous value.
        value.append(',').append(line);
        continue;
      }
      int separator = indexOfSeparator(line);
      if (section == null || separator < 0) {
        value = null;
        continue;
      }
      String key = line.substring(0, separator).strip().toLowerCase(Locale.ROOT);
      if (UIDS_KEY.equals(key)) {
        value = new StringBuilder(line.substring(separator + 1).strip());
        uidLists.put(section, value);
      } else {
        value = null;
      }
    }

    Map<String, Affiliation> uids = new HashMap<>();
    for (Affiliation affiliation : Affiliation.values()) {
      StringBuilder list = uidLists.get(affiliation.label());
      if (list == null) {
        continue;
      }
      for (String uid : list.toString().split(",")) {
        if (!uid.isBlank()) {
          uids.put(uid.strip(), affiliation);
        }
      }
    }
    return Map.copyOf(uids);
  }

  private static int indexOfSeparator(String line) {
    int equals = line.indexOf('=');
    int colon = line.indexOf(':');
    if (equals < 0) {
      return colon;
    }
    return colon < 0 ? equals : Math.min(equals, colon);
  }

  record Snapshot(FileTime modified, Map<String, Affiliation> uids) {
    static final Snapshot EMPTY = new Snapshot(null, Map.of());
  }
}
