package io.vitalconnect.backend.hospital;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/** Cached hospital display names for alert payloads. */
@Service
public class HospitalDirectory {

  private static final Logger log = LoggerFactory.getLogger(HospitalDirectory.class);
  static final String UNKNOWN_HOSPITAL = "Hospital";

  private final HospitalRepository hospitalRepository;
  private final Cache<UUID, String> names =
      Caffeine.newBuilder().expireAfterWrite(Duration.ofMinutes(30)).maximumSize(1_000).build();

  public HospitalDirectory(HospitalRepository hospitalRepository) {
    this.hospitalRepository = hospitalRepository;
  }

  /** Display name of the hospital; a generic label when it is unknown or cannot be read. */
  public String nameOf(UUID hospitalId) {
    String cached = names.getIfPresent(hospitalId);
    if (cached != null) {
      return cached;
    }
    try {
      return hospitalRepository
          .findById(hospitalId)
          .map(
              hospital -> {
                names.put(hospitalId, hospital.getName());
                return hospital.getName();
              })
          .orElse(UNKNOWN_HOSPITAL);
    } catch (DataAccessException e) {
      log.warn("Failed to resolve hospital {}: {}", hospitalId, e.getMessage());
      return UNKNOWN_HOSPITAL;
    }
  }
}
