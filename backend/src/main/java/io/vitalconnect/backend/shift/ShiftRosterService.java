package io.vitalconnect.backend.shift;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link OnDutyRoster} backed by the weekly shift schedule. Lookups are cached per hospital and
 * local minute for a few minutes.
 */
@Service
public class ShiftRosterService implements OnDutyRoster {

  private static final Logger log = LoggerFactory.getLogger(ShiftRosterService.class);

  private final ShiftRepository shiftRepository;
  private final OperatorRepository operatorRepository;
  private final ZoneId zone;
  private final Cache<RosterKey, List<OnDutyOperator>> cache;

  public ShiftRosterService(
      ShiftRepository shiftRepository,
      OperatorRepository operatorRepository,
      @Value("${vitalconnect.shift.zone:America/Sao_Paulo}") String zone,
      @Value("${vitalconnect.shift.roster-cache-ttl:5m}") Duration cacheTtl) {
    this.shiftRepository = shiftRepository;
    this.operatorRepository = operatorRepository;
    this.zone = ZoneId.of(zone);
    this.cache = Caffeine.newBuilder().expireAfterWrite(cacheTtl).maximumSize(5_000).build();
  }

  @Override
  @Transactional(readOnly = true)
  public List<OnDutyOperator> onDutyOperators(UUID hospitalId, Instant at) {
    ZonedDateTime local = at.atZone(zone);
    int day = Shift.dayIndex(local.getDayOfWeek());
    LocalTime time = local.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
    return cache.get(new RosterKey(hospitalId, day, time), key -> lookup(hospitalId, day, time));
  }

  public void invalidateAll() {
    cache.invalidateAll();
  }

  private List<OnDutyOperator> lookup(UUID hospitalId, int day, LocalTime time) {
    int previousDay = (day + 6) % 7;
    var userIds =
        shiftRepository
            .findByHospitalIdAndDayOfWeekIn(hospitalId, Set.of(day, previousDay))
            .stream()
            .filter(shift -> shift.covers(day, time))
            .map(Shift::getUserId)
            .distinct()
            .toList();
    var onShift =
        operatorRepository.findAllById(userIds).stream()
            .filter(Operator::isActive)
            .map(OnDutyOperator::from)
            .toList();
    if (!onShift.isEmpty()) {
      return onShift;
    }
    var managers =
        operatorRepository.findActiveManagersByHospitalId(hospitalId).stream()
            .map(OnDutyOperator::from)
            .toList();
    log.info(
        "No operator on shift at hospital {} (day={}, time={}), falling back to {} managers",
        hospitalId,
        day,
        time,
        managers.size());
    return managers;
  }

  private record RosterKey(UUID hospitalId, int day, LocalTime time) {}
}
