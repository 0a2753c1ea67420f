package io.vitalconnect.backend.occurrence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumSet;
import org.junit.jupiter.api.Test;

class OccurrenceStatusTest {

  @Test
  void allowedTransitionsPending() {
    assertThat(OccurrenceStatus.PENDING.allowedTransitions())
        .containsExactlyInAnyOrder(OccurrenceStatus.IN_PROGRESS, OccurrenceStatus.CANCELED);
  }

  @Test
  void allowedTransitionsInProgress() {
    assertThat(OccurrenceStatus.IN_PROGRESS.allowedTransitions())
        .containsExactlyInAnyOrder(
            OccurrenceStatus.ACCEPTED, OccurrenceStatus.REFUSED, OccurrenceStatus.CANCELED);
  }

  @Test
  void allowedTransitionsDecided() {
    assertThat(OccurrenceStatus.ACCEPTED.allowedTransitions())
        .containsExactlyInAnyOrder(OccurrenceStatus.CONCLUDED, OccurrenceStatus.CANCELED);
    assertThat(OccurrenceStatus.REFUSED.allowedTransitions())
        .containsExactlyInAnyOrder(OccurrenceStatus.CONCLUDED, OccurrenceStatus.CANCELED);
  }

  @Test
  void terminalStatesAllowNothing() {
    assertThat(OccurrenceStatus.CONCLUDED.allowedTransitions()).isEmpty();
    assertThat(OccurrenceStatus.CANCELED.allowedTransitions()).isEmpty();
    assertThat(OccurrenceStatus.CONCLUDED.isTerminal()).isTrue();
    assertThat(OccurrenceStatus.CANCELED.isTerminal()).isTrue();
    assertThat(OccurrenceStatus.ACCEPTED.isTerminal()).isFalse();
  }

  @Test
  void everyPairOutsideTheTableIsRefused() {
    for (OccurrenceStatus from : OccurrenceStatus.values()) {
      var illegal = EnumSet.allOf(OccurrenceStatus.class);
      illegal.removeAll(from.allowedTransitions());
      for (OccurrenceStatus to : illegal) {
        assertThat(from.canTransitionTo(to)).as("%s -> %s", from, to).isFalse();
      }
      assertThat(from.canTransitionTo(from)).as("self transition of %s", from).isFalse();
    }
  }

  @Test
  void allowedTargetNamesFollowDeclarationOrder() {
    assertThat(OccurrenceStatus.IN_PROGRESS.allowedTargetNames())
        .containsExactly("ACCEPTED", "REFUSED", "CANCELED");
    assertThat(OccurrenceStatus.CANCELED.allowedTargetNames()).isEmpty();
  }

  @Test
  void onlyDecidedStatesAcceptAnOutcome() {
    assertThat(OccurrenceStatus.ACCEPTED.acceptsOutcome()).isTrue();
    assertThat(OccurrenceStatus.REFUSED.acceptsOutcome()).isTrue();
    assertThat(OccurrenceStatus.PENDING.acceptsOutcome()).isFalse();
    assertThat(OccurrenceStatus.IN_PROGRESS.acceptsOutcome()).isFalse();
  }

  @Test
  void fromDbValueAcceptsDatabaseCodeAndName() {
    assertThat(OccurrenceStatus.fromDbValue("EM_ANDAMENTO"))
        .isEqualTo(OccurrenceStatus.IN_PROGRESS);
    assertThat(OccurrenceStatus.fromDbValue("CANCELED")).isEqualTo(OccurrenceStatus.CANCELED);
    assertThatThrownBy(() -> OccurrenceStatus.fromDbValue("ARQUIVADA"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
