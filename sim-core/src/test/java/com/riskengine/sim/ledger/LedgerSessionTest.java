package com.riskengine.sim.ledger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerSessionTest {

  private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

  @Mock
  private LedgerClient client;

  private final LedgerPublicKey programId = TestKeys.key(11);

  @Test
  void validatesNetworkOnlyOnce() throws Exception {
    when(client.accountData(programId)).thenReturn(Optional.of(new byte[]{1}));
    LedgerSession session = new LedgerSession(client, programId, Clock.fixed(NOW, ZoneOffset.UTC));

    session.ensureNetwork();
    session.ensureNetwork();

    assertThat(session.isNetworkValidated()).isTrue();
    verify(client, times(1)).accountData(programId);
  }

  @Test
  void missingProgramFailsValidation() throws Exception {
    when(client.accountData(programId)).thenReturn(Optional.empty());
    LedgerSession session = new LedgerSession(client, programId, Clock.fixed(NOW, ZoneOffset.UTC));

    assertThatThrownBy(session::ensureNetwork)
        .isInstanceOf(LedgerRpcException.class)
        .hasMessageContaining("not found");
    assertThat(session.isNetworkValidated()).isFalse();
  }

  @Test
  void clusterTimeAddsCachedDrift() throws Exception {
    when(client.slot()).thenReturn(500L);
    when(client.blockTime(500L)).thenReturn(OptionalLong.of(NOW.getEpochSecond() + 3));
    MutableClock clock = new MutableClock(NOW);
    LedgerSession session = new LedgerSession(client, programId, clock, Duration.ofMinutes(1));

    assertThat(session.clusterTimestampSeconds()).isEqualTo(NOW.getEpochSecond() + 3);

    clock.advance(Duration.ofSeconds(30));
    assertThat(session.clusterTimestampSeconds()).isEqualTo(NOW.getEpochSecond() + 33);
    verify(client, times(1)).slot();
  }

  @Test
  void failedRefreshKeepsPreviousDrift() throws Exception {
    when(client.slot()).thenReturn(500L).thenThrow(new LedgerRpcException("node down"));
    when(client.blockTime(500L)).thenReturn(OptionalLong.of(NOW.getEpochSecond() - 2));
    MutableClock clock = new MutableClock(NOW);
    LedgerSession session = new LedgerSession(client, programId, clock, Duration.ofMinutes(1));

    session.clusterTimestampSeconds();
    clock.advance(Duration.ofMinutes(2));

    assertThat(session.clusterTimestampSeconds()).isEqualTo(NOW.plus(Duration.ofMinutes(2)).getEpochSecond() - 2);
    assertThat(session.driftSeconds()).isEqualTo(-2);
  }

  private static final class MutableClock extends Clock {
    private Instant now;

    private MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration d) {
      now = now.plus(d);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
