package com.codeheadsystems.tether.server.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tether.server.store.SessionStore;
import com.codeheadsystems.tether.server.store.StoreUnavailableException;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionSweeperTest {

  @Mock private SessionStore sessionStore;

  @Test
  void sweepOnce_reportsRemovedCount() {
    when(sessionStore.sweepExpired()).thenReturn(3);

    assertThat(new SessionSweeper(sessionStore, Duration.ofHours(1)).sweepOnce()).isEqualTo(3);
  }

  @Test
  void sweepOnce_storeUnavailable_keepsSchedulerAlive() {
    when(sessionStore.sweepExpired()).thenThrow(new StoreUnavailableException("locked"));

    assertThat(new SessionSweeper(sessionStore, Duration.ofHours(1)).sweepOnce()).isEqualTo(-1);
  }
}
