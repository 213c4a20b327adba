package com.gentoro.galleryup.events;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.galleryup.queue.QueueStatus;
import org.junit.jupiter.api.Test;

class QueueEventBusTest {

  @Test
  void failingListenerDoesNotStopOthers() {
    QueueEventBus bus = new QueueEventBus();
    QueueEventListener broken = mock(QueueEventListener.class);
    QueueEventListener healthy = mock(QueueEventListener.class);
    doThrow(new IllegalStateException("boom"))
        .when(broken)
        .onStatusChanged(any(), any(), any(), any());
    bus.register(broken);
    bus.register(healthy);

    assertDoesNotThrow(
        () -> bus.publishStatus("/g/a", QueueStatus.READY, QueueStatus.QUEUED, null));

    verify(healthy).onStatusChanged("/g/a", QueueStatus.READY, QueueStatus.QUEUED, null);
  }

  @Test
  void unregisteredListenerReceivesNothing() {
    QueueEventBus bus = new QueueEventBus();
    QueueEventListener listener = mock(QueueEventListener.class);
    bus.register(listener);
    bus.unregister(listener);

    bus.publishProgress("/g/a", 1, 2, 50, "a.jpg");
    bus.publishLog("/g/a", "hello");

    assertEquals(0, bus.listenerCount());
    verifyNoInteractions(listener);
  }

  @Test
  void defaultMethodsAreOptional() {
    QueueEventBus bus = new QueueEventBus();
    bus.register(new QueueEventListener() {});
    assertDoesNotThrow(() -> bus.publishLog("/g/a", "line"));
  }
}
