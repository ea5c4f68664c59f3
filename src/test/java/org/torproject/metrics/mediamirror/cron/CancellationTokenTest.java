/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.cron;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

public class CancellationTokenTest {

  @Test
  public void testLifecycle() {
    CancellationToken token = new CancellationToken();
    assertEquals(CancellationToken.RunState.IDLE, token.getState());
    token.start();
    assertEquals(CancellationToken.RunState.RUNNING, token.getState());
    assertFalse(token.isCancelled());
    token.cancel();
    token.cancel();
    assertTrue(token.isCancelled());
    assertEquals(CancellationToken.RunState.CANCELLED, token.finish());
    token.reset();
    assertEquals(CancellationToken.RunState.IDLE, token.getState());
    assertFalse(token.isCancelled());
    token.start();
    assertEquals(CancellationToken.RunState.COMPLETED, token.finish());
  }

  @Test(timeout = 5000L)
  public void testShutdownHookCancelsAndWaitsForFinish() throws Exception {
    final CancellationToken token = new CancellationToken();
    final ShutdownHook hook = new ShutdownHook(token, 60000L);
    Thread control = new Thread() {
      @Override
      public void run() {
        while (!token.isCancelled()) {
          Thread.yield();
        }
        hook.finished();
      }
    };
    control.start();
    hook.run();
    assertTrue(token.isCancelled());
    control.join();
  }

  @Test(timeout = 5000L)
  public void testShutdownHookGivesUpAfterGracePeriod() {
    CancellationToken token = new CancellationToken();
    new ShutdownHook(token, 50L).run();
    assertTrue(token.isCancelled());
  }

  @Test(timeout = 5000L)
  public void testConsoleQuitCancels() {
    CancellationToken token = new CancellationToken();
    new ConsoleCancellationListener(new ByteArrayInputStream(
        "x\n Q \nmore\n".getBytes(StandardCharsets.UTF_8)), token).run();
    assertTrue(token.isCancelled());
    CancellationToken untouched = new CancellationToken();
    new ConsoleCancellationListener(new ByteArrayInputStream(
        "quit\n".getBytes(StandardCharsets.UTF_8)), untouched).run();
    assertFalse(untouched.isCancelled());
  }
}
