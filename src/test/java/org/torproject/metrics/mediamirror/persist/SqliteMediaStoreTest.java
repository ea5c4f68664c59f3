/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.persist;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

public class SqliteMediaStoreTest {

  private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  private Path databasePath;

  private SqliteMediaStore store;

  @Before
  public void setUp() throws Exception {
    this.databasePath = tmpf.getRoot().toPath().resolve("db")
        .resolve("mediamirror.db");
    this.store = new SqliteMediaStore(this.databasePath,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @After
  public void tearDown() throws Exception {
    this.store.close();
  }

  @Test
  public void testSchemaStatements() throws Exception {
    List<String> statements = SqliteMediaStore.readSchema();
    assertEquals(4, statements.size());
    assertTrue(statements.get(0).startsWith("CREATE TABLE IF NOT EXISTS "
        + "owners"));
  }

  @Test
  public void testOwnersAreCreatedOnce() throws Exception {
    long first = this.store.getOrCreateOwner(MediaStore.PLATFORM_GRAPH, "u1");
    long again = this.store.getOrCreateOwner(MediaStore.PLATFORM_GRAPH, "u1");
    long other = this.store.getOrCreateOwner(MediaStore.PLATFORM_GRAPH, "u2");
    assertEquals(first, again);
    assertNotEquals(first, other);
    assertNotEquals(first, this.store.getOrCreateOwner(2, "u1"));
  }

  @Test
  public void testMediaRecords() throws Exception {
    long owner = this.store.getOrCreateOwner(MediaStore.PLATFORM_GRAPH, "u1");
    assertNull(this.store.findMedia(owner, "m1"));
    this.store.insertMedia(owner, "m1", false, "downloads/u1/photos/m1.png");
    MediaRecord record = this.store.findMedia(owner, "m1");
    assertFalse(record.isHighQuality());
    assertEquals("downloads/u1/photos/m1.png", record.getFilePath());
    assertEquals(NOW, record.getCreatedAt());
    this.store.insertMedia(owner, "m1", true, "elsewhere");
    assertFalse(this.store.findMedia(owner, "m1").isHighQuality());
    long other = this.store.getOrCreateOwner(MediaStore.PLATFORM_GRAPH, "u2");
    assertNull(this.store.findMedia(other, "m1"));
  }

  @Test
  public void testUpgrade() throws Exception {
    long owner = this.store.getOrCreateOwner(MediaStore.PLATFORM_GRAPH, "u1");
    this.store.insertMedia(owner, "m1", false, "sd");
    this.store.insertMedia(owner, "m2", false, "sd2");
    this.store.insertMedia(owner, "m3", true, "hd3");
    assertEquals(2, this.store.findStandardQuality(owner).size());
    assertTrue(this.store.upgradeMedia(owner, "m1", "hd"));
    MediaRecord record = this.store.findMedia(owner, "m1");
    assertTrue(record.isHighQuality());
    assertEquals("hd", record.getFilePath());
    List<MediaRecord> standard = this.store.findStandardQuality(owner);
    assertEquals(1, standard.size());
    assertEquals("m2", standard.get(0).getMediaId());
    assertFalse(this.store.upgradeMedia(owner, "unknown", "x"));
  }

  @Test
  public void testCursors() throws Exception {
    long owner = this.store.getOrCreateOwner(MediaStore.PLATFORM_GRAPH, "u1");
    assertNull(this.store.findCursor(owner, CollectionKind.USER_PHOTOS));
    this.store.saveCursor(owner, CollectionKind.USER_PHOTOS, "C1", 1);
    this.store.saveCursor(owner, CollectionKind.USER_PHOTOS, "C2", 2);
    this.store.saveCursor(owner, CollectionKind.WALL_MEDIA, "W1", 1);
    PaginationCursor cursor = this.store.findCursor(owner,
        CollectionKind.USER_PHOTOS);
    assertEquals("C2", cursor.getCursorToken());
    assertEquals(2, cursor.getPagesLoaded());
    assertEquals(NOW, cursor.getLastUpdated());
    this.store.clearCursor(owner, CollectionKind.USER_PHOTOS);
    assertNull(this.store.findCursor(owner, CollectionKind.USER_PHOTOS));
    assertEquals("W1", this.store.findCursor(owner,
        CollectionKind.WALL_MEDIA).getCursorToken());
  }

  @Test
  public void testReopenKeepsRecords() throws Exception {
    long owner = this.store.getOrCreateOwner(MediaStore.PLATFORM_GRAPH, "u1");
    this.store.insertMedia(owner, "m1", true, "hd");
    this.store.close();
    this.store = new SqliteMediaStore(this.databasePath);
    assertEquals(owner, this.store.getOrCreateOwner(
        MediaStore.PLATFORM_GRAPH, "u1"));
    assertTrue(this.store.findMedia(owner, "m1").isHighQuality());
    assertTrue(this.store.isEnabled());
  }
}
