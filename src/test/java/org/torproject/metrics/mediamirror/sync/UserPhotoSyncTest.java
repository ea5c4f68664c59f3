/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;

public class UserPhotoSyncTest {

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  private SyncFixture fixture;

  @Before
  public void setUp() throws Exception {
    this.fixture = new SyncFixture(tmpf.getRoot().toPath());
  }

  @After
  public void tearDown() throws Exception {
    this.fixture.close();
  }

  @Test
  public void testPhotosAreSortedIntoAlbumFolders() throws Exception {
    this.fixture.api("U1/photos",
        "type=uploaded&fields=largest_image,name,album", "{\"data\":["
        + "{\"id\":\"1\",\"name\":\"At the lake\",\"album\":{\"name\":"
        + "\"Trip: 2024/07\"},\"largest_image\":{\"source\":\""
        + this.fixture.media("1.jpg", "one") + "\"}},"
        + "{\"id\":\"2\",\"largest_image\":{\"source\":\""
        + this.fixture.media("2.jpg", "two") + "\"}}]}");
    SyncResult result = new UserPhotoSync(this.fixture.context).sync(
        SyncRequest.of("U1"));
    assertEquals(2, result.getSavedPhotos());
    Path user = this.fixture.downloads().resolve("U1").resolve("photos");
    Path trip = user.resolve("Trip_ 2024_07");
    assertEquals("one", SyncFixture.read(trip.resolve("1.jpg")));
    assertEquals("At the lake", SyncFixture.read(trip.resolve("1.txt")));
    assertEquals("two", SyncFixture.read(user.resolve(
        UserPhotoSync.NO_ALBUM_FOLDER).resolve("2.jpg")));
    assertFalse(Files.exists(user.resolve(UserPhotoSync.NO_ALBUM_FOLDER)
        .resolve("2.txt")));
  }

  @Test
  public void testUploadsAreAlreadyHighQuality() throws Exception {
    this.fixture.settings.setHighQuality(true);
    this.fixture.api("U1/photos",
        "type=uploaded&fields=largest_image,name,album", "{\"data\":["
        + "{\"id\":\"1\",\"largest_image\":{\"source\":\""
        + this.fixture.media("1.jpg", "one") + "\"}}]}");
    new UserPhotoSync(this.fixture.context).sync(SyncRequest.of("U1"));
    assertTrue(this.fixture.tracker.findStandardQuality(
        this.fixture.tracker.ownerFor("U1")).isEmpty());
    assertEquals(0, this.fixture.connections.count(
        this.fixture.client.graphUrl("1", "fields=largest_image")));
  }

  @Test
  public void testSanitizeFolderName() {
    assertEquals("a_b_c_d", MediaSaver.sanitizeFolderName("a<b>c|d"));
    assertEquals("Summer 2024", MediaSaver.sanitizeFolderName(
        "  Summer \t 2024 "));
    assertEquals("(no name)", MediaSaver.sanitizeFolderName(null));
    assertEquals("(no name)", MediaSaver.sanitizeFolderName("   "));
    assertEquals("(no name)", MediaSaver.sanitizeFolderName(".."));
    StringBuilder longName = new StringBuilder();
    for (int i = 0; i < 30; i++) {
      longName.append("word ");
    }
    String truncated = MediaSaver.sanitizeFolderName(longName.toString());
    assertEquals(99, truncated.length());
    assertTrue(truncated.endsWith("word"));
  }
}
