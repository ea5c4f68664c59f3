/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.pagination;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

import java.util.List;

public class AttachmentsTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  private JsonNode json(String text) throws Exception {
    return this.objectMapper.readTree(text.replace('\'', '"'));
  }

  @Test
  public void testAlbumWithPhotoAndVideo() throws Exception {
    List<MediaItem> items = Attachments.flatten(json("{'type':'album',"
        + "'target':{'id':'A1'},'subattachments':{'data':["
        + "{'type':'photo','target':{'id':'P1'},"
        + "'media':{'image':{'src':'https://cdn/p1.jpg'}}},"
        + "{'type':'video_inline','target':{'id':'V1'},"
        + "'media':{'source':'https://cdn/v1.mp4'}}]}}"));
    assertEquals(2, items.size());
    assertEquals(MediaType.PHOTO, items.get(0).getType());
    assertEquals("P1", items.get(0).getId());
    assertEquals("https://cdn/p1.jpg", items.get(0).getUrl());
    assertFalse(items.get(0).isHighQuality());
    assertEquals(MediaType.VIDEO, items.get(1).getType());
    assertEquals("V1", items.get(1).getId());
    assertEquals("https://cdn/v1.mp4", items.get(1).getUrl());
  }

  @Test
  public void testNestedAlbums() throws Exception {
    List<MediaItem> items = Attachments.flatten(json("{'type':'album',"
        + "'target':{'id':'A1'},'subattachments':{'data':[{'type':'album',"
        + "'target':{'id':'A2'},'subattachments':{'data':[{'type':'photo',"
        + "'target':{'id':'P9'},'media':{'image':{'src':'u'}}}]}}]}}"));
    assertEquals(1, items.size());
    assertEquals("P9", items.get(0).getId());
  }

  @Test
  public void testVideoTypes() throws Exception {
    for (String type : new String[] {"video", "video_inline",
        "video_autoplay"}) {
      List<MediaItem> items = Attachments.flatten(json("{'type':'" + type
          + "','target':{'id':'V'},'media':{'source':'s'}}"));
      assertEquals(type, 1, items.size());
      assertFalse(items.get(0).isPhoto());
    }
  }

  @Test
  public void testIncompleteAttachmentsYieldNothing() throws Exception {
    assertTrue(Attachments.flatten(json("{'type':'photo',"
        + "'media':{'image':{'src':'u'}}}")).isEmpty());
    assertTrue(Attachments.flatten(json("{'target':{'id':'P'},"
        + "'media':{'image':{'src':'u'}}}")).isEmpty());
    assertTrue(Attachments.flatten(json("{'type':'photo',"
        + "'target':{'id':'P'}}")).isEmpty());
    assertTrue(Attachments.flatten(json("{'type':'video',"
        + "'target':{'id':'V'},'media':{'image':{'src':'u'}}}")).isEmpty());
    assertTrue(Attachments.flatten(json("{'type':'share',"
        + "'target':{'id':'S'},'media':{'image':{'src':'u'}}}")).isEmpty());
    assertTrue(Attachments.flatten(json("{'type':'album',"
        + "'target':{'id':'A'}}")).isEmpty());
  }

  @Test
  public void testFeedPage() throws Exception {
    List<MediaItem> items = Attachments.fromFeedPage(json("{'data':["
        + "{'id':'post1','attachments':{'data':[{'type':'photo',"
        + "'target':{'id':'P1'},'description':'Sunset',"
        + "'media':{'image':{'src':'u1'}}}]}},"
        + "{'id':'post2'},"
        + "{'id':'post3','attachments':{'data':[{'type':'video',"
        + "'target':{'id':'V3'},'media':{'source':'u3'}}]}}]}"));
    assertEquals(2, items.size());
    assertEquals("Sunset", items.get(0).getCaption());
    assertNull(items.get(1).getCaption());
    assertEquals("V3", items.get(1).getId());
  }

  @Test
  public void testListings() throws Exception {
    JsonNode page = json("{'data':[{'id':'1','name':'Caption',"
        + "'album':{'name':'Trip'},'largest_image':{'source':'l1'}},"
        + "{'id':'2','largest_image':{}},{'id':'3','largest_image':"
        + "{'source':'l3'}}]}");
    List<MediaItem> album = Listings.albumPhotos(page);
    assertEquals(2, album.size());
    assertTrue(album.get(0).isHighQuality());
    assertNull(album.get(0).getCaption());
    List<MediaItem> uploads = Listings.uploadedPhotos(page);
    assertEquals("Caption", uploads.get(0).getCaption());
    assertEquals("Trip", uploads.get(0).getAlbumName());
    assertNull(uploads.get(1).getAlbumName());
    assertEquals("l3", uploads.get(1).getUrl());
  }

  @Test
  public void testFeedVideos() throws Exception {
    List<MediaItem> videos = Listings.feedVideos(json("{'data':[{"
        + "'attachments':{'data':[{'type':'photo','target':{'id':'P'},"
        + "'media':{'image':{'src':'u'}}},{'type':'video_autoplay',"
        + "'target':{'id':'V'},'media':{'source':'s'}}]}}]}"));
    assertEquals(1, videos.size());
    assertEquals("V", videos.get(0).getId());
  }
}
