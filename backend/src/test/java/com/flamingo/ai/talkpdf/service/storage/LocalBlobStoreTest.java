package com.flamingo.ai.talkpdf.service.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.talkpdf.config.PipelineConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalBlobStoreTest {

  @TempDir Path root;

  private LocalBlobStore store;

  @BeforeEach
  void setUp() {
    PipelineConfig config = new PipelineConfig();
    config.getStorage().setBasePath(root.toString());
    store = new LocalBlobStore(config);
  }

  @Test
  void shouldWriteAndReadBack() throws Exception {
    String ref = store.upload("owner/doc/audio.mp3", new byte[] {1, 2, 3}, "audio/mpeg");

    assertThat(ref).isEqualTo("owner/doc/audio.mp3");
    assertThat(Files.exists(root.resolve("owner/doc/audio.mp3"))).isTrue();
    assertThat(store.download(ref)).isEqualTo(new byte[] {1, 2, 3});
  }

  @Test
  void shouldFail_whenBlobMissing() {
    assertThatThrownBy(() -> store.download("owner/missing.pdf"))
        .isInstanceOf(BlobStorageException.class)
        .hasMessageContaining("not found");
  }

  @Test
  void shouldRejectPathsOutsideRoot() {
    assertThatThrownBy(() -> store.upload("../escape.bin", new byte[] {1}, "audio/mpeg"))
        .isInstanceOf(BlobStorageException.class);
    assertThatThrownBy(() -> store.download(" ")).isInstanceOf(BlobStorageException.class);
  }
}
