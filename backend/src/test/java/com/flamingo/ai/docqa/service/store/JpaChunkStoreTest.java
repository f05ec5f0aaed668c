package com.flamingo.ai.docqa.service.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docqa.domain.entity.ChunkRecord;
import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.repository.DocumentRepository;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import(JpaChunkStore.class)
class JpaChunkStoreTest {

  @Autowired private JpaChunkStore chunkStore;
  @Autowired private DocumentRepository documentRepository;

  private UUID notes;
  private UUID atlas;
  private UUID bobsNotes;

  @BeforeEach
  void setUp() {
    notes = document("alice");
    atlas = document("alice");
    bobsNotes = document("bob");
  }

  private UUID document(String owner) {
    return documentRepository
        .saveAndFlush(Document.builder().ownerId(owner).name("notes.txt").rawText("x").build())
        .getId();
  }

  private static ChunkRecord chunk(String owner, UUID documentId, int index, String model) {
    return ChunkRecord.builder()
        .id(ChunkRecord.chunkId(documentId, index))
        .ownerId(owner)
        .documentId(documentId)
        .documentName("notes.txt")
        .chunkIndex(index)
        .text("chunk " + index)
        .embedding(new float[] {0.25f, -1.5f, index})
        .embeddingModelId(model)
        .embeddingDimension(3)
        .page(1)
        .charOffset(index * 10)
        .build();
  }

  @Test
  void shouldRoundTripChunksWithVectors_inIndexOrder() {
    chunkStore.replaceDocument(
        "alice", notes, List.of(chunk("alice", notes, 1, "m"), chunk("alice", notes, 0, "m")));

    List<ChunkRecord> stored = chunkStore.findByDocument("alice", notes);

    assertThat(stored).extracting(ChunkRecord::getChunkIndex).containsExactly(0, 1);
    assertThat(stored.get(1).getEmbedding()).containsExactly(0.25f, -1.5f, 1f);
    assertThat(stored.get(1).getCharOffset()).isEqualTo(10);
  }

  @Test
  void shouldReplaceWholeChunkSet_whenChunkIdsAreReused() {
    chunkStore.replaceDocument(
        "alice", notes, List.of(chunk("alice", notes, 0, "m"), chunk("alice", notes, 1, "m")));

    boolean replaced =
        chunkStore.replaceDocument("alice", notes, List.of(chunk("alice", notes, 0, "m2")));

    assertThat(replaced).isTrue();
    List<ChunkRecord> stored = chunkStore.findByDocument("alice", notes);
    assertThat(stored).hasSize(1);
    assertThat(stored.get(0).getEmbeddingModelId()).isEqualTo("m2");
  }

  @Test
  void shouldWriteNothing_whenDocumentWasDeleted() {
    documentRepository.deleteById(notes);
    documentRepository.flush();

    boolean replaced =
        chunkStore.replaceDocument("alice", notes, List.of(chunk("alice", notes, 0, "m")));

    assertThat(replaced).isFalse();
    assertThat(chunkStore.hasChunks("alice", notes)).isFalse();
  }

  @Test
  void shouldWriteNothing_whenDocumentBelongsToAnotherOwner() {
    boolean replaced =
        chunkStore.replaceDocument("alice", bobsNotes, List.of(chunk("alice", bobsNotes, 0, "m")));

    assertThat(replaced).isFalse();
    assertThat(chunkStore.findByOwner("alice")).isEmpty();
  }

  @Test
  void shouldScopeEveryReadToOwner() {
    chunkStore.replaceDocument("alice", notes, List.of(chunk("alice", notes, 0, "m")));
    chunkStore.replaceDocument("bob", bobsNotes, List.of(chunk("bob", bobsNotes, 0, "m")));

    assertThat(chunkStore.findByOwner("alice"))
        .extracting(ChunkRecord::getOwnerId)
        .containsOnly("alice");
    assertThat(chunkStore.findByDocument("alice", bobsNotes)).isEmpty();
    assertThat(chunkStore.findByIds("alice", List.of(ChunkRecord.chunkId(bobsNotes, 0))))
        .isEmpty();
    assertThat(chunkStore.hasChunks("bob", notes)).isFalse();
  }

  @Test
  void shouldRejectChunksOfAnotherDocument() {
    List<ChunkRecord> foreign = List.of(chunk("alice", atlas, 0, "m"));

    assertThatThrownBy(() -> chunkStore.replaceDocument("alice", notes, foreign))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void shouldReportEmbeddingModelPerDocument() {
    chunkStore.replaceDocument(
        "alice", notes, List.of(chunk("alice", notes, 0, "m"), chunk("alice", notes, 1, "m")));
    chunkStore.replaceDocument("alice", atlas, List.of(chunk("alice", atlas, 0, "other")));

    assertThat(chunkStore.embeddingInfo("alice"))
        .containsExactlyInAnyOrder(
            new DocumentEmbeddingInfo(notes, "m", 3), new DocumentEmbeddingInfo(atlas, "other", 3));
  }

  @Test
  void shouldDeleteOnlyTheGivenDocument() {
    chunkStore.replaceDocument("alice", notes, List.of(chunk("alice", notes, 0, "m")));
    chunkStore.replaceDocument("alice", atlas, List.of(chunk("alice", atlas, 0, "m")));

    chunkStore.deleteDocument("alice", notes);

    assertThat(chunkStore.hasChunks("alice", notes)).isFalse();
    assertThat(chunkStore.hasChunks("alice", atlas)).isTrue();
  }
}
