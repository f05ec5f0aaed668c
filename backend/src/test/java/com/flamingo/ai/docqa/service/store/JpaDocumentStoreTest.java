package com.flamingo.ai.docqa.service.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.repository.DocumentRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import(JpaDocumentStore.class)
class JpaDocumentStoreTest {

  @Autowired private JpaDocumentStore documentStore;

  @Autowired private DocumentRepository documentRepository;

  private Document save(String owner, String name, String text) {
    return documentRepository.save(
        Document.builder().ownerId(owner).name(name).rawText(text).build());
  }

  @Test
  void shouldRankDocumentsByQueryTermOccurrences() {
    save("alice", "cooking.txt", "Pasta with tomato sauce.");
    Document france = save("alice", "france.txt", "France and Paris. Paris has the Eiffel Tower.");
    Document travel = save("alice", "travel.txt", "Trains to Paris.");

    assertThat(documentStore.freeTextSearch("alice", "paris france", 5))
        .extracting(Document::getId)
        .containsExactly(france.getId(), travel.getId());
  }

  @Test
  void shouldNeverReturnAnotherOwnersDocuments() {
    save("bob", "paris.txt", "Paris Paris Paris.");

    assertThat(documentStore.freeTextSearch("alice", "paris", 5)).isEmpty();
  }

  @Test
  void shouldHonourLimit() {
    save("alice", "a.txt", "paris");
    save("alice", "b.txt", "paris");

    assertThat(documentStore.freeTextSearch("alice", "paris", 1)).hasSize(1);
  }

  @Test
  void shouldScopeGetToOwner() {
    Document document = save("alice", "a.txt", "text");

    assertThat(documentStore.get("alice", document.getId())).isPresent();
    assertThat(documentStore.get("bob", document.getId())).isEmpty();
  }
}
