package com.flamingo.ai.docqa.service.rag.context;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.service.rag.fusion.Candidate;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Renders candidates as numbered blocks:
 *
 * <pre>
 * [1] handbook.pdf (page 3, chunk 7)
 * chunk text
 * </pre>
 *
 * Blocks are separated by a blank line. The total never exceeds {@code rag.context.max-chars};
 * blocks that do not fit are dropped whole, together with every block after them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContextAssembler {

  private static final String BLOCK_SEPARATOR = "\n\n";

  private final RagConfig ragConfig;

  public AssembledContext assemble(List<Candidate> candidates) {
    int maxChars = ragConfig.getContext().getMaxChars();
    StringBuilder text = new StringBuilder();
    List<Candidate> included = new ArrayList<>();

    for (Candidate candidate : candidates) {
      String block = render(included.size() + 1, candidate);
      int needed = block.length() + (text.length() == 0 ? 0 : BLOCK_SEPARATOR.length());
      if (text.length() + needed > maxChars) {
        log.debug(
            "Context limit {} reached, dropping {} of {} candidates",
            maxChars,
            candidates.size() - included.size(),
            candidates.size());
        break;
      }
      if (text.length() > 0) {
        text.append(BLOCK_SEPARATOR);
      }
      text.append(block);
      included.add(candidate);
    }
    return new AssembledContext(text.toString(), List.copyOf(included));
  }

  static String render(int number, Candidate candidate) {
    return "["
        + number
        + "] "
        + candidate.getDocumentName()
        + " (page "
        + candidate.getPage()
        + ", chunk "
        + candidate.getChunkIndex()
        + ")\n"
        + candidate.getText();
  }
}
