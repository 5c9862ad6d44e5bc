package com.flamingo.ai.labmatch.service.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.labmatch.config.MatchingConfig;
import com.flamingo.ai.labmatch.domain.enums.SectionType;
import com.flamingo.ai.labmatch.domain.model.CorpusEntity;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads lab profiles from the crawler's JSON export.
 *
 * <p>{@code labs.json} maps a lab id to its metadata; {@code documents.json} maps a document id to
 * {@code lab_id}, {@code section} and {@code text}. Documents are grouped per lab and section in
 * file order, keeping at most {@code max-documents-per-section} per section. Sections with labels
 * that carry no ranking signal are ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonFileCorpusSource implements CorpusSource {

  private final ObjectMapper objectMapper;
  private final MatchingConfig matchingConfig;

  @Override
  public List<CorpusEntity> listEntities() throws IOException {
    MatchingConfig.Corpus settings = matchingConfig.getCorpus();
    JsonNode labs = readObject(Path.of(settings.getLabsPath()));
    JsonNode documents = readObject(Path.of(settings.getDocumentsPath()));

    Map<String, Map<SectionType, List<String>>> sectionsByLab =
        groupDocuments(documents, settings.getMaxDocumentsPerSection());

    List<CorpusEntity> entities = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> fields = labs.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> entry = fields.next();
      entities.add(toEntity(entry.getKey(), entry.getValue(), sectionsByLab));
    }
    log.debug("Read {} labs from {}", entities.size(), describe());
    return entities;
  }

  @Override
  public String describe() {
    MatchingConfig.Corpus settings = matchingConfig.getCorpus();
    return settings.getLabsPath() + " + " + settings.getDocumentsPath();
  }

  private JsonNode readObject(Path path) throws IOException {
    if (!Files.isRegularFile(path)) {
      throw new IOException("Corpus file not found: " + path.toAbsolutePath());
    }
    JsonNode node = objectMapper.readTree(path.toFile());
    if (node == null || !node.isObject()) {
      throw new IOException("Corpus file must contain a JSON object: " + path);
    }
    return node;
  }

  private Map<String, Map<SectionType, List<String>>> groupDocuments(
      JsonNode documents, int maxPerSection) {
    Map<String, Map<SectionType, List<String>>> grouped = new HashMap<>();
    int skipped = 0;
    for (JsonNode document : documents) {
      String labId = document.path("lab_id").asText("");
      String text = document.path("text").asText("").strip();
      Optional<SectionType> section = SectionType.fromLabel(document.path("section").asText(""));
      if (labId.isEmpty() || text.isEmpty() || section.isEmpty()) {
        skipped++;
        continue;
      }
      List<String> texts =
          grouped
              .computeIfAbsent(labId, id -> new EnumMap<>(SectionType.class))
              .computeIfAbsent(section.get(), s -> new ArrayList<>());
      if (texts.size() < maxPerSection) {
        texts.add(text);
      }
    }
    if (skipped > 0) {
      log.debug("Skipped {} documents without lab, text or a ranked section", skipped);
    }
    return grouped;
  }

  private CorpusEntity toEntity(
      String id, JsonNode lab, Map<String, Map<SectionType, List<String>>> sectionsByLab) {
    String name = lab.path("kor_name").asText("");
    if (name.isBlank()) {
      name = lab.path("name").asText("");
    }
    CorpusEntity.CorpusEntityBuilder builder =
        CorpusEntity.builder()
            .id(id)
            .name(name)
            .owner(lab.path("professor").asText(""))
            .contact(lab.path("email").asText(""))
            .description(lab.path("description").asText(""))
            .department(lab.path("department").asText(""))
            .homepage(lab.path("homepage").asText(""))
            .location(lab.path("location").asText(""));
    sectionsByLab
        .getOrDefault(id, Map.of())
        .forEach((type, texts) -> builder.section(type, String.join(" ", texts)));
    return builder.build();
  }
}
