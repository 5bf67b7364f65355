package work.lcod.lexicon.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.lexicon.api.DuplicateIdPolicy;
import work.lcod.lexicon.error.InvalidSchemaException;
import work.lcod.lexicon.error.LexiconNotFoundException;

/**
 * Read-only mapping of lexicon id to document, built once per validation call.
 */
public final class LexiconCatalog {
    private static final Logger LOGGER = LoggerFactory.getLogger(LexiconCatalog.class);
    private static final LexiconCatalog EMPTY = new LexiconCatalog(Map.of());

    private final Map<String, LexiconDocument> documents;

    private LexiconCatalog(Map<String, LexiconDocument> documents) {
        this.documents = documents;
    }

    public static LexiconCatalog empty() {
        return EMPTY;
    }

    public static LexiconCatalog of(Collection<LexiconDocument> documents, DuplicateIdPolicy policy) {
        var byId = new LinkedHashMap<String, LexiconDocument>();
        for (var document : documents) {
            var previous = byId.put(document.id(), document);
            if (previous != null) {
                if (policy == DuplicateIdPolicy.REJECT) {
                    throw new InvalidSchemaException("duplicate lexicon id '" + document.id() + "'");
                }
                LOGGER.warn("Lexicon id {} is defined more than once; keeping the last definition", document.id());
            }
        }
        LOGGER.debug("Built lexicon catalog with {} document(s)", byId.size());
        return new LexiconCatalog(Collections.unmodifiableMap(byId));
    }

    /**
     * Parses every JSON document and builds the catalog; the first malformed document aborts.
     */
    public static LexiconCatalog parse(List<? extends JsonNode> documents, DuplicateIdPolicy policy) {
        var parsed = new ArrayList<LexiconDocument>(documents.size());
        for (var json : documents) {
            parsed.add(LexiconDocument.parse(json));
        }
        return of(parsed, policy);
    }

    public Optional<LexiconDocument> get(String id) {
        return Optional.ofNullable(documents.get(id));
    }

    public boolean contains(String id) {
        return documents.containsKey(id);
    }

    public Collection<LexiconDocument> documents() {
        return documents.values();
    }

    public int size() {
        return documents.size();
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }

    public ObjectNode resolve(Reference reference) {
        var document = documents.get(reference.documentId());
        if (document == null) {
            throw new LexiconNotFoundException(reference.documentId());
        }
        return document.definition(reference.definition())
            .orElseThrow(() -> new InvalidSchemaException("definition not found: " + reference.canonical()));
    }
}
