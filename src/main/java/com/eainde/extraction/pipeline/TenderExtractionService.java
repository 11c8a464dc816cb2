package com.eainde.extraction.pipeline;

import com.eainde.extraction.exception.ExtractionException;
import com.eainde.extraction.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for uploaded tender files.
 *
 * For each SourceFile:
 *   1. Decode the content to text
 *   2. For the first (primary) file only, fetch its external references and append their text
 *   3. Collect the decoded Document
 *
 * After all files are decoded:
 *   4. Run the extraction pipeline over all documents as one tender.
 */
public class TenderExtractionService {

    private static final Logger log = LoggerFactory.getLogger(TenderExtractionService.class);

    static final String REFERENCE_SEPARATOR = "\n\n";

    private final DocumentDecoder decoder;
    private final ReferenceFetcher referenceFetcher;
    private final ExtractionPipelineOrchestrator orchestrator;

    public TenderExtractionService(DocumentDecoder decoder,
                                   ReferenceFetcher referenceFetcher,
                                   ExtractionPipelineOrchestrator orchestrator) {
        this.decoder = decoder;
        this.referenceFetcher = referenceFetcher;
        this.orchestrator = orchestrator;
    }

    /**
     * Decodes {@code files} and extracts one tender record from them.
     *
     * @throws ExtractionException when no file yields any text
     */
    public ExtractionResult process(List<SourceFile> files) {
        if (files == null || files.isEmpty()) {
            throw new ExtractionException("No files supplied for extraction");
        }
        log.info("Starting tender extraction for {} files", files.size());

        List<Document> documents = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            SourceFile file = files.get(i);
            log.info("Decoding file {}/{}: {}", i + 1, files.size(), file.name());

            DecodedDocument decoded;
            try {
                decoded = decoder.decode(file.content());
            } catch (RuntimeException e) {
                log.error("Failed to decode file: {}", file.name(), e);
                continue;
            }

            String text = decoded.text();
            if (i == 0 && !decoded.references().isEmpty()) {
                text = appendReferences(file.name(), text, decoded.references());
            }
            if (text.isBlank()) {
                log.warn("No text could be extracted from file: {}", file.name());
                continue;
            }
            documents.add(new Document(file.name(), text, decoded.references()));
        }

        if (documents.isEmpty()) {
            throw new ExtractionException("No content could be extracted from any of " + files.size() + " files");
        }
        return orchestrator.run(documents);
    }

    private String appendReferences(String fileName, String text, List<String> references) {
        log.info("Following {} external references from primary file {}", references.size(), fileName);
        List<String> fetched = referenceFetcher.fetch(references);
        if (fetched.isEmpty()) {
            return text;
        }
        log.info("Fetched {} of {} external references", fetched.size(), references.size());
        return text + REFERENCE_SEPARATOR + String.join(REFERENCE_SEPARATOR, fetched);
    }
}
