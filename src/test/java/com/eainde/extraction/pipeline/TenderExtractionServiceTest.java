package com.eainde.extraction.pipeline;

import com.eainde.extraction.exception.ExtractionException;
import com.eainde.extraction.model.CandidateRecord;
import com.eainde.extraction.model.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TenderExtractionServiceTest {

    @Mock
    private ExtractionPipelineOrchestrator orchestrator;

    @Mock
    private ReferenceFetcher referenceFetcher;

    @Mock
    private DocumentDecoder decoder;

    private static SourceFile file(String name, String text) {
        return new SourceFile(name, text.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("process")
    class Process {

        @Test
        void process_shouldDecodeAllFiles_andRunPipelineOnce() {
            // Arrange
            TenderExtractionService service = new TenderExtractionService(
                    DocumentDecoder.utf8Text(), referenceFetcher, orchestrator);
            ExtractionResult expected = new ExtractionResult(CandidateRecord.EMPTY, null);
            when(orchestrator.run(anyList())).thenReturn(expected);

            // Act
            ExtractionResult result = service.process(List.of(file("nit.pdf", "main"), file("corrigendum.pdf", "fix")));

            // Assert
            assertThat(result).isSameAs(expected);
            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<Document>> captor = ArgumentCaptor.forClass(List.class);
            verify(orchestrator).run(captor.capture());
            assertThat(captor.getValue()).containsExactly(
                    Document.of("nit.pdf", "main"), Document.of("corrigendum.pdf", "fix"));
            verify(referenceFetcher, never()).fetch(anyList());
        }

        @Test
        @DisplayName("references are followed for the primary file only")
        void process_shouldAppendFetchedReferences_forFirstFileOnly() {
            // Arrange
            when(decoder.decode(any())).thenReturn(
                    new DecodedDocument("main", List.of("https://example.org/annex-1.pdf")),
                    new DecodedDocument("second", List.of("https://example.org/annex-2.pdf")));
            when(referenceFetcher.fetch(List.of("https://example.org/annex-1.pdf"))).thenReturn(List.of("annex text"));
            TenderExtractionService service = new TenderExtractionService(decoder, referenceFetcher, orchestrator);

            // Act
            service.process(List.of(file("nit.pdf", "x"), file("boq.pdf", "y")));

            // Assert
            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<Document>> captor = ArgumentCaptor.forClass(List.class);
            verify(orchestrator).run(captor.capture());
            assertThat(captor.getValue()).extracting(Document::text).containsExactly("main\n\nannex text", "second");
            verify(referenceFetcher).fetch(List.of("https://example.org/annex-1.pdf"));
        }

        @Test
        void process_shouldSkipUndecodableAndBlankFiles() {
            when(decoder.decode(any()))
                    .thenThrow(new IllegalStateException("corrupt PDF"))
                    .thenReturn(new DecodedDocument("   ", List.of()))
                    .thenReturn(new DecodedDocument("usable", List.of()));
            TenderExtractionService service = new TenderExtractionService(decoder, referenceFetcher, orchestrator);

            service.process(List.of(file("a.pdf", ""), file("b.pdf", ""), file("c.pdf", "")));

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<Document>> captor = ArgumentCaptor.forClass(List.class);
            verify(orchestrator).run(captor.capture());
            assertThat(captor.getValue()).extracting(Document::identifier).containsExactly("c.pdf");
        }

        @Test
        void process_shouldThrow_whenNothingDecodes() {
            TenderExtractionService service = new TenderExtractionService(
                    DocumentDecoder.utf8Text(), referenceFetcher, orchestrator);

            assertThatThrownBy(() -> service.process(List.of(file("empty.pdf", " "))))
                    .isInstanceOf(ExtractionException.class)
                    .hasMessageContaining("No content could be extracted");
            assertThatThrownBy(() -> service.process(List.of()))
                    .isInstanceOf(ExtractionException.class);
            verify(orchestrator, never()).run(anyList());
        }
    }
}
