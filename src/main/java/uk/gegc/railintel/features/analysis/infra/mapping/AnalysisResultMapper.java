package uk.gegc.railintel.features.analysis.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.railintel.features.analysis.api.dto.AnalysisResponse;
import uk.gegc.railintel.features.analysis.api.dto.ClassificationDto;
import uk.gegc.railintel.features.analysis.api.dto.FileReferenceDto;
import uk.gegc.railintel.features.analysis.api.dto.InsightsDto;
import uk.gegc.railintel.features.analysis.api.dto.MetadataDto;
import uk.gegc.railintel.features.analysis.domain.model.AnalysisMetadata;
import uk.gegc.railintel.features.analysis.domain.model.AnalysisResult;
import uk.gegc.railintel.features.analysis.domain.model.ClassificationEntry;
import uk.gegc.railintel.features.analysis.domain.model.ClassificationInsights;
import uk.gegc.railintel.features.analysis.domain.model.ClassificationMode;
import uk.gegc.railintel.features.analysis.domain.model.DocumentCategory;
import uk.gegc.railintel.features.analysis.domain.model.ProcessingMode;
import uk.gegc.railintel.features.ocr.domain.SourceFile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts analyses between the domain model and the wire format, in both directions. Posted
 * analyses come from clients, so the inbound direction tolerates missing and unknown values.
 */
@Component
public class AnalysisResultMapper {

    public AnalysisResponse toResponse(AnalysisResult result) {
        return new AnalysisResponse(
                result.documentType(),
                result.classification().stream().map(this::toDto).toList(),
                toDto(result.insights()),
                result.ocrText(),
                result.summary(),
                result.keyInformation(),
                toDto(result.metadata())
        );
    }

    /**
     * Rebuilds a domain result from a posted analysis. Entries with an unknown category are dropped.
     */
    public AnalysisResult fromResponse(AnalysisResponse response) {
        if (response == null) {
            return null;
        }
        List<ClassificationEntry> classification = new ArrayList<>();
        if (response.classification() != null) {
            for (ClassificationDto dto : response.classification()) {
                if (dto == null) {
                    continue;
                }
                resolveCategory(dto).ifPresent(category -> classification.add(new ClassificationEntry(
                        category, clamp(dto.confidence()), clamp(dto.operatorRelevance()))));
            }
        }
        return new AnalysisResult(
                response.documentType(),
                response.summary(),
                response.ocrText(),
                classification,
                response.keyInformation(),
                ClassificationInsights.from(classification),
                fromDto(response.metadata())
        );
    }

    public List<SourceFile> toSourceFiles(List<FileReferenceDto> files) {
        return files.stream()
                .map(file -> new SourceFile(Path.of(file.path()), file.originalName()))
                .toList();
    }

    private ClassificationDto toDto(ClassificationEntry entry) {
        return new ClassificationDto(entry.label(), entry.category().getKey(), entry.confidence(), entry.operatorRelevance());
    }

    private InsightsDto toDto(ClassificationInsights insights) {
        if (insights == null) {
            return null;
        }
        return new InsightsDto(
                insights.primaryCategory(),
                insights.primaryConfidence(),
                insights.confidenceLevel().getDescription(),
                insights.highConfidenceCount(),
                insights.operatorRelevance(),
                insights.operatorDocument(),
                insights.categoryCount()
        );
    }

    private MetadataDto toDto(AnalysisMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        return new MetadataDto(
                metadata.totalPages(),
                metadata.filesProcessed(),
                metadata.languagesDetected(),
                metadata.ocrLanguage(),
                metadata.classificationMode().getValue(),
                metadata.totalCharacters(),
                metadata.processingMode().getValue(),
                metadata.degraded(),
                metadata.chunkCount(),
                metadata.failedChunks(),
                metadata.cancelled(),
                metadata.notice(),
                metadata.processingTimeMs()
        );
    }

    private AnalysisMetadata fromDto(MetadataDto dto) {
        if (dto == null) {
            return null;
        }
        return new AnalysisMetadata(
                dto.totalPages(),
                dto.filesProcessed(),
                dto.languagesDetected(),
                dto.ocrLanguage(),
                ClassificationMode.fromValue(dto.classificationMode()),
                dto.totalCharacters(),
                ProcessingMode.fromValue(dto.processingMode()),
                dto.chunkCount(),
                dto.failedChunks(),
                dto.cancelled(),
                dto.notice(),
                dto.processingTimeMs()
        );
    }

    private Optional<DocumentCategory> resolveCategory(ClassificationDto dto) {
        return DocumentCategory.fromKey(dto.categoryKey()).or(() -> DocumentCategory.fromKey(dto.category()));
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
