package com.raditha.cyclone.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.cyclone.analyzer.CloneReport;
import com.raditha.cyclone.model.ClonePair;
import com.raditha.cyclone.model.CloneRegion;
import com.raditha.cyclone.model.CloneType;
import com.raditha.cyclone.model.EditOperation;
import com.raditha.cyclone.model.ParseError;
import com.raditha.cyclone.model.UnmatchedPattern;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Exports clone reports to CSV and JSON formats for dashboards and
 * historical tracking.
 */
public class ReportExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Clock clock;

    public ReportExporter() {
        this(Clock.systemDefaultZone());
    }

    /**
     * @param clock source of the export timestamp
     */
    public ReportExporter(Clock clock) {
        this.clock = clock;
    }

    /**
     * DTO for the JSON export, decoupled from the pattern trees.
     */
    public record ReportDTO(
            LocalDateTime timestamp,
            SummaryDTO summary,
            List<RegionDTO> regions,
            List<ParseErrorDTO> parseErrors,
            List<UnmatchedDTO> unmatchedPatterns) {
    }

    public record SummaryDTO(
            String repositoryA,
            String repositoryB,
            int regions,
            long type1,
            long type2,
            long type3,
            int pairs,
            int patternsA,
            int patternsB,
            int skippedFiles,
            double threshold) {
    }

    public record RegionDTO(
            String type,
            double confidence,
            String fileA,
            int startLineA,
            int endLineA,
            String fileB,
            int startLineB,
            int endLineB,
            int pairs,
            List<String> edits) {
    }

    public record ParseErrorDTO(String repository, String file, int offset, int line, String message) {
    }

    public record UnmatchedDTO(String repository, String file, int startLine, int endLine, int size, String reason) {
    }

    /**
     * Build the export DTO of a report.
     */
    public ReportDTO toDto(CloneReport report) {
        SummaryDTO summary = new SummaryDTO(
                report.repositoryA(),
                report.repositoryB(),
                report.getRegionCount(),
                report.countByType(CloneType.TYPE1),
                report.countByType(CloneType.TYPE2),
                report.countByType(CloneType.TYPE3),
                report.pairCount(),
                report.patternsA(),
                report.patternsB(),
                report.parseErrors().size(),
                report.config().similarityThreshold());

        List<RegionDTO> regions = report.regions().stream().map(ReportExporter::toRegionDto).toList();
        List<ParseErrorDTO> errors = report.parseErrors().stream()
                .map(e -> new ParseErrorDTO(e.repositoryId(), e.fileId(), e.offset(), e.line(), e.message()))
                .toList();
        List<UnmatchedDTO> unmatched = report.unmatchedPatterns().stream()
                .map(u -> new UnmatchedDTO(u.repositoryId(), u.span().fileId(),
                        u.span().startLine(), u.span().endLine(), u.size(), u.reason()))
                .toList();

        return new ReportDTO(LocalDateTime.now(clock).withNano(0), summary, regions, errors, unmatched);
    }

    private static RegionDTO toRegionDto(CloneRegion region) {
        List<String> edits = new ArrayList<>();
        for (ClonePair pair : region.members()) {
            for (EditOperation edit : pair.edits()) {
                edits.add(edit.toDisplayString());
            }
        }
        return new RegionDTO(
                region.type().name(),
                region.confidence(),
                region.fileA(),
                region.startLineA(),
                region.endLineA(),
                region.fileB(),
                region.startLineB(),
                region.endLineB(),
                region.members().size(),
                edits);
    }

    /**
     * Render a report as JSON.
     */
    public String toJson(CloneReport report) {
        try {
            return mapper.writeValueAsString(toDto(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Export a report to JSON format.
     */
    public void exportToJson(CloneReport report, Path outputPath) throws IOException {
        mapper.writeValue(outputPath.toFile(), toDto(report));
    }

    /**
     * Render a report as CSV: one summary row, one row per region and one row
     * per skipped file.
     */
    public String toCsv(CloneReport report) {
        StringBuilder csv = new StringBuilder();

        // Header - Summary
        csv.append("# Summary\n");
        csv.append("timestamp,repository_a,repository_b,regions,type1,type2,type3,pairs,skipped_files,threshold\n");
        csv.append(String.format(Locale.ROOT, "%s,%s,%s,%d,%d,%d,%d,%d,%d,%.2f\n",
                LocalDateTime.now(clock).format(TIMESTAMP_FORMAT),
                escape(report.repositoryA()),
                escape(report.repositoryB()),
                report.getRegionCount(),
                report.countByType(CloneType.TYPE1),
                report.countByType(CloneType.TYPE2),
                report.countByType(CloneType.TYPE3),
                report.pairCount(),
                report.parseErrors().size(),
                report.config().similarityThreshold()));

        csv.append("\n");

        // Header - Regions
        csv.append("# Clone Regions\n");
        csv.append("type,confidence,file_a,start_line_a,end_line_a,file_b,start_line_b,end_line_b,pairs\n");
        for (CloneRegion region : report.regions()) {
            csv.append(String.format(Locale.ROOT, "%s,%.4f,%s,%d,%d,%s,%d,%d,%d\n",
                    region.type().name(),
                    region.confidence(),
                    escape(region.fileA()),
                    region.startLineA(),
                    region.endLineA(),
                    escape(region.fileB()),
                    region.startLineB(),
                    region.endLineB(),
                    region.members().size()));
        }

        if (!report.parseErrors().isEmpty()) {
            csv.append("\n");
            csv.append("# Parse Errors\n");
            csv.append("repository,file,offset,line,message\n");
            for (ParseError error : report.parseErrors()) {
                csv.append(String.format(Locale.ROOT, "%s,%s,%d,%d,%s\n",
                        escape(error.repositoryId()),
                        escape(error.fileId()),
                        error.offset(),
                        error.line(),
                        escape(error.message())));
            }
        }

        if (!report.unmatchedPatterns().isEmpty()) {
            csv.append("\n");
            csv.append("# Unmatched Patterns\n");
            csv.append("repository,file,start_line,end_line,size,reason\n");
            for (UnmatchedPattern pattern : report.unmatchedPatterns()) {
                csv.append(String.format(Locale.ROOT, "%s,%s,%d,%d,%d,%s\n",
                        escape(pattern.repositoryId()),
                        escape(pattern.span().fileId()),
                        pattern.span().startLine(),
                        pattern.span().endLine(),
                        pattern.size(),
                        escape(pattern.reason())));
            }
        }
        return csv.toString();
    }

    /**
     * Export a report to CSV format.
     */
    public void exportToCsv(CloneReport report, Path outputPath) throws IOException {
        Files.writeString(outputPath, toCsv(report));
    }

    /**
     * Quote a field that contains a separator, a quote or a line break.
     */
    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
