package com.poc.typeaudit.service;

import com.poc.typeaudit.config.ReportProperties;
import com.poc.typeaudit.dto.AnalysisResult;
import com.poc.typeaudit.dto.ReportResult;
import com.poc.typeaudit.exception.ReportErrorKind;
import com.poc.typeaudit.exception.TypeAuditException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry point of the audit: load, analyze, compose, then publish the report.
 * Each call runs synchronously in its own temporary workspace.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TypeAuditService {

    static final int TOKEN_LENGTH = 10;

    private static final Pattern TOKEN_PATTERN = Pattern.compile("(_[0-9a-f]{" + TOKEN_LENGTH + "})$");
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[\\\\/:*?\"<>|\\p{Cntrl}]");

    private final TabularLoader tabularLoader;
    private final ConsistencyAnalyzer consistencyAnalyzer;
    private final ReportComposer reportComposer;
    private final FileStorageService fileStorageService;
    private final ReportProperties properties;

    public ReportResult analyzeAndReport(InputStream fileStream, String formatHint, String originalFilename) {
        return analyzeAndReport(fileStream, formatHint, originalFilename, fileStorageService);
    }

    /**
     * @param formatHint extension or filename; when {@code null} the extension of {@code originalFilename} is used
     * @param sink       receives the finished report; nothing is written to it when any step fails
     */
    public ReportResult analyzeAndReport(InputStream fileStream, String formatHint, String originalFilename,
                                         FileStorageService sink) {
        SpreadsheetFormat format = SpreadsheetFormat.fromHint(formatHint != null ? formatHint : originalFilename);
        log.info("Auditing '{}' as .{}", originalFilename, format.getExtension());

        try (RequestWorkspace workspace = new RequestWorkspace()) {
            Path staged = workspace.stage(fileStream, "upload." + format.getExtension());

            String token;
            try (InputStream in = Files.newInputStream(staged)) {
                token = DigestUtils.sha256Hex(in).substring(0, TOKEN_LENGTH);
            }

            try (InputStream in = Files.newInputStream(staged);
                 LoadedDocument document = tabularLoader.load(in, format)) {

                AnalysisResult analysis = consistencyAnalyzer.analyze(document.getDataset());
                byte[] report = reportComposer.compose(document, analysis);

                String outputFilename = generateOutputFileName(originalFilename, format, token);
                String path = sink.saveFile(report, outputFilename);
                log.info("Report for '{}' saved to {}", originalFilename, path);

                return new ReportResult(outputFilename, analysis.getRows().size(), analysis.getFlaggedCount(),
                        analysis.getInconsistentNames().size(), analysis.getSummary().size());
            }
        } catch (TypeAuditException e) {
            log.warn("Audit of '{}' rejected [{}]: {}", originalFilename, e.getKind(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Unexpected failure while auditing '{}'", originalFilename, e);
            throw new TypeAuditException(ReportErrorKind.INTERNAL_FAILURE,
                    "Internal server error while processing the file. Please try again later or contact the administrator.", e);
        }
    }

    /**
     * {@code <prefix><base>[_<token>].<ext>}. A prefix and token left by an earlier run are
     * stripped first so a report fed back in keeps a stable name.
     */
    String generateOutputFileName(String originalFilename, SpreadsheetFormat format, String token) {
        String name = originalFilename == null ? "Unknown_File" : originalFilename;
        name = name.substring(Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\')) + 1);

        int dotIndex = name.lastIndexOf('.');
        String baseName = dotIndex <= 0 ? name : name.substring(0, dotIndex);
        baseName = UNSAFE_CHARS.matcher(baseName).replaceAll("_");

        String prefix = properties.getOutputPrefix();
        if (!prefix.isEmpty() && baseName.startsWith(prefix) && baseName.length() > prefix.length()) {
            baseName = baseName.substring(prefix.length());
            Matcher matcher = TOKEN_PATTERN.matcher(baseName);
            if (matcher.find() && matcher.start() > 0) {
                baseName = baseName.substring(0, matcher.start());
            }
        }
        if (baseName.isBlank()) {
            baseName = "Unknown_File";
        }

        String suffix = properties.isUniqueToken() ? "_" + token : "";
        return prefix + baseName + suffix + "." + format.getOutputExtension();
    }
}
