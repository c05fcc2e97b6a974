package com.eainde.policyaudit.pipeline;

import com.eainde.policyaudit.model.RawRuleRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * File-in, file-out runner.
 *
 * <pre>
 * java -jar policy-audit.jar \
 *     --policy-audit.runner.input=rules.json \
 *     --policy-audit.runner.output=analysis.json
 * </pre>
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "policy-audit.runner", name = "input")
public class AnalysisFileRunner implements ApplicationRunner {

    private final PolicyAnalysisPipeline pipeline;
    private final ObjectMapper objectMapper;

    @Value("${policy-audit.runner.input}")
    private String input;

    @Value("${policy-audit.runner.output:analysis-result.json}")
    private String output;

    public AnalysisFileRunner(PolicyAnalysisPipeline pipeline, ObjectMapper objectMapper) {
        this.pipeline = pipeline;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) {
        run(Path.of(input), Path.of(output));
    }

    public AnalysisResult run(Path inputFile, Path outputFile) {
        List<RawRuleRecord> records;
        try {
            records = objectMapper.readValue(inputFile.toFile(), new TypeReference<List<RawRuleRecord>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read rule rows from " + inputFile, e);
        }

        AnalysisResult result = pipeline.run(records);

        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputFile.toFile(), result);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write analysis result to " + outputFile, e);
        }
        log.info("Wrote {} contradictions and {} gap rows to {}",
                result.contradictions().size(), result.gaps().size(), outputFile);
        return result;
    }
}
