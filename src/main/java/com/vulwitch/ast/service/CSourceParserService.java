package com.vulwitch.ast.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vulwitch.ast.cst.SyntaxTree;
import com.vulwitch.ast.cst.treesitter.TreeSitterCFrontend;
import com.vulwitch.ast.error.CodeError;
import com.vulwitch.ast.error.NotYetSupportedError;
import com.vulwitch.ast.error.Unreachable;
import com.vulwitch.ast.lowering.CAstLowerer;
import com.vulwitch.ast.lowering.LoweringConfig;
import com.vulwitch.ast.model.TranslationUnit;

import lombok.Getter;
import lombok.NonNull;

/**
 * Entry point for lowering C sources: parses with tree-sitter and runs a fresh
 * {@link CAstLowerer} per call, so one instance can serve many threads.
 */
public class CSourceParserService {
    private static final Logger log = LoggerFactory.getLogger(CSourceParserService.class);

    @Getter
    private final LoweringConfig config;
    private final TreeSitterCFrontend frontend = new TreeSitterCFrontend();

    public CSourceParserService() {
        this(LoweringConfig.defaults());
    }

    public CSourceParserService(@NonNull LoweringConfig config) {
        this.config = config;
    }

    public TranslationUnit parse(Path path) throws IOException {
        Path source = config.isResolveAbsolutePaths() ? path.toAbsolutePath().normalize() : path;
        byte[] content = Files.readAllBytes(source);
        return parse(source.toString(), content);
    }

    public TranslationUnit parse(String file, byte[] source) {
        log.info("Lowering C source: {}", file);
        SyntaxTree tree = frontend.parse(file, source);
        return new CAstLowerer(tree, config).parseModule();
    }

    /**
     * Lowers an in-memory source and reports failures as an outcome instead of throwing.
     */
    public LoweringOutcome lower(String file, byte[] source) {
        try {
            return LoweringOutcome.lowered(file, parse(file, source));
        } catch (CodeError e) {
            log.error("Malformed input in {}: {}", file, e.getMessage());
            return LoweringOutcome.failed(file, LoweringOutcome.Status.MALFORMED_INPUT, e);
        } catch (NotYetSupportedError e) {
            log.error("Unsupported construct in {}: {}", file, e.getMessage());
            return LoweringOutcome.failed(file, LoweringOutcome.Status.NOT_YET_SUPPORTED, e);
        } catch (Unreachable e) {
            log.error("Internal defect while lowering {}", file, e);
            return LoweringOutcome.failed(file, LoweringOutcome.Status.INTERNAL_DEFECT, e);
        }
    }
}
