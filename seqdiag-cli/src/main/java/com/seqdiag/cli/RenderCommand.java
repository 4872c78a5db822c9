package com.seqdiag.cli;

import com.seqdiag.core.config.ConfigLoader;
import com.seqdiag.core.config.DiagramConfig;
import com.seqdiag.core.generator.GeneratedDiagram;
import com.seqdiag.core.generator.SequenceDiagramGenerator;
import com.seqdiag.core.parser.ParserException;
import com.seqdiag.core.tokenizer.TokenizerException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to render a sequence file to an SVG diagram.
 */
@Command(
    name = "render",
    description = "Render a sequence file to SVG",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    @Parameters(index = "0", description = "Sequence source file")
    private Path inputFile;

    @Option(names = {"-o", "--output"}, description = "Output SVG file (default: input file with .svg extension)")
    private Path outputFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file")
    private Path configFile = Paths.get("seqdiag.yaml");

    @Override
    public Integer call() {
        String source;
        try {
            source = Files.readString(inputFile);
        } catch (IOException e) {
            log.error("Failed to read input file: {}", inputFile, e);
            System.err.println("Cannot read " + inputFile + ": " + e.getMessage());
            return ExitCodes.IO_ERROR;
        }

        DiagramConfig config = ConfigLoader.load(configFile);
        Path target = outputFile != null ? outputFile : defaultOutput(inputFile);

        GeneratedDiagram diagram;
        try {
            diagram = new SequenceDiagramGenerator(config).generate(baseName(inputFile), source);
        } catch (TokenizerException e) {
            System.err.println(Diagnostics.format(inputFile, source, e));
            return ExitCodes.INVALID_INPUT;
        } catch (ParserException e) {
            System.err.println(Diagnostics.format(inputFile, source, e));
            return ExitCodes.INVALID_INPUT;
        }

        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, diagram.content());
        } catch (IOException e) {
            log.error("Failed to write output file: {}", target, e);
            System.err.println("Cannot write " + target + ": " + e.getMessage());
            return ExitCodes.IO_ERROR;
        }

        log.info("Wrote {} ({} bytes)", target, diagram.content().length());
        return ExitCodes.OK;
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static Path defaultOutput(Path input) {
        return input.resolveSibling(baseName(input) + ".svg");
    }
}
