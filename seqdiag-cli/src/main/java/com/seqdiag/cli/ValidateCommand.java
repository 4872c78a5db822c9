package com.seqdiag.cli;

import com.seqdiag.core.config.DiagramConfig;
import com.seqdiag.core.generator.SequenceDiagramGenerator;
import com.seqdiag.core.parser.ParserException;
import com.seqdiag.core.sequence.Sequence;
import com.seqdiag.core.tokenizer.TokenizerException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate a sequence file without rendering it.
 */
@Command(
    name = "validate",
    description = "Check a sequence file and report diagnostics",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Sequence source file")
    private Path inputFile;

    @Override
    public Integer call() {
        log.info("Validating sequence: {}", inputFile);

        String source;
        try {
            source = Files.readString(inputFile);
        } catch (IOException e) {
            System.err.println("Cannot read " + inputFile + ": " + e.getMessage());
            return ExitCodes.IO_ERROR;
        }

        try {
            Sequence sequence = new SequenceDiagramGenerator(DiagramConfig.defaults()).parse(source);
            System.out.println(inputFile + ": OK (" + sequence.entities().size() + " entities, "
                + sequence.activations().size() + " root activations)");
            return ExitCodes.OK;
        } catch (TokenizerException e) {
            System.err.println(Diagnostics.format(inputFile, source, e));
            return ExitCodes.INVALID_INPUT;
        } catch (ParserException e) {
            System.err.println(Diagnostics.format(inputFile, source, e));
            return ExitCodes.INVALID_INPUT;
        }
    }
}
