package com.seqdiag.core.generator;

import com.seqdiag.core.config.DiagramConfig;
import com.seqdiag.core.diagram.Diagram;
import com.seqdiag.core.parser.ParserException;
import com.seqdiag.core.parser.SequenceParser;
import com.seqdiag.core.renderer.impl.SvgRenderer;
import com.seqdiag.core.sequence.Sequence;
import com.seqdiag.core.tokenizer.Token;
import com.seqdiag.core.tokenizer.Tokenizer;
import com.seqdiag.core.tokenizer.TokenizerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs the whole pipeline from source text to an SVG diagram.
 *
 * <p>Source is tokenized, parsed into a {@link Sequence}, turned into a {@link Diagram},
 * laid out with the configured attributes and drawn to an {@link SvgRenderer}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * SequenceDiagramGenerator generator = new SequenceDiagramGenerator(DiagramConfig.defaults());
 * GeneratedDiagram diagram = generator.generate("login", source);
 * // diagram.content() contains the SVG document
 * }</pre>
 */
public class SequenceDiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(SequenceDiagramGenerator.class);

    private static final String FILE_EXTENSION = "svg";

    private final DiagramConfig config;
    private final Tokenizer tokenizer = new Tokenizer();
    private final SequenceParser parser = new SequenceParser();

    public SequenceDiagramGenerator(DiagramConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Parses source text into a sequence.
     *
     * @param source sequence source text
     * @return the parsed sequence
     * @throws TokenizerException if the source contains invalid characters
     * @throws ParserException if the source is not a valid sequence
     */
    public Sequence parse(String source) {
        List<Token> tokens = tokenizer.tokenize(source);
        return parser.parse(tokens);
    }

    /**
     * Generates an SVG diagram from source text.
     *
     * @param name diagram name
     * @param source sequence source text
     * @return the generated diagram
     * @throws TokenizerException if the source contains invalid characters
     * @throws ParserException if the source is not a valid sequence
     */
    public GeneratedDiagram generate(String name, String source) {
        Objects.requireNonNull(name, "name must not be null");
        Sequence sequence = parse(source);

        Diagram diagram = Diagram.create(sequence, config);
        diagram.layout(config.toRenderAttributes());

        SvgRenderer renderer = new SvgRenderer();
        diagram.draw(renderer);

        log.info("Generated diagram: {}", name);
        return new GeneratedDiagram(name, renderer.toSvg(diagram.getComputedSize()), FILE_EXTENSION);
    }
}
