package com.codelens.core.analysis;

import com.codelens.core.model.Token;
import com.codelens.core.model.TokenReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Splits source text into whitespace-delimited tokens and reports their frequencies
 * and lexical anomalies.
 *
 * <p>Frequencies are counted over every occurrence. A token is invalid when it is not
 * alphanumeric and not one of {@link Token#OPERATORS}; compound operators such as
 * {@code ==} are therefore invalid.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TokenReport report = new Tokenizer().tokenize("int x = 5 ;");
 * report.frequencyOf("x");   // 1
 * report.invalidTokens();    // []
 * }</pre>
 */
public class Tokenizer {

    private static final Logger log = LoggerFactory.getLogger(Tokenizer.class);

    /**
     * Tokenizes the source. Never fails; blank input yields an empty report.
     *
     * @param source source text
     * @return token frequencies, invalid tokens and elapsed time
     */
    public TokenReport tokenize(String source) {
        Objects.requireNonNull(source, "source must not be null");
        long start = System.nanoTime();

        List<Token> tokens = split(source);

        Map<String, Integer> frequencies = new LinkedHashMap<>();
        for (Token token : tokens) {
            frequencies.merge(token.text(), 1, Integer::sum);
        }

        List<String> invalidTokens = tokens.stream()
            .filter(Token::isInvalid)
            .map(Token::text)
            .toList();

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        log.debug("Tokenized {} tokens ({} distinct, {} invalid) in {}",
            tokens.size(), frequencies.size(), invalidTokens.size(), elapsed);

        return new TokenReport(frequencies, invalidTokens, elapsed);
    }

    /**
     * Splits the source into tokens in source order.
     *
     * @param source source text
     * @return tokens; empty for blank input
     */
    public List<Token> split(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return SourcePatterns.words(source).stream()
            .map(Token::of)
            .toList();
    }
}
