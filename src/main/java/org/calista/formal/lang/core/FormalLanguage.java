package org.calista.formal.lang.core;

import org.calista.formal.lang.FormalException;
import org.calista.formal.lang.ast.Node.Program;
import org.calista.formal.lang.commit.Fingerprinter;
import org.calista.formal.lang.eval.AmbiguityPolicy;
import org.calista.formal.lang.export.Brain;
import org.calista.formal.lang.lexer.Lexer;
import org.calista.formal.lang.lexer.Token;
import org.calista.formal.lang.lexer.UnknownCharacterPolicy;
import org.calista.formal.lang.lexer.impl.FormalLexer;
import org.calista.formal.lang.parser.Parser;
import org.calista.formal.lang.universe.ConstraintChecker;
import org.calista.formal.lang.universe.Universe;
import org.calista.formal.lang.universe.impl.ExistenceConstraintChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * FormalLanguage: source text to tokens, AST, Universe or Brain.
 *
 * <p>Stateless apart from its settings; every {@link #evaluate(String)} returns a fresh,
 * caller-owned Universe. Safe to share across threads.</p>
 */
public final class FormalLanguage {

    private static final Logger log = LoggerFactory.getLogger(FormalLanguage.class);

    private final Lexer lexer;
    private final Fingerprinter fingerprinter;
    private final AmbiguityPolicy ambiguity;
    private final ConstraintChecker constraintChecker;
    private final Clock clock;

    private FormalLanguage(Builder b) {
        FormalLexer.Config lc = new FormalLexer.Config();
        lc.unknownCharacters = b.unknownCharacters;
        this.lexer = new FormalLexer(lc);
        this.fingerprinter = new Fingerprinter(b.fingerprintLength);
        this.ambiguity = b.ambiguity;
        this.constraintChecker = b.constraintChecker;
        this.clock = b.clock;
    }

    /** Language configured from {@code cfg} (normalized first), stamping exports with {@code clock}. */
    public static FormalLanguage fromConfig(FormalConfig cfg, Clock clock) {
        Objects.requireNonNull(cfg, "cfg");
        cfg.validate();
        return builder()
                .unknownCharacters(cfg.lexer.unknownCharacters)
                .ambiguity(cfg.evaluation.ambiguousReferences)
                .fingerprintLength(cfg.hashing.fingerprintLength)
                .clock(clock)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private UnknownCharacterPolicy unknownCharacters = UnknownCharacterPolicy.SKIP;
        private AmbiguityPolicy ambiguity = AmbiguityPolicy.FIRST_MATCH;
        private int fingerprintLength = Fingerprinter.DEFAULT_LENGTH;
        private ConstraintChecker constraintChecker = ExistenceConstraintChecker.INSTANCE;
        private Clock clock = Clock.systemUTC();

        public Builder unknownCharacters(UnknownCharacterPolicy policy) {
            this.unknownCharacters = Objects.requireNonNull(policy, "unknownCharacters");
            return this;
        }

        public Builder ambiguity(AmbiguityPolicy policy) {
            this.ambiguity = Objects.requireNonNull(policy, "ambiguity");
            return this;
        }

        /** Validated when {@link #build()} creates the {@link Fingerprinter}. */
        public Builder fingerprintLength(int length) {
            this.fingerprintLength = length;
            return this;
        }

        public Builder constraintChecker(ConstraintChecker checker) {
            this.constraintChecker = Objects.requireNonNull(checker, "constraintChecker");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public FormalLanguage build() {
            return new FormalLanguage(this);
        }
    }

    // ---------------------------------------------------------------------
    // API
    // ---------------------------------------------------------------------

    public List<Token> tokenize(String source) {
        return lexer.tokenize(source);
    }

    /** Tokens plus warnings for skipped characters. */
    public Lexer.Result scan(String source) {
        return lexer.scan(source);
    }

    public Program parse(String source) {
        return Parser.parse(lexer.tokenize(source));
    }

    /** Empty Universe with this language's settings. */
    public Universe newUniverse() {
        return Universe.builder()
                .clock(clock)
                .fingerprinter(fingerprinter)
                .ambiguity(ambiguity)
                .constraintChecker(constraintChecker)
                .build();
    }

    /**
     * Tokenize, parse and evaluate into a fresh Universe.
     *
     * @throws FormalException on lexical, syntax or evaluation failure
     */
    public Universe evaluate(String source) {
        return newUniverse().eval(parse(source));
    }

    /**
     * Parse without evaluating. Lexical and syntax failures are reported, not thrown.
     */
    public ValidationResult validateSource(String source) {
        try {
            return ValidationResult.ok(parse(source));
        } catch (FormalException e) {
            log.debug("validateSource: {}", e.getMessage());
            return ValidationResult.failed(e.getMessage());
        }
    }

    public Brain compileToBrain(String source, String domain) {
        return evaluate(source).toBrain(domain);
    }

    public Fingerprinter fingerprinter() {
        return fingerprinter;
    }

    AmbiguityPolicy ambiguityPolicy() {
        return ambiguity;
    }

    // ---------------------------------------------------------------------

    public static final class ValidationResult {
        public final boolean valid;
        /** {@code null} when valid. */
        public final String error;
        /** {@code null} when invalid. */
        public final Program program;

        private ValidationResult(boolean valid, String error, Program program) {
            this.valid = valid;
            this.error = error;
            this.program = program;
        }

        static ValidationResult ok(Program program) {
            return new ValidationResult(true, null, program);
        }

        static ValidationResult failed(String error) {
            return new ValidationResult(false, error, null);
        }

        @Override
        public String toString() {
            return valid ? "ValidationResult{valid}" : "ValidationResult{invalid: " + error + '}';
        }
    }
}
