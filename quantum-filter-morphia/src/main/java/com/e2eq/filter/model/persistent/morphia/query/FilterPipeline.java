package com.e2eq.filter.model.persistent.morphia.query;

import com.e2eq.filter.exceptions.FilterRejectedException;
import com.e2eq.filter.exceptions.InvalidFilterException;
import com.e2eq.filter.model.persistent.morphia.compiler.mongo.MongoFilterCompiler;
import com.e2eq.filter.model.persistent.morphia.sanitizer.FilterSanitizer;
import com.e2eq.filter.model.security.FilterSecurityPolicy;
import com.e2eq.filter.model.security.SanitizationResult;
import com.e2eq.filter.model.security.SanitizerOptions;
import io.quarkus.logging.Log;
import org.bson.Document;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read, sanitize, compile. The only path by which a client supplied filter string reaches the database.
 *
 * <p>Violations are logged without the raw filter text. Whether a violation rejects the request or only
 * narrows the filter is decided by {@link Builder#rejectOnFatalViolation(boolean)} and
 * {@link Builder#rejectOnViolation(boolean)}.</p>
 */
public class FilterPipeline {

    private final FilterJsonReader reader;
    private final MongoFilterCompiler compiler;
    private final SanitizerOptions defaultOptions;
    private final SanitizerOptions trustedOptions;
    private final boolean rejectOnFatalViolation;
    private final boolean rejectOnViolation;

    private FilterPipeline(Builder b) {
        this.reader = b.reader;
        this.compiler = b.compiler;
        this.defaultOptions = b.defaultOptions;
        this.rejectOnFatalViolation = b.rejectOnFatalViolation;
        this.rejectOnViolation = b.rejectOnViolation;
        // back end filters may name protected fields but still only speak the DSL
        this.trustedOptions = SanitizerOptions.of(b.defaultOptions.policy().toBuilder()
                .protectedFields(Set.of())
                .fieldWhitelist(null)
                .build());
    }

    public static Builder builder() {
        return new Builder();
    }

    public MongoFilterCompiler compiler() {
        return compiler;
    }

    public SanitizerOptions defaultOptions() {
        return defaultOptions;
    }

    public CompiledFilter process(String json) {
        return process(json, defaultOptions, compiler);
    }

    public CompiledFilter process(String json, SanitizerOptions options) {
        return process(json, options, compiler);
    }

    /**
     * @throws InvalidFilterException  the text is not valid JSON
     * @throws FilterRejectedException a violation occurred and the pipeline is configured to reject it
     */
    public CompiledFilter process(String json, SanitizerOptions options, MongoFilterCompiler filterCompiler) {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(filterCompiler, "filterCompiler");

        Optional<Object> raw = reader.read(json);
        if (raw.isEmpty()) {
            return CompiledFilter.empty();
        }

        SanitizationResult result = FilterSanitizer.sanitize(raw.get(), options);
        if (result.failedClosed()) {
            if (rejectOnFatalViolation) {
                throw new FilterRejectedException("Filter rejected: structural limits exceeded", result.violations());
            }
            return new CompiledFilter(new Document(), result.sanitized(), result.violations(), true);
        }
        if (result.hasViolations()) {
            Log.warnf("Client filter sanitized with %d violation(s): %s", result.violations().size(), result.violations());
            if (rejectOnViolation) {
                throw new FilterRejectedException("Filter rejected: " + result.violations().size() + " invalid clause(s)",
                        result.violations());
            }
        }

        Document query = filterCompiler.compile(result.sanitized());
        return new CompiledFilter(query, result.sanitized(), result.violations(), false);
    }

    /**
     * Compiles a filter supplied by server code, such as a permanent context filter. Protected fields and the
     * field whitelist do not apply; native operators and structural limits still do, and any violation is a
     * programming error reported as {@link InvalidFilterException}.
     */
    public Document processTrusted(String json) {
        Optional<Object> raw = reader.read(json);
        if (raw.isEmpty()) {
            return new Document();
        }
        return processTrusted(raw.get());
    }

    public Document processTrusted(Object filter) {
        if (filter == null) {
            return new Document();
        }
        SanitizationResult result = FilterSanitizer.sanitize(filter, trustedOptions);
        if (result.hasViolations()) {
            throw new InvalidFilterException("Invalid context filter: " + String.join("; ", result.violations()));
        }
        return compiler.compile(result.sanitized());
    }

    public static final class Builder {
        private FilterJsonReader reader = new FilterJsonReader();
        private MongoFilterCompiler compiler = new MongoFilterCompiler();
        private SanitizerOptions defaultOptions = SanitizerOptions.defaults();
        private boolean rejectOnFatalViolation = true;
        private boolean rejectOnViolation = false;

        private Builder() {}

        public Builder reader(FilterJsonReader reader) {
            this.reader = Objects.requireNonNull(reader, "reader");
            return this;
        }

        public Builder compiler(MongoFilterCompiler compiler) {
            this.compiler = Objects.requireNonNull(compiler, "compiler");
            return this;
        }

        public Builder policy(FilterSecurityPolicy policy) {
            this.defaultOptions = SanitizerOptions.of(Objects.requireNonNull(policy, "policy"));
            return this;
        }

        public Builder defaultOptions(SanitizerOptions options) {
            this.defaultOptions = Objects.requireNonNull(options, "options");
            return this;
        }

        public Builder rejectOnFatalViolation(boolean reject) {
            this.rejectOnFatalViolation = reject;
            return this;
        }

        public Builder rejectOnViolation(boolean reject) {
            this.rejectOnViolation = reject;
            return this;
        }

        public FilterPipeline build() {
            return new FilterPipeline(this);
        }
    }
}
